package com.backlinkqc.contract;

import com.backlinkqc.order.Order;
import com.backlinkqc.order.OrderConstraints;
import com.backlinkqc.trust.DomainNames;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.regex.Pattern;

/**
 * Input contract for orders and validation requests. Every violation is
 * reported with the offending field name.
 */
@Component
public class OrderContractValidator {

    static final int MIN_TOPIC_LENGTH = 10;
    static final int MAX_ANCHOR_LENGTH = 100;
    static final int MIN_WORD_COUNT = 300;
    static final int MAX_WORD_COUNT = 3000;

    private static final Pattern ORDER_ID = Pattern.compile("^[A-Za-z0-9][A-Za-z0-9_.-]{0,63}$");
    private static final Pattern HOST = Pattern.compile("^(?:[a-z0-9](?:[a-z0-9-]*[a-z0-9])?\\.)+[a-z]{2,}$");
    private static final Pattern TAG = Pattern.compile("^[a-z0-9][a-z0-9_-]*$");

    public void validate(Order order) {
        requireNonNull(order, "order cannot be null");
        String orderId = requireString(order.orderId(), "order_id is required");
        if (!ORDER_ID.matcher(orderId).matches()) {
            throw new ContractViolationException("order_id may only contain letters, digits, '.', '_' and '-'");
        }
        requireString(order.customerRef(), "customer_ref is required");

        String publisher = requireString(order.publisherDomain(), "publisher_domain is required");
        if (!HOST.matcher(DomainNames.normalize(publisher)).matches()) {
            throw new ContractViolationException("publisher_domain must be a host name like example.se");
        }
        validateTargetUrl(requireString(order.targetUrl(), "target_url is required"));

        String anchor = requireString(order.anchorText(), "anchor_text is required");
        if (anchor.strip().length() > MAX_ANCHOR_LENGTH) {
            throw new ContractViolationException("anchor_text must be at most " + MAX_ANCHOR_LENGTH + " characters");
        }
        String topic = requireString(order.topic(), "topic is required");
        if (topic.strip().length() < MIN_TOPIC_LENGTH) {
            throw new ContractViolationException("topic must be at least " + MIN_TOPIC_LENGTH + " characters");
        }
        validateConstraints(order.constraints());
    }

    public void validateArticle(String articleText) {
        requireString(articleText, "article_text is required");
    }

    private void validateTargetUrl(String targetUrl) {
        URI uri;
        try {
            uri = new URI(targetUrl.strip());
        } catch (URISyntaxException ex) {
            throw new ContractViolationException("target_url is not a valid URL: " + ex.getReason());
        }
        String scheme = uri.getScheme();
        if (scheme == null || !(scheme.equalsIgnoreCase("http") || scheme.equalsIgnoreCase("https"))) {
            throw new ContractViolationException("target_url must use http or https");
        }
        if (uri.getHost() == null || !HOST.matcher(DomainNames.normalize(uri.getHost())).matches()) {
            throw new ContractViolationException("target_url must name a host");
        }
    }

    private void validateConstraints(OrderConstraints constraints) {
        Integer words = constraints.targetWordCount();
        if (words != null && (words < MIN_WORD_COUNT || words > MAX_WORD_COUNT)) {
            throw new ContractViolationException(
                "constraints.target_word_count must be between " + MIN_WORD_COUNT + " and " + MAX_WORD_COUNT);
        }
        for (String tag : constraints.complianceTags()) {
            if (!TAG.matcher(tag).matches()) {
                throw new ContractViolationException("constraints.compliance_tags contains an invalid tag: " + tag);
            }
        }
    }

    private String requireString(String value, String message) {
        if (value == null || value.isBlank()) {
            throw new ContractViolationException(message);
        }
        return value;
    }

    private void requireNonNull(Object value, String message) {
        if (value == null) {
            throw new ContractViolationException(message);
        }
    }
}
