package com.backlinkqc.order;

import com.backlinkqc.trust.DomainNames;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

/**
 * A backlink article order. Immutable once accepted; created by the caller and
 * consumed by the preflight matrix builder.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record Order(
    String orderId,
    String customerRef,
    String publisherDomain,
    String targetUrl,
    String anchorText,
    String topic,
    OrderConstraints constraints
) {

    public Order {
        if (constraints == null) {
            constraints = OrderConstraints.none();
        }
    }

    @JsonIgnore
    public String targetDomain() {
        return DomainNames.hostOf(targetUrl);
    }

    @JsonIgnore
    public String normalizedPublisherDomain() {
        return DomainNames.normalize(publisherDomain);
    }
}
