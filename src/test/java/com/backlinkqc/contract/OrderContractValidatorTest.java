package com.backlinkqc.contract;

import com.backlinkqc.order.Order;
import com.backlinkqc.order.OrderConstraints;
import com.backlinkqc.support.Orders;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class OrderContractValidatorTest {

    private OrderContractValidator validator;

    @BeforeEach
    void setUp() {
        validator = new OrderContractValidator();
    }

    private static Order order(String orderId, String publisher, String targetUrl, String anchor, String topic,
                               OrderConstraints constraints) {
        return new Order(orderId, "CUST-1", publisher, targetUrl, anchor, topic, constraints);
    }

    private static Order valid() {
        return Orders.gambling("ORD-C-001");
    }

    private String violation(Order order) {
        ContractViolationException ex = assertThrows(ContractViolationException.class, () -> validator.validate(order));
        assertEquals(ErrorKind.CONTRACT_VIOLATION, ex.getKind());
        return ex.getMessage();
    }

    @Test
    void seededOrderIsValid() {
        assertDoesNotThrow(() -> validator.validate(valid()));
    }

    @Nested
    @DisplayName("Identifiers")
    class Identifiers {

        @Test
        void orderIdIsRequired() {
            assertTrue(violation(order(" ", Orders.PUBLISHER, Orders.TARGET_URL, "anchor", Orders.TOPIC, null))
                .contains("order_id"));
        }

        @Test
        void orderIdRejectsSpacesAndSlashes() {
            assertTrue(violation(order("ORD 1", Orders.PUBLISHER, Orders.TARGET_URL, "anchor", Orders.TOPIC, null))
                .contains("order_id"));
            assertTrue(violation(order("ORD/1", Orders.PUBLISHER, Orders.TARGET_URL, "anchor", Orders.TOPIC, null))
                .contains("order_id"));
        }

        @Test
        void customerRefIsRequired() {
            Order order = new Order("ORD-C-2", null, Orders.PUBLISHER, Orders.TARGET_URL, "anchor", Orders.TOPIC, null);
            assertTrue(violation(order).contains("customer_ref"));
        }

        @Test
        void nullOrderIsRejected() {
            assertThrows(ContractViolationException.class, () -> validator.validate(null));
        }
    }

    @Nested
    @DisplayName("Domains and URLs")
    class Urls {

        @Test
        void publisherMustBeAHostName() {
            assertTrue(violation(order("ORD-C-3", "not a host", Orders.TARGET_URL, "anchor", Orders.TOPIC, null))
                .contains("publisher_domain"));
        }

        @Test
        void publisherWithWwwPrefixIsAccepted() {
            assertDoesNotThrow(() -> validator.validate(
                order("ORD-C-4", "www.slaktforskning.example.se", Orders.TARGET_URL, "anchor", Orders.TOPIC, null)));
        }

        @Test
        void targetUrlMustBeHttp() {
            assertTrue(violation(order("ORD-C-5", Orders.PUBLISHER, "ftp://bestcasino.example.com/x", "anchor",
                Orders.TOPIC, null)).contains("http"));
            assertTrue(violation(order("ORD-C-6", Orders.PUBLISHER, "bestcasino.example.com", "anchor",
                Orders.TOPIC, null)).contains("target_url"));
        }
    }

    @Nested
    @DisplayName("Text fields")
    class TextFields {

        @Test
        void anchorAtMostHundredCharacters() {
            String longAnchor = "a".repeat(101);
            assertTrue(violation(order("ORD-C-7", Orders.PUBLISHER, Orders.TARGET_URL, longAnchor, Orders.TOPIC, null))
                .contains("anchor_text"));
            assertDoesNotThrow(() -> validator.validate(
                order("ORD-C-8", Orders.PUBLISHER, Orders.TARGET_URL, "a".repeat(100), Orders.TOPIC, null)));
        }

        @Test
        void topicAtLeastTenCharacters() {
            assertTrue(violation(order("ORD-C-9", Orders.PUBLISHER, Orders.TARGET_URL, "anchor", "Too short", null))
                .contains("topic"));
        }

        @Test
        void articleTextMustNotBeBlank() {
            assertThrows(ContractViolationException.class, () -> validator.validateArticle("  \n "));
            assertDoesNotThrow(() -> validator.validateArticle("# Title\nBody."));
        }
    }

    @Nested
    @DisplayName("Constraints")
    class Constraints {

        @Test
        void wordCountWithinBounds() {
            assertTrue(violation(order("ORD-C-10", Orders.PUBLISHER, Orders.TARGET_URL, "anchor", Orders.TOPIC,
                new OrderConstraints(299, null, List.of()))).contains("target_word_count"));
            assertTrue(violation(order("ORD-C-11", Orders.PUBLISHER, Orders.TARGET_URL, "anchor", Orders.TOPIC,
                new OrderConstraints(3001, null, List.of()))).contains("target_word_count"));
            assertDoesNotThrow(() -> validator.validate(order("ORD-C-12", Orders.PUBLISHER, Orders.TARGET_URL,
                "anchor", Orders.TOPIC, new OrderConstraints(300, null, List.of()))));
        }

        @Test
        void tagsAreNormalizedThenChecked() {
            assertDoesNotThrow(() -> validator.validate(order("ORD-C-13", Orders.PUBLISHER, Orders.TARGET_URL,
                "anchor", Orders.TOPIC, new OrderConstraints(null, null, List.of(" Gambling ")))));
            assertTrue(violation(order("ORD-C-14", Orders.PUBLISHER, Orders.TARGET_URL, "anchor", Orders.TOPIC,
                new OrderConstraints(null, null, List.of("real money!")))).contains("compliance_tags"));
        }
    }
}
