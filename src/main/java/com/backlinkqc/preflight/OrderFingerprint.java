package com.backlinkqc.preflight;

import com.backlinkqc.order.Order;
import com.backlinkqc.order.OrderConstraints;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * SHA-256 over the canonical field values of an order. Two orders with the
 * same content always fingerprint the same.
 */
public final class OrderFingerprint {

    private static final char SEPARATOR = '\u001f';

    private OrderFingerprint() {
    }

    public static String of(Order order) {
        OrderConstraints c = order.constraints();
        String canonical = String.join(String.valueOf(SEPARATOR),
            String.valueOf(order.orderId()),
            String.valueOf(order.customerRef()),
            String.valueOf(order.publisherDomain()),
            String.valueOf(order.targetUrl()),
            String.valueOf(order.anchorText()),
            String.valueOf(order.topic()),
            String.valueOf(c.targetWordCount()),
            c.tone() == null ? "null" : c.tone().getValue(),
            String.join(",", c.complianceTags()));
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(canonical.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException ex) {
            throw new IllegalStateException("SHA-256 not available", ex);
        }
    }
}
