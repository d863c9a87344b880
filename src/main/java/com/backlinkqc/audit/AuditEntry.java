package com.backlinkqc.audit;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.time.Instant;

/**
 * One durable record handed to the audit sinks.
 *
 * @param payload the persisted object: an order, matrix, report or state change
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record AuditEntry(Kind kind, String orderId, String summary, Object payload, Instant recordedAt) {

    public enum Kind { ORDER, MATRIX, REPORT, TRANSITION }
}
