package com.backlinkqc.order;

import com.backlinkqc.preflight.PreflightMatrix;
import com.backlinkqc.qc.ValidationReport;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.ArrayList;
import java.util.List;

/**
 * Current snapshot of one order: its lifecycle state, the matrix it is being
 * written against, the latest draft and the latest QC report. Only the latest
 * report is retained.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record OrderRecord(
    Order order,
    OrderLifecycleState state,
    PreflightMatrix matrix,
    String article,
    ValidationReport latestReport,
    String failureReason,
    List<StateChange> history
) {

    public OrderRecord {
        history = List.copyOf(history);
    }

    public static OrderRecord accepted(Order order) {
        return new OrderRecord(order, OrderLifecycleState.PENDING, null, null, null, null, List.of());
    }

    public String orderId() {
        return order.orderId();
    }

    public OrderRecord withMatrix(PreflightMatrix newMatrix) {
        return new OrderRecord(order, state, newMatrix, article, latestReport, failureReason, history);
    }

    public OrderRecord withDraft(String newArticle) {
        return new OrderRecord(order, state, matrix, newArticle, latestReport, failureReason, history);
    }

    public OrderRecord withReport(String checkedArticle, ValidationReport report) {
        return new OrderRecord(order, state, matrix, checkedArticle, report, failureReason, history);
    }

    public OrderRecord withFailureReason(String reason) {
        return new OrderRecord(order, state, matrix, article, latestReport, reason, history);
    }

    OrderRecord movedTo(StateChange change) {
        List<StateChange> next = new ArrayList<>(history);
        next.add(change);
        String reason = change.to() == OrderLifecycleState.PENDING ? null : failureReason;
        return new OrderRecord(order, change.to(), matrix, article, latestReport, reason, next);
    }
}
