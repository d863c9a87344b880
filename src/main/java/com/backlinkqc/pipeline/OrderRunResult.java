package com.backlinkqc.pipeline;

import com.backlinkqc.order.OrderLifecycleState;
import com.backlinkqc.qc.ReportStatus;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

/**
 * Per-order line of a batch result. COMPLETED means the QC cycle ended
 * without failing; SKIPPED means another worker held the order or the
 * worker queue was full; TIMED_OUT means the run outlived the batch timeout
 * and was stopped, with {@code state} the state it committed.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record OrderRunResult(
    String orderId,
    Outcome outcome,
    OrderLifecycleState state,
    ReportStatus reportStatus,
    String message
) {

    public enum Outcome { COMPLETED, FAILED, SKIPPED, TIMED_OUT }
}
