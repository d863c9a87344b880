package com.backlinkqc.order;

import com.backlinkqc.contract.ErrorKind;
import com.backlinkqc.contract.PlanningException;
import com.backlinkqc.qc.ReportStatus;
import com.backlinkqc.qc.ValidationReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Sole mutator of an order's lifecycle state.
 *
 * <p>Legal moves come from {@link OrderLifecycleState#successors()}. Leaving
 * QC is further guarded by the latest report: APPROVED needs an APPROVED
 * report, WRITING needs LIGHT_EDITS, and a BLOCKED report only allows
 * FAILED. Re-applying the recorded transition that produced the current
 * state is a no-op; a same-state request with no such record is illegal.
 * Anything else is rejected with {@link ErrorKind#ILLEGAL_TRANSITION}.</p>
 */
public class OrderStateMachine {

    private static final Logger log = LoggerFactory.getLogger(OrderStateMachine.class);

    private final Clock clock;

    public OrderStateMachine(Clock clock) {
        this.clock = clock;
    }

    public OrderRecord transition(OrderRecord record, OrderLifecycleState target, String reason) {
        OrderLifecycleState current = record.state();
        if (current == target && isLastRecorded(record, target)) {
            log.debug("Transition replay ignored order={} state={}", record.orderId(), current);
            return record;
        }
        if (!current.canMoveTo(target)) {
            throw illegal(record, target, current + " cannot move to " + target);
        }
        if (current == OrderLifecycleState.QC) {
            checkQcExit(record, target);
        }
        OrderRecord moved = record.movedTo(new StateChange(current, target, reason, Instant.now(clock)));
        log.info("Order transition order={} {} -> {} reason={}", record.orderId(), current, target, reason);
        return moved;
    }

    private static boolean isLastRecorded(OrderRecord record, OrderLifecycleState target) {
        List<StateChange> history = record.history();
        return !history.isEmpty() && history.get(history.size() - 1).to() == target;
    }

    private void checkQcExit(OrderRecord record, OrderLifecycleState target) {
        if (target == OrderLifecycleState.FAILED) {
            return;
        }
        ValidationReport report = record.latestReport();
        if (report == null) {
            throw illegal(record, target, "no QC report recorded");
        }
        if (report.status() == ReportStatus.BLOCKED) {
            throw illegal(record, target, "a BLOCKED report only allows QC -> FAILED");
        }
        if (target == OrderLifecycleState.APPROVED && report.status() != ReportStatus.APPROVED) {
            throw illegal(record, target, "QC -> APPROVED requires an APPROVED report, got " + report.status());
        }
        if (target == OrderLifecycleState.WRITING && report.status() != ReportStatus.LIGHT_EDITS) {
            throw illegal(record, target, "QC -> WRITING requires a LIGHT_EDITS report, got " + report.status());
        }
    }

    private static PlanningException illegal(OrderRecord record, OrderLifecycleState target, String detail) {
        Map<String, Object> context = new LinkedHashMap<>();
        context.put("order_id", record.orderId());
        context.put("from", record.state().name());
        context.put("to", target.name());
        return new PlanningException(ErrorKind.ILLEGAL_TRANSITION,
            "Illegal transition for order " + record.orderId() + ": " + detail, context);
    }
}
