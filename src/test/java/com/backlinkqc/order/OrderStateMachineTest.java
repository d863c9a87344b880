package com.backlinkqc.order;

import com.backlinkqc.contract.ErrorKind;
import com.backlinkqc.contract.PlanningException;
import com.backlinkqc.qc.QcProperties;
import com.backlinkqc.qc.ReportStatus;
import com.backlinkqc.qc.ScoreCategory;
import com.backlinkqc.qc.ValidationReport;
import com.backlinkqc.qc.ValidationReportAssembler;
import com.backlinkqc.support.Orders;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class OrderStateMachineTest {

    private static final Instant NOW = Instant.parse("2024-03-01T10:15:30Z");

    private final OrderStateMachine machine = new OrderStateMachine(Clock.fixed(NOW, ZoneOffset.UTC));

    private static OrderRecord in(OrderLifecycleState state, ValidationReport report) {
        return new OrderRecord(Orders.gambling("ORD-SM-001"), state, null, null, report, null, List.of());
    }

    /** A report with every category at {@code score}; 100 approves, 80 asks for edits, 50 blocks. */
    private static ValidationReport report(int score) {
        Map<ScoreCategory, Integer> scores = new EnumMap<>(ScoreCategory.class);
        for (ScoreCategory category : ScoreCategory.values()) {
            scores.put(category, score);
        }
        return new ValidationReportAssembler(QcProperties.defaults()).assemble(scores, List.of(), 2, 0, null);
    }

    private static ErrorKind rejection(Runnable call) {
        return assertThrows(PlanningException.class, call::run).getKind();
    }

    @Nested
    @DisplayName("Successor table")
    class Successors {

        @Test
        void followsTheHappyPath() {
            OrderRecord record = in(OrderLifecycleState.PENDING, null);
            record = machine.transition(record, OrderLifecycleState.PREFLIGHT, "start");
            record = machine.transition(record, OrderLifecycleState.WRITING, "planned");
            record = machine.transition(record, OrderLifecycleState.QC, "drafted");
            record = machine.transition(record.withReport("text", report(100)), OrderLifecycleState.APPROVED, "ok");
            record = machine.transition(record, OrderLifecycleState.DELIVERED, "shipped");

            assertEquals(OrderLifecycleState.DELIVERED, record.state());
            assertEquals(5, record.history().size());
            assertEquals(OrderLifecycleState.PENDING, record.history().get(0).from());
            assertEquals(NOW, record.history().get(0).at());
        }

        @Test
        void skippingStatesIsIllegal() {
            assertEquals(ErrorKind.ILLEGAL_TRANSITION, rejection(() ->
                machine.transition(in(OrderLifecycleState.PENDING, null), OrderLifecycleState.DELIVERED, "skip")));
        }

        @Test
        void failedOrdersOnlyGoBackToPending() {
            OrderRecord failed = in(OrderLifecycleState.FAILED, null).withFailureReason("boom");

            assertEquals(ErrorKind.ILLEGAL_TRANSITION, rejection(() ->
                machine.transition(failed, OrderLifecycleState.PREFLIGHT, "resume")));

            OrderRecord retried = machine.transition(failed, OrderLifecycleState.PENDING, "retry");
            assertEquals(OrderLifecycleState.PENDING, retried.state());
            assertNull(retried.failureReason());
        }

        @Test
        void terminalStatesHaveNoSuccessors() {
            assertTrue(OrderLifecycleState.DELIVERED.successors().isEmpty());
            assertTrue(OrderLifecycleState.CANCELLED.successors().isEmpty());
            assertEquals(ErrorKind.ILLEGAL_TRANSITION, rejection(() ->
                machine.transition(in(OrderLifecycleState.CANCELLED, null), OrderLifecycleState.PENDING, "revive")));
        }

        @Test
        void replayingTheRecordedTransitionIsANoOp() {
            OrderRecord record = machine.transition(in(OrderLifecycleState.PREFLIGHT, null),
                OrderLifecycleState.WRITING, "planned");

            assertSame(record, machine.transition(record, OrderLifecycleState.WRITING, "again"));
        }

        @Test
        void sameStateWithoutARecordedTransitionIsIllegal() {
            assertEquals(ErrorKind.ILLEGAL_TRANSITION, rejection(() ->
                machine.transition(in(OrderLifecycleState.PENDING, null), OrderLifecycleState.PENDING, "again")));
            assertEquals(ErrorKind.ILLEGAL_TRANSITION, rejection(() ->
                machine.transition(in(OrderLifecycleState.QC, report(100)), OrderLifecycleState.QC, "again")));
        }
    }

    @Nested
    @DisplayName("Leaving QC")
    class QcExit {

        @Test
        void approvalNeedsAnApprovedReport() {
            assertEquals(ErrorKind.ILLEGAL_TRANSITION, rejection(() ->
                machine.transition(in(OrderLifecycleState.QC, report(80)), OrderLifecycleState.APPROVED, "ok")));
            assertEquals(ErrorKind.ILLEGAL_TRANSITION, rejection(() ->
                machine.transition(in(OrderLifecycleState.QC, null), OrderLifecycleState.APPROVED, "ok")));
        }

        @Test
        void lightEditsReturnToWriting() {
            ValidationReport edits = report(80);
            assertEquals(ReportStatus.LIGHT_EDITS, edits.status());

            OrderRecord moved = machine.transition(in(OrderLifecycleState.QC, edits), OrderLifecycleState.WRITING, "edits");

            assertEquals(OrderLifecycleState.WRITING, moved.state());
            assertEquals(ErrorKind.ILLEGAL_TRANSITION, rejection(() ->
                machine.transition(in(OrderLifecycleState.QC, report(100)), OrderLifecycleState.WRITING, "edits")));
        }

        @Test
        void blockedReportOnlyAllowsFailure() {
            ValidationReport blocked = report(50);
            assertEquals(ReportStatus.BLOCKED, blocked.status());

            assertEquals(ErrorKind.ILLEGAL_TRANSITION, rejection(() ->
                machine.transition(in(OrderLifecycleState.QC, blocked), OrderLifecycleState.WRITING, "retry")));
            assertEquals(OrderLifecycleState.FAILED,
                machine.transition(in(OrderLifecycleState.QC, blocked), OrderLifecycleState.FAILED, "blocked").state());
        }
    }
}
