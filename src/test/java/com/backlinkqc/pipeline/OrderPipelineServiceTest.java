package com.backlinkqc.pipeline;

import com.backlinkqc.audit.AuditEntry;
import com.backlinkqc.audit.AuditTrail;
import com.backlinkqc.audit.InMemoryAuditLog;
import com.backlinkqc.collector.AnchorPortfolioSource;
import com.backlinkqc.collector.ArticleDraftSource;
import com.backlinkqc.collector.CollectorGateway;
import com.backlinkqc.collector.CollectorProperties;
import com.backlinkqc.collector.MdcPropagatingExecutor;
import com.backlinkqc.collector.PublisherProfileSource;
import com.backlinkqc.collector.SerpSignalSource;
import com.backlinkqc.collector.TemplateArticleDraftSource;
import com.backlinkqc.collector.TrustRegistrySource;
import com.backlinkqc.contract.ErrorKind;
import com.backlinkqc.contract.OrderContractValidator;
import com.backlinkqc.contract.PlanningException;
import com.backlinkqc.order.Order;
import com.backlinkqc.order.OrderConstraints;
import com.backlinkqc.order.OrderLeaseRegistry;
import com.backlinkqc.order.OrderLifecycleState;
import com.backlinkqc.order.OrderRecord;
import com.backlinkqc.order.OrderStateMachine;
import com.backlinkqc.order.OrderStore;
import com.backlinkqc.portfolio.AnchorPortfolio;
import com.backlinkqc.portfolio.AnchorRiskModel;
import com.backlinkqc.portfolio.AnchorType;
import com.backlinkqc.portfolio.PortfolioDelta;
import com.backlinkqc.preflight.PreflightMatrix;
import com.backlinkqc.qc.ReportStatus;
import com.backlinkqc.support.Orders;
import com.backlinkqc.trust.DisclaimerCatalog;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Orders run through the wired pipeline with the in-process collaborators.
 * Each test uses its own order id and target host so portfolios do not leak
 * between tests sharing the context.
 */
@SpringBootTest
class OrderPipelineServiceTest {

    @Autowired OrderPipelineService pipeline;
    @Autowired PreflightService preflight;
    @Autowired ValidationService validation;
    @Autowired OrderLeaseRegistry leases;
    @Autowired InMemoryAuditLog auditLog;

    private static String uniqueId(String prefix) {
        return prefix + "-" + UUID.randomUUID().toString().substring(0, 8);
    }

    /** Genealogy publisher, gambling target on a host of its own. */
    private static Order order(String orderId) {
        String host = "casino-" + orderId.toLowerCase().replaceAll("[^a-z0-9]", "") + ".example.net";
        return new Order(orderId, "CUST-7", Orders.PUBLISHER, "https://" + host + "/spela", Orders.ANCHOR,
            Orders.TOPIC, new OrderConstraints(null, null, List.of("gambling")));
    }

    private static Order unknownPublisher(String orderId) {
        return new Order(orderId, "CUST-7", "okand.example.se", "https://casino-x.example.net/", Orders.ANCHOR,
            Orders.TOPIC, new OrderConstraints(null, null, List.of("gambling")));
    }

    @Nested
    @DisplayName("Full run")
    class FullRun {

        @Test
        @DisplayName("register -> run -> APPROVED -> deliver")
        void happyPath() {
            String orderId = uniqueId("ORD-HP");
            OrderRecord registered = pipeline.register(order(orderId));
            assertEquals(OrderLifecycleState.PENDING, registered.state());

            OrderRecord approved = pipeline.run(orderId);

            assertEquals(OrderLifecycleState.APPROVED, approved.state());
            assertEquals(ReportStatus.APPROVED, approved.latestReport().status());
            assertNotNull(approved.matrix());
            assertEquals("research breaks", approved.matrix().midpoint().label());
            assertTrue(approved.article().contains("](https://casino-"));
            assertEquals(List.of(OrderLifecycleState.PREFLIGHT, OrderLifecycleState.WRITING,
                    OrderLifecycleState.QC, OrderLifecycleState.APPROVED),
                approved.history().stream().map(change -> change.to()).toList());
            assertFalse(leases.isHeld(orderId));

            DeliveryReceipt receipt = pipeline.deliver(orderId);

            assertEquals(OrderLifecycleState.DELIVERED, receipt.order().state());
            assertEquals(0.0, receipt.portfolioDelta().oldRisk(), 1e-9);
            assertTrue(receipt.portfolioDelta().newRisk() > 0.0);
            assertEquals(PortfolioDelta.Direction.WORSENED, receipt.portfolioDelta().direction());
        }

        @Test
        void deliveringTwiceChangesNothing() {
            String orderId = uniqueId("ORD-DD");
            pipeline.register(order(orderId));
            pipeline.run(orderId);
            pipeline.deliver(orderId);

            DeliveryReceipt again = pipeline.deliver(orderId);

            assertEquals(OrderLifecycleState.DELIVERED, again.order().state());
            assertNull(again.portfolioDelta());
        }

        @Test
        void everyStepIsAudited() {
            String orderId = uniqueId("ORD-AU");
            pipeline.register(order(orderId));
            pipeline.run(orderId);

            Set<AuditEntry.Kind> kinds = auditLog.entriesFor(orderId).stream()
                .map(AuditEntry::kind)
                .collect(Collectors.toSet());

            assertEquals(Set.of(AuditEntry.Kind.ORDER, AuditEntry.Kind.MATRIX, AuditEntry.Kind.REPORT,
                AuditEntry.Kind.TRANSITION), kinds);
        }
    }

    @Nested
    @DisplayName("Failures")
    class Failures {

        @Test
        void unknownPublisherFailsTheOrderAndRetryResetsIt() {
            String orderId = uniqueId("ORD-UP");
            pipeline.register(unknownPublisher(orderId));

            OrderRecord failed = pipeline.run(orderId);

            assertEquals(OrderLifecycleState.FAILED, failed.state());
            assertTrue(failed.failureReason().startsWith("DEPENDENCY_UNAVAILABLE"));

            OrderRecord retried = pipeline.retry(orderId);
            assertEquals(OrderLifecycleState.PENDING, retried.state());
            assertNull(retried.failureReason());
        }

        @Test
        @DisplayName("an order left in QC without a matrix fails with STALE_MATRIX and can be retried")
        void qcWithoutAMatrixFailsAsStale() {
            String orderId = uniqueId("ORD-QM");
            pipeline.register(order(orderId));
            pipeline.transition(orderId, OrderLifecycleState.PREFLIGHT, "manual");
            pipeline.transition(orderId, OrderLifecycleState.WRITING, "manual");
            pipeline.transition(orderId, OrderLifecycleState.QC, "manual");

            OrderRecord failed = pipeline.run(orderId);

            assertEquals(OrderLifecycleState.FAILED, failed.state());
            assertTrue(failed.failureReason().startsWith("STALE_MATRIX"));
            assertFalse(leases.isHeld(orderId));

            pipeline.retry(orderId);
            assertEquals(OrderLifecycleState.APPROVED, pipeline.run(orderId).state());
        }

        @Test
        void duplicateRegistrationIsRejected() {
            String orderId = uniqueId("ORD-DUP");
            pipeline.register(order(orderId));

            PlanningException ex = assertThrows(PlanningException.class, () -> pipeline.register(order(orderId)));
            assertEquals(ErrorKind.DUPLICATE_ORDER, ex.getKind());
        }

        @Test
        @DisplayName("concurrent registrations of one id admit exactly one")
        void concurrentDuplicateRegistrationAdmitsOne() throws Exception {
            String orderId = uniqueId("ORD-CR");
            CountDownLatch start = new CountDownLatch(1);
            Callable<String> attempt = () -> {
                start.await();
                try {
                    pipeline.register(order(orderId));
                    return "registered";
                } catch (PlanningException ex) {
                    return ex.getKind().name();
                }
            };
            ExecutorService threads = Executors.newFixedThreadPool(2);
            try {
                List<Future<String>> results = List.of(threads.submit(attempt), threads.submit(attempt));
                start.countDown();
                List<String> outcomes = new ArrayList<>();
                for (Future<String> result : results) {
                    outcomes.add(result.get());
                }

                assertTrue(outcomes.contains("registered"));
                assertTrue(outcomes.contains(ErrorKind.DUPLICATE_ORDER.name()));
            } finally {
                threads.shutdownNow();
            }
            assertEquals(OrderLifecycleState.PENDING, pipeline.get(orderId).state());
            assertEquals(1, auditLog.entriesFor(orderId).stream()
                .filter(entry -> entry.kind() == AuditEntry.Kind.ORDER)
                .count());
        }

        @Test
        void runningAnApprovedOrderIsIllegal() {
            String orderId = uniqueId("ORD-AP");
            pipeline.register(order(orderId));
            pipeline.run(orderId);

            PlanningException ex = assertThrows(PlanningException.class, () -> pipeline.run(orderId));
            assertEquals(ErrorKind.ILLEGAL_TRANSITION, ex.getKind());
            assertEquals(OrderLifecycleState.APPROVED, pipeline.get(orderId).state());
        }

        @Test
        void heldOrderIsLocked() {
            String orderId = uniqueId("ORD-LK");
            pipeline.register(order(orderId));

            try (OrderLeaseRegistry.Lease lease = leases.acquire(orderId, "other-worker")) {
                PlanningException ex = assertThrows(PlanningException.class, () -> pipeline.run(lease.orderId()));
                assertEquals(ErrorKind.ORDER_LOCKED, ex.getKind());
            }
            assertEquals(OrderLifecycleState.PENDING, pipeline.get(orderId).state());
        }

        @Test
        void unknownOrderIsNotFound() {
            PlanningException ex = assertThrows(PlanningException.class, () -> pipeline.get("ORD-MISSING"));
            assertEquals(ErrorKind.ORDER_NOT_FOUND, ex.getKind());
        }
    }

    @Nested
    @DisplayName("Control")
    class Control {

        @Test
        @DisplayName("a stop for an order nobody is running is ignored")
        void stopForAnIdleOrderIsIgnored() {
            String orderId = uniqueId("ORD-ST");
            pipeline.register(order(orderId));

            assertFalse(pipeline.requestStop(orderId));

            assertEquals(OrderLifecycleState.APPROVED, pipeline.run(orderId).state());
        }

        @Test
        @DisplayName("a stop addressed to an earlier holder does not stop the next run")
        void staleStopDoesNotBlockTheNextRun() {
            String orderId = uniqueId("ORD-SS");
            pipeline.register(order(orderId));
            try (OrderLeaseRegistry.Lease lease = leases.acquire(orderId, "other-worker")) {
                assertTrue(pipeline.requestStop(lease.orderId()));
            }

            OrderRecord finished = pipeline.run(orderId);

            assertEquals(OrderLifecycleState.APPROVED, finished.state());
        }

        @Test
        void pendingOrderCanBeCancelled() {
            String orderId = uniqueId("ORD-CX");
            pipeline.register(order(orderId));

            assertEquals(OrderLifecycleState.CANCELLED, pipeline.cancel(orderId).state());
            assertThrows(PlanningException.class, () -> pipeline.run(orderId));
        }
    }

    @Nested
    @DisplayName("Delivery")
    class Delivery {

        @Autowired OrderContractValidator validator;
        @Autowired OrderStore store;
        @Autowired OrderStateMachine stateMachine;
        @Autowired AnchorRiskModel riskModel;
        @Autowired AuditTrail audit;
        @Autowired PublisherProfileSource profiles;
        @Autowired AnchorPortfolioSource portfolios;
        @Autowired SerpSignalSource serp;
        @Autowired TrustRegistrySource registry;
        @Autowired ArticleDraftSource drafts;
        @Autowired MdcPropagatingExecutor collectorExecutor;
        @Autowired CollectorProperties collectorProperties;

        /** Portfolio store whose writes fail until switched back on. */
        private final class FlakyPortfolios implements AnchorPortfolioSource {

            final AtomicBoolean offline = new AtomicBoolean(true);

            @Override
            public AnchorPortfolio get(String targetDomain) {
                return portfolios.get(targetDomain);
            }

            @Override
            public AnchorPortfolio recordPlacement(String targetDomain, AnchorType type) {
                if (offline.get()) {
                    throw new IllegalStateException("portfolio store offline");
                }
                return portfolios.recordPlacement(targetDomain, type);
            }
        }

        @Test
        @DisplayName("a failed placement write leaves the order APPROVED so delivery can be repeated")
        void failedPlacementKeepsTheOrderApproved() {
            String orderId = uniqueId("ORD-PW");
            pipeline.register(order(orderId));
            assertEquals(OrderLifecycleState.APPROVED, pipeline.run(orderId).state());

            FlakyPortfolios flaky = new FlakyPortfolios();
            CollectorGateway gateway = new CollectorGateway(profiles, flaky, serp, registry, drafts,
                collectorExecutor, collectorProperties);
            OrderPipelineService delivering = new OrderPipelineService(validator, store, leases, stateMachine,
                preflight, validation, gateway, riskModel, audit);

            PlanningException ex = assertThrows(PlanningException.class, () -> delivering.deliver(orderId));
            assertEquals(ErrorKind.DEPENDENCY_UNAVAILABLE, ex.getKind());
            assertEquals(OrderLifecycleState.APPROVED, pipeline.get(orderId).state());
            assertFalse(leases.isHeld(orderId));

            flaky.offline.set(false);
            DeliveryReceipt receipt = delivering.deliver(orderId);

            assertEquals(OrderLifecycleState.DELIVERED, receipt.order().state());
            assertEquals(OrderLifecycleState.DELIVERED, pipeline.get(orderId).state());
            assertNotNull(receipt.portfolioDelta());
            assertEquals(0.0, receipt.portfolioDelta().oldRisk(), 1e-9);
        }
    }

    @Nested
    @DisplayName("Externally written drafts")
    class Drafts {

        private String writingOrder() {
            String orderId = uniqueId("ORD-WR");
            pipeline.register(order(orderId));
            pipeline.transition(orderId, OrderLifecycleState.PREFLIGHT, "manual");
            pipeline.transition(orderId, OrderLifecycleState.WRITING, "manual");
            return orderId;
        }

        @Test
        void draftWithoutACurrentMatrixIsStaleAndTheMatrixIsRebuilt() {
            String orderId = writingOrder();

            PlanningException ex = assertThrows(PlanningException.class,
                () -> pipeline.submitDraft(orderId, "# Title\nSome text."));

            assertEquals(ErrorKind.STALE_MATRIX, ex.getKind());
            OrderRecord record = pipeline.get(orderId);
            assertEquals(OrderLifecycleState.WRITING, record.state());
            assertNotNull(record.matrix());
        }

        @Test
        void draftWrittenToThePlanIsApproved() {
            String orderId = writingOrder();
            assertThrows(PlanningException.class, () -> pipeline.submitDraft(orderId, "# Title\nSome text."));
            OrderRecord record = pipeline.get(orderId);
            String draft = new TemplateArticleDraftSource(DisclaimerCatalog.standard())
                .draft(record.order(), record.matrix());

            OrderRecord checked = pipeline.submitDraft(orderId, draft);

            assertEquals(OrderLifecycleState.APPROVED, checked.state());
        }

        @Test
        void blockedDraftFailsTheOrder() {
            String orderId = writingOrder();
            assertThrows(PlanningException.class, () -> pipeline.submitDraft(orderId, "# Title\nSome text."));

            OrderRecord checked = pipeline.submitDraft(orderId, "# Title\nNothing about the topic at all.");

            assertEquals(OrderLifecycleState.FAILED, checked.state());
            assertEquals(ReportStatus.BLOCKED, checked.latestReport().status());
            assertTrue(checked.failureReason().startsWith("QC blocked at "));
        }

        @Test
        void draftsAreOnlyAcceptedWhileWriting() {
            String orderId = uniqueId("ORD-NW");
            pipeline.register(order(orderId));

            PlanningException ex = assertThrows(PlanningException.class,
                () -> pipeline.submitDraft(orderId, "# Title\nSome text."));
            assertEquals(ErrorKind.ILLEGAL_TRANSITION, ex.getKind());
        }
    }

    @Test
    @DisplayName("Standalone preflight and validation agree with the pipeline")
    void standaloneOperations() {
        Order order = order(uniqueId("ORD-SA"));
        PreflightMatrix matrix = preflight.buildPreflight(order);
        String draft = new TemplateArticleDraftSource(DisclaimerCatalog.standard()).draft(order, matrix);

        ValidationOutcome outcome = validation.validate(draft, matrix, false);

        assertEquals(ReportStatus.APPROVED, outcome.report().status());
        assertNull(outcome.fix());
        assertEquals(draft, outcome.article());
    }
}
