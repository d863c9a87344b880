package com.backlinkqc.pipeline;

import com.backlinkqc.audit.AuditEntry;
import com.backlinkqc.audit.AuditTrail;
import com.backlinkqc.collector.CollectorGateway;
import com.backlinkqc.contract.ErrorKind;
import com.backlinkqc.contract.OrderContractValidator;
import com.backlinkqc.contract.PlanningException;
import com.backlinkqc.order.Order;
import com.backlinkqc.order.OrderLeaseRegistry;
import com.backlinkqc.order.OrderLifecycleState;
import com.backlinkqc.order.OrderRecord;
import com.backlinkqc.order.OrderStateMachine;
import com.backlinkqc.order.OrderStore;
import com.backlinkqc.portfolio.AnchorPortfolio;
import com.backlinkqc.portfolio.AnchorRiskModel;
import com.backlinkqc.portfolio.PortfolioDelta;
import com.backlinkqc.preflight.OrderFingerprint;
import com.backlinkqc.preflight.PreflightMatrix;
import com.backlinkqc.qc.ValidationReport;
import com.backlinkqc.trust.TrustRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Drives one order through preflight, drafting and QC.
 *
 * <p>A run holds the order's lease for its whole duration, so no two workers
 * ever process the same order. Steps run strictly in sequence; a stop
 * request is addressed to the lease holder, honoured between steps, and
 * leaves the last committed state in place. A QC cycle ends when the order reaches APPROVED, goes back to
 * WRITING for light edits, or FAILED.</p>
 */
@Service
public class OrderPipelineService {

    private static final Logger log = LoggerFactory.getLogger(OrderPipelineService.class);

    private final OrderContractValidator validator;
    private final OrderStore store;
    private final OrderLeaseRegistry leases;
    private final OrderStateMachine stateMachine;
    private final PreflightService preflight;
    private final ValidationService validation;
    private final CollectorGateway collectors;
    private final AnchorRiskModel riskModel;
    private final AuditTrail audit;
    private final Map<String, String> stopRequests = new ConcurrentHashMap<>();

    public OrderPipelineService(OrderContractValidator validator,
                                OrderStore store,
                                OrderLeaseRegistry leases,
                                OrderStateMachine stateMachine,
                                PreflightService preflight,
                                ValidationService validation,
                                CollectorGateway collectors,
                                AnchorRiskModel riskModel,
                                AuditTrail audit) {
        this.validator = validator;
        this.store = store;
        this.leases = leases;
        this.stateMachine = stateMachine;
        this.preflight = preflight;
        this.validation = validation;
        this.collectors = collectors;
        this.riskModel = riskModel;
        this.audit = audit;
    }

    public OrderRecord register(Order order) {
        validator.validate(order);
        OrderRecord record = OrderRecord.accepted(order);
        if (!store.saveIfAbsent(record)) {
            throw new PlanningException(ErrorKind.DUPLICATE_ORDER,
                "Order " + order.orderId() + " already exists", Map.of("order_id", order.orderId()));
        }
        audit.record(AuditEntry.Kind.ORDER, order.orderId(), "order accepted", order);
        log.info("Order registered order={} publisher={} target={}",
            order.orderId(), order.normalizedPublisherDomain(), order.targetDomain());
        return record;
    }

    public OrderRecord get(String orderId) {
        return store.find(orderId).orElseThrow(() -> new PlanningException(ErrorKind.ORDER_NOT_FOUND,
            "Order " + orderId + " not found", Map.of("order_id", orderId)));
    }

    /** Applies a single requested transition under the order's lease. */
    public OrderRecord transition(String orderId, OrderLifecycleState target, String reason) {
        try (OrderLeaseRegistry.Lease lease = leases.acquire(orderId, newOwner())) {
            return move(get(lease.orderId()), target, reason);
        }
    }

    public OrderRecord retry(String orderId) {
        return transition(orderId, OrderLifecycleState.PENDING, "retry requested");
    }

    public OrderRecord cancel(String orderId) {
        return transition(orderId, OrderLifecycleState.CANCELLED, "cancelled by caller");
    }

    /**
     * Asks the run currently holding the order to stop before its next step.
     *
     * @return false when no run holds the order; nothing is recorded then
     */
    public boolean requestStop(String orderId) {
        Optional<String> holder = leases.holder(orderId);
        if (holder.isEmpty()) {
            log.info("Stop ignored, order={} is not running", orderId);
            return false;
        }
        stopRequests.put(orderId, holder.get());
        log.info("Stop requested order={} holder={}", orderId, holder.get());
        return true;
    }

    /**
     * Runs the pipeline from the order's current state until the QC cycle
     * ends. Collaborator failures after preflight started move the order to
     * FAILED with the reason recorded.
     */
    public OrderRecord run(String orderId) {
        String owner = newOwner();
        try (OrderLeaseRegistry.Lease lease = leases.acquire(orderId, owner)) {
            OrderRecord record = get(lease.orderId());
            OrderLifecycleState start = record.state();
            if (start != OrderLifecycleState.PENDING && start != OrderLifecycleState.WRITING
                && start != OrderLifecycleState.QC && start != OrderLifecycleState.PREFLIGHT) {
                throw new PlanningException(ErrorKind.ILLEGAL_TRANSITION,
                    "Order " + orderId + " cannot run from state " + start,
                    Map.of("order_id", orderId, "from", start.name()));
            }
            try {
                return advance(record, owner);
            } catch (PlanningException ex) {
                if (ex.getKind() == ErrorKind.ILLEGAL_TRANSITION) {
                    throw ex;
                }
                OrderRecord current = get(orderId);
                if (!current.state().canMoveTo(OrderLifecycleState.FAILED)) {
                    throw ex;
                }
                log.warn("Pipeline failed order={} kind={}: {}", orderId, ex.getKind(), ex.getMessage());
                return move(current.withFailureReason(ex.getKind() + ": " + ex.getMessage()),
                    OrderLifecycleState.FAILED, ex.getKind().name());
            } finally {
                stopRequests.remove(orderId, owner);
            }
        }
    }

    /**
     * QC for a draft written outside the pipeline. A matrix that no longer
     * matches the order or the registry is rebuilt and the draft is rejected
     * with {@code STALE_MATRIX}.
     */
    public OrderRecord submitDraft(String orderId, String articleText) {
        validator.validateArticle(articleText);
        try (OrderLeaseRegistry.Lease lease = leases.acquire(orderId, newOwner())) {
            OrderRecord record = get(lease.orderId());
            if (record.state() != OrderLifecycleState.WRITING) {
                throw new PlanningException(ErrorKind.ILLEGAL_TRANSITION,
                    "Drafts are only accepted in WRITING, order " + orderId + " is " + record.state(),
                    Map.of("order_id", orderId, "from", record.state().name()));
            }
            TrustRegistry registry = collectors.trustRegistry();
            if (isStale(record, registry)) {
                store.save(record.withMatrix(preflight.buildPreflight(record.order(), registry)));
                throw new PlanningException(ErrorKind.STALE_MATRIX,
                    "Matrix for order " + orderId + " was rebuilt; redraft against the new plan",
                    Map.of("order_id", orderId, "registry_version", registry.version()));
            }
            OrderRecord inQc = move(record.withDraft(articleText), OrderLifecycleState.QC, "draft submitted");
            return runQc(inQc, registry);
        }
    }

    /**
     * Delivers an approved order and records the placed anchor in the target's
     * portfolio. The order only becomes DELIVERED once the placement is
     * recorded. Delivering an already delivered order changes nothing.
     */
    public DeliveryReceipt deliver(String orderId) {
        try (OrderLeaseRegistry.Lease lease = leases.acquire(orderId, newOwner())) {
            OrderRecord record = get(lease.orderId());
            if (record.state() == OrderLifecycleState.DELIVERED) {
                return new DeliveryReceipt(record, null);
            }
            OrderRecord delivered = stateMachine.transition(record, OrderLifecycleState.DELIVERED, "delivered");
            String targetDomain = record.order().targetDomain();
            AnchorPortfolio before = collectors.anchorPortfolio(targetDomain);
            AnchorPortfolio after = collectors.recordPlacement(targetDomain,
                delivered.matrix().anchor().orderAnchorType());
            commit(record, delivered);
            PortfolioDelta delta = riskModel.compare(before, after);
            log.info("Anchor placement recorded order={} target={} risk {} -> {} ({})",
                orderId, targetDomain, delta.oldRisk(), delta.newRisk(), delta.direction());
            return new DeliveryReceipt(delivered, delta);
        }
    }

    private OrderRecord advance(OrderRecord start, String owner) {
        OrderRecord record = start;
        TrustRegistry registry = collectors.trustRegistry();
        while (true) {
            if (stopRequests.remove(record.orderId(), owner)) {
                log.info("Pipeline stopped order={} state={}", record.orderId(), record.state());
                return record;
            }
            switch (record.state()) {
                case PENDING -> record = move(record, OrderLifecycleState.PREFLIGHT, "pipeline started");
                case PREFLIGHT -> {
                    PreflightMatrix matrix = preflight.buildPreflight(record.order(), registry);
                    record = move(store.save(record.withMatrix(matrix)), OrderLifecycleState.WRITING,
                        "preflight matrix built");
                }
                case WRITING -> {
                    if (isStale(record, registry)) {
                        log.info("Stale matrix for order={}, rebuilding", record.orderId());
                        record = store.save(record.withMatrix(preflight.buildPreflight(record.order(), registry)));
                    }
                    String draft = collectors.draft(record.order(), record.matrix());
                    record = move(record.withDraft(draft), OrderLifecycleState.QC, "draft received");
                }
                case QC -> {
                    if (isStale(record, registry)) {
                        throw new PlanningException(ErrorKind.STALE_MATRIX,
                            "Order " + record.orderId() + " is in QC without a current matrix",
                            Map.of("order_id", record.orderId(), "registry_version", registry.version()));
                    }
                    return runQc(record, registry);
                }
                default -> {
                    return record;
                }
            }
        }
    }

    private OrderRecord runQc(OrderRecord record, TrustRegistry registry) {
        ValidationOutcome outcome = validation.validate(record.article(), record.matrix(), registry, true);
        ValidationReport report = outcome.report();
        OrderRecord checked = store.save(record.withReport(outcome.article(), report));
        return switch (report.status()) {
            case APPROVED -> move(checked, OrderLifecycleState.APPROVED, "QC approved");
            case LIGHT_EDITS -> move(checked, OrderLifecycleState.WRITING, "light edits requested");
            case BLOCKED -> move(checked.withFailureReason("QC blocked at " + report.totalScore()),
                OrderLifecycleState.FAILED, "QC blocked");
        };
    }

    private OrderRecord move(OrderRecord record, OrderLifecycleState target, String reason) {
        return commit(record, stateMachine.transition(record, target, reason));
    }

    private OrderRecord commit(OrderRecord record, OrderRecord moved) {
        store.save(moved);
        if (moved != record) {
            audit.record(AuditEntry.Kind.TRANSITION, record.orderId(), record.state() + " -> " + moved.state(),
                moved.history().get(moved.history().size() - 1));
        }
        return moved;
    }

    private static boolean isStale(OrderRecord record, TrustRegistry registry) {
        PreflightMatrix matrix = record.matrix();
        return matrix == null
            || !matrix.orderFingerprint().equals(OrderFingerprint.of(record.order()))
            || !matrix.registryVersion().equals(registry.version());
    }

    private static String newOwner() {
        return Thread.currentThread().getName() + "-" + UUID.randomUUID();
    }
}
