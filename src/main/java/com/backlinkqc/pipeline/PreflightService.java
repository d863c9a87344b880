package com.backlinkqc.pipeline;

import com.backlinkqc.audit.AuditEntry;
import com.backlinkqc.audit.AuditTrail;
import com.backlinkqc.collector.CollectorGateway;
import com.backlinkqc.contract.ErrorKind;
import com.backlinkqc.contract.OrderContractValidator;
import com.backlinkqc.contract.PlanningException;
import com.backlinkqc.order.Order;
import com.backlinkqc.portfolio.AnchorPortfolio;
import com.backlinkqc.preflight.PreflightMatrix;
import com.backlinkqc.preflight.PreflightMatrixBuilder;
import com.backlinkqc.preflight.PublisherProfile;
import com.backlinkqc.preflight.SerpSignal;
import com.backlinkqc.trust.TrustRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * {@code build_preflight(order)}: gathers the collaborator data for an order
 * and builds its matrix. Profile, portfolio and registry failures are fatal;
 * a failing SERP collector only removes SERP support from term ranking.
 */
@Service
public class PreflightService {

    private static final Logger log = LoggerFactory.getLogger(PreflightService.class);

    private final OrderContractValidator validator;
    private final CollectorGateway collectors;
    private final PreflightMatrixBuilder builder;
    private final AuditTrail audit;

    public PreflightService(OrderContractValidator validator,
                            CollectorGateway collectors,
                            PreflightMatrixBuilder builder,
                            AuditTrail audit) {
        this.validator = validator;
        this.collectors = collectors;
        this.builder = builder;
        this.audit = audit;
    }

    public PreflightMatrix buildPreflight(Order order) {
        validator.validate(order);
        TrustRegistry registry = collectors.trustRegistry();
        return buildPreflight(order, registry);
    }

    PreflightMatrix buildPreflight(Order order, TrustRegistry registry) {
        PublisherProfile profile = collectors.publisherProfile(order.normalizedPublisherDomain());
        if (profile == null) {
            throw PlanningException.dependencyUnavailable("publisher_profile", order.normalizedPublisherDomain(), null);
        }
        AnchorPortfolio portfolio = collectors.anchorPortfolio(order.targetDomain());
        SerpSignal serp = null;
        try {
            serp = collectors.serpSignal(order.topic());
        } catch (PlanningException ex) {
            if (ex.getKind() != ErrorKind.DEPENDENCY_UNAVAILABLE) {
                throw ex;
            }
            log.warn("SERP signal unavailable for order={}: {}", order.orderId(), ex.getMessage());
        }
        PreflightMatrix matrix = builder.build(order, profile, serp, portfolio, registry);
        audit.record(AuditEntry.Kind.MATRIX, order.orderId(),
            "matrix built against registry " + registry.version(), matrix);
        return matrix;
    }
}
