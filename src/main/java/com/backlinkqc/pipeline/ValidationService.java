package com.backlinkqc.pipeline;

import com.backlinkqc.audit.AuditEntry;
import com.backlinkqc.audit.AuditTrail;
import com.backlinkqc.autofix.AutoFixController;
import com.backlinkqc.autofix.AutoFixOutcome;
import com.backlinkqc.collector.CollectorGateway;
import com.backlinkqc.contract.ErrorKind;
import com.backlinkqc.contract.OrderContractValidator;
import com.backlinkqc.contract.PlanningException;
import com.backlinkqc.preflight.PreflightMatrix;
import com.backlinkqc.qc.QcScoringEngine;
import com.backlinkqc.qc.ValidationReport;
import com.backlinkqc.trust.TrustRegistry;
import org.springframework.stereotype.Service;

import java.util.Map;

/**
 * {@code validate(article_text, matrix, auto_fix)}: scores a draft against the
 * current registry snapshot and, when asked, spends the cycle's single
 * auto-fix.
 */
@Service
public class ValidationService {

    private final OrderContractValidator validator;
    private final CollectorGateway collectors;
    private final QcScoringEngine engine;
    private final AutoFixController autoFix;
    private final AuditTrail audit;

    public ValidationService(OrderContractValidator validator,
                             CollectorGateway collectors,
                             QcScoringEngine engine,
                             AutoFixController autoFix,
                             AuditTrail audit) {
        this.validator = validator;
        this.collectors = collectors;
        this.engine = engine;
        this.autoFix = autoFix;
        this.audit = audit;
    }

    public ValidationOutcome validate(String articleText, PreflightMatrix matrix, boolean autoFixEnabled) {
        validator.validateArticle(articleText);
        if (matrix == null) {
            throw new PlanningException(ErrorKind.CONTRACT_VIOLATION, "matrix is required");
        }
        TrustRegistry registry = collectors.trustRegistry();
        if (!registry.version().equals(matrix.registryVersion())) {
            throw new PlanningException(ErrorKind.STALE_MATRIX,
                "Matrix for order " + matrix.orderId() + " was built against an outdated trust registry",
                Map.of("matrix_registry_version", String.valueOf(matrix.registryVersion()),
                    "current_registry_version", registry.version()));
        }
        return validate(articleText, matrix, registry, autoFixEnabled);
    }

    ValidationOutcome validate(String articleText, PreflightMatrix matrix, TrustRegistry registry,
                               boolean autoFixEnabled) {
        ValidationReport report = engine.evaluate(articleText, matrix, registry);
        ValidationOutcome outcome;
        if (autoFixEnabled) {
            AutoFixOutcome fixed = autoFix.maybeFix(articleText, report, matrix, registry);
            outcome = new ValidationOutcome(fixed.article(), fixed.report(), fixed.fix());
        } else {
            outcome = new ValidationOutcome(articleText, report, null);
        }
        audit.record(AuditEntry.Kind.REPORT, matrix.orderId(),
            "QC " + outcome.report().status() + " score " + outcome.report().totalScore(), outcome.report());
        return outcome;
    }
}
