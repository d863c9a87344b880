package com.backlinkqc.autofix;

import com.backlinkqc.preflight.PreflightMatrix;
import com.backlinkqc.qc.ComplianceRule;
import com.backlinkqc.qc.QcScoringEngine;
import com.backlinkqc.qc.ValidationIssue;
import com.backlinkqc.qc.ValidationReport;
import com.backlinkqc.trust.TrustRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;
import java.util.Set;

/**
 * Applies at most one automated repair per validation cycle.
 *
 * <p>The attempt counter travels in the report: a report that already
 * records an attempt is returned untouched. Otherwise the highest-ranked
 * fixable issue picks the repair, the repair runs once, and a successful
 * repair is followed by exactly one re-evaluation whose report is final.
 * A repair that cannot be applied still consumes the cycle and leaves its
 * record on the original findings.</p>
 *
 * <p>Human-only findings ({@code ANCHOR_IN_HEADER}, {@code ERR_TRUST_COMPETITOR},
 * {@code ERR_COMPLIANCE}) are never repaired.</p>
 */
public class AutoFixController {

    private static final Logger log = LoggerFactory.getLogger(AutoFixController.class);

    static final int MAX_ATTEMPTS = 1;
    static final Set<String> HUMAN_ONLY_CODES = Set.of("ANCHOR_IN_HEADER", "ERR_TRUST_COMPETITOR", "ERR_COMPLIANCE");

    private final QcScoringEngine engine;
    private final ArticleRepairer repairer;

    public AutoFixController(QcScoringEngine engine, ArticleRepairer repairer) {
        this.engine = engine;
        this.repairer = repairer;
    }

    public AutoFixOutcome maybeFix(String article, ValidationReport report, PreflightMatrix matrix,
                                   TrustRegistry registry) {
        if (report.autoFixAttempts() >= MAX_ATTEMPTS) {
            log.debug("Auto-fix already used for order={}, report is final", matrix.orderId());
            return new AutoFixOutcome(article, report, null);
        }
        Optional<Target> target = selectTarget(report, matrix);
        if (target.isEmpty()) {
            return new AutoFixOutcome(article, report, null);
        }

        Target chosen = target.get();
        ArticleRepairer.Repair repair = switch (chosen.kind()) {
            case ADD_DISCLAIMER -> repairer.addDisclaimer(article, chosen.tag());
            case MOVE_LINK -> repairer.moveLink(article, matrix);
            case INJECT_LSI -> repairer.injectLsi(article, matrix);
            case ADD_TRUST -> repairer.addTrust(article, matrix);
        };
        FixRecord record = new FixRecord(chosen.kind(), chosen.issueCode(), repair.description(), repair.applied());

        if (!repair.applied()) {
            log.warn("Auto-fix {} for order={} could not be applied: {}",
                chosen.kind().getValue(), matrix.orderId(), repair.description());
            return new AutoFixOutcome(article, report.withFixAttempt(record), record);
        }
        log.info("Auto-fix {} applied for order={} issue={}",
            chosen.kind().getValue(), matrix.orderId(), chosen.issueCode());
        ValidationReport finalReport = engine.evaluate(repair.text(), matrix, registry, MAX_ATTEMPTS, record);
        return new AutoFixOutcome(repair.text(), finalReport, record);
    }

    private record Target(FixKind kind, String issueCode, String tag) {}

    /** First fixable issue in report order, which is recommendation order. */
    private Optional<Target> selectTarget(ValidationReport report, PreflightMatrix matrix) {
        for (ValidationIssue issue : report.issues()) {
            String code = issue.code();
            if (HUMAN_ONLY_CODES.contains(code)) {
                continue;
            }
            switch (code) {
                case "ANCHOR_PLACEMENT_WRONG":
                    return Optional.of(new Target(FixKind.MOVE_LINK, code, null));
                case "INSUFFICIENT_LSI_TERMS":
                    return Optional.of(new Target(FixKind.INJECT_LSI, code, null));
                case "INSUFFICIENT_TRUST_SIGNALS":
                    return Optional.of(new Target(FixKind.ADD_TRUST, code, null));
                default:
                    break;
            }
            for (String tag : matrix.compliance().requiredTags()) {
                if (ComplianceRule.missingDisclaimerCode(tag).equals(code)) {
                    return Optional.of(new Target(FixKind.ADD_DISCLAIMER, code, tag));
                }
            }
        }
        return Optional.empty();
    }
}
