package com.backlinkqc.qc;

import com.backlinkqc.autofix.FixRecord;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Folds category scores and issues into a {@link ValidationReport}: weighted
 * total, status, signoff flag, ranked recommendations and next actions.
 *
 * <p>Status: BLOCKED when the total is below the light-edits threshold or any
 * hard-block issue is present, APPROVED at or above the approved threshold,
 * LIGHT_EDITS otherwise.</p>
 *
 * <p>Recommendations are ranked hard-block first, then by the weight of the
 * category the issue was scored under (heaviest first), then by severity,
 * then by issue code. One recommendation per code.</p>
 */
public class ValidationReportAssembler {

    static final Set<String> SIGNOFF_CODES = Set.of("ANCHOR_IN_HEADER", "ERR_TRUST_COMPETITOR", "ERR_COMPLIANCE");

    static final Comparator<ValidationIssue> RANKING = Comparator
        .comparing((ValidationIssue issue) -> !issue.hardBlock())
        .thenComparingInt(issue -> -issue.scoredUnder().weightPercent())
        .thenComparingInt(issue -> issue.severity().rank())
        .thenComparing(ValidationIssue::code);

    private final QcProperties properties;

    public ValidationReportAssembler(QcProperties properties) {
        this.properties = properties;
    }

    public ValidationReport assemble(Map<ScoreCategory, Integer> scores,
                                     List<ValidationIssue> issues,
                                     int qualifyingTrustSignals,
                                     int autoFixAttempts,
                                     FixRecord fix) {
        Map<ScoreCategory, Integer> ordered = new LinkedHashMap<>();
        int weighted = 0;
        for (ScoreCategory category : ScoreCategory.values()) {
            Integer score = scores.get(category);
            if (score == null) {
                throw new IllegalArgumentException("missing score for category " + category);
            }
            ordered.put(category, score);
            weighted += score * category.weightPercent();
        }
        double total = Math.round(weighted / 10.0) / 10.0;

        boolean hardBlock = issues.stream().anyMatch(ValidationIssue::hardBlock);
        ReportStatus status;
        if (hardBlock || total < properties.lightEditsThreshold()) {
            status = ReportStatus.BLOCKED;
        } else if (total >= properties.approvedThreshold()) {
            status = ReportStatus.APPROVED;
        } else {
            status = ReportStatus.LIGHT_EDITS;
        }

        boolean signoff = qualifyingTrustSignals == 0
            || issues.stream().anyMatch(issue -> SIGNOFF_CODES.contains(issue.code()))
            || ordered.values().stream().anyMatch(score -> score < properties.signoffCategoryFloor());

        List<ValidationIssue> ranked = rank(issues);
        return new ValidationReport(status, total, ordered, ranked, qualifyingTrustSignals, autoFixAttempts,
            signoff, recommend(ranked), nextActions(status, signoff), fix);
    }

    /** Issues in recommendation order. */
    public static List<ValidationIssue> rank(List<ValidationIssue> issues) {
        List<ValidationIssue> ranked = new ArrayList<>(issues);
        ranked.sort(RANKING);
        return ranked;
    }

    private List<Recommendation> recommend(List<ValidationIssue> ranked) {
        Set<String> codes = new LinkedHashSet<>();
        for (ValidationIssue issue : ranked) {
            if (codes.size() >= properties.maxRecommendations()) {
                break;
            }
            codes.add(issue.code());
        }
        return codes.stream()
            .map(code -> new Recommendation(code, RecommendationCatalog.actionFor(code)))
            .toList();
    }

    private static List<String> nextActions(ReportStatus status, boolean signoff) {
        List<String> actions = new ArrayList<>();
        switch (status) {
            case APPROVED -> actions.add("Proceed to delivery");
            case LIGHT_EDITS -> {
                actions.add("Apply the recommended edits");
                actions.add("Re-run QC validation");
            }
            case BLOCKED -> {
                actions.add("Address the critical issues before resubmitting");
                actions.add("Re-run QC validation after the rewrite");
            }
        }
        if (signoff) {
            actions.add("Request human sign-off");
        }
        return actions;
    }
}
