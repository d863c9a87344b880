package com.backlinkqc.qc;

import com.backlinkqc.autofix.FixRecord;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable result of one QC pass.
 *
 * @param scores          per-category score, in {@link ScoreCategory} order
 * @param autoFixAttempts 0 or 1
 * @param fix             the repair attempted before this report, or null
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ValidationReport(
    ReportStatus status,
    double totalScore,
    Map<ScoreCategory, Integer> scores,
    List<ValidationIssue> issues,
    int qualifyingTrustSignals,
    int autoFixAttempts,
    boolean humanSignoffRequired,
    List<Recommendation> recommendations,
    List<String> nextActions,
    FixRecord fix
) {

    public ValidationReport {
        if (autoFixAttempts < 0 || autoFixAttempts > 1) {
            throw new IllegalArgumentException("autoFixAttempts must be 0 or 1, got " + autoFixAttempts);
        }
        scores = Collections.unmodifiableMap(new LinkedHashMap<>(scores));
        issues = List.copyOf(issues);
        recommendations = List.copyOf(recommendations);
        nextActions = List.copyOf(nextActions);
    }

    public int score(ScoreCategory category) {
        return scores.getOrDefault(category, 0);
    }

    public boolean hasIssue(String code) {
        return issues.stream().anyMatch(issue -> issue.code().equals(code));
    }

    public boolean hasHardBlock() {
        return issues.stream().anyMatch(ValidationIssue::hardBlock);
    }

    /** Same findings, marked as the result of a used-up auto-fix cycle. */
    public ValidationReport withFixAttempt(FixRecord record) {
        return new ValidationReport(status, totalScore, scores, issues, qualifyingTrustSignals, 1,
            humanSignoffRequired, recommendations, nextActions, record);
    }
}
