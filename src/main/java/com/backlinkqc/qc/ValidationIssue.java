package com.backlinkqc.qc;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.Objects;

/**
 * One finding of a QC pass.
 *
 * @param hardBlock   true when the finding forces a BLOCKED report on its own
 * @param scoredUnder the score category the finding deducted from; drives
 *                    recommendation ranking
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ValidationIssue(
    IssueSeverity severity,
    IssueCategory category,
    String code,
    String message,
    IssueLocation location,
    boolean hardBlock,
    ScoreCategory scoredUnder
) {

    public ValidationIssue {
        Objects.requireNonNull(severity, "severity");
        Objects.requireNonNull(category, "category");
        Objects.requireNonNull(code, "code");
        Objects.requireNonNull(scoredUnder, "scoredUnder");
    }

    public static ValidationIssue error(ScoreCategory scoredUnder, IssueCategory category, String code,
                                        String message, IssueLocation location) {
        return new ValidationIssue(IssueSeverity.ERROR, category, code, message, location, false, scoredUnder);
    }

    public static ValidationIssue blocking(ScoreCategory scoredUnder, IssueCategory category, String code,
                                           String message, IssueLocation location) {
        return new ValidationIssue(IssueSeverity.ERROR, category, code, message, location, true, scoredUnder);
    }

    public static ValidationIssue warning(ScoreCategory scoredUnder, IssueCategory category, String code,
                                          String message, IssueLocation location) {
        return new ValidationIssue(IssueSeverity.WARNING, category, code, message, location, false, scoredUnder);
    }

    public static ValidationIssue info(ScoreCategory scoredUnder, IssueCategory category, String code,
                                       String message, IssueLocation location) {
        return new ValidationIssue(IssueSeverity.INFO, category, code, message, location, false, scoredUnder);
    }
}
