package com.backlinkqc.qc;

import java.util.List;

/**
 * Score (clamped to 0..100) and findings of one category rule.
 */
public record CategoryResult(int score, List<ValidationIssue> issues) {

    public CategoryResult {
        score = Math.max(0, Math.min(100, score));
        issues = List.copyOf(issues);
    }

    public static CategoryResult perfect() {
        return new CategoryResult(100, List.of());
    }
}
