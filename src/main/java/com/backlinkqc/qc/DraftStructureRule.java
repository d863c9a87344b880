package com.backlinkqc.qc;

import com.backlinkqc.lexical.Section;
import com.backlinkqc.preflight.WordCountPlan;

import java.util.ArrayList;
import java.util.List;

/**
 * Section structure and length of the draft.
 */
public class DraftStructureRule implements CategoryRule {

    static final int MIN_SECTIONS = 3;

    private final QcProperties properties;

    public DraftStructureRule(QcProperties properties) {
        this.properties = properties;
    }

    @Override
    public ScoreCategory category() {
        return ScoreCategory.DRAFT;
    }

    @Override
    public CategoryResult evaluate(ArticleFacts facts) {
        List<ValidationIssue> issues = new ArrayList<>();
        int score = 100;

        List<Section> sections = facts.document().sections();
        if (sections.size() < MIN_SECTIONS) {
            score -= 20;
            issues.add(ValidationIssue.warning(category(), IssueCategory.STRUCTURE, "INSUFFICIENT_SECTIONS",
                "Article has " + sections.size() + " sections, at least " + MIN_SECTIONS + " expected", null));
        }
        for (Section section : sections) {
            if (section.isEmpty()) {
                score -= 10;
                issues.add(ValidationIssue.warning(category(), IssueCategory.STRUCTURE, "EMPTY_SECTION",
                    "Section '" + section.title() + "' has no content", IssueLocation.section(section.index())));
            }
        }

        WordCountPlan plan = facts.matrix().wordCount();
        int words = facts.document().wordCount();
        double deviation = plan.target() == 0 ? 0.0 : Math.abs(words - plan.target()) / (double) plan.target();
        String message = "Word count " + words + " deviates " + Math.round(deviation * 100)
            + "% from target " + plan.target();
        if (deviation > properties.wordCountBlockTolerance()) {
            score -= 40;
            issues.add(ValidationIssue.blocking(category(), IssueCategory.STRUCTURE, "WORD_COUNT_MISMATCH",
                message, null));
        } else if (deviation > properties.wordCountWarnTolerance()) {
            score -= 15;
            issues.add(ValidationIssue.warning(category(), IssueCategory.STRUCTURE, "WORD_COUNT_MISMATCH",
                message, null));
        }
        return new CategoryResult(score, issues);
    }
}
