package com.backlinkqc.qc;

import com.backlinkqc.preflight.LsiPlan;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Counts the plan's LSI vocabulary in the sentence window around the anchor.
 * The count bounds are inclusive: exactly {@code minTerms} or {@code maxTerms}
 * distinct lemmas score 100.
 */
public class LsiCoverageRule implements CategoryRule {

    @Override
    public ScoreCategory category() {
        return ScoreCategory.LSI;
    }

    @Override
    public CategoryResult evaluate(ArticleFacts facts) {
        if (!facts.anchorFound()) {
            return new CategoryResult(0, List.of(ValidationIssue.error(category(), IssueCategory.LSI,
                "ANCHOR_NOT_FOUND_FOR_LSI", "LSI window cannot be measured without the anchor", null)));
        }
        LsiPlan plan = facts.matrix().lsi();
        Set<String> vocabulary = plan.vocabulary();
        IssueLocation location = new IssueLocation(facts.anchor().sectionIndex(), facts.anchor().paragraphNumber(),
            facts.anchor().sentenceIndex());

        List<ValidationIssue> issues = new ArrayList<>();
        int distinct = 0;
        List<String> overused = new ArrayList<>();
        for (Map.Entry<String, Integer> entry : facts.windowLemmas().entrySet()) {
            if (vocabulary.contains(entry.getKey())) {
                distinct++;
                if (entry.getValue() > plan.maxRepeat()) {
                    overused.add(entry.getKey());
                }
            }
        }

        int score = 100;
        if (distinct < plan.minTerms()) {
            score = 100 * distinct / plan.minTerms();
            issues.add(ValidationIssue.warning(category(), IssueCategory.LSI, "INSUFFICIENT_LSI_TERMS",
                distinct + " LSI terms near the anchor, at least " + plan.minTerms() + " expected", location));
        } else if (distinct > plan.maxTerms()) {
            score = 100 - 10 * (distinct - plan.maxTerms());
            issues.add(ValidationIssue.warning(category(), IssueCategory.LSI, "EXCESSIVE_LSI_TERMS",
                distinct + " LSI terms near the anchor, at most " + plan.maxTerms() + " expected", location));
        }
        for (String lemma : overused) {
            score -= 10;
            issues.add(ValidationIssue.warning(category(), IssueCategory.LSI, "LSI_OVERUSE",
                "'" + lemma + "' is used " + facts.windowLemmas().get(lemma) + " times near the anchor, at most "
                    + plan.maxRepeat() + " allowed", location));
        }
        return new CategoryResult(score, issues);
    }
}
