package com.backlinkqc.qc;

import com.backlinkqc.trust.DisclaimerCatalog;
import com.backlinkqc.trust.ProhibitedClaim;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Required disclaimers and prohibited claims for the plan's compliance tags.
 */
public class ComplianceRule implements CategoryRule {

    private final DisclaimerCatalog catalog;

    public ComplianceRule(DisclaimerCatalog catalog) {
        this.catalog = catalog;
    }

    @Override
    public ScoreCategory category() {
        return ScoreCategory.COMPLIANCE;
    }

    /** {@code MISSING_GAMBLING_DISCLAIMER} for tag {@code gambling}. */
    public static String missingDisclaimerCode(String tag) {
        return "MISSING_" + tag.toUpperCase(Locale.ROOT).replaceAll("[^A-Z0-9]+", "_") + "_DISCLAIMER";
    }

    @Override
    public CategoryResult evaluate(ArticleFacts facts) {
        List<String> required = facts.matrix().compliance().requiredTags();
        if (required.isEmpty()) {
            return CategoryResult.perfect();
        }
        List<ValidationIssue> issues = new ArrayList<>();
        boolean zeroed = false;

        for (ProhibitedClaim claim : facts.prohibitedClaims()) {
            issues.add(ValidationIssue.blocking(category(), IssueCategory.COMPLIANCE, "ERR_COMPLIANCE",
                "Prohibited " + claim.tag() + " claim: '" + claim.phrase() + "'", null));
            zeroed = true;
        }
        for (String tag : facts.missingDisclaimers()) {
            boolean regulated = catalog.isRegulated(tag);
            ValidationIssue issue = regulated
                ? ValidationIssue.blocking(category(), IssueCategory.COMPLIANCE, missingDisclaimerCode(tag),
                    "Required " + tag + " disclaimer is missing", null)
                : ValidationIssue.error(category(), IssueCategory.COMPLIANCE, missingDisclaimerCode(tag),
                    "Required " + tag + " disclaimer is missing", null);
            issues.add(issue);
            zeroed |= regulated;
        }
        int satisfied = required.size() - facts.missingDisclaimers().size();
        int score = zeroed ? 0 : 100 * satisfied / required.size();
        return new CategoryResult(score, issues);
    }
}
