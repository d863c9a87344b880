package com.backlinkqc.qc;

import com.backlinkqc.lexical.ArticleLink;
import com.backlinkqc.preflight.AnchorPlan;
import com.backlinkqc.preflight.PreflightMatrix;
import com.backlinkqc.trust.DomainNames;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Checks that the draft follows the plan it was written against: the anchor
 * is hyperlinked to the target exactly once, the midpoint concept is present,
 * and the order's anchor type is one the portfolio allows.
 */
public class PreflightConformanceRule implements CategoryRule {

    @Override
    public ScoreCategory category() {
        return ScoreCategory.PREFLIGHT;
    }

    @Override
    public CategoryResult evaluate(ArticleFacts facts) {
        PreflightMatrix matrix = facts.matrix();
        AnchorPlan anchorPlan = matrix.anchor();
        List<ValidationIssue> issues = new ArrayList<>();
        int score = 100;

        List<ArticleLink> anchorLinks = facts.document().links().stream()
            .filter(ArticleLink::markdown)
            .filter(link -> link.text().equalsIgnoreCase(anchorPlan.primary().strip()))
            .toList();
        if (anchorLinks.isEmpty()) {
            score -= 30;
            issues.add(ValidationIssue.warning(category(), IssueCategory.ANCHOR, "ANCHOR_NOT_LINKED",
                "Anchor text '" + anchorPlan.primary() + "' is not hyperlinked", null));
        }
        for (ArticleLink link : anchorLinks) {
            if (!DomainNames.belongsTo(DomainNames.hostOf(link.url()), matrix.targetDomain())) {
                score -= 40;
                issues.add(ValidationIssue.error(category(), IssueCategory.ANCHOR, "ANCHOR_TARGET_MISMATCH",
                    "Anchor links to " + link.url() + " instead of " + matrix.targetUrl(), null));
                break;
            }
        }

        long targetLinks = facts.document().links().stream()
            .filter(link -> DomainNames.belongsTo(DomainNames.hostOf(link.url()), matrix.targetDomain()))
            .count();
        if (targetLinks > 1) {
            score -= 20;
            issues.add(ValidationIssue.warning(category(), IssueCategory.ANCHOR, "DUPLICATE_TARGET_LINK",
                "Target domain is linked " + targetLinks + " times; keep a single link", null));
        }

        String label = matrix.midpoint().label().toLowerCase(Locale.ROOT);
        if (!facts.text().toLowerCase(Locale.ROOT).contains(label)) {
            score -= 20;
            issues.add(ValidationIssue.warning(category(), IssueCategory.CONTENT, "MIDPOINT_BRIDGE_MISSING",
                "Midpoint concept '" + matrix.midpoint().label() + "' is not mentioned", null));
        }

        if (!anchorPlan.recommendation().allows(anchorPlan.orderAnchorType())) {
            score -= 15;
            issues.add(ValidationIssue.warning(category(), IssueCategory.ANCHOR, "ANCHOR_TYPE_DISCOURAGED",
                "Anchor type " + anchorPlan.orderAnchorType().getValue() + " is discouraged at "
                    + anchorPlan.recommendation().riskLevel().getValue() + " portfolio risk; consider '"
                    + anchorPlan.backup() + "'", null));
        }
        return new CategoryResult(score, issues);
    }
}
