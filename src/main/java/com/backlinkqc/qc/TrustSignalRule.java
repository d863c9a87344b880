package com.backlinkqc.qc;

import com.backlinkqc.trust.ClassifiedLink;
import com.backlinkqc.trust.CompetitorHit;
import com.backlinkqc.trust.TrustTier;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Outbound citations: enough qualifying sources, no competitors, and no
 * unregistered domains when the topic is regulated.
 */
public class TrustSignalRule implements CategoryRule {

    static final int PENALTY_PER_MISSING_SIGNAL = 30;

    @Override
    public ScoreCategory category() {
        return ScoreCategory.TRUST;
    }

    @Override
    public CategoryResult evaluate(ArticleFacts facts) {
        List<ValidationIssue> issues = new ArrayList<>();
        boolean regulated = facts.matrix().compliance().regulated();
        boolean zeroed = false;

        if (!facts.competitorHits().isEmpty()) {
            String references = facts.competitorHits().stream()
                .map(CompetitorHit::reference)
                .collect(Collectors.joining(", "));
            issues.add(ValidationIssue.blocking(category(), IssueCategory.TRUST, "ERR_TRUST_COMPETITOR",
                "Competitor referenced: " + references, null));
            zeroed = true;
        }

        for (ClassifiedLink link : facts.outboundLinks()) {
            if (link.competitor()) {
                continue;
            }
            if (!link.registered()) {
                if (regulated) {
                    issues.add(ValidationIssue.blocking(category(), IssueCategory.TRUST,
                        "ERR_TRUST_UNREGISTERED_DOMAIN",
                        "Unregistered domain " + link.domain() + " cited in a regulated article", null));
                    zeroed = true;
                } else {
                    issues.add(ValidationIssue.info(category(), IssueCategory.TRUST, "UNREGISTERED_SOURCE",
                        "Source " + link.domain() + " is not in the trust registry", null));
                }
            } else if (!link.tier().meets(TrustTier.T2)) {
                issues.add(ValidationIssue.info(category(), IssueCategory.TRUST, "LOW_TIER_TRUST_SOURCE",
                    "Source " + link.domain() + " is tier " + link.tier().name()
                        + " and does not count as a trust signal", null));
            }
        }

        int required = facts.matrix().trust().requiredSignals();
        int qualifying = facts.qualifyingTrustSignals();
        int score = 100;
        if (qualifying == 0 && required > 0) {
            score = 0;
            issues.add(ValidationIssue.error(category(), IssueCategory.TRUST, "MISSING_TRUST_SIGNALS",
                "No qualifying trust sources cited, " + required + " expected", null));
        } else if (qualifying < required) {
            score -= PENALTY_PER_MISSING_SIGNAL * (required - qualifying);
            issues.add(ValidationIssue.warning(category(), IssueCategory.TRUST, "INSUFFICIENT_TRUST_SIGNALS",
                qualifying + " qualifying trust sources cited, " + required + " expected", null));
        }
        return new CategoryResult(zeroed ? 0 : score, issues);
    }
}
