package com.backlinkqc.portfolio;

import java.util.List;

/**
 * Diversity/risk score of an anchor portfolio.
 *
 * <pre>
 * risk = 0.7 * exactRatio + 0.3 * (1 - diversity) * (1 - exactRatio)
 * </pre>
 * where {@code exactRatio = exact / total} and {@code diversity} is the
 * Shannon entropy of the four type proportions divided by {@code ln 4}.
 * The concentration term only weighs the non-exact share: a portfolio made
 * purely of exact anchors scores 0.7, an evenly spread one 0.175.
 * An empty portfolio has exact ratio 0 and diversity 1, so its risk is 0.
 *
 * Pure: never mutates the portfolio it scores.
 */
public class AnchorRiskModel {

    static final double EXACT_WEIGHT = 0.7;
    static final double DIVERSITY_WEIGHT = 0.3;
    static final double HIGH_RISK_THRESHOLD = 0.6;
    static final double LOW_RISK_THRESHOLD = 0.3;

    private static final double MAX_ENTROPY = Math.log(4);
    private static final double UNCHANGED_EPSILON = 0.01;

    public double risk(AnchorPortfolio portfolio) {
        int total = portfolio.total();
        double exactRatio = total == 0 ? 0.0 : (double) portfolio.exact() / total;
        return EXACT_WEIGHT * exactRatio + DIVERSITY_WEIGHT * (1.0 - diversity(portfolio)) * (1.0 - exactRatio);
    }

    public double diversity(AnchorPortfolio portfolio) {
        int total = portfolio.total();
        if (total == 0) {
            return 1.0;
        }
        double entropy = 0.0;
        for (AnchorType type : AnchorType.values()) {
            int count = portfolio.count(type);
            if (count > 0) {
                double p = (double) count / total;
                entropy -= p * Math.log(p);
            }
        }
        return Math.max(0.0, Math.min(1.0, entropy / MAX_ENTROPY));
    }

    /**
     * Applies the allocation policy: above 0.6 exact anchors are forbidden,
     * above 0.3 at most one new link in ten may be exact, otherwise up to 20%.
     */
    public AnchorRecommendation recommend(AnchorPortfolio portfolio) {
        double risk = risk(portfolio);
        RiskLevel level = RiskLevel.of(risk);
        return switch (level) {
            case HIGH -> new AnchorRecommendation(risk, level,
                List.of(AnchorType.BRAND, AnchorType.GENERIC), AnchorType.BRAND, 0.0);
            case MEDIUM -> new AnchorRecommendation(risk, level,
                List.of(AnchorType.PARTIAL, AnchorType.BRAND, AnchorType.GENERIC, AnchorType.EXACT),
                AnchorType.PARTIAL, 0.10);
            case LOW -> new AnchorRecommendation(risk, level,
                List.of(AnchorType.EXACT, AnchorType.PARTIAL, AnchorType.BRAND, AnchorType.GENERIC),
                AnchorType.PARTIAL, 0.20);
        };
    }

    public PortfolioDelta compare(AnchorPortfolio before, AnchorPortfolio after) {
        double oldRisk = risk(before);
        double newRisk = risk(after);
        double change = newRisk - oldRisk;
        PortfolioDelta.Direction direction;
        if (Math.abs(change) < UNCHANGED_EPSILON) {
            direction = PortfolioDelta.Direction.UNCHANGED;
        } else if (change < 0) {
            direction = PortfolioDelta.Direction.IMPROVED;
        } else {
            direction = PortfolioDelta.Direction.WORSENED;
        }
        return new PortfolioDelta(after.targetDomain(), oldRisk, newRisk, RiskLevel.of(newRisk), direction);
    }
}
