package com.backlinkqc.preflight;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Planning parameters, bound from {@code backlinkqc.preflight.*}.
 */
@ConfigurationProperties(prefix = "backlinkqc.preflight")
public record PreflightProperties(
    @DefaultValue("6") int lsiMin,
    @DefaultValue("10") int lsiMax,
    @DefaultValue("8") int lsiTarget,
    @DefaultValue("2") int windowRadius,
    @DefaultValue("2") int maxRepeat,
    @DefaultValue("6") int reserveTerms,
    @DefaultValue("2") int requiredTrustSignals,
    @DefaultValue("3") int suggestedTrustSources,
    @DefaultValue("800") int defaultWordCount,
    @DefaultValue("0.20") double wordCountTolerance,
    @DefaultValue("2") int preferredAnchorParagraph
) {

    public PreflightProperties {
        if (lsiMin < LsiPlan.ABSOLUTE_MIN || lsiMax > LsiPlan.ABSOLUTE_MAX || lsiMin > lsiMax) {
            throw new IllegalArgumentException("LSI bounds must lie within [6,10], got [" + lsiMin + "," + lsiMax + "]");
        }
        if (lsiTarget < lsiMin || lsiTarget > lsiMax) {
            throw new IllegalArgumentException("lsi-target must lie within the LSI bounds");
        }
    }

    public static PreflightProperties defaults() {
        return new PreflightProperties(6, 10, 8, 2, 2, 6, 2, 3, 800, 0.20, 2);
    }
}
