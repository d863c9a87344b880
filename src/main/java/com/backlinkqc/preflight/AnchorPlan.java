package com.backlinkqc.preflight;

import com.backlinkqc.portfolio.AnchorRecommendation;
import com.backlinkqc.portfolio.AnchorType;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

/**
 * @param primary            the order's anchor text
 * @param orderAnchorType    how the order's anchor classifies against the target host
 * @param backup             a fallback anchor of the recommended type
 * @param placementSection   always {@code midpoint}
 * @param preferredParagraph one-based paragraph inside the midpoint section
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record AnchorPlan(
    String primary,
    AnchorType orderAnchorType,
    String backup,
    AnchorRecommendation recommendation,
    String placementSection,
    int preferredParagraph
) {

    public static final String MIDPOINT = "midpoint";
}
