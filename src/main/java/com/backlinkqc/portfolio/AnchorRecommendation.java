package com.backlinkqc.portfolio;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.List;

/**
 * Anchor-type guidance for new links to a target domain.
 *
 * @param maxExactShare highest share of new links that may use an exact-match anchor
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record AnchorRecommendation(
    double riskScore,
    RiskLevel riskLevel,
    List<AnchorType> allowedTypes,
    AnchorType preferredType,
    double maxExactShare
) {

    public AnchorRecommendation {
        allowedTypes = List.copyOf(allowedTypes);
    }

    public boolean allows(AnchorType type) {
        return allowedTypes.contains(type);
    }
}
