package com.backlinkqc.portfolio;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

/**
 * Historical anchor-type counts for one target domain. The risk score is not
 * stored here: it is always derived from the counts by {@link AnchorRiskModel}.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record AnchorPortfolio(
    String targetDomain,
    int exact,
    int partial,
    int brand,
    int generic
) {

    public AnchorPortfolio {
        if (exact < 0 || partial < 0 || brand < 0 || generic < 0) {
            throw new IllegalArgumentException("anchor counts must be non-negative for " + targetDomain);
        }
    }

    public static AnchorPortfolio empty(String targetDomain) {
        return new AnchorPortfolio(targetDomain, 0, 0, 0, 0);
    }

    @JsonIgnore
    public int total() {
        return exact + partial + brand + generic;
    }

    public int count(AnchorType type) {
        return switch (type) {
            case EXACT -> exact;
            case PARTIAL -> partial;
            case BRAND -> brand;
            case GENERIC -> generic;
        };
    }

    /** Returns a copy with one more placed anchor of {@code type}. */
    public AnchorPortfolio plus(AnchorType type) {
        return new AnchorPortfolio(targetDomain,
            exact + (type == AnchorType.EXACT ? 1 : 0),
            partial + (type == AnchorType.PARTIAL ? 1 : 0),
            brand + (type == AnchorType.BRAND ? 1 : 0),
            generic + (type == AnchorType.GENERIC ? 1 : 0));
    }
}
