package com.backlinkqc.preflight;

import com.backlinkqc.trust.TrustTier;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record TrustPlan(
    int requiredSignals,
    TrustTier minimumTier,
    List<TrustTier> preferredTiers,
    List<String> suggestedSources
) {

    public TrustPlan {
        preferredTiers = List.copyOf(preferredTiers);
        suggestedSources = List.copyOf(suggestedSources);
    }
}
