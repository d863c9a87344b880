package com.backlinkqc.preflight;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.List;

/**
 * Immutable content plan for one order. Built once; a draft checked against a
 * matrix whose {@code orderFingerprint} or {@code registryVersion} no longer
 * matches must trigger a rebuild.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record PreflightMatrix(
    String orderId,
    String orderFingerprint,
    String registryVersion,
    String publisherDomain,
    String targetUrl,
    String targetDomain,
    String sourceIndustry,
    String targetIndustry,
    String queryCluster,
    List<String> intents,
    MidpointBridge midpoint,
    List<MidpointBridge> midpointCandidates,
    LsiPlan lsi,
    AnchorPlan anchor,
    TrustPlan trust,
    CompliancePlan compliance,
    WordCountPlan wordCount,
    VoicePlan voice
) {

    public PreflightMatrix {
        intents = List.copyOf(intents);
        midpointCandidates = List.copyOf(midpointCandidates);
        if (lsi == null || midpoint == null || anchor == null) {
            throw new IllegalArgumentException("preflight matrix requires lsi, midpoint and anchor plans");
        }
    }
}
