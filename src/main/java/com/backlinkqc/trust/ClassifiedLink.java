package com.backlinkqc.trust;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ClassifiedLink(
    String url,
    String domain,
    TrustTier tier,
    boolean competitor,
    boolean registered
) {}
