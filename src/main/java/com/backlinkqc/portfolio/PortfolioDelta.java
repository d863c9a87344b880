package com.backlinkqc.portfolio;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record PortfolioDelta(
    String targetDomain,
    double oldRisk,
    double newRisk,
    RiskLevel riskLevel,
    Direction direction
) {

    public enum Direction { IMPROVED, WORSENED, UNCHANGED }
}
