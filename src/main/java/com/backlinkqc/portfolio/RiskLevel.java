package com.backlinkqc.portfolio;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum RiskLevel {
    LOW,
    MEDIUM,
    HIGH;

    public static RiskLevel of(double risk) {
        if (risk > AnchorRiskModel.HIGH_RISK_THRESHOLD) {
            return HIGH;
        }
        if (risk > AnchorRiskModel.LOW_RISK_THRESHOLD) {
            return MEDIUM;
        }
        return LOW;
    }

    @JsonValue
    public String getValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
