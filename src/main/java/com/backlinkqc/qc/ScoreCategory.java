package com.backlinkqc.qc;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * The seven scored categories and their weights. Weights are integer
 * percentages summing to 100 so the weighted total is exact.
 */
public enum ScoreCategory {
    PREFLIGHT("preflight", 25),
    DRAFT("draft", 15),
    ANCHOR("anchor", 20),
    TRUST("trust", 15),
    LSI("lsi", 15),
    FIT("fit", 5),
    COMPLIANCE("compliance", 5);

    private final String value;
    private final int weightPercent;

    ScoreCategory(String value, int weightPercent) {
        this.value = value;
        this.weightPercent = weightPercent;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public int weightPercent() {
        return weightPercent;
    }

    public double weight() {
        return weightPercent / 100.0;
    }

    @Override
    public String toString() {
        return value;
    }
}
