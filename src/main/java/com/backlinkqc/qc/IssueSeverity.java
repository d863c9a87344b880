package com.backlinkqc.qc;

import com.fasterxml.jackson.annotation.JsonValue;

public enum IssueSeverity {
    ERROR("error", 0),
    WARNING("warning", 1),
    INFO("info", 2);

    private final String value;
    private final int rank;

    IssueSeverity(String value, int rank) {
        this.value = value;
        this.rank = rank;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /** Lower is more severe. */
    public int rank() {
        return rank;
    }
}
