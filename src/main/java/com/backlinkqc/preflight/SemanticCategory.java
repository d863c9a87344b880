package com.backlinkqc.preflight;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

/**
 * The five semantic slots an LSI term set is balanced across. Declaration
 * order is the round-robin order used when selecting terms.
 */
public enum SemanticCategory {
    PROCESS("process"),
    MEASUREMENT("measurement"),
    FAILURE_MODE("failure-mode"),
    TOOL("tool"),
    TEMPORAL("temporal");

    private final String value;

    SemanticCategory(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static SemanticCategory fromValue(String raw) {
        if (raw == null) {
            return null;
        }
        return Arrays.stream(values())
            .filter(v -> v.value.equalsIgnoreCase(raw) || v.name().equalsIgnoreCase(raw))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException("Unknown semantic category: " + raw));
    }
}
