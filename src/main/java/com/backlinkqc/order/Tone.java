package com.backlinkqc.order;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

public enum Tone {
    INFORMATIVE("informative"),
    CONVERSATIONAL("conversational"),
    PROFESSIONAL("professional"),
    ACADEMIC("academic");

    private final String value;

    Tone(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /** Formal registers tolerate no contractions and few exclamations. */
    public boolean isFormal() {
        return this == PROFESSIONAL || this == ACADEMIC;
    }

    @JsonCreator
    public static Tone fromValue(String raw) {
        if (raw == null) {
            return null;
        }
        return Arrays.stream(values())
            .filter(v -> v.value.equalsIgnoreCase(raw) || v.name().equalsIgnoreCase(raw))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException("Unknown tone: " + raw));
    }
}
