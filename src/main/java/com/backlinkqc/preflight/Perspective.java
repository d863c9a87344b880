package com.backlinkqc.preflight;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum Perspective {
    FIRST_PERSON,
    SECOND_PERSON,
    THIRD_PERSON;

    @JsonValue
    public String getValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static Perspective fromValue(String raw) {
        if (raw == null) {
            return null;
        }
        return valueOf(raw.trim().toUpperCase(Locale.ROOT).replace('-', '_'));
    }
}
