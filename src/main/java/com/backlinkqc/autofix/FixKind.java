package com.backlinkqc.autofix;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum FixKind {
    ADD_DISCLAIMER,
    MOVE_LINK,
    INJECT_LSI,
    ADD_TRUST;

    @JsonValue
    public String getValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
