package com.backlinkqc.qc;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Topical grouping of an issue, independent of which score category it
 * deducts from.
 */
public enum IssueCategory {
    ANCHOR,
    TRUST,
    LSI,
    COMPLIANCE,
    STRUCTURE,
    CONTENT;

    @JsonValue
    public String getValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
