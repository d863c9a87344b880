package com.backlinkqc.qc;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

/**
 * Zero-based section and sentence index, one-based paragraph number.
 * Any part may be null when it does not apply.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record IssueLocation(Integer section, Integer paragraph, Integer sentence) {

    public static IssueLocation section(int section) {
        return new IssueLocation(section, null, null);
    }
}
