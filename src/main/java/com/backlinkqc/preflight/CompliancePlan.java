package com.backlinkqc.preflight;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.List;

/**
 * @param requiredTags disclaimer tags the article must satisfy, sorted
 * @param regulated    true when any required tag belongs to a regulated industry
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record CompliancePlan(List<String> requiredTags, boolean regulated) {

    public CompliancePlan {
        requiredTags = List.copyOf(requiredTags);
    }
}
