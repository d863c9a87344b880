package com.backlinkqc.autofix;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

/**
 * Record of one automated repair attempt, kept whether or not it succeeded.
 *
 * @param issueCode the issue code the repair targeted
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record FixRecord(FixKind type, String issueCode, String description, boolean applied) {}
