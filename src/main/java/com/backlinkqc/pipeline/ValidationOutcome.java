package com.backlinkqc.pipeline;

import com.backlinkqc.autofix.FixRecord;
import com.backlinkqc.qc.ValidationReport;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

/**
 * @param article the article the final report was computed on; differs from
 *                the submitted text only when a repair was applied
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ValidationOutcome(String article, ValidationReport report, FixRecord fix) {}
