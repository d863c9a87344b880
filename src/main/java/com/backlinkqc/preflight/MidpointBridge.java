package com.backlinkqc.preflight;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

/**
 * A declared semantic link between the publisher's topic and the target's
 * topic. The anchor is expected in the section that carries this concept.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record MidpointBridge(String label, double score, String rationale) {}
