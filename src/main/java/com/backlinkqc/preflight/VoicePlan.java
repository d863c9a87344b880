package com.backlinkqc.preflight;

import com.backlinkqc.order.Tone;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record VoicePlan(Tone tone, Perspective perspective) {}
