package com.backlinkqc.preflight;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record WordCountPlan(int target, int min, int max) {

    public static WordCountPlan around(int target, double tolerance) {
        return new WordCountPlan(target,
            (int) Math.round(target * (1 - tolerance)),
            (int) Math.round(target * (1 + tolerance)));
    }
}
