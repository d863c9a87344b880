package com.backlinkqc.preflight;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record SerpSignal(
    String query,
    String locale,
    List<String> lsiTerms,
    List<String> intents
) {

    public SerpSignal {
        lsiTerms = lsiTerms == null ? List.of() : List.copyOf(lsiTerms);
        intents = intents == null ? List.of() : List.copyOf(intents);
    }

    public static SerpSignal empty(String query, String locale) {
        return new SerpSignal(query, locale, List.of(), List.of());
    }
}
