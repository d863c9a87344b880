package com.backlinkqc.order;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Writing constraints declared on an order. Compliance tags are normalized to
 * lower case, de-duplicated and sorted so that equal orders fingerprint equally.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record OrderConstraints(
    Integer targetWordCount,
    Tone tone,
    List<String> complianceTags
) {

    public OrderConstraints {
        complianceTags = complianceTags == null
            ? List.of()
            : complianceTags.stream()
                .filter(Objects::nonNull)
                .map(tag -> tag.trim().toLowerCase(Locale.ROOT))
                .filter(tag -> !tag.isEmpty())
                .distinct()
                .sorted()
                .toList();
    }

    public static OrderConstraints none() {
        return new OrderConstraints(null, null, List.of());
    }

    public int wordCountOr(int fallback) {
        return targetWordCount != null ? targetWordCount : fallback;
    }

    public Tone toneOr(Tone fallback) {
        return tone != null ? tone : fallback;
    }
}
