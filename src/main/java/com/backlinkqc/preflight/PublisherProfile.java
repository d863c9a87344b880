package com.backlinkqc.preflight;

import com.backlinkqc.order.Tone;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

/**
 * Voice profile of a publishing site: what it writes about and how.
 *
 * @param topicIndustry the industry the publisher covers, a key of {@link IndustryLexicon}
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record PublisherProfile(
    String domain,
    String topicIndustry,
    Tone tone,
    Perspective perspective
) {}
