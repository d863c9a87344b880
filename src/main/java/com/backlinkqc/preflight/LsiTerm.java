package com.backlinkqc.preflight;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

/**
 * A planned LSI term. {@code term} is the surface form given to writers,
 * {@code lemma} the canonical form counted in the window. A bridge term
 * belongs to both the publisher's and the target's industry vocabulary.
 * {@code category} is null for SERP terms with no lexicon category.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record LsiTerm(
    String term,
    String lemma,
    SemanticCategory category,
    boolean bridge
) {}
