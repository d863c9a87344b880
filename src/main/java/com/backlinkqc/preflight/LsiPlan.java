package com.backlinkqc.preflight;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * LSI requirements for the window around the anchor.
 *
 * @param terms        the 6 to 10 terms writers are asked to use
 * @param reserveTerms further topical candidates; they count towards the
 *                     window vocabulary (and so towards over-optimization)
 *                     but are not requested
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record LsiPlan(
    int minTerms,
    int maxTerms,
    int radiusSentences,
    int maxRepeat,
    List<LsiTerm> terms,
    List<LsiTerm> reserveTerms
) {

    public static final int ABSOLUTE_MIN = 6;
    public static final int ABSOLUTE_MAX = 10;

    public LsiPlan {
        terms = List.copyOf(terms);
        reserveTerms = reserveTerms == null ? List.of() : List.copyOf(reserveTerms);
        if (terms.size() < ABSOLUTE_MIN || terms.size() > ABSOLUTE_MAX) {
            throw new IllegalArgumentException(
                "LSI term count must be within [" + ABSOLUTE_MIN + "," + ABSOLUTE_MAX + "], got " + terms.size());
        }
    }

    /** Lemmas counted in the anchor window: planned terms first, then reserve. */
    public Set<String> vocabulary() {
        Set<String> lemmas = new LinkedHashSet<>();
        terms.forEach(term -> lemmas.add(term.lemma()));
        reserveTerms.forEach(term -> lemmas.add(term.lemma()));
        return lemmas;
    }
}
