package com.backlinkqc.collector;

import com.backlinkqc.lexical.ArticleParser;
import com.backlinkqc.preflight.SerpSignal;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Deterministic stand-in for a SERP collector: query words longer than three
 * letters plus six generic related terms picked by the query's hash.
 */
public class MockSerpSignalSource implements SerpSignalSource {

    static final List<String> BASE_TERMS = List.of(
        "guide", "tips", "method", "tool", "process", "analysis",
        "example", "strategy", "technique", "result", "research", "study");

    private static final Set<String> COMMERCIAL = Set.of("best", "review", "compare", "top");
    private static final Set<String> TRANSACTIONAL = Set.of("buy", "price", "cheap", "deal", "bonus");

    @Override
    public SerpSignal fetch(String query, String locale) {
        String q = query == null ? "" : query.toLowerCase(Locale.ROOT);
        Set<String> terms = new LinkedHashSet<>();
        Set<String> intents = new LinkedHashSet<>();
        intents.add("informational");
        for (String word : ArticleParser.words(q)) {
            if (word.length() > 3) {
                terms.add(word);
            }
            if (COMMERCIAL.contains(word)) {
                intents.add("commercial");
            }
            if (TRANSACTIONAL.contains(word)) {
                intents.add("transactional");
            }
        }
        int offset = Math.floorMod(q.hashCode(), BASE_TERMS.size());
        for (int i = 0; i < 6; i++) {
            terms.add(BASE_TERMS.get((offset + i) % BASE_TERMS.size()));
        }
        return new SerpSignal(query, locale, new ArrayList<>(terms).subList(0, Math.min(10, terms.size())),
            List.copyOf(intents));
    }
}
