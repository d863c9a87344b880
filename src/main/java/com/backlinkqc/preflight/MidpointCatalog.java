package com.backlinkqc.preflight;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;

/**
 * Catalogue of bridge concepts. A concept is a candidate when one of its
 * bridge words matches an entity of the publisher or the target; matching
 * both sides lifts its score by 20% (capped at 1.0).
 */
public class MidpointCatalog {

    static final int MAX_CANDIDATES = 3;
    static final MidpointBridge FALLBACK =
        new MidpointBridge("everyday balance", 0.5, "General bridge between work and leisure");

    public record Concept(String label, List<String> bridgeWords, double baseScore, String rationale) {

        public Concept {
            bridgeWords = List.copyOf(bridgeWords);
        }
    }

    private final List<Concept> concepts;

    public MidpointCatalog(List<Concept> concepts) {
        this.concepts = List.copyOf(concepts);
    }

    public static MidpointCatalog standard() {
        return new MidpointCatalog(List.of(
            new Concept("research breaks", List.of("research", "archive", "genealogy", "casino", "break", "leisure"),
                0.85, "Natural bridge between focused research work and relaxing downtime"),
            new Concept("concentration exercises", List.of("study", "focus", "poker", "strategy", "game"),
                0.75, "Focus and strategy are shared by both activities"),
            new Concept("household budgeting", List.of("budget", "finance", "saving", "money", "family"),
                0.72, "Money planning connects household topics with financial services"),
            new Concept("digital tools", List.of("online", "internet", "software", "app", "digital"),
                0.70, "Modern technology links otherwise different activities"),
            new Concept("healthy routines", List.of("health", "exercise", "routine", "sleep", "wellness"),
                0.68, "Daily habits connect wellbeing with the target's offer"),
            new Concept("time management", List.of("planning", "schedule", "leisure", "weekend"),
                0.65, "Balance between work and rest")
        ));
    }

    /**
     * Scores every concept against the two entity sets and returns the best
     * {@value #MAX_CANDIDATES}, highest score first, ties by label. Never empty.
     */
    public List<MidpointBridge> candidates(List<String> publisherEntities, List<String> targetEntities) {
        List<MidpointBridge> scored = new ArrayList<>();
        for (Concept concept : concepts) {
            boolean publisherMatch = matches(concept, publisherEntities);
            boolean targetMatch = matches(concept, targetEntities);
            if (!publisherMatch && !targetMatch) {
                continue;
            }
            double score = concept.baseScore();
            if (publisherMatch && targetMatch) {
                score = Math.min(1.0, score * 1.2);
            }
            scored.add(new MidpointBridge(concept.label(), Math.round(score * 100) / 100.0, concept.rationale()));
        }
        scored.sort(Comparator.comparingDouble(MidpointBridge::score).reversed()
            .thenComparing(MidpointBridge::label));
        if (scored.isEmpty()) {
            return List.of(FALLBACK);
        }
        return List.copyOf(scored.subList(0, Math.min(MAX_CANDIDATES, scored.size())));
    }

    private static boolean matches(Concept concept, List<String> entities) {
        for (String entity : entities) {
            String e = entity.toLowerCase(Locale.ROOT);
            for (String word : concept.bridgeWords()) {
                if (e.contains(word) || (e.length() > 3 && word.contains(e))) {
                    return true;
                }
            }
        }
        return false;
    }
}
