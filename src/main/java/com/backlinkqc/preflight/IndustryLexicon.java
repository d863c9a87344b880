package com.backlinkqc.preflight;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Static per-industry vocabulary: the keywords that identify an industry in
 * a domain, URL or topic, and the seed LSI terms for it tagged by semantic
 * category. {@code general} is always present and always has enough terms to
 * fill a plan on its own.
 */
public final class IndustryLexicon {

    public static final String GENERAL = "general";

    public record Industry(String name, List<String> keywords, Map<SemanticCategory, List<String>> terms) {

        public Industry {
            keywords = List.copyOf(keywords);
            Map<SemanticCategory, List<String>> copy = new LinkedHashMap<>();
            for (SemanticCategory category : SemanticCategory.values()) {
                copy.put(category, List.copyOf(terms.getOrDefault(category, List.of())));
            }
            terms = Collections.unmodifiableMap(copy);
        }
    }

    private final Map<String, Industry> industries;

    public IndustryLexicon(List<Industry> industries) {
        Map<String, Industry> byName = new TreeMap<>();
        for (Industry industry : industries) {
            byName.put(industry.name(), industry);
        }
        if (!byName.containsKey(GENERAL)) {
            throw new IllegalArgumentException("lexicon must define the '" + GENERAL + "' industry");
        }
        this.industries = Collections.unmodifiableMap(byName);
    }

    public static IndustryLexicon standard() {
        return new IndustryLexicon(List.of(
            industry("gambling",
                List.of("casino", "betting", "poker", "slots", "gambling", "bingo", "odds", "wager"),
                List.of("wagering", "deposit"), List.of("odds", "payout"), List.of("losses", "overspending"),
                List.of("bonus", "budget"), List.of("session", "break")),
            industry("finance",
                List.of("bank", "loan", "finance", "invest", "credit", "mortgage", "saving", "insurance"),
                List.of("saving", "budgeting"), List.of("interest", "return"), List.of("debt", "overdraft"),
                List.of("spreadsheet", "budget"), List.of("month", "schedule")),
            industry("health",
                List.of("health", "fitness", "clinic", "medical", "wellness", "nutrition", "diet", "pharmacy"),
                List.of("exercise", "recovery"), List.of("pulse", "calories"), List.of("injury", "fatigue"),
                List.of("tracker", "journal"), List.of("routine", "week")),
            industry("genealogy",
                List.of("genealogy", "ancestry", "family", "archive", "heritage", "ancestor", "history"),
                List.of("research", "transcription"), List.of("generation", "record"), List.of("gap", "error"),
                List.of("archive", "register"), List.of("century", "break")),
            industry("technology",
                List.of("software", "tech", "app", "cloud", "computer", "digital", "device", "online"),
                List.of("setup", "update"), List.of("speed", "storage"), List.of("bug", "outage"),
                List.of("software", "device"), List.of("release", "schedule")),
            industry(GENERAL,
                List.of(),
                List.of("planning", "method"), List.of("result", "analysis"), List.of("mistake", "risk"),
                List.of("tool", "checklist"), List.of("time", "routine"))
        ));
    }

    private static Industry industry(String name, List<String> keywords,
                                     List<String> process, List<String> measurement, List<String> failureMode,
                                     List<String> tool, List<String> temporal) {
        Map<SemanticCategory, List<String>> terms = new LinkedHashMap<>();
        terms.put(SemanticCategory.PROCESS, process);
        terms.put(SemanticCategory.MEASUREMENT, measurement);
        terms.put(SemanticCategory.FAILURE_MODE, failureMode);
        terms.put(SemanticCategory.TOOL, tool);
        terms.put(SemanticCategory.TEMPORAL, temporal);
        return new Industry(name, keywords, terms);
    }

    public Industry get(String name) {
        Industry industry = industries.get(name);
        return industry != null ? industry : industries.get(GENERAL);
    }

    /** Industry names in alphabetical order. */
    public List<String> industryNames() {
        return List.copyOf(industries.keySet());
    }

    public boolean knows(String name) {
        return name != null && industries.containsKey(name.toLowerCase(Locale.ROOT));
    }

    /**
     * Picks the industry whose keywords occur most often in {@code text}
     * (substring match, so {@code bestcasino.se} counts for {@code casino}).
     * Ties go to the alphabetically first industry; no hit at all yields empty.
     */
    public Optional<String> detect(String text) {
        String lower = text == null ? "" : text.toLowerCase(Locale.ROOT);
        String best = null;
        int bestHits = 0;
        for (Industry industry : industries.values()) {
            int hits = 0;
            for (String keyword : industry.keywords()) {
                if (lower.contains(keyword)) {
                    hits++;
                }
            }
            if (hits > bestHits) {
                best = industry.name();
                bestHits = hits;
            }
        }
        return Optional.ofNullable(best);
    }

    /**
     * All seed terms of an industry with their category, in category order.
     */
    public List<Map.Entry<String, SemanticCategory>> seedTerms(String industryName) {
        List<Map.Entry<String, SemanticCategory>> seeds = new ArrayList<>();
        get(industryName).terms().forEach((category, words) ->
            words.forEach(word -> seeds.add(Map.entry(word, category))));
        return seeds;
    }
}
