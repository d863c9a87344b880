package com.backlinkqc.trust;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Static per-tag compliance data: the canonical phrases that satisfy a
 * disclaimer requirement, the sentence appended by the auto-fixer, and the
 * claims that are never acceptable for a regulated topic.
 *
 * Phrase matching is a lower-case substring match.
 */
public final class DisclaimerCatalog {

    /** Tags whose missing disclaimer is a hard block. */
    public static final Set<String> REGULATED_TAGS = Set.of("gambling", "finance", "health", "legal", "crypto");

    private final Map<String, List<String>> acceptedPhrases;
    private final Map<String, String> canonicalDisclaimers;
    private final Map<String, List<String>> prohibitedClaims;

    public DisclaimerCatalog(Map<String, List<String>> acceptedPhrases,
                             Map<String, String> canonicalDisclaimers,
                             Map<String, List<String>> prohibitedClaims) {
        this.acceptedPhrases = Map.copyOf(acceptedPhrases);
        this.canonicalDisclaimers = Map.copyOf(canonicalDisclaimers);
        this.prohibitedClaims = Map.copyOf(prohibitedClaims);
    }

    public static DisclaimerCatalog standard() {
        return new DisclaimerCatalog(
            Map.of(
                "gambling", List.of("play responsibly", "gamble responsibly", "18+", "begambleaware",
                    "gamcare", "spela ansvarsfullt", "spelpaus.se", "stodlinjen"),
                "finance", List.of("not financial advice", "consult a licensed financial", "capital at risk",
                    "professional financial advisor", "inte finansiell rådgivning"),
                "health", List.of("not medical advice", "consult your doctor", "consult a doctor",
                    "qualified healthcare professional", "inte medicinsk rådgivning"),
                "crypto", List.of("crypto assets are volatile", "you may lose the money you invest",
                    "high-risk investment"),
                "legal", List.of("not legal advice", "consult a qualified lawyer", "consult an attorney"),
                "sponsored", List.of("sponsored", "in partnership with", "annons"),
                "affiliate", List.of("affiliate link", "we may earn a commission")
            ),
            Map.of(
                "gambling", "Play responsibly: gambling is for adults 18+ only, and free support is available at begambleaware.org.",
                "finance", "This article is not financial advice; consult a licensed financial advisor before you decide.",
                "health", "This article is not medical advice; consult your doctor or a qualified healthcare professional.",
                "crypto", "Crypto assets are volatile and you may lose the money you invest.",
                "legal", "This article is not legal advice; consult a qualified lawyer about your situation.",
                "sponsored", "This article is sponsored.",
                "affiliate", "This article contains an affiliate link and we may earn a commission."
            ),
            Map.of(
                "gambling", List.of("guaranteed win", "risk-free bet", "can't lose", "sure win"),
                "finance", List.of("guaranteed returns", "risk-free investment", "get rich quick"),
                "health", List.of("miracle cure", "cures cancer", "guaranteed cure"),
                "crypto", List.of("guaranteed profit", "guaranteed returns"),
                "legal", List.of("guaranteed outcome")
            )
        );
    }

    public boolean isRegulated(String tag) {
        return REGULATED_TAGS.contains(tag);
    }

    public boolean knows(String tag) {
        return acceptedPhrases.containsKey(tag);
    }

    public List<String> acceptedPhrases(String tag) {
        return acceptedPhrases.getOrDefault(tag, List.of());
    }

    public Optional<String> canonicalDisclaimer(String tag) {
        return Optional.ofNullable(canonicalDisclaimers.get(tag));
    }

    public List<String> prohibitedClaims(String tag) {
        return prohibitedClaims.getOrDefault(tag, List.of());
    }
}
