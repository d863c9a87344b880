package com.backlinkqc.trust;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Versioned, immutable snapshot of the trust registry plus the competitor
 * name list. Passed explicitly into every build and evaluation call so runs
 * can be replayed against the exact reference data they saw.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record TrustRegistry(
    String version,
    List<TrustRegistryEntry> entries,
    List<String> competitorNames
) {

    public TrustRegistry {
        entries = entries == null ? List.of() : entries.stream()
            .sorted(Comparator.comparing(TrustRegistryEntry::domain))
            .toList();
        competitorNames = competitorNames == null ? List.of() : competitorNames.stream()
            .map(name -> name.trim().toLowerCase(Locale.ROOT))
            .filter(name -> !name.isEmpty())
            .distinct()
            .sorted()
            .toList();
    }

    public static TrustRegistry empty(String version) {
        return new TrustRegistry(version, List.of(), List.of());
    }

    /**
     * Finds the most specific registered entry covering {@code host}
     * ({@code news.example.se} matches a row for {@code example.se}).
     */
    public Optional<TrustRegistryEntry> lookup(String host) {
        return entries.stream()
            .filter(entry -> DomainNames.belongsTo(host, entry.domain()))
            .max(Comparator.comparingInt(entry -> entry.domain().length()));
    }

    public List<TrustRegistryEntry> competitors() {
        return entries.stream().filter(TrustRegistryEntry::competitor).toList();
    }
}
