package com.backlinkqc.trust;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.Locale;

/**
 * One row of the trust registry: a domain, its tier, whether it belongs to a
 * competitor, and its category pattern (e.g. {@code government}, {@code news},
 * or an industry such as {@code gambling}).
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record TrustRegistryEntry(
    String domain,
    TrustTier tier,
    boolean competitor,
    String category,
    String region
) {

    public TrustRegistryEntry {
        domain = DomainNames.normalize(domain);
        if (tier == null) {
            tier = TrustTier.UNKNOWN;
        }
        category = category == null ? "" : category.trim().toLowerCase(Locale.ROOT);
    }

    public static TrustRegistryEntry of(String domain, TrustTier tier, String category) {
        return new TrustRegistryEntry(domain, tier, false, category, "GLOBAL");
    }

    public static TrustRegistryEntry competitor(String domain, String category) {
        return new TrustRegistryEntry(domain, TrustTier.T4, true, category, "GLOBAL");
    }
}
