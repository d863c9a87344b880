package com.backlinkqc.collector;

import com.backlinkqc.trust.TrustRegistry;
import com.backlinkqc.trust.TrustRegistryEntry;
import com.backlinkqc.trust.TrustTier;

import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Holds the current registry snapshot. Replacing it publishes a new version;
 * matrices built against the previous version become stale.
 */
public class InMemoryTrustRegistrySource implements TrustRegistrySource {

    private final AtomicReference<TrustRegistry> current;

    public InMemoryTrustRegistrySource(TrustRegistry initial) {
        this.current = new AtomicReference<>(initial);
    }

    public static InMemoryTrustRegistrySource seeded() {
        return new InMemoryTrustRegistrySource(new TrustRegistry("2024-01-v1", List.of(
            new TrustRegistryEntry("riksarkivet.se", TrustTier.T1, false, "government", "SE"),
            new TrustRegistryEntry("kb.se", TrustTier.T1, false, "government", "SE"),
            new TrustRegistryEntry("scb.se", TrustTier.T1, false, "government", "SE"),
            new TrustRegistryEntry("spelinspektionen.se", TrustTier.T1, false, "gambling", "SE"),
            new TrustRegistryEntry("folkhalsomyndigheten.se", TrustTier.T1, false, "health", "SE"),
            new TrustRegistryEntry("fi.se", TrustTier.T1, false, "finance", "SE"),
            new TrustRegistryEntry("wikipedia.org", TrustTier.T2, false, "encyclopedia", "GLOBAL"),
            new TrustRegistryEntry("dn.se", TrustTier.T2, false, "news", "SE"),
            new TrustRegistryEntry("svt.se", TrustTier.T2, false, "news", "SE"),
            new TrustRegistryEntry("aftonbladet.se", TrustTier.T3, false, "tabloid", "SE"),
            new TrustRegistryEntry("expressen.se", TrustTier.T3, false, "tabloid", "SE"),
            new TrustRegistryEntry("bestcasino.example.com", TrustTier.T3, false, "gambling", "SE"),
            TrustRegistryEntry.competitor("rivalcasino.example.com", "gambling"),
            TrustRegistryEntry.competitor("luckyspin.example.com", "gambling")
        ), List.of("RivalCasino", "LuckySpin")));
    }

    @Override
    public TrustRegistry current() {
        return current.get();
    }

    public void replace(TrustRegistry registry) {
        current.set(registry);
    }
}
