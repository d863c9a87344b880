package com.backlinkqc.trust;

import com.fasterxml.jackson.annotation.JsonCreator;

import java.util.Locale;

/**
 * Authority classification of a cited domain. T1 is the highest (government
 * and official sources); UNKNOWN marks domains absent from the registry.
 */
public enum TrustTier {
    T1(1),
    T2(2),
    T3(3),
    T4(4),
    UNKNOWN(99);

    private final int rank;

    TrustTier(int rank) {
        this.rank = rank;
    }

    public int rank() {
        return rank;
    }

    /** True when this tier is at least as authoritative as {@code minimum}. */
    public boolean meets(TrustTier minimum) {
        return this != UNKNOWN && rank <= minimum.rank;
    }

    @JsonCreator
    public static TrustTier fromValue(String raw) {
        if (raw == null) {
            return null;
        }
        return valueOf(raw.trim().toUpperCase(Locale.ROOT));
    }
}
