package com.backlinkqc.collector;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Boundary settings for external collaborators, bound from {@code backlinkqc.collectors.*}.
 */
@ConfigurationProperties(prefix = "backlinkqc.collectors")
public record CollectorProperties(
    @DefaultValue("2000") long timeoutMs,
    @DefaultValue("sv-SE") String locale,
    @DefaultValue("8") int poolSize
) {

    public CollectorProperties {
        if (timeoutMs < 1) {
            throw new IllegalArgumentException("backlinkqc.collectors.timeout-ms must be positive");
        }
        if (poolSize < 1) {
            throw new IllegalArgumentException("backlinkqc.collectors.pool-size must be at least 1");
        }
    }

    public static CollectorProperties defaults() {
        return new CollectorProperties(2000, "sv-SE", 8);
    }
}
