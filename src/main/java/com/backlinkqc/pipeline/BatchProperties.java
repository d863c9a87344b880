package com.backlinkqc.pipeline;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Bounded worker pool for batch runs, bound from {@code backlinkqc.batch.*}.
 */
@ConfigurationProperties(prefix = "backlinkqc.batch")
public record BatchProperties(
    @DefaultValue("4") int workerThreads,
    @DefaultValue("256") int queueCapacity,
    @DefaultValue("60000") long orderTimeoutMs
) {

    public BatchProperties {
        if (workerThreads < 1) {
            throw new IllegalArgumentException("backlinkqc.batch.worker-threads must be at least 1");
        }
        if (queueCapacity < 1) {
            throw new IllegalArgumentException("backlinkqc.batch.queue-capacity must be at least 1");
        }
    }

    public static BatchProperties defaults() {
        return new BatchProperties(4, 256, 60000);
    }
}
