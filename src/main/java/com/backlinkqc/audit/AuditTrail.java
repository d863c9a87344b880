package com.backlinkqc.audit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

/**
 * Hands every record to all sinks. A failing sink is logged and skipped;
 * audit failures never reach the caller.
 */
public class AuditTrail {

    private static final Logger log = LoggerFactory.getLogger(AuditTrail.class);

    private final List<AuditSink> sinks;
    private final Clock clock;

    public AuditTrail(List<AuditSink> sinks, Clock clock) {
        this.sinks = List.copyOf(sinks);
        this.clock = clock;
    }

    public void record(AuditEntry.Kind kind, String orderId, String summary, Object payload) {
        AuditEntry entry = new AuditEntry(kind, orderId, summary, payload, Instant.now(clock));
        for (AuditSink sink : sinks) {
            try {
                sink.persist(entry);
            } catch (RuntimeException ex) {
                log.warn("Audit sink {} failed for order={} kind={}: {}",
                    sink.getClass().getSimpleName(), orderId, kind, ex.getMessage());
            }
        }
    }
}
