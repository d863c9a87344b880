package com.backlinkqc.audit;

import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class AuditTrailTest {

    private static final Instant NOW = Instant.parse("2024-03-01T08:00:00Z");

    @Test
    void failingSinkDoesNotStopTheOthers() {
        InMemoryAuditLog log = new InMemoryAuditLog();
        AuditSink broken = entry -> {
            throw new IllegalStateException("disk full");
        };
        AuditTrail trail = new AuditTrail(List.of(broken, log), Clock.fixed(NOW, ZoneOffset.UTC));

        assertDoesNotThrow(() -> trail.record(AuditEntry.Kind.ORDER, "ORD-A-1", "order accepted", "payload"));

        assertEquals(1, log.entries().size());
        AuditEntry entry = log.entries().get(0);
        assertEquals(AuditEntry.Kind.ORDER, entry.kind());
        assertEquals("ORD-A-1", entry.orderId());
        assertEquals(NOW, entry.recordedAt());
    }

    @Test
    void entriesAreFilteredByOrder() {
        InMemoryAuditLog log = new InMemoryAuditLog();
        AuditTrail trail = new AuditTrail(List.of(log), Clock.systemUTC());

        trail.record(AuditEntry.Kind.ORDER, "ORD-A-2", "order accepted", null);
        trail.record(AuditEntry.Kind.TRANSITION, "ORD-A-3", "PENDING -> PREFLIGHT", null);
        trail.record(AuditEntry.Kind.REPORT, "ORD-A-2", "report", null);

        assertEquals(List.of(AuditEntry.Kind.ORDER, AuditEntry.Kind.REPORT),
            log.entriesFor("ORD-A-2").stream().map(AuditEntry::kind).toList());
        assertEquals(3, log.entries().size());
    }
}
