package com.backlinkqc.audit;

/**
 * Durability boundary. Implementations may be slow or fail; callers never
 * depend on completion.
 */
public interface AuditSink {

    void persist(AuditEntry entry);
}
