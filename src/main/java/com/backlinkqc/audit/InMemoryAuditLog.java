package com.backlinkqc.audit;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

public class InMemoryAuditLog implements AuditSink {

    private final CopyOnWriteArrayList<AuditEntry> entries = new CopyOnWriteArrayList<>();

    @Override
    public void persist(AuditEntry entry) {
        entries.add(entry);
    }

    public List<AuditEntry> entries() {
        return List.copyOf(entries);
    }

    public List<AuditEntry> entriesFor(String orderId) {
        return entries.stream().filter(entry -> orderId.equals(entry.orderId())).toList();
    }
}
