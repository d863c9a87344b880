package com.backlinkqc.order;

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle of an order. Each state lists the states it may move to;
 * DELIVERED and CANCELLED are terminal, FAILED may only go back to PENDING.
 */
public enum OrderLifecycleState {
    PENDING,
    PREFLIGHT,
    WRITING,
    QC,
    APPROVED,
    DELIVERED,
    FAILED,
    CANCELLED;

    public Set<OrderLifecycleState> successors() {
        return switch (this) {
            case PENDING -> EnumSet.of(PREFLIGHT, CANCELLED);
            case PREFLIGHT -> EnumSet.of(WRITING, FAILED);
            case WRITING -> EnumSet.of(QC, FAILED);
            case QC -> EnumSet.of(APPROVED, WRITING, FAILED);
            case APPROVED -> EnumSet.of(DELIVERED, FAILED);
            case FAILED -> EnumSet.of(PENDING);
            case DELIVERED, CANCELLED -> EnumSet.noneOf(OrderLifecycleState.class);
        };
    }

    public boolean canMoveTo(OrderLifecycleState target) {
        return successors().contains(target);
    }

    public boolean isTerminal() {
        return this == DELIVERED || this == CANCELLED;
    }
}
