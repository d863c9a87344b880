package com.backlinkqc.contract;

/**
 * Machine-readable kind of a {@link PlanningException}.
 */
public enum ErrorKind {
    /** A collaborator (publisher profile, anchor portfolio, trust registry, SERP) is missing or timed out. */
    DEPENDENCY_UNAVAILABLE,
    ILLEGAL_TRANSITION,
    CONTRACT_VIOLATION,
    /** The preflight matrix no longer matches the order or registry snapshot it was built from. */
    STALE_MATRIX,
    ORDER_NOT_FOUND,
    DUPLICATE_ORDER,
    /** Another worker holds the order's lease. */
    ORDER_LOCKED
}
