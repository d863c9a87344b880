package com.backlinkqc.qc;

public enum ReportStatus {
    APPROVED,
    LIGHT_EDITS,
    BLOCKED
}
