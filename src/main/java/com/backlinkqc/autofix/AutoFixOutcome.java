package com.backlinkqc.autofix;

import com.backlinkqc.qc.ValidationReport;

/**
 * Result of {@link AutoFixController#maybeFix}.
 *
 * @param article the article after the repair, or the input when nothing changed
 * @param report  the final report of this validation cycle
 * @param fix     the repair attempted by this call, or null when none was attempted
 */
public record AutoFixOutcome(String article, ValidationReport report, FixRecord fix) {

    public boolean fixApplied() {
        return fix != null && fix.applied();
    }
}
