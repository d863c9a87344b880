package com.backlinkqc.qc;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ValidationReportAssemblerTest {

    private final ValidationReportAssembler assembler = new ValidationReportAssembler(QcProperties.defaults());

    private static Map<ScoreCategory, Integer> scores(int preflight, int draft, int anchor, int trust,
                                                      int lsi, int fit, int compliance) {
        Map<ScoreCategory, Integer> scores = new EnumMap<>(ScoreCategory.class);
        scores.put(ScoreCategory.PREFLIGHT, preflight);
        scores.put(ScoreCategory.DRAFT, draft);
        scores.put(ScoreCategory.ANCHOR, anchor);
        scores.put(ScoreCategory.TRUST, trust);
        scores.put(ScoreCategory.LSI, lsi);
        scores.put(ScoreCategory.FIT, fit);
        scores.put(ScoreCategory.COMPLIANCE, compliance);
        return scores;
    }

    private static ValidationIssue placementWarning() {
        return ValidationIssue.warning(ScoreCategory.ANCHOR, IssueCategory.ANCHOR, "ANCHOR_PLACEMENT_WRONG",
            "Anchor is in section 1 of 5", IssueLocation.section(0));
    }

    @Nested
    @DisplayName("Status")
    class Status {

        @Test
        @DisplayName("Total 78 with a single placement warning asks for light edits")
        void lightEditsBand() {
            ValidationReport report = assembler.assemble(scores(80, 100, 70, 70, 70, 100, 60),
                List.of(placementWarning()), 1, 0, null);

            assertEquals(78.0, report.totalScore(), 1e-9);
            assertEquals(ReportStatus.LIGHT_EDITS, report.status());
            assertFalse(report.humanSignoffRequired());
            assertFalse(report.recommendations().isEmpty());
            assertEquals("ANCHOR_PLACEMENT_WRONG", report.recommendations().get(0).code());
            assertEquals(List.of("Apply the recommended edits", "Re-run QC validation"), report.nextActions());
        }

        @Test
        void thresholdsAreInclusive() {
            // 85.0 exactly
            assertEquals(ReportStatus.APPROVED,
                assembler.assemble(scores(100, 100, 100, 100, 0, 100, 100), List.of(), 2, 0, null).status());
            // 70.0 exactly
            assertEquals(ReportStatus.LIGHT_EDITS,
                assembler.assemble(scores(100, 100, 100, 0, 0, 100, 100), List.of(), 2, 0, null).status());
        }

        @Test
        void belowSeventyIsBlocked() {
            ValidationReport report = assembler.assemble(scores(76, 100, 50, 50, 50, 100, 100), List.of(), 2, 0, null);

            assertEquals(69.0, report.totalScore(), 1e-9);
            assertEquals(ReportStatus.BLOCKED, report.status());
        }

        @Test
        void hardBlockOverridesAPerfectTotal() {
            ValidationIssue block = ValidationIssue.blocking(ScoreCategory.COMPLIANCE, IssueCategory.COMPLIANCE,
                "MISSING_GAMBLING_DISCLAIMER", "Required gambling disclaimer is missing", null);

            ValidationReport report = assembler.assemble(scores(100, 100, 100, 100, 100, 100, 100),
                List.of(block), 2, 0, null);

            assertEquals(ReportStatus.BLOCKED, report.status());
        }

        @Test
        void missingCategoryIsRejected() {
            Map<ScoreCategory, Integer> partial = scores(100, 100, 100, 100, 100, 100, 100);
            partial.remove(ScoreCategory.FIT);

            assertThrows(IllegalArgumentException.class, () -> assembler.assemble(partial, List.of(), 2, 0, null));
        }
    }

    @Nested
    @DisplayName("Human sign-off")
    class Signoff {

        @Test
        void zeroQualifyingSignalsRequiresSignoff() {
            assertTrue(assembler.assemble(scores(100, 100, 100, 100, 100, 100, 100), List.of(), 0, 0, null)
                .humanSignoffRequired());
        }

        @Test
        void categoryBelowFiftyRequiresSignoff() {
            assertTrue(assembler.assemble(scores(100, 100, 100, 100, 100, 49, 100), List.of(), 2, 0, null)
                .humanSignoffRequired());
            assertFalse(assembler.assemble(scores(100, 100, 100, 100, 100, 50, 100), List.of(), 2, 0, null)
                .humanSignoffRequired());
        }
    }

    @Nested
    @DisplayName("Recommendations")
    class Recommendations {

        @Test
        void rankedHardBlockFirstThenByCategoryWeight() {
            List<ValidationIssue> issues = List.of(
                ValidationIssue.warning(ScoreCategory.LSI, IssueCategory.LSI, "INSUFFICIENT_LSI_TERMS", "4 terms", null),
                ValidationIssue.info(ScoreCategory.FIT, IssueCategory.CONTENT, "PERSPECTIVE_MISMATCH", "we", null),
                placementWarning(),
                ValidationIssue.blocking(ScoreCategory.COMPLIANCE, IssueCategory.COMPLIANCE,
                    "MISSING_GAMBLING_DISCLAIMER", "missing", null),
                ValidationIssue.warning(ScoreCategory.TRUST, IssueCategory.TRUST, "INSUFFICIENT_TRUST_SIGNALS", "1", null));

            ValidationReport report = assembler.assemble(scores(100, 100, 70, 70, 66, 90, 0), issues, 1, 0, null);

            assertEquals(List.of("MISSING_GAMBLING_DISCLAIMER", "ANCHOR_PLACEMENT_WRONG",
                    "INSUFFICIENT_LSI_TERMS", "INSUFFICIENT_TRUST_SIGNALS"),
                report.recommendations().stream().map(Recommendation::code).toList());
            assertEquals("Add the required gambling disclaimer", report.recommendations().get(0).action());
            assertEquals("PERSPECTIVE_MISMATCH", report.issues().get(report.issues().size() - 1).code());
        }

        @Test
        void onePerCodeAndAtMostFour() {
            List<ValidationIssue> issues = List.of(
                ValidationIssue.warning(ScoreCategory.DRAFT, IssueCategory.STRUCTURE, "EMPTY_SECTION", "a", null),
                ValidationIssue.warning(ScoreCategory.DRAFT, IssueCategory.STRUCTURE, "EMPTY_SECTION", "b", null),
                ValidationIssue.warning(ScoreCategory.LSI, IssueCategory.LSI, "LSI_OVERUSE", "x", null),
                ValidationIssue.warning(ScoreCategory.LSI, IssueCategory.LSI, "EXCESSIVE_LSI_TERMS", "y", null),
                ValidationIssue.warning(ScoreCategory.FIT, IssueCategory.CONTENT, "OVERLY_PROMOTIONAL", "z", null),
                ValidationIssue.warning(ScoreCategory.FIT, IssueCategory.CONTENT, "TONE_TOO_INFORMAL", "w", null));

            ValidationReport report = assembler.assemble(scores(100, 80, 100, 100, 80, 60, 100), issues, 2, 0, null);

            List<String> codes = report.recommendations().stream().map(Recommendation::code).toList();
            assertEquals(4, codes.size());
            assertEquals(List.of("EMPTY_SECTION", "EXCESSIVE_LSI_TERMS", "LSI_OVERUSE", "OVERLY_PROMOTIONAL"), codes);
        }
    }
}
