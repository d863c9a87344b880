package com.backlinkqc.autofix;

import com.backlinkqc.lexical.AnchorLocation;
import com.backlinkqc.preflight.PreflightMatrix;
import com.backlinkqc.qc.QcScoringEngine;
import com.backlinkqc.qc.ReportStatus;
import com.backlinkqc.qc.ScoreCategory;
import com.backlinkqc.qc.ValidationReport;
import com.backlinkqc.support.QcFixtures;
import com.backlinkqc.trust.TrustRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static com.backlinkqc.support.QcFixtures.ANCHOR;
import static com.backlinkqc.support.QcFixtures.ANCHOR_LINK;
import static org.junit.jupiter.api.Assertions.*;

class AutoFixControllerTest {

    private QcScoringEngine engine;
    private AutoFixController controller;
    private TrustRegistry registry;

    @BeforeEach
    void setUp() {
        engine = QcFixtures.engine();
        controller = new AutoFixController(engine, new ArticleRepairer(QcFixtures.analyzer(), QcFixtures.DISCLAIMERS));
        registry = QcFixtures.registry();
    }

    private AutoFixOutcome validate(String article, PreflightMatrix matrix) {
        return controller.maybeFix(article, engine.evaluate(article, matrix, registry), matrix, registry);
    }

    @Nested
    @DisplayName("Missing disclaimer")
    class AddDisclaimer {

        @Test
        @DisplayName("Appends the canonical disclaimer and re-evaluates once")
        void repairsAndApproves() {
            PreflightMatrix matrix = QcFixtures.matrixFor(QcFixtures.approvedArticle());

            AutoFixOutcome outcome = validate(QcFixtures.withoutDisclaimer(), matrix);

            assertTrue(outcome.article().contains(QcFixtures.GAMBLING_DISCLAIMER));
            assertEquals(QcFixtures.approvedArticle(), outcome.article());
            ValidationReport report = outcome.report();
            assertEquals(100, report.score(ScoreCategory.COMPLIANCE));
            assertEquals(ReportStatus.APPROVED, report.status());
            assertEquals(1, report.autoFixAttempts());
            assertTrue(outcome.fixApplied());
            assertEquals(FixKind.ADD_DISCLAIMER, outcome.fix().type());
            assertEquals("MISSING_GAMBLING_DISCLAIMER", outcome.fix().issueCode());
            assertEquals(outcome.fix(), report.fix());
        }

        @Test
        void correctedArticleNeedsNoFurtherRepair() {
            PreflightMatrix matrix = QcFixtures.matrixFor(QcFixtures.approvedArticle());
            String corrected = validate(QcFixtures.withoutDisclaimer(), matrix).article();

            AutoFixOutcome second = validate(corrected, matrix);

            assertNull(second.fix());
            assertSame(corrected, second.article());
            assertEquals(0, second.report().autoFixAttempts());
        }
    }

    @Test
    @DisplayName("Anchor in the introduction is moved into the midpoint section")
    void movesLinkIntoMidpoint() {
        String intro = QcFixtures.INTRO_SECTION + " Some unwind with " + ANCHOR_LINK + " games between sessions.";
        String midpoint = String.join("\n",
            "# Research breaks",
            "Every long research session deserves a proper break. Genealogists often keep a budget for archive visits.",
            "Each payout is small compared with the value of a good record. A new generation of hobbyists sees "
                + "leisure differently.");
        String article = String.join("\n\n", intro, QcFixtures.SOURCES_SECTION, midpoint,
            QcFixtures.NOTES_SECTION, QcFixtures.SUMMARY_SECTION) + "\n\n" + QcFixtures.GAMBLING_DISCLAIMER + "\n";
        PreflightMatrix matrix = QcFixtures.matrixFor(article);
        assertTrue(engine.evaluate(article, matrix, registry).hasIssue("ANCHOR_PLACEMENT_WRONG"));

        AutoFixOutcome outcome = validate(article, matrix);

        assertEquals(FixKind.MOVE_LINK, outcome.fix().type());
        assertTrue(outcome.fixApplied());
        AnchorLocation location = QcFixtures.analyzer().locate(outcome.article(), ANCHOR).orElseThrow();
        assertEquals(2, location.sectionIndex());
        assertEquals(1, location.paragraphNumber());
        assertFalse(outcome.report().hasIssue("ANCHOR_PLACEMENT_WRONG"));
        assertEquals(100, outcome.report().score(ScoreCategory.ANCHOR));
        assertEquals(1, outcome.report().autoFixAttempts());
    }

    @Test
    @DisplayName("Too few LSI terms near the anchor are topped up from the plan")
    void injectsMissingTerms() {
        String article = QcFixtures.articleWithDisclaimer(String.join("\n",
            "# Research breaks",
            "Every long research session deserves a proper break. Friends of the hobby see leisure differently.",
            "Some unwind with " + ANCHOR_LINK + " games now and then. Small wins feel pleasant. Quiet evenings help as well."));
        PreflightMatrix matrix = QcFixtures.matrixFor(article);

        AutoFixOutcome outcome = validate(article, matrix);

        assertEquals(FixKind.INJECT_LSI, outcome.fix().type());
        assertTrue(outcome.article().contains("Key considerations here include budget, archive and payout."));
        assertEquals(100, outcome.report().score(ScoreCategory.LSI));
        assertFalse(outcome.report().hasIssue("INSUFFICIENT_LSI_TERMS"));
    }

    @Test
    @DisplayName("A missing trust source is cited from the suggested list")
    void addsTrustSource() {
        String article = QcFixtures.approvedArticle().replace("[SCB](https://www.scb.se/statistik)", "SCB");
        PreflightMatrix matrix = QcFixtures.matrixFor(article);

        AutoFixOutcome outcome = validate(article, matrix);

        assertEquals(FixKind.ADD_TRUST, outcome.fix().type());
        assertTrue(outcome.article().contains("[scb.se](https://scb.se)"));
        assertEquals(2, outcome.report().qualifyingTrustSignals());
        assertEquals(100, outcome.report().score(ScoreCategory.TRUST));
    }

    @Test
    @DisplayName("Competitor mentions are left to a human")
    void neverRepairsHumanOnlyFindings() {
        String article = QcFixtures.articleWithDisclaimer(QcFixtures.MIDPOINT_SECTION
            .replace("A new generation", "Unlike RivalCasino, a new generation"));
        PreflightMatrix matrix = QcFixtures.matrixFor(article);
        ValidationReport report = engine.evaluate(article, matrix, registry);

        AutoFixOutcome outcome = controller.maybeFix(article, report, matrix, registry);

        assertNull(outcome.fix());
        assertSame(article, outcome.article());
        assertSame(report, outcome.report());
    }

    @Test
    @DisplayName("A repair that cannot be applied still uses up the cycle")
    void failedRepairConsumesTheAttempt() {
        String article = String.join("\n\n", QcFixtures.INTRO_SECTION, QcFixtures.MIDPOINT_SECTION)
            + "\n\n" + QcFixtures.GAMBLING_DISCLAIMER + "\n";
        PreflightMatrix matrix = QcFixtures.matrixFor(article);
        ValidationReport report = engine.evaluate(article, matrix, registry);

        AutoFixOutcome outcome = controller.maybeFix(article, report, matrix, registry);

        assertEquals(FixKind.MOVE_LINK, outcome.fix().type());
        assertFalse(outcome.fixApplied());
        assertSame(article, outcome.article());
        assertEquals(1, outcome.report().autoFixAttempts());
        assertEquals(report.issues(), outcome.report().issues());
        assertEquals(outcome.fix(), outcome.report().fix());
    }

    @Test
    void reportThatAlreadyUsedItsAttemptIsFinal() {
        PreflightMatrix matrix = QcFixtures.matrixFor(QcFixtures.approvedArticle());
        FixRecord earlier = new FixRecord(FixKind.ADD_TRUST, "INSUFFICIENT_TRUST_SIGNALS", "earlier", true);
        ValidationReport report = engine.evaluate(QcFixtures.withoutDisclaimer(), matrix, registry, 1, earlier);

        AutoFixOutcome outcome = controller.maybeFix(QcFixtures.withoutDisclaimer(), report, matrix, registry);

        assertNull(outcome.fix());
        assertSame(report, outcome.report());
        assertFalse(outcome.article().contains(QcFixtures.GAMBLING_DISCLAIMER));
    }
}
