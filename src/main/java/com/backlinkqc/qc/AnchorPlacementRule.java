package com.backlinkqc.qc;

import com.backlinkqc.lexical.AnchorLocation;
import com.backlinkqc.lexical.Section;

import java.util.ArrayList;
import java.util.List;

/**
 * The anchor must sit in body text of the midpoint section, not too deep
 * into it. An anchor in a heading zeroes the category whatever else holds.
 */
public class AnchorPlacementRule implements CategoryRule {

    private final QcProperties properties;

    public AnchorPlacementRule(QcProperties properties) {
        this.properties = properties;
    }

    @Override
    public ScoreCategory category() {
        return ScoreCategory.ANCHOR;
    }

    @Override
    public CategoryResult evaluate(ArticleFacts facts) {
        if (!facts.anchorHeadings().isEmpty()) {
            Section heading = facts.anchorHeadings().get(0);
            return new CategoryResult(0, List.of(ValidationIssue.blocking(category(), IssueCategory.ANCHOR,
                "ANCHOR_IN_HEADER", "Anchor appears in heading '" + heading.title() + "'",
                IssueLocation.section(heading.index()))));
        }
        if (!facts.anchorFound()) {
            return new CategoryResult(0, List.of(ValidationIssue.blocking(category(), IssueCategory.ANCHOR,
                "ANCHOR_NOT_FOUND", "Anchor text '" + facts.matrix().anchor().primary() + "' not found", null)));
        }

        AnchorLocation anchor = facts.anchor();
        IssueLocation location = new IssueLocation(anchor.sectionIndex(), anchor.paragraphNumber(),
            anchor.sentenceIndex());
        List<ValidationIssue> issues = new ArrayList<>();
        int score = 100;
        int sections = facts.document().sections().size();
        if (!isMidpoint(anchor.sectionIndex(), sections)) {
            score -= 30;
            issues.add(ValidationIssue.warning(category(), IssueCategory.ANCHOR, "ANCHOR_PLACEMENT_WRONG",
                "Anchor is in section " + (anchor.sectionIndex() + 1) + " of " + sections
                    + ", expected near '" + facts.matrix().midpoint().label() + "' in the middle", location));
        }
        if (anchor.paragraphNumber() > properties.maxAnchorParagraphDepth()) {
            score -= 15;
            issues.add(ValidationIssue.warning(category(), IssueCategory.ANCHOR, "ANCHOR_TOO_DEEP",
                "Anchor is in paragraph " + anchor.paragraphNumber() + " of its section, at most "
                    + properties.maxAnchorParagraphDepth() + " allowed", location));
        }
        return new CategoryResult(score, issues);
    }

    /**
     * A midpoint section is neither first nor last and within one section of
     * the document centre. Documents with fewer than three sections have none.
     */
    static boolean isMidpoint(int sectionIndex, int sectionCount) {
        if (sectionCount < 3 || sectionIndex <= 0 || sectionIndex >= sectionCount - 1) {
            return false;
        }
        return Math.abs(sectionIndex - sectionCount / 2) <= 1;
    }
}
