package com.backlinkqc.qc;

import java.util.Locale;
import java.util.Map;

/**
 * Imperative action text per issue code.
 */
final class RecommendationCatalog {

    private static final Map<String, String> ACTIONS = Map.ofEntries(
        Map.entry("ANCHOR_NOT_FOUND", "Insert the anchor text verbatim in a body paragraph of the midpoint section"),
        Map.entry("ANCHOR_IN_HEADER", "Move the anchor out of the heading into body text"),
        Map.entry("ANCHOR_PLACEMENT_WRONG", "Move the link into the midpoint section next to the bridge concept"),
        Map.entry("ANCHOR_TOO_DEEP", "Place the link in one of the first paragraphs of its section"),
        Map.entry("ANCHOR_NOT_LINKED", "Hyperlink the anchor text to the target URL"),
        Map.entry("ANCHOR_TARGET_MISMATCH", "Point the anchor link at the ordered target URL"),
        Map.entry("DUPLICATE_TARGET_LINK", "Remove extra links to the target so only the anchor link remains"),
        Map.entry("ANCHOR_TYPE_DISCOURAGED", "Use the suggested backup anchor to protect the anchor portfolio"),
        Map.entry("MIDPOINT_BRIDGE_MISSING", "Mention the midpoint bridge concept near the link"),
        Map.entry("ANCHOR_NOT_FOUND_FOR_LSI", "Place the anchor so related terms can be measured around it"),
        Map.entry("INSUFFICIENT_LSI_TERMS", "Add related terms from the LSI plan around the anchor"),
        Map.entry("EXCESSIVE_LSI_TERMS", "Thin out related terms around the anchor to avoid over-optimization"),
        Map.entry("LSI_OVERUSE", "Vary wording so no related term repeats more than twice near the anchor"),
        Map.entry("ERR_TRUST_COMPETITOR", "Remove every competitor link and mention"),
        Map.entry("ERR_TRUST_UNREGISTERED_DOMAIN", "Replace unregistered sources with registry-approved ones"),
        Map.entry("MISSING_TRUST_SIGNALS", "Cite at least two T1 or T2 sources"),
        Map.entry("INSUFFICIENT_TRUST_SIGNALS", "Add another citation from a T1 or T2 source"),
        Map.entry("LOW_TIER_TRUST_SOURCE", "Prefer T1 or T2 sources over low-tier ones"),
        Map.entry("UNREGISTERED_SOURCE", "Prefer sources listed in the trust registry"),
        Map.entry("ERR_COMPLIANCE", "Remove the prohibited claim"),
        Map.entry("INSUFFICIENT_SECTIONS", "Split the article into at least three sections"),
        Map.entry("EMPTY_SECTION", "Fill or remove empty sections"),
        Map.entry("WORD_COUNT_MISMATCH", "Adjust the length to the planned word count"),
        Map.entry("TONE_TOO_INFORMAL", "Rewrite contractions in the publisher's formal register"),
        Map.entry("TONE_TOO_FORMAL", "Loosen the tone and address the reader directly"),
        Map.entry("EXCESSIVE_EXCLAMATIONS", "Cut back on exclamation marks"),
        Map.entry("OVERLY_PROMOTIONAL", "Tone down promotional phrasing"),
        Map.entry("PERSPECTIVE_MISMATCH", "Rewrite first-person passages in the third person")
    );

    private RecommendationCatalog() {
    }

    static String actionFor(String code) {
        String action = ACTIONS.get(code);
        if (action != null) {
            return action;
        }
        if (code.startsWith("MISSING_") && code.endsWith("_DISCLAIMER")) {
            String tag = code.substring("MISSING_".length(), code.length() - "_DISCLAIMER".length());
            return "Add the required " + tag.toLowerCase(Locale.ROOT).replace('_', ' ') + " disclaimer";
        }
        return "Resolve " + code;
    }
}
