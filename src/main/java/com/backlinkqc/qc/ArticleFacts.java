package com.backlinkqc.qc;

import com.backlinkqc.lexical.AnchorLocation;
import com.backlinkqc.lexical.ArticleDocument;
import com.backlinkqc.lexical.Section;
import com.backlinkqc.preflight.PreflightMatrix;
import com.backlinkqc.trust.ClassifiedLink;
import com.backlinkqc.trust.CompetitorHit;
import com.backlinkqc.trust.ProhibitedClaim;

import java.util.List;
import java.util.SortedMap;

/**
 * Everything the category rules need to know about one draft, computed once
 * per evaluation.
 *
 * @param anchor          first body occurrence of the anchor, or null when absent
 * @param outboundLinks   classified links excluding the target and publisher domains
 * @param windowLemmas    lemma counts of the anchor window; empty without an anchor
 */
public record ArticleFacts(
    String text,
    ArticleDocument document,
    PreflightMatrix matrix,
    AnchorLocation anchor,
    List<Section> anchorHeadings,
    SortedMap<String, Integer> windowLemmas,
    List<ClassifiedLink> outboundLinks,
    int qualifyingTrustSignals,
    List<CompetitorHit> competitorHits,
    List<String> missingDisclaimers,
    List<ProhibitedClaim> prohibitedClaims
) {

    public ArticleFacts {
        anchorHeadings = List.copyOf(anchorHeadings);
        outboundLinks = List.copyOf(outboundLinks);
        competitorHits = List.copyOf(competitorHits);
        missingDisclaimers = List.copyOf(missingDisclaimers);
        prohibitedClaims = List.copyOf(prohibitedClaims);
    }

    public boolean anchorFound() {
        return anchor != null;
    }
}
