package com.backlinkqc.trust;

/**
 * A competitor reference found in an article, either as a link or as a bare
 * mention of a competitor name or domain.
 */
public record CompetitorHit(String reference, Source source) {

    public enum Source { LINK, MENTION }
}
