package com.backlinkqc.preflight;

import com.backlinkqc.portfolio.AnchorType;
import com.backlinkqc.trust.DomainNames;

import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Classifies an anchor text against the target host: the host's own name is
 * a brand anchor, a phrase containing it is partial, stock phrases are
 * generic, anything else is an exact keyword anchor.
 */
public class AnchorClassifier {

    static final Set<String> GENERIC_PHRASES = Set.of(
        "click here", "here", "read more", "learn more", "this site", "this guide",
        "this page", "more information", "find out more", "website", "the website");

    public AnchorType classify(String anchorText, String targetHost) {
        String anchor = anchorText.strip().toLowerCase(Locale.ROOT);
        List<String> brandTokens = DomainNames.brandTokens(targetHost);
        String joined = String.join("", brandTokens);
        String spaced = String.join(" ", brandTokens);

        if (anchor.equals(joined) || anchor.equals(spaced) || anchor.equals(DomainNames.normalize(targetHost))
            || brandTokens.contains(anchor)) {
            return AnchorType.BRAND;
        }
        for (String token : brandTokens) {
            if (token.length() >= 3 && anchor.contains(token)) {
                return AnchorType.PARTIAL;
            }
        }
        if (GENERIC_PHRASES.contains(anchor)) {
            return AnchorType.GENERIC;
        }
        return AnchorType.EXACT;
    }

    /**
     * Renders a fallback anchor of the given type.
     */
    public String render(AnchorType type, String anchorText, String targetHost) {
        List<String> brandTokens = DomainNames.brandTokens(targetHost);
        String brand = brandTokens.isEmpty() ? DomainNames.normalize(targetHost) : String.join("", brandTokens);
        return switch (type) {
            case BRAND -> brand;
            case GENERIC -> "this guide";
            case PARTIAL -> anchorText.strip() + " at " + brand;
            case EXACT -> anchorText.strip();
        };
    }
}
