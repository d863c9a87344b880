package com.backlinkqc.trust;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.regex.Pattern;

/**
 * Classifies cited domains against a registry snapshot and verifies the
 * disclaimers required for regulated topics. Stateless; every call receives
 * the reference data it works on.
 */
public class TrustComplianceChecker {

    private final DisclaimerCatalog catalog;

    public TrustComplianceChecker(DisclaimerCatalog catalog) {
        this.catalog = catalog;
    }

    public DisclaimerCatalog catalog() {
        return catalog;
    }

    /**
     * Classifies each URL once, in first-seen order.
     */
    public List<ClassifiedLink> classifyLinks(List<String> urls, TrustRegistry registry) {
        Map<String, ClassifiedLink> classified = new LinkedHashMap<>();
        for (String url : urls) {
            if (classified.containsKey(url)) {
                continue;
            }
            String host = DomainNames.hostOf(url);
            ClassifiedLink link = registry.lookup(host)
                .map(entry -> new ClassifiedLink(url, host, entry.tier(), entry.competitor(), true))
                .orElseGet(() -> new ClassifiedLink(url, host, TrustTier.UNKNOWN, false, false));
            classified.put(url, link);
        }
        return List.copyOf(classified.values());
    }

    /**
     * Counts distinct registered, non-competitor domains at or above {@code minTier}.
     */
    public int countQualifyingTrustSignals(List<ClassifiedLink> classified, TrustTier minTier) {
        Set<String> domains = new TreeSet<>();
        for (ClassifiedLink link : classified) {
            if (link.registered() && !link.competitor() && link.tier().meets(minTier)) {
                domains.add(link.domain());
            }
        }
        return domains.size();
    }

    /**
     * Finds competitor references: links to competitor-flagged domains and
     * bare mentions of competitor names or domains anywhere in the text.
     * Result is sorted and de-duplicated by reference.
     */
    public List<CompetitorHit> findCompetitorHits(String articleText,
                                                  List<ClassifiedLink> classified,
                                                  TrustRegistry registry) {
        Map<String, CompetitorHit> hits = new TreeMap<>();
        for (ClassifiedLink link : classified) {
            if (link.competitor()) {
                hits.putIfAbsent(link.domain(), new CompetitorHit(link.domain(), CompetitorHit.Source.LINK));
            }
        }
        String lower = articleText.toLowerCase(Locale.ROOT);
        for (TrustRegistryEntry entry : registry.competitors()) {
            if (lower.contains(entry.domain())) {
                hits.putIfAbsent(entry.domain(), new CompetitorHit(entry.domain(), CompetitorHit.Source.MENTION));
            }
        }
        for (String name : registry.competitorNames()) {
            Pattern word = Pattern.compile("(?<![\\p{L}\\p{N}])" + Pattern.quote(name) + "(?![\\p{L}\\p{N}])");
            if (word.matcher(lower).find()) {
                hits.putIfAbsent(name, new CompetitorHit(name, CompetitorHit.Source.MENTION));
            }
        }
        return List.copyOf(hits.values());
    }

    /**
     * Returns the required tags with no accepted phrase present in the text,
     * in the order they were required. A tag the catalog does not know can
     * never be verified and is always reported missing.
     */
    public List<String> checkCompliance(String articleText, List<String> requiredTags) {
        String lower = articleText.toLowerCase(Locale.ROOT);
        List<String> missing = new ArrayList<>();
        for (String tag : requiredTags) {
            boolean satisfied = catalog.acceptedPhrases(tag).stream().anyMatch(lower::contains);
            if (!satisfied) {
                missing.add(tag);
            }
        }
        return missing;
    }

    public List<ProhibitedClaim> findProhibitedClaims(String articleText, List<String> requiredTags) {
        String lower = articleText.toLowerCase(Locale.ROOT);
        List<ProhibitedClaim> claims = new ArrayList<>();
        for (String tag : requiredTags) {
            for (String phrase : catalog.prohibitedClaims(tag)) {
                if (lower.contains(phrase)) {
                    claims.add(new ProhibitedClaim(tag, phrase));
                }
            }
        }
        return claims;
    }
}
