package com.backlinkqc.preflight;

import com.backlinkqc.contract.PlanningException;
import com.backlinkqc.lexical.ArticleParser;
import com.backlinkqc.lexical.Lemmatizer;
import com.backlinkqc.order.Order;
import com.backlinkqc.order.Tone;
import com.backlinkqc.portfolio.AnchorPortfolio;
import com.backlinkqc.portfolio.AnchorRecommendation;
import com.backlinkqc.portfolio.AnchorRiskModel;
import com.backlinkqc.portfolio.AnchorType;
import com.backlinkqc.trust.DisclaimerCatalog;
import com.backlinkqc.trust.DomainNames;
import com.backlinkqc.trust.TrustRegistry;
import com.backlinkqc.trust.TrustRegistryEntry;
import com.backlinkqc.trust.TrustTier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Combines an order with its publisher profile, SERP signal, anchor portfolio
 * and trust registry snapshot into an immutable {@link PreflightMatrix}.
 *
 * <p>The builder is a pure function of its inputs: the same order, profile,
 * signal, portfolio and registry always yield an equal matrix. Missing
 * profile, portfolio or registry data is fatal; a missing SERP signal only
 * removes the SERP support from term ranking.</p>
 *
 * <p>LSI selection:
 * <ol>
 *   <li>candidates are the target and source industry seed terms plus
 *       single-word SERP terms, merged by lemma;</li>
 *   <li>candidates are ranked bridge terms first, then SERP-supported terms,
 *       then by lemma;</li>
 *   <li>terms are taken round-robin across the five semantic categories until
 *       the target size is reached, then filled from the remaining ranked
 *       candidates and finally padded from the {@code general} lexicon.</li>
 * </ol>
 */
public class PreflightMatrixBuilder {

    private static final Logger log = LoggerFactory.getLogger(PreflightMatrixBuilder.class);

    static final Set<String> STOPWORDS = Set.of(
        "the", "and", "for", "with", "from", "into", "about", "your", "you", "are", "how", "what",
        "why", "when", "this", "that", "our", "its", "all", "can", "a", "an", "of", "to", "in", "on", "or");

    private static final Set<String> INFORMATIONAL_MARKERS =
        Set.of("how", "what", "why", "guide", "tips", "learn", "history", "explained", "research");
    private static final Set<String> COMMERCIAL_MARKERS =
        Set.of("best", "review", "reviews", "compare", "comparison", "top", "vs", "alternatives");
    private static final Set<String> TRANSACTIONAL_MARKERS =
        Set.of("buy", "price", "prices", "deal", "deals", "bonus", "order", "cheap", "discount", "signup");

    private static final List<TrustTier> PREFERRED_TIERS = List.of(TrustTier.T1, TrustTier.T2);

    private final IndustryLexicon lexicon;
    private final MidpointCatalog midpoints;
    private final AnchorRiskModel riskModel;
    private final AnchorClassifier anchorClassifier;
    private final DisclaimerCatalog disclaimers;
    private final Lemmatizer lemmatizer;
    private final PreflightProperties properties;

    public PreflightMatrixBuilder(IndustryLexicon lexicon,
                                  MidpointCatalog midpoints,
                                  AnchorRiskModel riskModel,
                                  AnchorClassifier anchorClassifier,
                                  DisclaimerCatalog disclaimers,
                                  Lemmatizer lemmatizer,
                                  PreflightProperties properties) {
        this.lexicon = lexicon;
        this.midpoints = midpoints;
        this.riskModel = riskModel;
        this.anchorClassifier = anchorClassifier;
        this.disclaimers = disclaimers;
        this.lemmatizer = lemmatizer;
        this.properties = properties;
    }

    public PreflightMatrix build(Order order,
                                 PublisherProfile profile,
                                 SerpSignal serp,
                                 AnchorPortfolio portfolio,
                                 TrustRegistry registry) {
        if (profile == null) {
            throw PlanningException.dependencyUnavailable("publisher_profile", order.publisherDomain(), null);
        }
        if (portfolio == null) {
            throw PlanningException.dependencyUnavailable("anchor_portfolio", order.targetDomain(), null);
        }
        if (registry == null) {
            throw PlanningException.dependencyUnavailable("trust_registry", order.orderId(), null);
        }
        if (serp == null) {
            log.warn("No SERP signal for order={}, ranking terms without SERP support", order.orderId());
            serp = SerpSignal.empty(order.topic(), "");
        }

        String publisherDomain = order.normalizedPublisherDomain();
        String targetDomain = order.targetDomain();
        Optional<TrustRegistryEntry> targetEntry = registry.lookup(targetDomain);

        String sourceIndustry = sourceIndustry(profile, publisherDomain);
        String targetIndustry = targetIndustry(order, targetEntry);

        List<MidpointBridge> candidates = midpoints.candidates(
            entities(sourceIndustry, publisherDomain, order.topic()),
            entities(targetIndustry, targetDomain, order.anchorText()));

        LsiSelection selection = selectLsiTerms(sourceIndustry, targetIndustry, serp);
        LsiPlan lsi = new LsiPlan(properties.lsiMin(), properties.lsiMax(), properties.windowRadius(),
            properties.maxRepeat(), selection.terms(), selection.reserve());

        AnchorRecommendation recommendation = riskModel.recommend(portfolio);
        AnchorType orderAnchorType = anchorClassifier.classify(order.anchorText(), targetDomain);
        AnchorPlan anchor = new AnchorPlan(order.anchorText(), orderAnchorType,
            anchorClassifier.render(recommendation.preferredType(), order.anchorText(), targetDomain),
            recommendation, AnchorPlan.MIDPOINT, properties.preferredAnchorParagraph());

        PreflightMatrix matrix = new PreflightMatrix(
            order.orderId(),
            OrderFingerprint.of(order),
            registry.version(),
            publisherDomain,
            order.targetUrl(),
            targetDomain,
            sourceIndustry,
            targetIndustry,
            queryCluster(order.topic()),
            intents(order.topic(), serp),
            candidates.get(0),
            candidates,
            lsi,
            anchor,
            trustPlan(registry, sourceIndustry, targetIndustry, publisherDomain, targetDomain),
            compliancePlan(order, targetEntry),
            WordCountPlan.around(order.constraints().wordCountOr(properties.defaultWordCount()),
                properties.wordCountTolerance()),
            new VoicePlan(order.constraints().toneOr(profile.tone() != null ? profile.tone() : Tone.INFORMATIVE),
                profile.perspective() != null ? profile.perspective() : Perspective.THIRD_PERSON)
        );

        log.info("Preflight matrix built order={} source={} target={} midpoint='{}' lsiTerms={} risk={}",
            order.orderId(), sourceIndustry, targetIndustry, matrix.midpoint().label(),
            lsi.terms().size(), recommendation.riskLevel());
        return matrix;
    }

    private String sourceIndustry(PublisherProfile profile, String publisherDomain) {
        if (lexicon.knows(profile.topicIndustry())) {
            return profile.topicIndustry().toLowerCase(Locale.ROOT);
        }
        return lexicon.detect(publisherDomain).orElse(IndustryLexicon.GENERAL);
    }

    private String targetIndustry(Order order, Optional<TrustRegistryEntry> targetEntry) {
        if (targetEntry.isPresent() && lexicon.knows(targetEntry.get().category())) {
            return targetEntry.get().category();
        }
        return lexicon.detect(order.targetDomain() + " " + order.anchorText() + " " + order.targetUrl())
            .or(() -> lexicon.detect(order.topic()))
            .orElse(IndustryLexicon.GENERAL);
    }

    private List<String> entities(String industry, String domain, String phrase) {
        List<String> entities = new ArrayList<>();
        entities.add(industry);
        entities.addAll(lexicon.get(industry).keywords());
        entities.addAll(DomainNames.brandTokens(domain));
        for (String word : ArticleParser.words(phrase == null ? "" : phrase)) {
            String lower = word.toLowerCase(Locale.ROOT);
            if (lower.length() > 2 && !STOPWORDS.contains(lower)) {
                entities.add(lower);
            }
        }
        return entities;
    }

    private record Candidate(String term, String lemma, SemanticCategory category, boolean bridge, boolean serp) {

        LsiTerm toTerm() {
            return new LsiTerm(term, lemma, category, bridge);
        }
    }

    private record LsiSelection(List<LsiTerm> terms, List<LsiTerm> reserve) {}

    private LsiSelection selectLsiTerms(String sourceIndustry, String targetIndustry, SerpSignal serp) {
        Map<String, SemanticCategory> targetSeeds = lemmaIndex(lexicon.seedTerms(targetIndustry));
        Map<String, SemanticCategory> sourceSeeds = lemmaIndex(lexicon.seedTerms(sourceIndustry));
        Map<String, SemanticCategory> allSeeds = new TreeMap<>();
        for (String industry : lexicon.industryNames()) {
            lemmaIndex(lexicon.seedTerms(industry)).forEach(allSeeds::putIfAbsent);
        }
        Set<String> serpLemmas = new TreeSet<>();
        List<String> serpTerms = new ArrayList<>();
        for (String raw : serp.lsiTerms()) {
            String term = raw == null ? "" : raw.trim().toLowerCase(Locale.ROOT);
            if (ArticleParser.words(term).size() == 1 && term.equals(ArticleParser.words(term).get(0))) {
                serpTerms.add(term);
                serpLemmas.add(lemmatizer.lemma(term));
            }
        }
        boolean crossIndustry = !sourceIndustry.equals(targetIndustry);

        Map<String, Candidate> byLemma = new LinkedHashMap<>();
        List<Map.Entry<String, SemanticCategory>> seeds = new ArrayList<>(lexicon.seedTerms(targetIndustry));
        seeds.addAll(lexicon.seedTerms(sourceIndustry));
        for (Map.Entry<String, SemanticCategory> seed : seeds) {
            String lemma = lemmatizer.lemma(seed.getKey());
            boolean bridge = crossIndustry && targetSeeds.containsKey(lemma) && sourceSeeds.containsKey(lemma);
            byLemma.putIfAbsent(lemma,
                new Candidate(seed.getKey(), lemma, seed.getValue(), bridge, serpLemmas.contains(lemma)));
        }
        for (String term : serpTerms) {
            String lemma = lemmatizer.lemma(term);
            byLemma.putIfAbsent(lemma, new Candidate(term, lemma, allSeeds.get(lemma), false, true));
        }

        List<Candidate> ranked = new ArrayList<>(byLemma.values());
        ranked.sort(Comparator.comparing(Candidate::bridge).reversed()
            .thenComparing(Comparator.comparing(Candidate::serp).reversed())
            .thenComparing(Candidate::lemma));

        int target = Math.min(properties.lsiTarget(), properties.lsiMax());
        List<Candidate> chosen = new ArrayList<>();
        Map<SemanticCategory, List<Candidate>> perCategory = new LinkedHashMap<>();
        for (SemanticCategory category : SemanticCategory.values()) {
            perCategory.put(category, new ArrayList<>());
        }
        for (Candidate candidate : ranked) {
            if (candidate.category() != null) {
                perCategory.get(candidate.category()).add(candidate);
            }
        }
        boolean progressed = true;
        for (int round = 0; chosen.size() < target && progressed; round++) {
            progressed = false;
            for (List<Candidate> bucket : perCategory.values()) {
                if (chosen.size() < target && round < bucket.size()) {
                    chosen.add(bucket.get(round));
                    progressed = true;
                }
            }
        }
        for (Candidate candidate : ranked) {
            if (chosen.size() >= target) {
                break;
            }
            if (!chosen.contains(candidate)) {
                chosen.add(candidate);
            }
        }
        if (chosen.size() < target) {
            Set<String> taken = new TreeSet<>();
            chosen.forEach(candidate -> taken.add(candidate.lemma()));
            for (Map.Entry<String, SemanticCategory> seed : lexicon.seedTerms(IndustryLexicon.GENERAL)) {
                String lemma = lemmatizer.lemma(seed.getKey());
                if (chosen.size() < target && taken.add(lemma)) {
                    chosen.add(new Candidate(seed.getKey(), lemma, seed.getValue(), false, false));
                }
            }
        }

        List<LsiTerm> reserve = new ArrayList<>();
        for (Candidate candidate : ranked) {
            if (reserve.size() >= properties.reserveTerms()) {
                break;
            }
            if (!chosen.contains(candidate)) {
                reserve.add(candidate.toTerm());
            }
        }
        return new LsiSelection(chosen.stream().map(Candidate::toTerm).toList(), reserve);
    }

    private Map<String, SemanticCategory> lemmaIndex(List<Map.Entry<String, SemanticCategory>> seeds) {
        Map<String, SemanticCategory> index = new HashMap<>();
        for (Map.Entry<String, SemanticCategory> seed : seeds) {
            index.putIfAbsent(lemmatizer.lemma(seed.getKey()), seed.getValue());
        }
        return index;
    }

    private TrustPlan trustPlan(TrustRegistry registry, String sourceIndustry, String targetIndustry,
                                String publisherDomain, String targetDomain) {
        List<String> suggested = registry.entries().stream()
            .filter(entry -> !entry.competitor())
            .filter(entry -> entry.tier().meets(TrustTier.T2))
            .filter(entry -> !DomainNames.belongsTo(targetDomain, entry.domain())
                && !DomainNames.belongsTo(entry.domain(), targetDomain))
            .filter(entry -> !DomainNames.belongsTo(publisherDomain, entry.domain())
                && !DomainNames.belongsTo(entry.domain(), publisherDomain))
            .sorted(Comparator
                .comparing((TrustRegistryEntry entry) ->
                    !(entry.category().equals(targetIndustry) || entry.category().equals(sourceIndustry)))
                .thenComparingInt(entry -> entry.tier().rank())
                .thenComparing(TrustRegistryEntry::domain))
            .limit(properties.suggestedTrustSources())
            .map(TrustRegistryEntry::domain)
            .toList();
        return new TrustPlan(properties.requiredTrustSignals(), TrustTier.T2, PREFERRED_TIERS, suggested);
    }

    private CompliancePlan compliancePlan(Order order, Optional<TrustRegistryEntry> targetEntry) {
        Set<String> tags = new TreeSet<>(order.constraints().complianceTags());
        targetEntry.map(TrustRegistryEntry::category)
            .filter(disclaimers::isRegulated)
            .ifPresent(tags::add);
        boolean regulated = tags.stream().anyMatch(disclaimers::isRegulated);
        return new CompliancePlan(List.copyOf(tags), regulated);
    }

    static String queryCluster(String topic) {
        List<String> words = new ArrayList<>();
        for (String word : ArticleParser.words(topic == null ? "" : topic)) {
            String lower = word.toLowerCase(Locale.ROOT);
            if (lower.length() > 2 && !STOPWORDS.contains(lower) && words.size() < 4) {
                words.add(lower);
            }
        }
        return String.join(" ", words);
    }

    static List<String> intents(String topic, SerpSignal serp) {
        Set<String> intents = new TreeSet<>();
        for (String word : ArticleParser.words(topic == null ? "" : topic)) {
            String lower = word.toLowerCase(Locale.ROOT);
            if (INFORMATIONAL_MARKERS.contains(lower)) {
                intents.add("informational");
            }
            if (COMMERCIAL_MARKERS.contains(lower)) {
                intents.add("commercial");
            }
            if (TRANSACTIONAL_MARKERS.contains(lower)) {
                intents.add("transactional");
            }
        }
        for (String intent : serp.intents()) {
            if (intent != null && !intent.isBlank()) {
                intents.add(intent.trim().toLowerCase(Locale.ROOT));
            }
        }
        if (intents.isEmpty()) {
            intents.add("informational");
        }
        return List.copyOf(intents);
    }
}
