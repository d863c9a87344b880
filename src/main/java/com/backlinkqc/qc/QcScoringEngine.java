package com.backlinkqc.qc;

import com.backlinkqc.autofix.FixRecord;
import com.backlinkqc.lexical.AnchorLocation;
import com.backlinkqc.lexical.ArticleDocument;
import com.backlinkqc.lexical.LexicalWindowAnalyzer;
import com.backlinkqc.preflight.PreflightMatrix;
import com.backlinkqc.trust.ClassifiedLink;
import com.backlinkqc.trust.DomainNames;
import com.backlinkqc.trust.TrustComplianceChecker;
import com.backlinkqc.trust.TrustRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Scores a draft against its preflight matrix.
 *
 * <p>The engine holds one {@link CategoryRule} per {@link ScoreCategory}
 * and folds their results through the {@link ValidationReportAssembler}.
 * Evaluation has no side effects besides logging: the same article, matrix
 * and registry snapshot always produce an equal report.</p>
 */
public class QcScoringEngine {

    private static final Logger log = LoggerFactory.getLogger(QcScoringEngine.class);

    private final LexicalWindowAnalyzer analyzer;
    private final TrustComplianceChecker checker;
    private final Map<ScoreCategory, CategoryRule> rules;
    private final ValidationReportAssembler assembler;

    public QcScoringEngine(LexicalWindowAnalyzer analyzer,
                           TrustComplianceChecker checker,
                           List<CategoryRule> rules,
                           ValidationReportAssembler assembler) {
        this.analyzer = analyzer;
        this.checker = checker;
        this.assembler = assembler;
        Map<ScoreCategory, CategoryRule> table = new EnumMap<>(ScoreCategory.class);
        for (CategoryRule rule : rules) {
            if (table.put(rule.category(), rule) != null) {
                throw new IllegalArgumentException("duplicate rule for category " + rule.category());
            }
        }
        for (ScoreCategory category : ScoreCategory.values()) {
            if (!table.containsKey(category)) {
                throw new IllegalArgumentException("no rule for category " + category);
            }
        }
        this.rules = Collections.unmodifiableMap(table);
    }

    public ValidationReport evaluate(String articleText, PreflightMatrix matrix, TrustRegistry registry) {
        return evaluate(articleText, matrix, registry, 0, null);
    }

    /**
     * Evaluates and stamps the report with the auto-fix cycle it belongs to.
     */
    public ValidationReport evaluate(String articleText, PreflightMatrix matrix, TrustRegistry registry,
                                     int autoFixAttempts, FixRecord fix) {
        ArticleFacts facts = collectFacts(articleText == null ? "" : articleText, matrix, registry);

        Map<ScoreCategory, Integer> scores = new EnumMap<>(ScoreCategory.class);
        List<ValidationIssue> issues = new ArrayList<>();
        for (Map.Entry<ScoreCategory, CategoryRule> entry : rules.entrySet()) {
            CategoryResult result = entry.getValue().evaluate(facts);
            scores.put(entry.getKey(), result.score());
            issues.addAll(result.issues());
        }

        ValidationReport report = assembler.assemble(scores, issues, facts.qualifyingTrustSignals(),
            autoFixAttempts, fix);
        log.info("QC evaluated order={} status={} total={} issues={} signoff={}",
            matrix.orderId(), report.status(), report.totalScore(), report.issues().size(),
            report.humanSignoffRequired());
        return report;
    }

    ArticleFacts collectFacts(String text, PreflightMatrix matrix, TrustRegistry registry) {
        ArticleDocument document = analyzer.parse(text);
        String anchorText = matrix.anchor().primary();
        AnchorLocation anchor = analyzer.locate(document, anchorText).orElse(null);

        SortedMap<String, Integer> windowLemmas = anchor == null
            ? Collections.unmodifiableSortedMap(new TreeMap<>())
            : analyzer.extractLemmas(analyzer.window(document, anchor, matrix.lsi().radiusSentences()));

        List<ClassifiedLink> classified = checker.classifyLinks(document.linkUrls(), registry);
        List<ClassifiedLink> outbound = classified.stream()
            .filter(link -> !DomainNames.belongsTo(link.domain(), matrix.targetDomain()))
            .filter(link -> !DomainNames.belongsTo(link.domain(), matrix.publisherDomain()))
            .toList();
        List<String> tags = matrix.compliance().requiredTags();

        return new ArticleFacts(
            text,
            document,
            matrix,
            anchor,
            analyzer.headingsContaining(document, anchorText),
            windowLemmas,
            outbound,
            checker.countQualifyingTrustSignals(outbound, matrix.trust().minimumTier()),
            checker.findCompetitorHits(text, classified, registry),
            checker.checkCompliance(text, tags),
            checker.findProhibitedClaims(text, tags));
    }
}
