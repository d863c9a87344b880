package com.backlinkqc.qc;

import com.backlinkqc.lexical.LexicalWindowAnalyzer;
import com.backlinkqc.trust.DisclaimerCatalog;
import com.backlinkqc.trust.TrustComplianceChecker;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

@Configuration
public class QcConfiguration {

    /**
     * One rule per score category. The engine refuses to start when a
     * category is missing or claimed twice.
     */
    @Bean
    public QcScoringEngine qcScoringEngine(LexicalWindowAnalyzer analyzer,
                                           TrustComplianceChecker checker,
                                           DisclaimerCatalog disclaimers,
                                           QcProperties properties) {
        List<CategoryRule> rules = List.of(
            new PreflightConformanceRule(),
            new DraftStructureRule(properties),
            new AnchorPlacementRule(properties),
            new TrustSignalRule(),
            new LsiCoverageRule(),
            new VoiceFitRule(),
            new ComplianceRule(disclaimers)
        );
        return new QcScoringEngine(analyzer, checker, rules, new ValidationReportAssembler(properties));
    }
}
