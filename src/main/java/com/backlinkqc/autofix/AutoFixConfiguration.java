package com.backlinkqc.autofix;

import com.backlinkqc.lexical.LexicalWindowAnalyzer;
import com.backlinkqc.qc.QcScoringEngine;
import com.backlinkqc.trust.DisclaimerCatalog;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class AutoFixConfiguration {

    @Bean
    public ArticleRepairer articleRepairer(LexicalWindowAnalyzer analyzer, DisclaimerCatalog disclaimers) {
        return new ArticleRepairer(analyzer, disclaimers);
    }

    @Bean
    public AutoFixController autoFixController(QcScoringEngine engine, ArticleRepairer repairer) {
        return new AutoFixController(engine, repairer);
    }
}
