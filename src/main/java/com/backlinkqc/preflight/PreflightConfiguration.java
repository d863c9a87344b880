package com.backlinkqc.preflight;

import com.backlinkqc.lexical.Lemmatizer;
import com.backlinkqc.portfolio.AnchorRiskModel;
import com.backlinkqc.trust.DisclaimerCatalog;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class PreflightConfiguration {

    @Bean
    public IndustryLexicon industryLexicon() {
        return IndustryLexicon.standard();
    }

    @Bean
    public MidpointCatalog midpointCatalog() {
        return MidpointCatalog.standard();
    }

    @Bean
    public AnchorRiskModel anchorRiskModel() {
        return new AnchorRiskModel();
    }

    @Bean
    public AnchorClassifier anchorClassifier() {
        return new AnchorClassifier();
    }

    @Bean
    public PreflightMatrixBuilder preflightMatrixBuilder(IndustryLexicon lexicon,
                                                         MidpointCatalog midpoints,
                                                         AnchorRiskModel riskModel,
                                                         AnchorClassifier anchorClassifier,
                                                         DisclaimerCatalog disclaimers,
                                                         Lemmatizer lemmatizer,
                                                         PreflightProperties properties) {
        return new PreflightMatrixBuilder(lexicon, midpoints, riskModel, anchorClassifier,
            disclaimers, lemmatizer, properties);
    }
}
