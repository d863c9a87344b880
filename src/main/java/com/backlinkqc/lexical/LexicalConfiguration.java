package com.backlinkqc.lexical;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class LexicalConfiguration {

    @Bean
    public Lemmatizer lemmatizer() {
        return new SuffixRuleLemmatizer();
    }

    @Bean
    public ArticleParser articleParser() {
        return new ArticleParser();
    }

    @Bean
    public LexicalWindowAnalyzer lexicalWindowAnalyzer(ArticleParser parser, Lemmatizer lemmatizer) {
        return new LexicalWindowAnalyzer(parser, lemmatizer);
    }
}
