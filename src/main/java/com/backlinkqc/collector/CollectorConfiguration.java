package com.backlinkqc.collector;

import com.backlinkqc.trust.DisclaimerCatalog;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.Executors;

/**
 * Wires the in-process collaborators used until real publisher, SERP and
 * registry feeds are connected. Each is replaceable by declaring a bean of
 * the same interface.
 */
@Configuration
public class CollectorConfiguration {

    @Bean
    public PublisherProfileSource publisherProfileSource() {
        return InMemoryPublisherProfileSource.seeded();
    }

    @Bean
    public AnchorPortfolioSource anchorPortfolioSource() {
        return new InMemoryAnchorPortfolioSource();
    }

    @Bean
    public SerpSignalSource serpSignalSource() {
        return new MockSerpSignalSource();
    }

    @Bean
    public TrustRegistrySource trustRegistrySource() {
        return InMemoryTrustRegistrySource.seeded();
    }

    @Bean
    public ArticleDraftSource articleDraftSource(DisclaimerCatalog disclaimers) {
        return new TemplateArticleDraftSource(disclaimers);
    }

    @Bean
    public MdcPropagatingExecutor collectorExecutor(CollectorProperties properties) {
        return new MdcPropagatingExecutor(Executors.newFixedThreadPool(properties.poolSize()));
    }

    @Bean
    public CollectorGateway collectorGateway(PublisherProfileSource profiles,
                                             AnchorPortfolioSource portfolios,
                                             SerpSignalSource serp,
                                             TrustRegistrySource registry,
                                             ArticleDraftSource drafts,
                                             MdcPropagatingExecutor collectorExecutor,
                                             CollectorProperties properties) {
        return new CollectorGateway(profiles, portfolios, serp, registry, drafts, collectorExecutor, properties);
    }
}
