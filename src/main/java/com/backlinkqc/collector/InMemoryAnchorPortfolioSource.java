package com.backlinkqc.collector;

import com.backlinkqc.portfolio.AnchorPortfolio;
import com.backlinkqc.portfolio.AnchorType;
import com.backlinkqc.trust.DomainNames;

import java.util.concurrent.ConcurrentHashMap;

public class InMemoryAnchorPortfolioSource implements AnchorPortfolioSource {

    private final ConcurrentHashMap<String, AnchorPortfolio> portfolios = new ConcurrentHashMap<>();

    public void put(AnchorPortfolio portfolio) {
        portfolios.put(DomainNames.normalize(portfolio.targetDomain()), portfolio);
    }

    @Override
    public AnchorPortfolio get(String targetDomain) {
        String key = DomainNames.normalize(targetDomain);
        return portfolios.getOrDefault(key, AnchorPortfolio.empty(key));
    }

    @Override
    public AnchorPortfolio recordPlacement(String targetDomain, AnchorType type) {
        String key = DomainNames.normalize(targetDomain);
        return portfolios.compute(key, (domain, current) ->
            (current == null ? AnchorPortfolio.empty(domain) : current).plus(type));
    }
}
