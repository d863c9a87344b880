package com.backlinkqc.collector;

import com.backlinkqc.portfolio.AnchorPortfolio;
import com.backlinkqc.portfolio.AnchorType;

/**
 * Historical anchor counts per target domain, and the recalculation that
 * follows a placed link.
 */
public interface AnchorPortfolioSource {

    /** Never null: a domain without history has an empty portfolio. */
    AnchorPortfolio get(String targetDomain);

    /** Records a placed link and returns the updated portfolio. */
    AnchorPortfolio recordPlacement(String targetDomain, AnchorType type);
}
