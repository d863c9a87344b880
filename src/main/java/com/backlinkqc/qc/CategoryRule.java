package com.backlinkqc.qc;

/**
 * Evaluator for one score category. Rules are deterministic and read only
 * the facts they are given.
 */
public interface CategoryRule {

    ScoreCategory category();

    CategoryResult evaluate(ArticleFacts facts);
}
