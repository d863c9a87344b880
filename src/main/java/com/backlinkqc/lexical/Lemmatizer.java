package com.backlinkqc.lexical;

/**
 * Maps a surface token to its canonical lemma. Implementations hold the
 * language-specific rule tables and must be deterministic: scoring depends
 * on reproducible lemma counts.
 */
@FunctionalInterface
public interface Lemmatizer {

    String lemma(String token);
}
