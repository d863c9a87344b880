package com.backlinkqc.lexical;

/**
 * A body sentence in visible text. {@code index} is global across the article;
 * section and paragraph indices are zero-based.
 */
public record Sentence(int index, String text, int sectionIndex, int paragraphIndex) {}
