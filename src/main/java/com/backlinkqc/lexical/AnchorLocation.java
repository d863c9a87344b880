package com.backlinkqc.lexical;

/**
 * Where the anchor text first occurs in the article body.
 *
 * @param sentenceIndex   global sentence index, the centre of the LSI window
 * @param sectionIndex    zero-based section index
 * @param paragraphNumber one-based paragraph position inside its section
 * @param lineNumber      zero-based source line of the paragraph
 */
public record AnchorLocation(int sentenceIndex, int sectionIndex, int paragraphNumber, int lineNumber) {}
