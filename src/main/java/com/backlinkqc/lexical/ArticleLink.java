package com.backlinkqc.lexical;

/**
 * A link found in article text. Bare URLs carry the URL itself as text.
 */
public record ArticleLink(String text, String url, int lineNumber, boolean markdown) {}
