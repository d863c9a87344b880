package com.backlinkqc.lexical;

import java.util.List;

/**
 * Parsed view of an article: sections, the flattened body sentences, every
 * link, and the visible word count.
 */
public record ArticleDocument(
    String text,
    List<Section> sections,
    List<Sentence> sentences,
    List<ArticleLink> links,
    int wordCount
) {

    public ArticleDocument {
        sections = List.copyOf(sections);
        sentences = List.copyOf(sentences);
        links = List.copyOf(links);
    }

    public List<String> linkUrls() {
        return links.stream().map(ArticleLink::url).toList();
    }
}
