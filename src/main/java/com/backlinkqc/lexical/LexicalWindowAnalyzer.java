package com.backlinkqc.lexical;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Locates the anchor in an article and measures the vocabulary around it.
 * Pure functions over their inputs; the language rules live in the injected
 * {@link Lemmatizer}.
 */
public class LexicalWindowAnalyzer {

    private final ArticleParser parser;
    private final Lemmatizer lemmatizer;

    public LexicalWindowAnalyzer(ArticleParser parser, Lemmatizer lemmatizer) {
        this.parser = parser;
        this.lemmatizer = lemmatizer;
    }

    public ArticleDocument parse(String text) {
        return parser.parse(text);
    }

    public Optional<AnchorLocation> locate(String text, String anchor) {
        return locate(parser.parse(text), anchor);
    }

    /**
     * Finds the first body sentence containing the anchor text verbatim,
     * ignoring case. Headings are not searched; see {@link #headingsContaining}.
     *
     * @return the location, or empty when the anchor does not occur in the body
     */
    public Optional<AnchorLocation> locate(ArticleDocument document, String anchor) {
        if (anchor == null || anchor.isBlank()) {
            return Optional.empty();
        }
        String needle = anchor.strip().toLowerCase(Locale.ROOT);
        for (Sentence sentence : document.sentences()) {
            if (sentence.text().toLowerCase(Locale.ROOT).contains(needle)) {
                Section section = document.sections().get(sentence.sectionIndex());
                Paragraph paragraph = section.paragraphs().get(sentence.paragraphIndex());
                return Optional.of(new AnchorLocation(
                    sentence.index(),
                    sentence.sectionIndex(),
                    sentence.paragraphIndex() + 1,
                    paragraph.lineNumber()));
            }
        }
        return Optional.empty();
    }

    public List<Section> headingsContaining(ArticleDocument document, String anchor) {
        if (anchor == null || anchor.isBlank()) {
            return List.of();
        }
        String needle = anchor.strip().toLowerCase(Locale.ROOT);
        return document.sections().stream()
            .filter(Section::hasHeading)
            .filter(section -> section.title().toLowerCase(Locale.ROOT).contains(needle))
            .toList();
    }

    /**
     * Sentences within {@code radius} of the anchor sentence, in document order.
     */
    public List<String> window(ArticleDocument document, AnchorLocation location, int radius) {
        List<Sentence> all = document.sentences();
        if (all.isEmpty()) {
            return List.of();
        }
        int from = Math.max(0, location.sentenceIndex() - radius);
        int to = Math.min(all.size() - 1, location.sentenceIndex() + radius);
        List<String> window = new ArrayList<>();
        for (int i = from; i <= to; i++) {
            window.add(all.get(i).text());
        }
        return window;
    }

    /**
     * Lemma multiset of the window, sorted by lemma.
     */
    public SortedMap<String, Integer> extractLemmas(List<String> window) {
        SortedMap<String, Integer> counts = new TreeMap<>();
        for (String sentence : window) {
            for (String token : ArticleParser.words(sentence)) {
                String lemma = lemmatizer.lemma(token);
                if (!lemma.isEmpty()) {
                    counts.merge(lemma, 1, Integer::sum);
                }
            }
        }
        return Collections.unmodifiableSortedMap(counts);
    }

    public String lemma(String term) {
        return lemmatizer.lemma(term.strip());
    }
}
