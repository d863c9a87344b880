package com.backlinkqc.collector;

import com.backlinkqc.lexical.ArticleParser;
import com.backlinkqc.order.Order;
import com.backlinkqc.preflight.LsiTerm;
import com.backlinkqc.preflight.PreflightMatrix;
import com.backlinkqc.trust.DisclaimerCatalog;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Deterministic stand-in for the external writer. Lays the plan out as a
 * five-section article: the anchor sentence opens the centre section between
 * the planned LSI terms, the suggested trust sources are cited in the fourth
 * section and the required disclaimers close the article. Neutral filler
 * brings the text to the planned length.
 */
public class TemplateArticleDraftSource implements ArticleDraftSource {

    static final List<String> FILLER = List.of(
        "Readers appreciate clear context and honest perspective when they explore a new subject.",
        "Small and steady habits tend to matter more than dramatic changes.",
        "Each part below keeps the explanation short and concrete."
    );

    private final DisclaimerCatalog disclaimers;

    public TemplateArticleDraftSource(DisclaimerCatalog disclaimers) {
        this.disclaimers = disclaimers;
    }

    @Override
    public String draft(Order order, PreflightMatrix matrix) {
        List<LsiTerm> terms = matrix.lsi().terms();
        int half = terms.size() / 2;

        String overview = "## Overview\n\nThis article looks at " + order.topic().strip() + ".";
        String midpoint = "## " + capitalize(matrix.midpoint().label()) + "\n\n"
            + "Readers often need a pause when a long task drags on. "
            + "Useful points here include " + enumerate(terms.subList(0, half)) + ". "
            + "A fitting option is [" + order.anchorText().strip() + "](" + order.targetUrl().strip() + "). "
            + "Related themes are " + enumerate(terms.subList(half, terms.size())) + ". "
            + FILLER.get(1);

        StringBuilder sources = new StringBuilder("## Sources\n\n");
        List<String> suggested = matrix.trust().suggestedSources();
        for (int i = 0; i < Math.min(matrix.trust().requiredSignals(), suggested.size()); i++) {
            String domain = suggested.get(i);
            sources.append(i == 0 ? "" : " ")
                .append("Background figures are published by [").append(domain)
                .append("](https://").append(domain).append(").");
        }

        StringBuilder summary = new StringBuilder("## Summary\n\nA calm approach keeps the subject manageable.");
        for (String tag : matrix.compliance().requiredTags()) {
            disclaimers.canonicalDisclaimer(tag).ifPresent(text -> summary.append("\n\n").append(text));
        }

        int fixedWords = countWords(overview) + countWords(midpoint) + countWords(sources.toString())
            + countWords(summary.toString()) + countWords("## Background");
        List<String> background = new ArrayList<>();
        int words = fixedWords;
        for (int i = 0; words < matrix.wordCount().target(); i++) {
            String sentence = FILLER.get(i % FILLER.size());
            background.add(sentence);
            words += countWords(sentence);
        }
        if (background.isEmpty()) {
            background.add(FILLER.get(0));
        }

        StringBuilder text = new StringBuilder(overview).append("\n\n## Background\n\n");
        for (int i = 0; i < background.size(); i++) {
            if (i > 0) {
                text.append(i % 6 == 0 ? "\n\n" : " ");
            }
            text.append(background.get(i));
        }
        return text.append("\n\n").append(midpoint)
            .append("\n\n").append(sources)
            .append("\n\n").append(summary)
            .append('\n')
            .toString();
    }

    private static int countWords(String markdown) {
        int count = 0;
        for (String line : markdown.split("\n")) {
            String stripped = line.strip();
            if (stripped.startsWith("#")) {
                stripped = stripped.replaceFirst("^#+", "");
            }
            count += ArticleParser.words(ArticleParser.visible(stripped)).size();
        }
        return count;
    }

    private static String enumerate(List<LsiTerm> terms) {
        List<String> words = terms.stream().map(LsiTerm::term).toList();
        if (words.size() == 1) {
            return words.get(0);
        }
        return String.join(", ", words.subList(0, words.size() - 1)) + " and " + words.get(words.size() - 1);
    }

    private static String capitalize(String label) {
        if (label.isEmpty()) {
            return label;
        }
        return label.substring(0, 1).toUpperCase(Locale.ROOT) + label.substring(1);
    }
}
