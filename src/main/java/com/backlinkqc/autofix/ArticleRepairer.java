package com.backlinkqc.autofix;

import com.backlinkqc.lexical.AnchorLocation;
import com.backlinkqc.lexical.ArticleDocument;
import com.backlinkqc.lexical.ArticleParser;
import com.backlinkqc.lexical.LexicalWindowAnalyzer;
import com.backlinkqc.lexical.Section;
import com.backlinkqc.preflight.LsiTerm;
import com.backlinkqc.preflight.PreflightMatrix;
import com.backlinkqc.trust.DisclaimerCatalog;
import com.backlinkqc.trust.DomainNames;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeSet;

/**
 * Text edits behind the four repair kinds. Each edit works on the raw
 * article lines so Markdown links survive, and reports whether it could be
 * applied.
 */
public class ArticleRepairer {

    /** Outcome of one text edit. */
    public record Repair(String text, boolean applied, String description) {

        static Repair failed(String text, String description) {
            return new Repair(text, false, description);
        }
    }

    private final LexicalWindowAnalyzer analyzer;
    private final DisclaimerCatalog catalog;

    public ArticleRepairer(LexicalWindowAnalyzer analyzer, DisclaimerCatalog catalog) {
        this.analyzer = analyzer;
        this.catalog = catalog;
    }

    /** Appends the canonical disclaimer of {@code tag} as a closing paragraph. */
    public Repair addDisclaimer(String text, String tag) {
        Optional<String> disclaimer = catalog.canonicalDisclaimer(tag);
        if (disclaimer.isEmpty()) {
            return Repair.failed(text, "No canonical disclaimer for tag '" + tag + "'");
        }
        return new Repair(appendParagraph(text, disclaimer.get()), true,
            "Appended the " + tag + " disclaimer as the final paragraph");
    }

    /**
     * Moves the sentence carrying the anchor to the start of the first
     * paragraph of the centre section.
     */
    public Repair moveLink(String text, PreflightMatrix matrix) {
        ArticleDocument document = analyzer.parse(text);
        String anchor = matrix.anchor().primary();
        Optional<AnchorLocation> location = analyzer.locate(document, anchor);
        if (location.isEmpty()) {
            return Repair.failed(text, "Anchor not found; nothing to move");
        }
        int sectionCount = document.sections().size();
        if (sectionCount < 3) {
            return Repair.failed(text, "Article has no midpoint section to move the link into");
        }
        Section target = document.sections().get(sectionCount / 2);
        if (target.paragraphs().isEmpty()) {
            return Repair.failed(text, "Midpoint section '" + target.title() + "' has no paragraph");
        }

        String[] lines = text.split("\\r?\\n", -1);
        int sourceLine = location.get().lineNumber();
        int targetLine = target.paragraphs().get(0).lineNumber();
        if (sourceLine == targetLine) {
            return Repair.failed(text, "Anchor already opens the midpoint section");
        }
        List<String> sentences = new ArrayList<>(ArticleParser.splitSentences(lines[sourceLine].strip()));
        int carrying = indexOfAnchorSentence(sentences, anchor);
        if (carrying < 0) {
            return Repair.failed(text, "Anchor sentence could not be isolated");
        }
        String moved = sentences.remove(carrying);
        lines[sourceLine] = String.join(" ", sentences);
        lines[targetLine] = moved + " " + lines[targetLine].strip();
        return new Repair(String.join("\n", lines), true,
            "Moved the anchor sentence into section '" + target.title() + "'");
    }

    /**
     * Inserts one sentence naming planned LSI terms missing from the anchor
     * window, directly after the anchor sentence.
     */
    public Repair injectLsi(String text, PreflightMatrix matrix) {
        ArticleDocument document = analyzer.parse(text);
        String anchor = matrix.anchor().primary();
        Optional<AnchorLocation> location = analyzer.locate(document, anchor);
        if (location.isEmpty()) {
            return Repair.failed(text, "Anchor not found; no window to enrich");
        }
        SortedMap<String, Integer> window = analyzer.extractLemmas(
            analyzer.window(document, location.get(), matrix.lsi().radiusSentences()));
        Set<String> vocabulary = matrix.lsi().vocabulary();
        int present = (int) window.keySet().stream().filter(vocabulary::contains).count();
        int deficit = matrix.lsi().minTerms() - present;

        List<String> missing = new ArrayList<>();
        for (LsiTerm term : matrix.lsi().terms()) {
            if (missing.size() < deficit && !window.containsKey(term.lemma())) {
                missing.add(term.term());
            }
        }
        if (missing.isEmpty()) {
            return Repair.failed(text, "No missing planned terms to inject");
        }

        String[] lines = text.split("\\r?\\n", -1);
        int line = location.get().lineNumber();
        List<String> sentences = new ArrayList<>(ArticleParser.splitSentences(lines[line].strip()));
        int carrying = indexOfAnchorSentence(sentences, anchor);
        if (carrying < 0) {
            return Repair.failed(text, "Anchor sentence could not be isolated");
        }
        sentences.add(carrying + 1, "Key considerations here include " + enumerate(missing) + ".");
        lines[line] = String.join(" ", sentences);
        return new Repair(String.join("\n", lines), true,
            "Injected LSI terms next to the anchor: " + String.join(", ", missing));
    }

    /** Appends a citation of the first suggested trust source not yet linked. */
    public Repair addTrust(String text, PreflightMatrix matrix) {
        ArticleDocument document = analyzer.parse(text);
        Set<String> cited = new TreeSet<>();
        for (String url : document.linkUrls()) {
            cited.add(DomainNames.hostOf(url));
        }
        for (String source : matrix.trust().suggestedSources()) {
            boolean alreadyCited = cited.stream().anyMatch(host -> DomainNames.belongsTo(host, source));
            if (!alreadyCited) {
                String sentence = "Further background is available from [" + source + "](https://" + source + ").";
                return new Repair(appendParagraph(text, sentence), true, "Added a citation of " + source);
            }
        }
        return Repair.failed(text, "No uncited trust source left to suggest");
    }

    private static int indexOfAnchorSentence(List<String> rawSentences, String anchor) {
        String needle = anchor.strip().toLowerCase(Locale.ROOT);
        for (int i = 0; i < rawSentences.size(); i++) {
            if (ArticleParser.visible(rawSentences.get(i)).toLowerCase(Locale.ROOT).contains(needle)) {
                return i;
            }
        }
        return -1;
    }

    private static String appendParagraph(String text, String paragraph) {
        return text.stripTrailing() + "\n\n" + paragraph + "\n";
    }

    private static String enumerate(List<String> terms) {
        if (terms.size() == 1) {
            return terms.get(0);
        }
        return String.join(", ", terms.subList(0, terms.size() - 1)) + " and " + terms.get(terms.size() - 1);
    }
}
