package com.backlinkqc.lexical;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits Markdown-like article text into sections, paragraphs and sentences.
 *
 * A line starting with {@code #} opens a section; every other non-blank line
 * is a paragraph of the current section. Markdown links {@code [text](url)}
 * render as their text, bare URLs are dropped from visible text.
 */
public class ArticleParser {

    static final Pattern MARKDOWN_LINK = Pattern.compile("\\[([^\\]]*)\\]\\(([^)\\s]+)\\)");
    static final Pattern BARE_URL = Pattern.compile("https?://[^\\s)\\]]+");
    static final Pattern SENTENCE_BREAK = Pattern.compile("(?<=[.!?])\\s+");
    static final Pattern WORD = Pattern.compile("[\\p{L}\\p{N}]+");

    public ArticleDocument parse(String text) {
        String source = text == null ? "" : text;
        String[] lines = source.split("\\r?\\n", -1);

        List<Section> sections = new ArrayList<>();
        List<Sentence> sentences = new ArrayList<>();
        List<ArticleLink> links = new ArrayList<>();
        int wordCount = 0;

        String title = "";
        int level = 0;
        int headingLine = -1;
        List<Paragraph> paragraphs = new ArrayList<>();

        for (int lineNo = 0; lineNo < lines.length; lineNo++) {
            String line = lines[lineNo].strip();
            if (line.isEmpty()) {
                continue;
            }
            collectLinks(line, lineNo, links);

            if (line.startsWith("#")) {
                if (level > 0 || !paragraphs.isEmpty()) {
                    sections.add(new Section(sections.size(), title, level, headingLine, paragraphs));
                }
                level = countLeading(line, '#');
                title = visible(line.substring(level)).strip();
                headingLine = lineNo;
                paragraphs = new ArrayList<>();
                wordCount += countWords(title);
                continue;
            }

            String visibleText = visible(line);
            wordCount += countWords(visibleText);
            int sectionIndex = sections.size();
            int paragraphIndex = paragraphs.size();
            List<Sentence> paragraphSentences = new ArrayList<>();
            for (String piece : splitSentences(visibleText)) {
                Sentence sentence = new Sentence(sentences.size(), piece, sectionIndex, paragraphIndex);
                sentences.add(sentence);
                paragraphSentences.add(sentence);
            }
            paragraphs.add(new Paragraph(paragraphIndex, lineNo, line, visibleText, paragraphSentences));
        }
        if (level > 0 || !paragraphs.isEmpty()) {
            sections.add(new Section(sections.size(), title, level, headingLine, paragraphs));
        }
        return new ArticleDocument(source, sections, sentences, links, wordCount);
    }

    /** Renders a Markdown line as plain visible text. */
    public static String visible(String line) {
        String withoutLinks = MARKDOWN_LINK.matcher(line).replaceAll(match -> Matcher.quoteReplacement(match.group(1)));
        String withoutUrls = BARE_URL.matcher(withoutLinks).replaceAll("");
        return withoutUrls.replace("*", "").replaceAll("\\s{2,}", " ").strip();
    }

    public static List<String> splitSentences(String text) {
        List<String> result = new ArrayList<>();
        for (String piece : SENTENCE_BREAK.split(text)) {
            String trimmed = piece.strip();
            if (!trimmed.isEmpty()) {
                result.add(trimmed);
            }
        }
        return result;
    }

    public static List<String> words(String text) {
        List<String> tokens = new ArrayList<>();
        Matcher matcher = WORD.matcher(text);
        while (matcher.find()) {
            tokens.add(matcher.group());
        }
        return tokens;
    }

    private static int countWords(String text) {
        int count = 0;
        Matcher matcher = WORD.matcher(text);
        while (matcher.find()) {
            count++;
        }
        return count;
    }

    private static void collectLinks(String line, int lineNo, List<ArticleLink> links) {
        Matcher markdown = MARKDOWN_LINK.matcher(line);
        while (markdown.find()) {
            links.add(new ArticleLink(markdown.group(1).strip(), markdown.group(2), lineNo, true));
        }
        Matcher bare = BARE_URL.matcher(MARKDOWN_LINK.matcher(line).replaceAll(" "));
        while (bare.find()) {
            links.add(new ArticleLink(bare.group(), bare.group(), lineNo, false));
        }
    }

    private static int countLeading(String line, char c) {
        int n = 0;
        while (n < line.length() && line.charAt(n) == c) {
            n++;
        }
        return n;
    }
}
