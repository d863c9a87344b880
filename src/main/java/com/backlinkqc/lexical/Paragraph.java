package com.backlinkqc.lexical;

import java.util.List;

/**
 * One non-blank body line. {@code rawText} keeps the Markdown as written,
 * {@code text} is the visible rendering the sentences are cut from.
 */
public record Paragraph(int index, int lineNumber, String rawText, String text, List<Sentence> sentences) {

    public Paragraph {
        sentences = List.copyOf(sentences);
    }
}
