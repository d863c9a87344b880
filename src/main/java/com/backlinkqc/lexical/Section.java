package com.backlinkqc.lexical;

import java.util.List;

/**
 * A heading and the paragraphs under it. The untitled lead section (text
 * before the first heading) has heading level 0 and line number -1.
 */
public record Section(int index, String title, int headingLevel, int lineNumber, List<Paragraph> paragraphs) {

    public Section {
        paragraphs = List.copyOf(paragraphs);
    }

    public boolean hasHeading() {
        return headingLevel > 0;
    }

    public boolean isEmpty() {
        return paragraphs.isEmpty();
    }
}
