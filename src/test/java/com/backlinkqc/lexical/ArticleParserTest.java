package com.backlinkqc.lexical;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ArticleParserTest {

    private ArticleParser parser;

    @BeforeEach
    void setUp() {
        parser = new ArticleParser();
    }

    @Test
    @DisplayName("Headings open sections and text before the first heading forms a lead section")
    void sectionsAndLead() {
        ArticleDocument doc = parser.parse("""
            Lead paragraph here.

            # First
            Body one. Body two!

            ## Second
            """);

        assertEquals(3, doc.sections().size());
        assertFalse(doc.sections().get(0).hasHeading());
        assertEquals("First", doc.sections().get(1).title());
        assertEquals(1, doc.sections().get(1).headingLevel());
        assertEquals(2, doc.sections().get(2).headingLevel());
        assertTrue(doc.sections().get(2).isEmpty());
        assertEquals(3, doc.sentences().size());
    }

    @Test
    void markdownLinksRenderAsTheirText() {
        ArticleDocument doc = parser.parse("# T\nRead [the guide](https://example.com/guide) today.");

        Paragraph paragraph = doc.sections().get(0).paragraphs().get(0);
        assertEquals("Read the guide today.", paragraph.text());
        assertEquals(1, doc.links().size());
        ArticleLink link = doc.links().get(0);
        assertEquals("the guide", link.text());
        assertEquals("https://example.com/guide", link.url());
        assertTrue(link.markdown());
    }

    @Test
    void bareUrlsAreCollectedButNotVisible() {
        ArticleDocument doc = parser.parse("# T\nSee https://scb.se/data for numbers.");

        assertEquals(List.of("https://scb.se/data"), doc.linkUrls());
        assertFalse(doc.links().get(0).markdown());
        assertEquals("See for numbers.", doc.sections().get(0).paragraphs().get(0).text());
    }

    @Test
    void wordCountIncludesHeadings() {
        ArticleDocument doc = parser.parse("# Two words\nThree more words.");
        assertEquals(5, doc.wordCount());
    }

    @Test
    void sentencesAreSplitAfterTerminalPunctuation() {
        assertEquals(List.of("One.", "Two?", "Three!"), ArticleParser.splitSentences("One. Two? Three!"));
        assertEquals(List.of("Version 1.5 works."), ArticleParser.splitSentences("Version 1.5 works."));
    }

    @Test
    void emptyTextParsesToEmptyDocument() {
        ArticleDocument doc = parser.parse(null);
        assertTrue(doc.sections().isEmpty());
        assertEquals(0, doc.wordCount());
    }
}
