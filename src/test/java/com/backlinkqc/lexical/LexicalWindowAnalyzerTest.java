package com.backlinkqc.lexical;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;
import java.util.SortedMap;

import static org.junit.jupiter.api.Assertions.*;

class LexicalWindowAnalyzerTest {

    private static final String ARTICLE = """
        # Intro
        Sentence zero. Sentence one.

        # Middle
        Sentence two. Try [Online Casino](https://casino.example.com) tonight. Sentence four.
        Sentence five. Sentence six.

        # End
        Sentence seven.
        """;

    private LexicalWindowAnalyzer analyzer;

    @BeforeEach
    void setUp() {
        analyzer = new LexicalWindowAnalyzer(new ArticleParser(), new SuffixRuleLemmatizer());
    }

    @Nested
    @DisplayName("locate")
    class Locate {

        @Test
        void findsAnchorCaseInsensitively() {
            Optional<AnchorLocation> location = analyzer.locate(ARTICLE, "online casino");

            assertTrue(location.isPresent());
            assertEquals(3, location.get().sentenceIndex());
            assertEquals(1, location.get().sectionIndex());
            assertEquals(1, location.get().paragraphNumber());
        }

        @Test
        void missingAnchorIsSignaledNotThrown() {
            assertTrue(analyzer.locate(ARTICLE, "poker bonus").isEmpty());
            assertTrue(analyzer.locate(ARTICLE, " ").isEmpty());
        }

        @Test
        void headingsAreNotSearchedByLocate() {
            String text = "# Online Casino tips\nNothing here.";
            assertTrue(analyzer.locate(text, "online casino").isEmpty());
            ArticleDocument doc = analyzer.parse(text);
            assertEquals(1, analyzer.headingsContaining(doc, "Online Casino").size());
        }
    }

    @Nested
    @DisplayName("window")
    class Window {

        @Test
        void windowSpansTwoSentencesEachSide() {
            ArticleDocument doc = analyzer.parse(ARTICLE);
            AnchorLocation location = analyzer.locate(doc, "Online Casino").orElseThrow();

            List<String> window = analyzer.window(doc, location, 2);

            assertEquals(List.of("Sentence one.", "Sentence two.", "Try Online Casino tonight.",
                "Sentence four.", "Sentence five."), window);
        }

        @Test
        void windowIsClippedAtDocumentEdges() {
            ArticleDocument doc = analyzer.parse(ARTICLE);
            AnchorLocation first = new AnchorLocation(0, 0, 1, 1);

            assertEquals(3, analyzer.window(doc, first, 2).size());
        }
    }

    @Test
    void extractLemmasCountsCanonicalForms() {
        SortedMap<String, Integer> lemmas = analyzer.extractLemmas(
            List.of("Budgets help planning.", "A budget and planned savings."));

        assertEquals(2, lemmas.get("budget"));
        assertEquals(2, lemmas.get("plan"));
        assertEquals(1, lemmas.get("saving"));
        assertEquals(List.copyOf(lemmas.keySet()), lemmas.keySet().stream().sorted().toList());
    }
}
