package com.products.scraper.parser;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ContentClassifierTest {

    private ContentClassifier classifier;

    @BeforeEach
    void setUp() {
        classifier = new ContentClassifier();
    }

    @Test
    void shouldDetectCategoryFromKeywords() {
        assertEquals("course", classifier.detectCategory("Learn Python in 30 lessons", "courses"));
        assertEquals("font", classifier.detectCategory("A handwritten TYPEFACE", null));
    }

    @Test
    void shouldUseFirstMatchingGroup() {
        assertEquals("template", classifier.detectCategory("Resume template with a video intro", null));
    }

    @Test
    void shouldFallBackWhenNothingMatches() {
        assertEquals("printables", classifier.detectCategory("Cute stickers", "printables"));
        assertEquals("digital-product", classifier.detectCategory("Cute stickers", null));
        assertEquals("digital-product", classifier.detectCategory(null, null));
    }

    @Test
    void shouldPutHashtagsFirst() {
        List<String> tags = classifier.extractTags("#notion #planner budget budget budget tracker");

        assertEquals("notion", tags.get(0));
        assertEquals("planner", tags.get(1));
        assertTrue(tags.contains("budget"));
    }

    @Test
    void shouldSkipStopWordsAndShortWords() {
        List<String> tags = classifier.extractTags("this that with from planner the and a an to");

        assertEquals(List.of("planner"), tags);
    }

    @Test
    void shouldCapTags() {
        StringBuilder text = new StringBuilder();
        for (int i = 0; i < 20; i++) {
            text.append("#tag").append(i).append(' ');
        }

        assertEquals(ContentClassifier.MAX_TAGS, classifier.extractTags(text.toString()).size());
        assertTrue(classifier.extractTags("  ").isEmpty());
    }
}
