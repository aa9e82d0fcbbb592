package com.products.scraper.parser;

import org.jsoup.nodes.Document;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class HtmlSelectorParserTest {

    private static final String BASE = "https://www.etsy.com/listing/1/planner";

    private static final String HTML = """
            <html><body>
              <h1>  Digital   Planner </h1>
              <div class="shop-name">PaperStudio</div>
              <ul class="features"><li>Hyperlinked tabs</li><li>Undated</li><li> </li></ul>
              <div class="gallery">
                <img src="/img/main.jpg">
                <img src="https://cdn.example.com/second.png">
              </div>
              <img src="/assets/logo.svg">
              <span class="review"></span><span class="review"></span>
            </body></html>
            """;

    private HtmlSelectorParser parser;
    private Document doc;

    @BeforeEach
    void setUp() {
        parser = new HtmlSelectorParser();
        doc = parser.parse(HTML, BASE);
    }

    // ===== Text =====

    @Test
    void shouldReturnFirstNonBlankAlternative() {
        assertEquals(Optional.of("PaperStudio"), parser.selectText(doc, ".creator-name, .shop-name"));
        assertEquals(Optional.of("Digital Planner"), parser.selectText(doc, "h1"));
    }

    @Test
    void shouldReturnEmptyForMissingOrBlankSelector() {
        assertTrue(parser.selectText(doc, ".nothing-here").isEmpty());
        assertTrue(parser.selectText(doc, null).isEmpty());
    }

    @Test
    void shouldIgnoreUnparsableSelector() {
        assertTrue(parser.selectText(doc, "div:no-such-pseudo").isEmpty());
        assertEquals(0, parser.count(doc, "div:no-such-pseudo"));
    }

    @Test
    void shouldCollectTextsOfListItems() {
        assertEquals(List.of("Hyperlinked tabs", "Undated"), parser.selectTexts(doc, ".features li", 10));
        assertEquals(List.of("Hyperlinked tabs"), parser.selectTexts(doc, ".features li", 1));
    }

    @Test
    void shouldCountMatches() {
        assertEquals(2, parser.count(doc, ".review"));
    }

    // ===== Images =====

    @Test
    void shouldResolveImagesOfSelector() {
        List<String> images = parser.images(doc, ".gallery img", "", 10);

        assertEquals(List.of("https://www.etsy.com/img/main.jpg", "https://cdn.example.com/second.png"), images);
    }

    @Test
    void shouldFallBackToAllImagesWithoutNoise() {
        List<String> images = parser.images(doc, ".missing img", null, 10);

        assertTrue(images.contains("https://www.etsy.com/img/main.jpg"));
        assertFalse(images.stream().anyMatch(src -> src.contains("logo")));
    }

    @Test
    void shouldAddMarkdownImagesDeduplicatedAndCapped() {
        String markdown = "![cover](https://cdn.example.com/second.png)\n![extra](/img/extra.jpg)";

        List<String> all = parser.images(doc, ".gallery", markdown, 10);
        List<String> capped = parser.images(doc, ".gallery", markdown, 2);

        assertEquals(3, all.size());
        assertEquals("https://www.etsy.com/img/extra.jpg", all.get(2));
        assertEquals(2, capped.size());
    }

    @Test
    void shouldCollapseVisibleText() {
        Document small = parser.parse("<p>Only\n   <b>$5</b></p>", BASE);

        assertEquals("Only $5", parser.visibleText(small));
    }
}
