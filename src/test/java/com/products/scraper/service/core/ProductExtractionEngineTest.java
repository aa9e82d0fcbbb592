package com.products.scraper.service.core;

import com.products.scraper.config.ScraperProperties;
import com.products.scraper.model.BillingInterval;
import com.products.scraper.model.FetchedContent;
import com.products.scraper.model.PageMetadata;
import com.products.scraper.model.PricingType;
import com.products.scraper.model.ProductExtract;
import com.products.scraper.model.ScrapingOptions;
import com.products.scraper.parser.ContentClassifier;
import com.products.scraper.parser.FeatureExtractor;
import com.products.scraper.parser.HtmlSelectorParser;
import com.products.scraper.parser.PricingParser;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class ProductExtractionEngineTest {

    private static final String URL = "https://www.etsy.com/listing/1/digital-planner";
    private static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");

    private ProductExtractionEngine engine;

    @BeforeEach
    void setUp() {
        engine = newEngine(new PricingParser());
    }

    private static ProductExtractionEngine newEngine(PricingParser pricingParser) {
        return new ProductExtractionEngine(pricingParser, new FeatureExtractor(), new HtmlSelectorParser(),
                new ContentClassifier(), new ScraperProperties.Extraction(), Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private static FetchedContent content(String markdown, String html, PageMetadata metadata) {
        return new FetchedContent(markdown, html, metadata);
    }

    // ===== Title and description =====

    @Test
    void shouldPreferMetadataTitleAndDescription() {
        PageMetadata meta = new PageMetadata("Meta Title", "Meta description", "de", URL, null);

        ProductExtract product = engine.extract(content("# Heading\n\nParagraph", "", meta),
                TestSources.ETSY, URL, ScrapingOptions.defaults());

        assertEquals("Meta Title", product.title());
        assertEquals("Meta description", product.description());
        assertEquals("Etsy", product.source());
        assertEquals(URL, product.url());
        assertEquals(NOW, product.scrapedAt());
        assertTrue(product.id().startsWith("prod_"));
    }

    @Test
    void shouldFallBackToHeadingAndFirstParagraph() {
        String markdown = "![banner](/b.png)\n\n# Digital Planner 2024\n\n## Overview\n\n- item\n\n"
                + "Plan your whole year\nwith one file.\n\nSecond paragraph.";

        ProductExtract product = engine.extract(content(markdown, "", null),
                TestSources.ETSY, URL, ScrapingOptions.defaults());

        assertEquals("Digital Planner 2024", product.title());
        assertEquals("Plan your whole year with one file.", product.description());
    }

    @Test
    void shouldReadParagraphDirectlyUnderHeading() {
        ProductExtract product = engine.extract(content("# Planner\nA printable yearly planner.\n\n- A\n- B", "", null),
                TestSources.ETSY, URL, ScrapingOptions.defaults());

        assertEquals("Planner", product.title());
        assertEquals("A printable yearly planner.", product.description());
        assertEquals(List.of("A", "B"), product.features());
    }

    @Test
    void shouldSkipListContinuationsWhenLookingForParagraph() {
        assertEquals("Real paragraph",
                ProductExtractionEngine.firstParagraph("- item one\n  continued text\n\nReal paragraph").orElseThrow());
        assertEquals("Intro line",
                ProductExtractionEngine.firstParagraph("Intro line\n- list item\nafter").orElseThrow());
        assertTrue(ProductExtractionEngine.firstParagraph("## Only\n> quote\n\n---").isEmpty());
    }

    @Test
    void shouldFallBackToSelectorsThenDefaults() {
        String html = "<h1>Selector Title</h1>";

        ProductExtract fromSelector = engine.extract(content("", html, null),
                TestSources.ETSY, URL, ScrapingOptions.defaults());
        ProductExtract bare = engine.extract(content("", "", null),
                TestSources.GUMROAD, "https://gumroad.com/l/x", ScrapingOptions.defaults());

        assertEquals("Selector Title", fromSelector.title());
        assertEquals(ProductExtractionEngine.UNTITLED, bare.title());
        assertEquals(ProductExtractionEngine.NO_DESCRIPTION, bare.description());
    }

    // ===== Pricing and features =====

    @Test
    void shouldParsePriceAndFeaturesFromMarkdown() {
        String markdown = "# Planner\n\nPrice: $29.99\n\n## Features\n- A\n- B\n- C\n";

        ProductExtract product = engine.extract(content(markdown, "", null),
                TestSources.ETSY, URL, ScrapingOptions.defaults());

        assertEquals(0, new BigDecimal("29.99").compareTo(product.pricing().amount()));
        assertEquals("USD", product.pricing().currency());
        assertEquals(PricingType.ONE_TIME, product.pricing().type());
        assertEquals(List.of("A", "B", "C"), product.features());
    }

    @Test
    void shouldFallBackToPriceSelectorAndFeatureSelector() {
        String html = "<div class=\"price\">€49.99/month</div><ul class=\"features\"><li>Sync</li><li>Export</li></ul>";

        ProductExtract product = engine.extract(content("No list and no price here.", html, null),
                TestSources.ETSY, URL, ScrapingOptions.defaults());

        assertEquals(PricingType.SUBSCRIPTION, product.pricing().type());
        assertEquals(BillingInterval.MONTHLY, product.pricing().interval());
        assertEquals(List.of("Sync", "Export"), product.features());
    }

    @Test
    void shouldDegradeToUnknownPricingAndEmptyFeatures() {
        ProductExtract product = engine.extract(content("Nothing to see.", "", null),
                TestSources.GUMROAD, "https://gumroad.com/l/x", ScrapingOptions.defaults());

        assertNull(product.pricing().amount());
        assertTrue(product.features().isEmpty());
    }

    // ===== Optional parts =====

    @Test
    void shouldRespectOptionSwitches() {
        String html = "<div class=\"gallery\"><img src=\"/a.jpg\"></div>";
        ScrapingOptions off = ScrapingOptions.builder().includeImages(false).includeMetadata(false).build();
        ScrapingOptions content = ScrapingOptions.builder().extractContent(true).build();

        ProductExtract lean = engine.extract(content("# T", html, null), TestSources.ETSY, URL, off);
        ProductExtract full = engine.extract(content("# T", html, null), TestSources.ETSY, URL, content);

        assertNull(lean.images());
        assertNull(lean.metadata());
        assertNull(lean.content());
        assertEquals(List.of("https://www.etsy.com/a.jpg"), full.images());
        assertEquals("en", full.metadata().language());
        assertEquals("# T", full.content());
    }

    @Test
    void shouldReadSellerAndReviews() {
        String html = "<span class=\"shop-name\">PaperStudio</span><span class=\"stars\">4.8 out of 5</span>"
                + "<div class=\"review\"></div><div class=\"review\"></div><div class=\"review\"></div>";

        ProductExtract product = engine.extract(content("", html, null), TestSources.ETSY, URL,
                ScrapingOptions.defaults());

        assertEquals("PaperStudio", product.seller());
        assertEquals(4.8, product.reviews().averageRating());
        assertEquals(3, product.reviews().totalReviews());
    }

    @Test
    void shouldUseDetectedOrSourceCategory() {
        ProductExtract course = engine.extract(content("# Learn Figma\n\nA full course.", "", null),
                TestSources.GUMROAD, "https://gumroad.com/l/x", ScrapingOptions.defaults());
        ProductExtract fallback = engine.extract(content("# Stickers", "", null),
                TestSources.ETSY, URL, ScrapingOptions.defaults());

        assertEquals("course", course.category());
        assertEquals("templates", fallback.category());
    }

    // ===== Failure isolation =====

    @Test
    void shouldNeverThrowOnParserFailure() {
        PricingParser broken = mock(PricingParser.class);
        when(broken.parse(any())).thenThrow(new IllegalStateException("boom"));
        ProductExtractionEngine fragile = newEngine(broken);

        ProductExtract product = fragile.extract(content("# Title\n\nBody text", "", null),
                TestSources.ETSY, URL, ScrapingOptions.defaults());

        assertEquals("Title", product.title());
        assertEquals("Body text", product.description());
        assertNull(product.pricing().amount());
    }

    @Test
    void shouldFindFirstHeadingOnlyAtLevelOne() {
        assertEquals("Top", ProductExtractionEngine.firstHeading("## Sub\n# Top #\n").orElseThrow());
        assertTrue(ProductExtractionEngine.firstHeading("## Only sub").isEmpty());
    }
}
