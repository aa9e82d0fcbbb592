package com.products.scraper.service.core;

import com.products.scraper.config.ScraperProperties;
import com.products.scraper.model.SourceDescriptor;

import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Source descriptors and settings shared by the pipeline tests.
 */
final class TestSources {

    static final SourceDescriptor ETSY = SourceDescriptor.builder()
            .id("etsy")
            .displayName("Etsy")
            .domainPatterns(List.of("etsy.com"))
            .categories(List.of("templates", "printables"))
            .requestsPerHour(100)
            .selectors(Map.of("title", "h1", "price", ".price", "seller", ".shop-name",
                    "rating", ".stars", "reviews", ".review", "features", ".features li", "images", ".gallery img"))
            .fetchHints(new SourceDescriptor.FetchHints(null,
                    Map.of("User-Agent", "Mozilla/5.0 (compatible; ProductAnalyzer/1.0)"), List.of()))
            .build();

    static final SourceDescriptor GUMROAD = SourceDescriptor.builder()
            .id("gumroad")
            .displayName("Gumroad")
            .domainPatterns(List.of("gumroad.com"))
            .categories(List.of("software", "courses"))
            .requestsPerHour(200)
            .fetchHints(new SourceDescriptor.FetchHints(3000L, null, null))
            .build();

    static final SourceDescriptor SHOPIFY_THEMES = SourceDescriptor.builder()
            .id("shopify")
            .displayName("Shopify")
            .domainPatterns(List.of("themes.shopify.com"))
            .categories(List.of("themes"))
            .requestsPerHour(40)
            .build();

    private TestSources() {
    }

    static SourceRegistry registry() {
        return new SourceRegistry(List.of(ETSY, GUMROAD, SHOPIFY_THEMES));
    }

    /** Settings with millisecond backoff so retry tests stay fast. */
    static ScraperProperties fastProperties(final int maxRetries) {
        ScraperProperties props = new ScraperProperties();
        props.setMaxRetries(maxRetries);
        props.setDefaultTimeout(Duration.ofSeconds(2));
        props.getRetry().setInitialBackoff(Duration.ofMillis(1));
        props.getRetry().setMaxBackoff(Duration.ofMillis(5));
        props.getRetry().setJitter(0);
        props.getBatch().setConcurrency(3);
        return props;
    }
}
