package com.products.scraper.config;

import lombok.Data;
import lombok.Getter;
import lombok.Setter;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Holds configuration of one marketplace known to the scraper.
 * <p>
 * Each instance is bound from a <code>scraper.sources.{id}</code> section and turned into an
 * immutable {@link com.products.scraper.model.SourceDescriptor} at startup.
 * </p>
 */
@Getter
@Setter
public class SourceCfg {

    /**
     * Name reported as the product source.
     * <p>For example, "Creative Market".</p>
     */
    private String displayName;

    /**
     * Registrable domains of the marketplace, subdomains included implicitly.
     * <p>For example, "etsy.com" also matches "www.etsy.com".</p>
     */
    private List<String> domains = new ArrayList<>();

    /**
     * Category tags; the first one is the fallback product category.
     */
    private List<String> categories = new ArrayList<>();

    /**
     * Hourly request quota respected by the rate limiter.
     */
    private int requestsPerHour = 60;

    /**
     * CSS selectors keyed by field: title, price, description, images, seller,
     * features, rating, reviews.
     */
    private Map<String, String> selectors = new LinkedHashMap<>();

    /**
     * Source specific options forwarded to the fetch service.
     */
    private FetchHints fetch = new FetchHints();

    @Data
    public static class FetchHints {

        /** How long the fetch service waits for dynamic content, unset for the global default */
        private Duration waitFor;

        /** Extra request headers */
        private Map<String, String> headers = new LinkedHashMap<>();

        /** Tags removed from the page before conversion */
        private List<String> excludeTags = new ArrayList<>();
    }
}
