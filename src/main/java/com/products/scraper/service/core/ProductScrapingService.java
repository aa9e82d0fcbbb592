package com.products.scraper.service.core;

import com.products.scraper.exception.InvalidScrapeInputException;
import com.products.scraper.model.ScrapingRequest;
import com.products.scraper.model.ScrapingResult;
import com.products.scraper.model.ScrapingStats;
import com.products.scraper.model.SourceDescriptor;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Entry point of the product acquisition pipeline.
 * <p>
 * Apart from the input guard of {@link #process(Object, Map)}, no operation throws:
 * every failure is reported as a {@link ScrapingResult} with {@code success == false}.
 * </p>
 */
public interface ProductScrapingService {

    /**
     * Classifies, fetches and extracts one listing.
     *
     * @param request the URL plus optional switches
     * @return a successful result carrying the product, or a failed one carrying the reason
     */
    ScrapingResult scrapeProduct(ScrapingRequest request);

    /**
     * Scrapes many listings with bounded concurrency.
     *
     * @param requests items to scrape
     * @return one result per request, in input order
     */
    List<ScrapingResult> scrapeMultipleProducts(List<ScrapingRequest> requests);

    /**
     * @return a snapshot of the usage counters
     */
    ScrapingStats getStats();

    /**
     * Zeroes all usage counters.
     */
    void resetStats();

    /**
     * @param url candidate URL, malformed input yields {@code false}
     * @return whether the URL's host belongs to a registered source
     */
    boolean isUrlSupported(String url);

    /**
     * @param url candidate URL, malformed input yields an empty result
     * @return the source the URL belongs to
     */
    Optional<SourceDescriptor> resolveSource(String url);

    /**
     * @return the full read-only source table keyed by source id
     */
    Map<String, SourceDescriptor> getSupportedSources();

    /**
     * @param category category tag such as {@code courses} or {@code templates}
     * @return sources carrying that tag, in registry order
     */
    List<SourceDescriptor> getSourcesByCategory(String category);

    /**
     * Generic entry point taking an untyped input.
     *
     * @param input expected to be a URL string
     * @return the scrape result for the URL
     * @throws InvalidScrapeInputException when the input is not a string
     */
    default ScrapingResult process(final Object input) {
        return process(input, Map.of());
    }

    /**
     * Generic entry point with a context map that may carry {@code options}
     * (a map or {@code ScrapingOptions}) and {@code priority}.
     *
     * @throws InvalidScrapeInputException when the input is not a string or the context is unreadable
     */
    ScrapingResult process(Object input, Map<String, ?> context);
}
