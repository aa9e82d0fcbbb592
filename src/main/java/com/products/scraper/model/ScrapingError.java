package com.products.scraper.model;

/**
 * Failure description of a scrape.
 *
 * @param code    error family, {@link #SCRAPING_FAILED} for every pipeline failure
 * @param message human readable reason distinguishing the failure kind
 */
public record ScrapingError(String code, String message) {

    public static final String SCRAPING_FAILED = "SCRAPING_FAILED";

    public static final String BATCH_SCRAPING_FAILED = "BATCH_SCRAPING_FAILED";
}
