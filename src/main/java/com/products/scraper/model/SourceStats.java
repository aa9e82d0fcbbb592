package com.products.scraper.model;

/**
 * Per-source counters inside a {@link ScrapingStats} snapshot.
 */
public record SourceStats(long requests, long successes, long failures, double avgResponseTimeMs) {
}
