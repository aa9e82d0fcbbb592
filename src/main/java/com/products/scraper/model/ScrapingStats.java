package com.products.scraper.model;

import java.util.Map;

/**
 * Point-in-time snapshot of an agent's usage counters.
 *
 * @param totalRequests         completed top-level scrape calls
 * @param successfulScrapes     calls that produced a product record
 * @param failedScrapes         calls that ended in a failure result
 * @param averageResponseTimeMs mean duration over all completed calls
 * @param rateLimitHits         scrapes that had to wait for rate limit capacity
 * @param errorsByType          failures keyed by failure reason
 * @param sourceStats           counters keyed by source id
 */
public record ScrapingStats(
        long totalRequests,
        long successfulScrapes,
        long failedScrapes,
        double averageResponseTimeMs,
        long rateLimitHits,
        Map<String, Long> errorsByType,
        Map<String, SourceStats> sourceStats
) {

    public ScrapingStats {
        errorsByType = Map.copyOf(errorsByType);
        sourceStats = Map.copyOf(sourceStats);
    }
}
