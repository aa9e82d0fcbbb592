package com.products.scraper.service.core;

import com.products.scraper.model.ScrapingStats;
import com.products.scraper.model.SourceStats;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.TreeMap;

/**
 * Usage counters of one agent. Every completed top-level scrape is recorded exactly once,
 * total and outcome together, so a reset never leaves an in-flight request half counted.
 */
public class ScrapingStatsTracker {

    private long totalRequests;

    private long successfulScrapes;

    private long failedScrapes;

    private long totalDurationMs;

    private long rateLimitHits;

    private final Map<String, Long> errorsByType = new TreeMap<>();

    private final Map<String, Counter> bySource = new LinkedHashMap<>();

    public synchronized void recordSuccess(final String sourceId, final long durationMs) {
        totalRequests++;
        successfulScrapes++;
        totalDurationMs += durationMs;
        if (sourceId != null) {
            bySource.computeIfAbsent(sourceId, id -> new Counter()).add(true, durationMs);
        }
    }

    /**
     * @param sourceId  source of the URL, {@code null} when classification failed
     * @param errorType failure kind, e.g. the failure reason's name
     */
    public synchronized void recordFailure(final String sourceId, final String errorType, final long durationMs) {
        totalRequests++;
        failedScrapes++;
        totalDurationMs += durationMs;
        errorsByType.merge(errorType, 1L, Long::sum);
        if (sourceId != null) {
            bySource.computeIfAbsent(sourceId, id -> new Counter()).add(false, durationMs);
        }
    }

    public synchronized void recordRateLimitHit() {
        rateLimitHits++;
    }

    public synchronized ScrapingStats snapshot() {
        Map<String, SourceStats> sources = new LinkedHashMap<>();
        bySource.forEach((id, c) -> sources.put(id, c.toStats()));
        return new ScrapingStats(
                totalRequests,
                successfulScrapes,
                failedScrapes,
                average(totalDurationMs, totalRequests),
                rateLimitHits,
                errorsByType,
                sources);
    }

    public synchronized void reset() {
        totalRequests = 0;
        successfulScrapes = 0;
        failedScrapes = 0;
        totalDurationMs = 0;
        rateLimitHits = 0;
        errorsByType.clear();
        bySource.clear();
    }

    private static double average(final long sum, final long count) {
        return count == 0 ? 0.0 : (double) sum / count;
    }

    private static final class Counter {
        private long requests;
        private long successes;
        private long failures;
        private long durationMs;

        void add(final boolean success, final long duration) {
            requests++;
            if (success) {
                successes++;
            } else {
                failures++;
            }
            durationMs += duration;
        }

        SourceStats toStats() {
            return new SourceStats(requests, successes, failures, average(durationMs, requests));
        }
    }
}
