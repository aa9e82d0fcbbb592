package com.products.scraper.model;

/**
 * Bookkeeping attached to every result.
 *
 * @param requestId          unique id of the scrape call
 * @param durationMs         wall time of the call including rate limit waits and retries
 * @param retryCount         fetch attempts beyond the first
 * @param rateLimitRemaining permits left in the source's bucket after the call, -1 if unknown
 */
public record ResultMetadata(String requestId, long durationMs, int retryCount, long rateLimitRemaining) {

    public static ResultMetadata none(final String requestId) {
        return new ResultMetadata(requestId, 0L, 0, -1L);
    }
}
