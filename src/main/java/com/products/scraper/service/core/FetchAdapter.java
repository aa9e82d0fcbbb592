package com.products.scraper.service.core;

/**
 * Contract of the external capability that retrieves page content for a URL.
 *
 * <p>Implementations talk to a content extraction service; the scraping pipeline never
 * performs raw HTTP or DOM work itself. A call either returns a {@link FetchResponse}
 * (successful or not) or throws; both unsuccessful responses and exceptions are treated
 * as transient by the retry controller.</p>
 */
@FunctionalInterface
public interface FetchAdapter {

    /**
     * Fetches one page.
     *
     * @param url     absolute URL of the listing
     * @param options formats, main-content switch, timeout and source hints
     * @return the service's answer, never {@code null}
     */
    FetchResponse fetch(String url, FetchOptions options);
}
