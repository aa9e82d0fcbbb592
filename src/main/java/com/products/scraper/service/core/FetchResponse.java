package com.products.scraper.service.core;

import com.products.scraper.model.FetchedContent;

/**
 * Answer of the fetch service: {@code data} when successful, {@code error} otherwise.
 */
public record FetchResponse(boolean success, FetchedContent data, String error) {

    public static FetchResponse success(final FetchedContent data) {
        return new FetchResponse(true, data, null);
    }

    public static FetchResponse failure(final String error) {
        return new FetchResponse(false, null, error == null ? "Unknown error" : error);
    }

    /** A response only counts as usable when it is flagged successful and carries content. */
    public boolean usable() {
        return success && data != null;
    }
}
