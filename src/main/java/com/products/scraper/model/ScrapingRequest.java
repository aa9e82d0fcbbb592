package com.products.scraper.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * One scrape call. Created by the caller, never persisted.
 *
 * @param url      listing URL to scrape
 * @param options  optional switches, {@code null} means defaults
 * @param priority caller priority, defaults to {@link RequestPriority#NORMAL}
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record ScrapingRequest(String url, ScrapingOptions options, RequestPriority priority) {

    public ScrapingRequest {
        options = options == null ? ScrapingOptions.defaults() : options;
        priority = priority == null ? RequestPriority.NORMAL : priority;
    }

    public static ScrapingRequest of(final String url) {
        return new ScrapingRequest(url, null, null);
    }
}
