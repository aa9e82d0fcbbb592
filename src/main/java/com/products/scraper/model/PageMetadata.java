package com.products.scraper.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Page level metadata reported by the fetch service.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record PageMetadata(
        String title,
        String description,
        String language,
        String sourceURL,
        String ogImage
) {

    public static PageMetadata empty() {
        return new PageMetadata(null, null, null, null, null);
    }
}
