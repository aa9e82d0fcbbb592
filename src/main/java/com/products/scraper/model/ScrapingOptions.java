package com.products.scraper.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;

import java.util.List;

/**
 * Per request switches. Every field is optional; {@code null} means "use the default".
 *
 * @param includeImages     collect product image URLs (default {@code true})
 * @param includeMetadata   attach SEO metadata and tags (default {@code true})
 * @param extractContent    keep the page markdown and run insight enrichment (default {@code false})
 * @param respectRateLimit  overrides the agent wide rate limit flag for this request
 * @param timeoutMs         overrides the agent wide per-attempt timeout
 * @param formats           content formats requested from the fetch service
 */
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record ScrapingOptions(
        Boolean includeImages,
        Boolean includeMetadata,
        Boolean extractContent,
        Boolean respectRateLimit,
        Long timeoutMs,
        List<String> formats
) {

    public static ScrapingOptions defaults() {
        return ScrapingOptions.builder().build();
    }

    public boolean imagesWanted() {
        return includeImages == null || includeImages;
    }

    public boolean metadataWanted() {
        return includeMetadata == null || includeMetadata;
    }

    public boolean contentWanted() {
        return Boolean.TRUE.equals(extractContent);
    }
}
