package com.products.scraper.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;

import java.time.Instant;
import java.util.List;

/**
 * Structured product record produced by the extraction pipeline.
 * <p>
 * {@code images} is {@code null} when the request opted out of image collection,
 * {@code metadata} when it opted out of metadata, {@code content} and {@code insights}
 * unless content extraction was requested.
 * </p>
 */
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ProductExtract(
        String id,
        String url,
        String source,
        String title,
        String description,
        Pricing pricing,
        List<String> features,
        List<String> images,
        String category,
        String seller,
        ReviewInfo reviews,
        ProductMetadata metadata,
        String content,
        ProductInsights insights,
        Instant scrapedAt
) {

    public ProductExtract {
        features = features == null ? List.of() : List.copyOf(features);
        images = images == null ? null : List.copyOf(images);
        pricing = pricing == null ? Pricing.unknown() : pricing;
    }
}
