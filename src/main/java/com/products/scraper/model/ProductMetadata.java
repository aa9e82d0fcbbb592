package com.products.scraper.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/**
 * SEO and classification data attached when {@code includeMetadata} is requested.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ProductMetadata(
        String language,
        String metaTitle,
        String metaDescription,
        String ogImage,
        List<String> tags
) {

    public ProductMetadata withTags(final List<String> newTags) {
        return new ProductMetadata(language, metaTitle, metaDescription, ogImage, List.copyOf(newTags));
    }
}
