package com.products.scraper.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/**
 * Model generated enrichment of a product record.
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
@JsonIgnoreProperties(ignoreUnknown = true)
public record ProductInsights(
        String category,
        List<String> tags,
        String targetAudience,
        List<String> sellingPoints
) {

    public ProductInsights {
        tags = tags == null ? List.of() : List.copyOf(tags);
        sellingPoints = sellingPoints == null ? List.of() : List.copyOf(sellingPoints);
    }
}
