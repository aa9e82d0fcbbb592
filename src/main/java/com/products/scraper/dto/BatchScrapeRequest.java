package com.products.scraper.dto;

import com.products.scraper.model.ScrapingRequest;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

import java.util.List;

/**
 * Request payload of a batch scrape.
 *
 * @param requests between 1 and {@value #MAX_ITEMS} scrape requests, scraped in parallel and
 *                 answered in the same order
 */
public record BatchScrapeRequest(
        @NotEmpty @Size(max = BatchScrapeRequest.MAX_ITEMS) List<@Valid @NotNull ScrapingRequest> requests
) {

    public static final int MAX_ITEMS = 100;
}
