package com.products.scraper.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Objects;

/**
 * Tagged outcome of one scrape: {@code data} is present iff {@code success},
 * {@code error} is present iff not.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ScrapingResult(boolean success, ProductExtract data, ScrapingError error, ResultMetadata metadata) {

    public ScrapingResult {
        if (success) {
            Objects.requireNonNull(data, "successful result needs data");
            if (error != null) {
                throw new IllegalArgumentException("successful result cannot carry an error");
            }
        } else {
            Objects.requireNonNull(error, "failed result needs an error");
            if (data != null) {
                throw new IllegalArgumentException("failed result cannot carry data");
            }
        }
    }

    public static ScrapingResult success(final ProductExtract data, final ResultMetadata metadata) {
        return new ScrapingResult(true, data, null, metadata);
    }

    public static ScrapingResult failure(final String code, final String message, final ResultMetadata metadata) {
        return new ScrapingResult(false, null, new ScrapingError(code, message), metadata);
    }

    public static ScrapingResult failure(final String message, final ResultMetadata metadata) {
        return failure(ScrapingError.SCRAPING_FAILED, message, metadata);
    }

    @JsonIgnore
    public boolean isFailure() {
        return !success;
    }
}
