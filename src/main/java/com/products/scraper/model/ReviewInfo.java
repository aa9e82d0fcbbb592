package com.products.scraper.model;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Rating summary read from a source's review selectors.
 *
 * @param averageRating average star rating, {@code null} if not shown
 * @param totalReviews  number of review elements on the page, {@code null} if not selectable
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ReviewInfo(Double averageRating, Integer totalReviews) {
}
