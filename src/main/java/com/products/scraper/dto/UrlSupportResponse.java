package com.products.scraper.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Answer of the URL support check.
 *
 * @param url       the URL as received
 * @param supported whether the URL belongs to a registered source
 * @param source    display name of the matching source, absent when unsupported
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record UrlSupportResponse(String url, boolean supported, String source) {
}
