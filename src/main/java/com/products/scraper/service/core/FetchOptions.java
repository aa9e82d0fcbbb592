package com.products.scraper.service.core;

import lombok.Builder;

import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Options of one fetch call.
 *
 * @param formats         content formats to return, e.g. {@code markdown}, {@code html}
 * @param onlyMainContent strip navigation, headers and footers
 * @param timeout         service side timeout of the page load
 * @param waitFor         delay for dynamic content, {@code null} for the service default
 * @param headers         extra request headers
 * @param excludeTags     tags removed before conversion
 */
@Builder
public record FetchOptions(
        List<String> formats,
        boolean onlyMainContent,
        Duration timeout,
        Duration waitFor,
        Map<String, String> headers,
        List<String> excludeTags
) {

    public FetchOptions {
        formats = formats == null ? List.of() : List.copyOf(formats);
        headers = headers == null ? Map.of() : Map.copyOf(headers);
        excludeTags = excludeTags == null ? List.of() : List.copyOf(excludeTags);
    }
}
