package com.products.scraper.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;

import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Immutable description of a recognised marketplace.
 *
 * @param id              registry key, e.g. {@code etsy}
 * @param displayName     human readable name reported as the product source
 * @param domainPatterns  registrable domains; a host matches a pattern when it equals it
 *                        or is a subdomain of it
 * @param categories      category tags, the first one doubles as the default product category
 * @param requestsPerHour hourly request quota used by the rate limiter
 * @param selectors       CSS selectors keyed by field name (title, price, description, ...)
 * @param fetchHints      source specific options for the fetch service
 */
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record SourceDescriptor(
        String id,
        String displayName,
        List<String> domainPatterns,
        List<String> categories,
        int requestsPerHour,
        Map<String, String> selectors,
        FetchHints fetchHints
) {

    public SourceDescriptor {
        domainPatterns = domainPatterns == null ? List.of()
                : domainPatterns.stream().map(d -> d.toLowerCase(Locale.ROOT)).toList();
        categories = categories == null ? List.of() : List.copyOf(categories);
        selectors = selectors == null ? Map.of() : Map.copyOf(selectors);
        fetchHints = fetchHints == null ? FetchHints.none() : fetchHints;
    }

    /**
     * @param host lower-cased host name of a candidate URL
     * @return {@code true} if the host equals one of the patterns or is a subdomain of one
     */
    public boolean matchesHost(final String host) {
        for (String pattern : domainPatterns) {
            if (host.equals(pattern) || host.endsWith("." + pattern)) {
                return true;
            }
        }
        return false;
    }

    /** CSS selector for a field, or {@code null} when the source defines none. */
    public String selector(final String field) {
        return selectors.get(field);
    }

    @JsonIgnore
    public String defaultCategory() {
        return categories.isEmpty() ? null : categories.get(0);
    }

    /**
     * Extra fetch options some sources need.
     *
     * @param waitForMs   time the fetch service waits for dynamic content, {@code null} for the default
     * @param headers     additional request headers
     * @param excludeTags HTML tags the fetch service strips
     */
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public record FetchHints(Long waitForMs, Map<String, String> headers, List<String> excludeTags) {

        public FetchHints {
            headers = headers == null ? Map.of() : Map.copyOf(headers);
            excludeTags = excludeTags == null ? List.of() : List.copyOf(excludeTags);
        }

        public static FetchHints none() {
            return new FetchHints(null, Map.of(), List.of());
        }
    }
}
