package com.products.scraper.exception;

import lombok.Getter;

/**
 * Terminal failure of one scrape. Thrown inside the pipeline and turned into a failed
 * {@code ScrapingResult} by the agent; never escapes the public API.
 */
@Getter
public class ScrapingException extends RuntimeException {

    private final FailureReason reason;

    public ScrapingException(final FailureReason reason, final String message) {
        super(message);
        this.reason = reason;
    }

    public ScrapingException(final FailureReason reason, final String message, final Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }

    public static ScrapingException invalidUrl() {
        return new ScrapingException(FailureReason.INVALID_URL, "Invalid URL provided");
    }

    public static ScrapingException unsupportedDomain(final String host) {
        return new ScrapingException(FailureReason.UNSUPPORTED_DOMAIN, "Unsupported domain: " + host);
    }
}
