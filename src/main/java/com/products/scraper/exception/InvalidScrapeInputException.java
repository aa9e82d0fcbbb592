package com.products.scraper.exception;

/**
 * Raised by the generic {@code process} entry point when its input is not a URL string
 * or its context cannot be read. Thrown before any classification or network activity.
 */
public class InvalidScrapeInputException extends IllegalArgumentException {

    public InvalidScrapeInputException(final Object input) {
        super("Invalid input: expected a URL string but got "
                + (input == null ? "null" : input.getClass().getSimpleName()));
    }

    public InvalidScrapeInputException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
