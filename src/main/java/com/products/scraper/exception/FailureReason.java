package com.products.scraper.exception;

/**
 * Kinds of pipeline failure. All of them surface with the same error code and are told
 * apart by their message.
 */
public enum FailureReason {

    /** The input is not an absolute http(s) URL. */
    INVALID_URL,

    /** The URL's host is not in the source registry. */
    UNSUPPORTED_DOMAIN,

    /** The source's bucket would not have capacity within the maximum wait. */
    RATE_LIMITED,

    /** The fetch service kept failing until retries were exhausted. */
    FETCH_FAILED
}
