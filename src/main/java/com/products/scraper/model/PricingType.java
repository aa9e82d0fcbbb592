package com.products.scraper.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * How a listing is paid for.
 */
public enum PricingType {

    FREE("free"),
    ONE_TIME("one-time"),
    SUBSCRIPTION("subscription");

    private final String value;

    PricingType(final String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }
}
