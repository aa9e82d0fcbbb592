package com.products.scraper.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Billing period of a subscription price.
 */
public enum BillingInterval {

    MONTHLY("monthly"),
    YEARLY("yearly");

    private final String value;

    BillingInterval(final String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }
}
