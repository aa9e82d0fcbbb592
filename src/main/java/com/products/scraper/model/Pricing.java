package com.products.scraper.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.math.BigDecimal;

/**
 * Price information parsed from a listing page.
 *
 * @param amount   the detected amount, {@code null} when no price token was found
 * @param currency ISO 4217 code, {@code null} for free items or unknown currencies
 * @param type     how the item is paid for; never {@code null}
 * @param interval billing period, only set for {@link PricingType#SUBSCRIPTION}
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Pricing(
        BigDecimal amount,
        String currency,
        PricingType type,
        BillingInterval interval
) {

    /** Nothing price-like was found on the page. */
    public static Pricing unknown() {
        return new Pricing(null, null, PricingType.FREE, null);
    }

    public static Pricing free() {
        return new Pricing(BigDecimal.ZERO, null, PricingType.FREE, null);
    }

    public boolean hasAmount() {
        return amount != null;
    }
}
