package com.products.scraper.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Caller supplied priority of a scrape request. Carried through for auditing only.
 */
public enum RequestPriority {

    LOW,
    NORMAL,
    HIGH,
    CRITICAL;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Lenient parser used by Jackson and by {@code process(input, context)}.
     *
     * @param raw priority name in any case; {@code null} or blank maps to {@link #NORMAL}
     * @return the matching priority
     * @throws IllegalArgumentException if the name is not a known priority
     */
    @JsonCreator
    public static RequestPriority fromValue(final String raw) {
        if (raw == null || raw.isBlank()) {
            return NORMAL;
        }
        return valueOf(raw.trim().toUpperCase(Locale.ROOT));
    }
}
