package com.products.scraper.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Binds scraper configuration from <code>application.yml</code> under the
 * <code>scraper</code> prefix.
 * <p>
 * Example YAML:
 * <pre>{@code
 * scraper:
 *   fetch:
 *     api-key: ${FIRECRAWL_API_KEY:}
 *   default-timeout: 30s
 *   max-retries: 3
 *   respect-rate-limit: true
 *   sources:
 *     etsy:
 *       display-name: Etsy
 *       domains: [etsy.com]
 *       requests-per-hour: 100
 *     # ...
 * }</pre>
 */
@Component
@Getter
@Setter
@Validated
@ConfigurationProperties(prefix = "scraper")
public class ScraperProperties {

    /**
     * Connection settings of the content fetch service.
     */
    @Valid
    private Fetch fetch = new Fetch();

    /**
     * Upper bound of one fetch attempt. Exceeding it counts as a transient failure.
     */
    @NotNull
    private Duration defaultTimeout = Duration.ofSeconds(30);

    /**
     * Ceiling of a per-request timeout override. Longer requested timeouts are clamped to it.
     */
    @NotNull
    private Duration maxTimeout = Duration.ofMinutes(2);

    /**
     * Additional attempts after the first failed fetch.
     */
    @Min(0)
    private int maxRetries = 3;

    /**
     * Whether scrapes wait for per-source rate limit capacity.
     */
    private boolean respectRateLimit = true;

    @Valid
    private Backoff retry = new Backoff();

    @Valid
    private RateLimit rateLimit = new RateLimit();

    @Valid
    private Batch batch = new Batch();

    @Valid
    private Extraction extraction = new Extraction();

    /**
     * Map of source identifiers to their {@link SourceCfg}, preserving insertion order.
     * The order is the match order of the URL classifier.
     */
    private final Map<String, SourceCfg> sources = new LinkedHashMap<>();

    /**
     * Longest timeout a single fetch attempt may be given, default or overridden.
     * The HTTP client's response timeout has to stay above it.
     */
    public Duration longestAttemptTimeout() {
        return maxTimeout.compareTo(defaultTimeout) > 0 ? maxTimeout : defaultTimeout;
    }

    @Data
    public static class Fetch {

        /** Credential of the fetch service */
        private String apiKey;

        /** Root URL of the fetch service */
        private String baseUrl = "https://api.firecrawl.dev";

        /** Default wait for dynamic content */
        private Duration waitFor = Duration.ofSeconds(2);

        /** Formats requested when the caller does not ask for specific ones */
        private List<String> formats = new ArrayList<>(List.of("markdown", "html"));
    }

    @Data
    public static class Backoff {

        /** Delay before the first retry */
        private Duration initialBackoff = Duration.ofMillis(500);

        /** Growth factor between consecutive retries */
        private double multiplier = 2.0;

        /** Randomisation factor applied to each delay, 0 disables jitter */
        private double jitter = 0.5;

        /** Ceiling of a single delay */
        private Duration maxBackoff = Duration.ofSeconds(10);
    }

    @Data
    public static class RateLimit {

        /** Permits handed out per refresh window; the window is sized so the hourly quota holds */
        @Min(1)
        private int burst = 5;

        /** Longest a scrape waits for capacity before failing */
        private Duration maxWait = Duration.ofMinutes(5);
    }

    @Data
    public static class Batch {

        /** Worker pool size of batch scrapes */
        @Min(1)
        private int concurrency = 3;
    }

    @Data
    public static class Extraction {

        @Min(1)
        private int maxFeatures = 20;

        @Min(1)
        private int maxImages = 10;
    }
}
