package com.products.scraper.service.core;

import com.products.scraper.config.ScraperProperties;
import com.products.scraper.exception.FailureReason;
import com.products.scraper.exception.ScrapingException;
import com.products.scraper.model.SourceDescriptor;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import io.github.resilience4j.ratelimiter.RateLimiterRegistry;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * Paces fetches per source with one Resilience4j {@link RateLimiter} per source id.
 * <p>
 * Each limiter hands out {@code burst} permits per window, the window being sized so the
 * source's hourly quota holds. A scrape waits for its own source only; other sources are
 * never blocked.
 * </p>
 */
@Slf4j
public class DomainRateLimiter {

    private static final Duration HOUR = Duration.ofHours(1);

    private final RateLimiterRegistry registry;

    private final int burst;

    private final Duration maxWait;

    public DomainRateLimiter(final RateLimiterRegistry registry, final ScraperProperties.RateLimit settings) {
        this.registry = registry;
        this.burst = Math.max(1, settings.getBurst());
        this.maxWait = settings.getMaxWait();
    }

    /**
     * Takes one permit for the source, suspending the caller while its bucket is empty.
     *
     * @param source the classified source
     * @return whether the caller had to wait
     * @throws ScrapingException with {@link FailureReason#RATE_LIMITED} when no permit frees up
     *                           within the maximum wait, or the wait is interrupted
     */
    public boolean acquire(final SourceDescriptor source) {
        RateLimiter limiter = limiterFor(source);
        long waitNanos = limiter.reservePermission();
        if (waitNanos < 0) {
            throw new ScrapingException(FailureReason.RATE_LIMITED,
                    "Rate limit exceeded for " + source.id() + ". Please try again later.");
        }
        if (waitNanos == 0) {
            return false;
        }
        log.warn("Rate limit reached for {}, waiting {} ms", source.id(), TimeUnit.NANOSECONDS.toMillis(waitNanos));
        try {
            TimeUnit.NANOSECONDS.sleep(waitNanos);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new ScrapingException(FailureReason.RATE_LIMITED,
                    "Rate limit exceeded for " + source.id() + ". Wait interrupted.", ex);
        }
        return true;
    }

    /**
     * @return permits currently left in the source's bucket
     */
    public long remaining(final SourceDescriptor source) {
        return Math.max(0, limiterFor(source).getMetrics().getAvailablePermissions());
    }

    RateLimiter limiterFor(final SourceDescriptor source) {
        return registry.rateLimiter(source.id(), () -> configFor(source));
    }

    RateLimiterConfig configFor(final SourceDescriptor source) {
        int permits = Math.min(burst, source.requestsPerHour());
        Duration window = HOUR.multipliedBy(permits).dividedBy(source.requestsPerHour());
        return RateLimiterConfig.custom()
                .limitForPeriod(permits)
                .limitRefreshPeriod(window)
                .timeoutDuration(maxWait)
                .build();
    }
}
