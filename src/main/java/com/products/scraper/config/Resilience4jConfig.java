package com.products.scraper.config;

import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.github.resilience4j.ratelimiter.RateLimiterRegistry;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryRegistry;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * <h2>Resilience4j Configuration</h2>
 *
 * <p>
 * Exposes the Resilience4j registries used by the scraping pipeline: per-source rate
 * limiters for fetch pacing, plus the retry and circuit breaker guarding the optional
 * product insight lookups. The fetch retry policy is built per agent from
 * {@link ScraperProperties}, since its attempt count is a construction parameter.
 * </p>
 */
@Configuration
public class Resilience4jConfig {

    /**
     * Name of the retry and circuit breaker instances guarding LLM insight calls.
     */
    public static final String INSIGHT_LOOKUP = "productInsightLookup";

    /**
     * Creates the global {@link RetryRegistry} which holds all configured
     * {@link Retry} instances.
     *
     * @return a registry pre‐populated with default retry configuration
     */
    @Bean
    public RetryRegistry retryRegistry() {
        return RetryRegistry.ofDefaults();
    }

    /**
     * Creates the global {@link CircuitBreakerRegistry} which holds all
     * configured {@link CircuitBreaker} instances.
     *
     * @return a registry pre‐populated with default circuit‐breaker configuration
     */
    @Bean
    public CircuitBreakerRegistry circuitBreakerRegistry() {
        return CircuitBreakerRegistry.ofDefaults();
    }

    /**
     * Registry of per-source rate limiters. Instances are created lazily by the
     * domain rate limiter with a configuration derived from each source's quota.
     *
     * @return an empty registry with default configuration
     */
    @Bean
    public RateLimiterRegistry rateLimiterRegistry() {
        return RateLimiterRegistry.ofDefaults();
    }

    /**
     * Named {@link Retry} policy for product insight lookups.
     *
     * @param registry the global {@link RetryRegistry} to pull from
     * @return a {@link Retry} configured under the name {@value #INSIGHT_LOOKUP}
     */
    @Bean
    public Retry insightRetry(final RetryRegistry registry) {
        return registry.retry(INSIGHT_LOOKUP);
    }

    /**
     * Named {@link CircuitBreaker} for product insight lookups.
     * <p>
     * When too many LLM calls fail the breaker opens and scrapes skip enrichment
     * until the failure rate improves.
     * </p>
     *
     * @param registry the global {@link CircuitBreakerRegistry} to pull from
     * @return a {@link CircuitBreaker} configured under the name {@value #INSIGHT_LOOKUP}
     */
    @Bean
    public CircuitBreaker insightCircuitBreaker(final CircuitBreakerRegistry registry) {
        return registry.circuitBreaker(INSIGHT_LOOKUP);
    }

}
