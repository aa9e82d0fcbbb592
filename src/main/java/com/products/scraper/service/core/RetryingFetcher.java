package com.products.scraper.service.core;

import com.products.scraper.config.ScraperProperties;
import com.products.scraper.exception.FailureReason;
import com.products.scraper.exception.ScrapingException;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.timelimiter.TimeLimiter;
import io.github.resilience4j.timelimiter.TimeLimiterConfig;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Wraps a {@link FetchAdapter} call with a per-attempt timeout and bounded retries.
 * <p>
 * A fetch counts as transiently failed when it returns an unusable response, throws, or
 * exceeds the attempt timeout. Delays between attempts grow exponentially with jitter.
 * </p>
 */
@Slf4j
public class RetryingFetcher {

    private final FetchAdapter adapter;

    private final Retry retry;

    private final ExecutorService executor;

    /**
     * @param adapter    the fetch capability
     * @param maxRetries additional attempts after the first
     * @param backoff    delay policy between attempts
     * @param executor   runs each attempt so that it can be timed out
     */
    public RetryingFetcher(final FetchAdapter adapter,
                           final int maxRetries,
                           final ScraperProperties.Backoff backoff,
                           final ExecutorService executor) {
        this.adapter = adapter;
        this.executor = executor;
        this.retry = Retry.of("fetch", RetryConfig.<FetchResponse>custom()
                .maxAttempts(maxRetries + 1)
                .intervalFunction(interval(backoff))
                .retryOnResult(response -> response == null || !response.usable())
                .retryExceptions(Exception.class)
                .build());
        retry.getEventPublisher().onRetry(event -> log.warn("Fetch attempt {} failed, retrying in {} ms: {}",
                event.getNumberOfRetryAttempts(),
                event.getWaitInterval().toMillis(),
                event.getLastThrowable() == null ? "unsuccessful response" : event.getLastThrowable().toString()));
    }

    /**
     * Fetches a URL, retrying transient failures.
     *
     * @param url            target page
     * @param options        fetch options forwarded to the adapter
     * @param attemptTimeout upper bound of a single attempt
     * @return the successful response and the number of attempts it took
     * @throws ScrapingException with {@link FailureReason#FETCH_FAILED} once retries are exhausted
     */
    public Outcome fetch(final String url, final FetchOptions options, final Duration attemptTimeout) {
        AtomicInteger attempts = new AtomicInteger();
        TimeLimiter limiter = TimeLimiter.of(TimeLimiterConfig.custom()
                .timeoutDuration(attemptTimeout)
                .cancelRunningFuture(true)
                .build());

        Callable<FetchResponse> attempt = () -> {
            attempts.incrementAndGet();
            return limiter.executeFutureSupplier(
                    () -> CompletableFuture.supplyAsync(() -> adapter.fetch(url, options), executor));
        };

        FetchResponse response;
        try {
            response = Retry.decorateCallable(retry, attempt).call();
        } catch (TimeoutException ex) {
            throw fetchFailed("Request timed out after " + attemptTimeout.toMillis() + "ms", attempts.get(), ex);
        } catch (Exception ex) {
            throw fetchFailed(rootMessage(ex), attempts.get(), ex);
        }

        if (response == null || !response.usable()) {
            String reason = response == null || response.error() == null ? "Unknown error" : response.error();
            throw fetchFailed(reason, attempts.get(), null);
        }
        return new Outcome(response, attempts.get());
    }

    private static ScrapingException fetchFailed(final String reason, final int attempts, final Throwable cause) {
        log.warn("Fetch gave up after {} attempt(s): {}", attempts, reason);
        return new AttemptsExhaustedException("Fetch service failed: " + reason, attempts, cause);
    }

    private static String rootMessage(final Throwable ex) {
        Throwable t = ex;
        while (t.getCause() != null && t.getCause() != t) {
            t = t.getCause();
        }
        return t.getMessage() == null ? t.getClass().getSimpleName() : t.getMessage();
    }

    private static IntervalFunction interval(final ScraperProperties.Backoff backoff) {
        long initial = Math.max(1L, backoff.getInitialBackoff().toMillis());
        long max = Math.max(initial, backoff.getMaxBackoff().toMillis());
        double multiplier = Math.max(1.0, backoff.getMultiplier());
        if (backoff.getJitter() <= 0) {
            return IntervalFunction.ofExponentialBackoff(initial, multiplier, max);
        }
        double jitter = Math.min(backoff.getJitter(), 0.99);
        return IntervalFunction.ofExponentialRandomBackoff(initial, multiplier, jitter, max);
    }

    /**
     * @param response a usable response
     * @param attempts attempts made, at least 1
     */
    public record Outcome(FetchResponse response, int attempts) {

        public int retries() {
            return attempts - 1;
        }
    }

    /**
     * Terminal fetch failure that still reports how many attempts were made.
     */
    public static class AttemptsExhaustedException extends ScrapingException {

        private final int attempts;

        AttemptsExhaustedException(final String message, final int attempts, final Throwable cause) {
            super(FailureReason.FETCH_FAILED, message, cause);
            this.attempts = attempts;
        }

        public int getAttempts() {
            return attempts;
        }
    }
}
