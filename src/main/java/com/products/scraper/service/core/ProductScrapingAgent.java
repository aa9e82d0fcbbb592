package com.products.scraper.service.core;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.products.scraper.ai.ProductInsightHelper;
import com.products.scraper.config.ScraperProperties;
import com.products.scraper.exception.InvalidScrapeInputException;
import com.products.scraper.exception.ScrapingException;
import com.products.scraper.model.ProductExtract;
import com.products.scraper.model.ProductInsights;
import com.products.scraper.model.ProductMetadata;
import com.products.scraper.model.RequestPriority;
import com.products.scraper.model.ResultMetadata;
import com.products.scraper.model.ScrapingOptions;
import com.products.scraper.model.ScrapingRequest;
import com.products.scraper.model.ScrapingResult;
import com.products.scraper.model.ScrapingStats;
import com.products.scraper.model.SourceDescriptor;
import io.github.resilience4j.ratelimiter.RateLimiterRegistry;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * <h2>ProductScrapingAgent</h2>
 *
 * <p>Runs the per-request pipeline:</p>
 * <ol>
 *   <li>classify the URL against the {@link SourceRegistry},</li>
 *   <li>wait for the source's rate limit capacity when pacing is on,</li>
 *   <li>fetch through the {@link RetryingFetcher},</li>
 *   <li>extract the product with the {@link ProductExtractionEngine} and optionally enrich it.</li>
 * </ol>
 *
 * <p>Failures at any step become a failed {@link ScrapingResult}; counters are updated once
 * per completed request. Closing the agent stops its attempt executor.</p>
 */
@Slf4j
public class ProductScrapingAgent implements ProductScrapingService, AutoCloseable {

    static final String UNEXPECTED = "UNEXPECTED";

    private final SourceRegistry registry;

    private final UrlClassifier classifier;

    private final ProductExtractionEngine engine;

    private final ProductInsightHelper insightHelper;

    private final ObjectMapper mapper;

    private final ScraperProperties props;

    private final ExecutorService attemptExecutor;

    private final RetryingFetcher fetcher;

    private final DomainRateLimiter rateLimiter;

    private final BatchScrapeOrchestrator batch;

    private final ScrapingStatsTracker stats = new ScrapingStatsTracker();

    /**
     * @param fetchAdapter       the fetch capability
     * @param registry           source table
     * @param engine             product extraction
     * @param insightHelper      optional enrichment, may be {@code null}
     * @param rateLimiterRegistry registry holding one limiter per source
     * @param mapper             mapper used to read {@code process} context options
     * @param props              timeouts, retry policy, pacing and batch settings
     */
    public ProductScrapingAgent(final FetchAdapter fetchAdapter,
                                final SourceRegistry registry,
                                final ProductExtractionEngine engine,
                                final ProductInsightHelper insightHelper,
                                final RateLimiterRegistry rateLimiterRegistry,
                                final ObjectMapper mapper,
                                final ScraperProperties props) {
        this.registry = registry;
        this.classifier = new UrlClassifier(registry);
        this.engine = engine;
        this.insightHelper = insightHelper;
        this.mapper = mapper;
        this.props = props;
        this.attemptExecutor = Executors.newCachedThreadPool(daemonThreads("fetch-attempt-"));
        this.fetcher = new RetryingFetcher(fetchAdapter, props.getMaxRetries(), props.getRetry(), attemptExecutor);
        this.rateLimiter = new DomainRateLimiter(rateLimiterRegistry, props.getRateLimit());
        this.batch = new BatchScrapeOrchestrator(props.getBatch().getConcurrency());
        log.info("Scraping agent ready: timeout={} maxRetries={} respectRateLimit={} batchConcurrency={}",
                props.getDefaultTimeout(), props.getMaxRetries(), props.isRespectRateLimit(),
                props.getBatch().getConcurrency());
    }

    @Override
    public ScrapingResult scrapeProduct(final ScrapingRequest request) {
        String requestId = "scrape_" + UUID.randomUUID();
        long start = System.nanoTime();
        SourceDescriptor source = null;
        int attempts = 0;
        try {
            if (request == null) {
                throw ScrapingException.invalidUrl();
            }
            source = classifier.classify(request.url());
            ScrapingOptions options = request.options();

            if (rateLimitWanted(options) && rateLimiter.acquire(source)) {
                stats.recordRateLimitHit();
            }

            RetryingFetcher.Outcome outcome = fetcher.fetch(request.url(), fetchOptions(source, options),
                    attemptTimeout(options));
            attempts = outcome.attempts();

            ProductExtract product = engine.extract(outcome.response().data(), source, request.url(), options);
            product = enrich(product, options);

            long durationMs = elapsedMs(start);
            stats.recordSuccess(source.id(), durationMs);
            log.info("Scraped {} from {} in {} ms ({} attempt(s))", request.url(), source.id(), durationMs, attempts);
            return ScrapingResult.success(product,
                    new ResultMetadata(requestId, durationMs, attempts - 1, rateLimiter.remaining(source)));
        } catch (ScrapingException ex) {
            if (ex instanceof RetryingFetcher.AttemptsExhaustedException exhausted) {
                attempts = exhausted.getAttempts();
            }
            return failed(requestId, request, source, ex.getReason().name(), ex.getMessage(), start, attempts);
        } catch (RuntimeException ex) {
            log.error("Unexpected failure scraping {}", request == null ? null : request.url(), ex);
            String message = ex.getMessage() == null ? ex.getClass().getSimpleName() : ex.getMessage();
            return failed(requestId, request, source, UNEXPECTED, message, start, attempts);
        }
    }

    @Override
    public List<ScrapingResult> scrapeMultipleProducts(final List<ScrapingRequest> requests) {
        return batch.run(requests, this::scrapeProduct);
    }

    @Override
    public ScrapingStats getStats() {
        return stats.snapshot();
    }

    @Override
    public void resetStats() {
        stats.reset();
        log.info("Scraping stats reset");
    }

    @Override
    public boolean isUrlSupported(final String url) {
        return classifier.isSupported(url);
    }

    @Override
    public Optional<SourceDescriptor> resolveSource(final String url) {
        return classifier.parseHost(url).flatMap(registry::findByHost);
    }

    @Override
    public Map<String, SourceDescriptor> getSupportedSources() {
        return registry.all();
    }

    @Override
    public List<SourceDescriptor> getSourcesByCategory(final String category) {
        if (category == null || category.isBlank()) {
            return List.of();
        }
        return registry.findByCategory(category);
    }

    @Override
    public ScrapingResult process(final Object input, final Map<String, ?> context) {
        if (!(input instanceof String url)) {
            throw new InvalidScrapeInputException(input);
        }
        Map<String, ?> ctx = context == null ? Map.of() : context;
        return scrapeProduct(new ScrapingRequest(url, toOptions(ctx.get("options")), toPriority(ctx.get("priority"))));
    }

    @Override
    public void close() {
        attemptExecutor.shutdownNow();
        try {
            if (!attemptExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("Fetch attempt executor did not terminate in time");
            }
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
        }
    }

    private ScrapingResult failed(final String requestId,
                                  final ScrapingRequest request,
                                  final SourceDescriptor source,
                                  final String errorType,
                                  final String message,
                                  final long start,
                                  final int attempts) {
        long durationMs = elapsedMs(start);
        stats.recordFailure(source == null ? null : source.id(), errorType, durationMs);
        log.info("Scrape of {} failed after {} ms: {}", request == null ? null : request.url(), durationMs, message);
        return ScrapingResult.failure(message, new ResultMetadata(requestId, durationMs,
                Math.max(0, attempts - 1), source == null ? -1L : rateLimiter.remaining(source)));
    }

    private boolean rateLimitWanted(final ScrapingOptions options) {
        return options.respectRateLimit() == null ? props.isRespectRateLimit() : options.respectRateLimit();
    }

    private Duration attemptTimeout(final ScrapingOptions options) {
        if (options.timeoutMs() == null || options.timeoutMs() <= 0) {
            return props.getDefaultTimeout();
        }
        Duration requested = Duration.ofMillis(options.timeoutMs());
        Duration ceiling = props.longestAttemptTimeout();
        return requested.compareTo(ceiling) > 0 ? ceiling : requested;
    }

    FetchOptions fetchOptions(final SourceDescriptor source, final ScrapingOptions options) {
        SourceDescriptor.FetchHints hints = source.fetchHints();
        List<String> formats = options.formats() == null || options.formats().isEmpty()
                ? props.getFetch().getFormats()
                : options.formats();
        return FetchOptions.builder()
                .formats(formats)
                .onlyMainContent(true)
                .timeout(attemptTimeout(options))
                .waitFor(hints.waitForMs() == null ? props.getFetch().getWaitFor() : Duration.ofMillis(hints.waitForMs()))
                .headers(hints.headers())
                .excludeTags(hints.excludeTags())
                .build();
    }

    private ProductExtract enrich(final ProductExtract product, final ScrapingOptions options) {
        if (!options.contentWanted() || insightHelper == null || !insightHelper.isEnabled()) {
            return product;
        }
        Optional<ProductInsights> found = insightHelper.insightsFor(product);
        if (found.isEmpty()) {
            return product;
        }
        ProductInsights insights = found.get();
        ProductExtract.ProductExtractBuilder builder = product.toBuilder().insights(insights);
        if (insights.category() != null && !insights.category().isBlank()) {
            builder.category(insights.category());
        }
        if (product.metadata() != null && !insights.tags().isEmpty()) {
            Set<String> merged = new LinkedHashSet<>(product.metadata().tags() == null
                    ? List.of() : product.metadata().tags());
            merged.addAll(insights.tags());
            ProductMetadata metadata = product.metadata().withTags(List.copyOf(merged));
            builder.metadata(metadata);
        }
        return builder.build();
    }

    private ScrapingOptions toOptions(final Object raw) {
        if (raw == null) {
            return null;
        }
        if (raw instanceof ScrapingOptions options) {
            return options;
        }
        try {
            return mapper.convertValue(raw, ScrapingOptions.class);
        } catch (IllegalArgumentException ex) {
            throw new InvalidScrapeInputException("Invalid input: unreadable options in context", ex);
        }
    }

    private static RequestPriority toPriority(final Object raw) {
        if (raw == null) {
            return RequestPriority.NORMAL;
        }
        if (raw instanceof RequestPriority priority) {
            return priority;
        }
        try {
            return RequestPriority.fromValue(raw.toString());
        } catch (IllegalArgumentException ex) {
            throw new InvalidScrapeInputException("Invalid input: unknown priority " + raw, ex);
        }
    }

    private static long elapsedMs(final long startNanos) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
    }

    private static ThreadFactory daemonThreads(final String prefix) {
        AtomicInteger seq = new AtomicInteger();
        return runnable -> {
            Thread t = new Thread(runnable, prefix + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
