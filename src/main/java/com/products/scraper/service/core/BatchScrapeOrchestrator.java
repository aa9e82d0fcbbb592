package com.products.scraper.service.core;

import com.products.scraper.model.ResultMetadata;
import com.products.scraper.model.ScrapingError;
import com.products.scraper.model.ScrapingRequest;
import com.products.scraper.model.ScrapingResult;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Function;

/**
 * Runs many scrapes with at most {@code concurrency} in flight.
 * <p>
 * Results come back in input order whatever the completion order, and an item that throws
 * becomes a {@code BATCH_SCRAPING_FAILED} result instead of aborting its siblings.
 * </p>
 */
@Slf4j
public class BatchScrapeOrchestrator {

    private final int concurrency;

    public BatchScrapeOrchestrator(final int concurrency) {
        if (concurrency < 1) {
            throw new IllegalArgumentException("concurrency must be >= 1");
        }
        this.concurrency = concurrency;
    }

    /**
     * @param requests items of the batch, may be empty; a {@code null} item is handed to {@code scrape} as is
     * @param scrape   the single-item pipeline
     * @return one result per request, same order
     */
    public List<ScrapingResult> run(final List<ScrapingRequest> requests,
                                    final Function<ScrapingRequest, ScrapingResult> scrape) {
        if (requests == null || requests.isEmpty()) {
            return List.of();
        }
        log.info("Starting batch of {} request(s) with concurrency {}", requests.size(), concurrency);
        // Reactor rejects null elements, so items travel wrapped
        List<Optional<ScrapingRequest>> items = requests.stream().map(Optional::ofNullable).toList();
        List<ScrapingResult> results = Flux.fromIterable(items)
                .flatMapSequential(item -> Mono.fromCallable(() -> scrape.apply(item.orElse(null)))
                        .subscribeOn(Schedulers.boundedElastic())
                        .switchIfEmpty(Mono.fromSupplier(
                                () -> itemFailed(item.orElse(null), new IllegalStateException("No result produced"))))
                        .onErrorResume(ex -> Mono.just(itemFailed(item.orElse(null), ex))),
                        concurrency)
                .collectList()
                .block();
        return results == null ? List.of() : results;
    }

    private static ScrapingResult itemFailed(final ScrapingRequest request, final Throwable ex) {
        log.warn("Batch item {} failed unexpectedly: {}", request == null ? null : request.url(), ex.toString());
        String message = ex.getMessage() == null ? "Unknown error" : ex.getMessage();
        return ScrapingResult.failure(ScrapingError.BATCH_SCRAPING_FAILED, message,
                ResultMetadata.none("batch_" + UUID.randomUUID()));
    }
}
