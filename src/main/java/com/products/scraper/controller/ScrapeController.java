package com.products.scraper.controller;

import com.products.scraper.dto.BatchScrapeRequest;
import com.products.scraper.model.ScrapingRequest;
import com.products.scraper.model.ScrapingResult;
import com.products.scraper.model.ScrapingStats;
import com.products.scraper.service.core.ProductScrapingService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

/**
 * REST controller exposing product scraping.
 * <p>
 * Endpoints:
 * <ul>
 *   <li><code>POST /api/scrape</code>: scrape one listing</li>
 *   <li><code>POST /api/scrape/batch</code>: scrape up to 100 listings, answered in input order</li>
 *   <li><code>GET /api/scrape/stats</code>: usage counters</li>
 *   <li><code>DELETE /api/scrape/stats</code>: reset the counters</li>
 * </ul>
 * </p>
 *
 * <h3>Example Request</h3>
 * <pre>{@code
 * POST /api/scrape
 * Content-Type: application/json
 *
 * {
 *   "url": "https://www.etsy.com/listing/123/planner-template",
 *   "options": { "includeImages": true, "extractContent": false },
 *   "priority": "normal"
 * }
 * }</pre>
 *
 * <h3>Example Response</h3>
 * <pre>{@code
 * {
 *   "success": true,
 *   "data": {
 *     "title": "Digital Planner Template",
 *     "source": "Etsy",
 *     "pricing": { "amount": 29.99, "currency": "USD", "type": "one-time" },
 *     ...
 *   },
 *   "metadata": { "requestId": "scrape_...", "durationMs": 812, "retryCount": 0, ... }
 * }
 * }</pre>
 *
 * <p>A failed scrape is still answered with HTTP 200 and {@code success:false}; only
 * malformed request bodies yield 400.</p>
 */
@Slf4j
@Validated
@RestController
@RequestMapping("/api/scrape")
@RequiredArgsConstructor
public class ScrapeController {

    private final ProductScrapingService scrapingService;

    /**
     * Scrapes a single listing.
     *
     * @param request URL plus optional switches
     * @return the tagged result
     */
    @PostMapping(consumes = MediaType.APPLICATION_JSON_VALUE,
            produces = MediaType.APPLICATION_JSON_VALUE)
    public ScrapingResult scrape(@RequestBody final ScrapingRequest request) {
        return scrapingService.scrapeProduct(request);
    }

    /**
     * Scrapes a batch of listings with bounded concurrency.
     *
     * @param batch between 1 and 100 requests
     * @return one result per request, same order
     */
    @PostMapping(path = "/batch",
            consumes = MediaType.APPLICATION_JSON_VALUE,
            produces = MediaType.APPLICATION_JSON_VALUE)
    public List<ScrapingResult> scrapeBatch(@Valid @RequestBody final BatchScrapeRequest batch) {
        return scrapingService.scrapeMultipleProducts(batch.requests());
    }

    @GetMapping(path = "/stats", produces = MediaType.APPLICATION_JSON_VALUE)
    public ScrapingStats stats() {
        return scrapingService.getStats();
    }

    @DeleteMapping("/stats")
    public ResponseEntity<Void> resetStats() {
        scrapingService.resetStats();
        return ResponseEntity.noContent().build();
    }

    /**
     * Handles invalid arguments thrown during request processing.
     *
     * @param ex the exception containing the error details
     * @return a {@link ResponseEntity} with HTTP 400 and a JSON body {"error": "..."}
     */
    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, String>> handleBadRequest(final IllegalArgumentException ex) {
        log.warn("Bad request: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(Map.of("error", String.valueOf(ex.getMessage())));
    }
}
