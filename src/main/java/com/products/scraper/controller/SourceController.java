package com.products.scraper.controller;

import com.products.scraper.dto.UrlSupportResponse;
import com.products.scraper.model.SourceDescriptor;
import com.products.scraper.service.core.ProductScrapingService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.Collection;

/**
 * Read-only view of the source table.
 * <p>
 * <code>GET /api/sources</code> lists every source, <code>GET /api/sources?category=courses</code>
 * only those tagged with the category, and <code>GET /api/sources/supported?url=...</code>
 * tells whether a URL can be scraped.
 * </p>
 */
@RestController
@RequestMapping(path = "/api/sources", produces = MediaType.APPLICATION_JSON_VALUE)
@RequiredArgsConstructor
public class SourceController {

    private final ProductScrapingService scrapingService;

    @GetMapping
    public Collection<SourceDescriptor> sources(@RequestParam(name = "category", required = false)
                                                final String category) {
        if (category == null || category.isBlank()) {
            return scrapingService.getSupportedSources().values();
        }
        return scrapingService.getSourcesByCategory(category);
    }

    @GetMapping("/supported")
    public UrlSupportResponse supported(@RequestParam("url") final String url) {
        return scrapingService.resolveSource(url)
                .map(source -> new UrlSupportResponse(url, true, source.displayName()))
                .orElseGet(() -> new UrlSupportResponse(url, false, null));
    }
}
