package com.products.scraper.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.products.scraper.ai.ProductInsightHelper;
import com.products.scraper.service.core.FetchAdapter;
import com.products.scraper.service.core.ProductExtractionEngine;
import com.products.scraper.service.core.ProductScrapingAgent;
import com.products.scraper.service.core.SourceRegistry;
import io.github.resilience4j.ratelimiter.RateLimiterRegistry;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the {@link ProductScrapingAgent} from the fetch adapter, source table, extraction
 * engine and scraper settings. The agent's attempt executor is shut down with the context.
 */
@Configuration
public class ScrapingAgentConfiguration {

    @Bean(destroyMethod = "close")
    public ProductScrapingAgent productScrapingAgent(final FetchAdapter fetchAdapter,
                                                     final SourceRegistry registry,
                                                     final ProductExtractionEngine engine,
                                                     final ProductInsightHelper insightHelper,
                                                     final RateLimiterRegistry rateLimiterRegistry,
                                                     @Qualifier("scraperObjectMapper") final ObjectMapper mapper,
                                                     final ScraperProperties props) {
        return new ProductScrapingAgent(fetchAdapter, registry, engine, insightHelper,
                rateLimiterRegistry, mapper, props);
    }
}
