package com.products.scraper.config;

import io.github.cdimascio.dotenv.DotenvEntry;
import org.junit.jupiter.api.Test;
import org.springframework.core.Ordered;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class DotenvEnvironmentPostProcessorTest {

    @Test
    void shouldKeepOnlyScraperRelatedKeys() {
        List<DotenvEntry> entries = List.of(
                new DotenvEntry("FIRECRAWL_API_KEY", "fc-123"),
                new DotenvEntry("OPENAI_API_KEY", "sk-456"),
                new DotenvEntry("SCRAPER_MAX_RETRIES", "5"),
                new DotenvEntry("DATABASE_PASSWORD", "secret"),
                new DotenvEntry("PATH", "/usr/bin"));

        Map<String, Object> accepted = DotenvEnvironmentPostProcessor.filter(entries);

        assertEquals(Map.of(
                "FIRECRAWL_API_KEY", "fc-123",
                "OPENAI_API_KEY", "sk-456",
                "SCRAPER_MAX_RETRIES", "5"), accepted);
    }

    @Test
    void shouldRunBeforeOtherPostProcessors() {
        assertEquals(Ordered.HIGHEST_PRECEDENCE, new DotenvEnvironmentPostProcessor().getOrder());
    }
}
