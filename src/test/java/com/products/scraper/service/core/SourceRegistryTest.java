package com.products.scraper.service.core;

import com.products.scraper.config.ScraperProperties;
import com.products.scraper.config.SourceCfg;
import com.products.scraper.model.SourceDescriptor;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class SourceRegistryTest {

    private SourceRegistry registry;

    @BeforeEach
    void setUp() {
        registry = TestSources.registry();
    }

    // ===== Host matching =====

    @Test
    void shouldMatchExactDomainAndSubdomains() {
        assertEquals("etsy", registry.findByHost("etsy.com").orElseThrow().id());
        assertEquals("etsy", registry.findByHost("www.etsy.com").orElseThrow().id());
        assertEquals("gumroad", registry.findByHost("creator.gumroad.com").orElseThrow().id());
    }

    @Test
    void shouldMatchCaseInsensitively() {
        assertTrue(registry.findByHost("WWW.ETSY.COM").isPresent());
    }

    @Test
    void shouldNotMatchLookalikeHosts() {
        assertTrue(registry.findByHost("notetsy.com").isEmpty());
        assertTrue(registry.findByHost("etsy.com.evil.org").isEmpty());
        assertTrue(registry.findByHost("shopify.com").isEmpty());
    }

    @Test
    void shouldPreferFirstRegisteredMatch() {
        SourceDescriptor broad = SourceDescriptor.builder()
                .id("broad").displayName("Broad").domainPatterns(List.of("example.com")).requestsPerHour(10).build();
        SourceDescriptor narrow = SourceDescriptor.builder()
                .id("narrow").displayName("Narrow").domainPatterns(List.of("shop.example.com")).requestsPerHour(10).build();

        SourceRegistry ordered = new SourceRegistry(List.of(broad, narrow));

        assertEquals("broad", ordered.findByHost("shop.example.com").orElseThrow().id());
    }

    // ===== Table =====

    @Test
    void shouldExposeReadOnlyTable() {
        Map<String, SourceDescriptor> all = registry.all();

        assertEquals(List.of("etsy", "gumroad", "shopify"), List.copyOf(all.keySet()));
        assertThrows(UnsupportedOperationException.class, () -> all.remove("etsy"));
    }

    @Test
    void shouldRejectDuplicateIds() {
        assertThrows(IllegalArgumentException.class,
                () -> new SourceRegistry(List.of(TestSources.ETSY, TestSources.ETSY)));
    }

    @Test
    void shouldFindByCategoryIgnoringCase() {
        assertEquals(List.of(TestSources.GUMROAD), registry.findByCategory("COURSES"));
        assertTrue(registry.findByCategory("nft").isEmpty());
    }

    // ===== Configuration =====

    @Test
    void shouldBuildDescriptorsFromProperties() {
        SourceCfg cfg = new SourceCfg();
        cfg.setDisplayName("Udemy");
        cfg.setDomains(List.of("Udemy.com"));
        cfg.setCategories(List.of("courses"));
        cfg.setRequestsPerHour(100);
        cfg.getFetch().setWaitFor(Duration.ofSeconds(3));
        cfg.getFetch().setExcludeTags(List.of("script", "nav"));
        ScraperProperties props = new ScraperProperties();
        props.getSources().put("udemy", cfg);

        SourceRegistry fromConfig = new SourceRegistry(props);
        SourceDescriptor udemy = fromConfig.find("udemy").orElseThrow();

        assertEquals("Udemy", udemy.displayName());
        assertEquals(List.of("udemy.com"), udemy.domainPatterns());
        assertEquals(3000L, udemy.fetchHints().waitForMs());
        assertEquals(List.of("script", "nav"), udemy.fetchHints().excludeTags());
        assertEquals("courses", udemy.defaultCategory());
    }

    @Test
    void shouldRejectSourceWithoutDomains() {
        SourceCfg cfg = new SourceCfg();

        assertThrows(IllegalArgumentException.class, () -> SourceRegistry.toDescriptor("empty", cfg));
    }

    @Test
    void shouldRejectNonPositiveQuota() {
        SourceCfg cfg = new SourceCfg();
        cfg.setDomains(List.of("example.com"));
        cfg.setRequestsPerHour(0);

        assertThrows(IllegalArgumentException.class, () -> SourceRegistry.toDescriptor("zero", cfg));
    }
}
