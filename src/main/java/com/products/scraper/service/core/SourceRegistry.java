package com.products.scraper.service.core;

import com.products.scraper.config.ScraperProperties;
import com.products.scraper.config.SourceCfg;
import com.products.scraper.model.SourceDescriptor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Read-only table of recognised marketplaces, built once at startup.
 * Iteration order is the configuration order and doubles as match priority.
 */
@Slf4j
@Component
public class SourceRegistry {

    private final Map<String, SourceDescriptor> byId;

    @Autowired
    public SourceRegistry(final ScraperProperties props) {
        this(fromConfig(props.getSources()));
        log.info("Registered {} scraping sources: {}", byId.size(), byId.keySet());
    }

    public SourceRegistry(final Collection<SourceDescriptor> descriptors) {
        Map<String, SourceDescriptor> map = new LinkedHashMap<>();
        for (SourceDescriptor d : descriptors) {
            if (map.putIfAbsent(d.id(), d) != null) {
                throw new IllegalArgumentException("Duplicate source id " + d.id());
            }
        }
        this.byId = Collections.unmodifiableMap(map);
    }

    /**
     * First source whose domain patterns match the host, in registry order.
     *
     * @param host host name of a parsed URL, any case
     * @return the matching source, empty when the host is unknown
     */
    public Optional<SourceDescriptor> findByHost(final String host) {
        if (host == null || host.isBlank()) {
            return Optional.empty();
        }
        String normalized = host.toLowerCase(Locale.ROOT);
        for (SourceDescriptor d : byId.values()) {
            if (d.matchesHost(normalized)) {
                return Optional.of(d);
            }
        }
        return Optional.empty();
    }

    public Optional<SourceDescriptor> find(final String id) {
        return Optional.ofNullable(byId.get(id));
    }

    /**
     * Sources tagged with the given category, e.g. {@code courses}.
     */
    public List<SourceDescriptor> findByCategory(final String category) {
        String wanted = category.toLowerCase(Locale.ROOT);
        return byId.values().stream()
                .filter(d -> d.categories().stream().anyMatch(c -> c.equalsIgnoreCase(wanted)))
                .toList();
    }

    /** The whole table; the returned map is unmodifiable. */
    public Map<String, SourceDescriptor> all() {
        return byId;
    }

    private static List<SourceDescriptor> fromConfig(final Map<String, SourceCfg> sources) {
        return sources.entrySet().stream()
                .map(e -> toDescriptor(e.getKey(), e.getValue()))
                .toList();
    }

    static SourceDescriptor toDescriptor(final String id, final SourceCfg cfg) {
        if (cfg.getDomains().isEmpty()) {
            throw new IllegalArgumentException("Source <scraper.sources." + id + "> declares no domains");
        }
        if (cfg.getRequestsPerHour() <= 0) {
            throw new IllegalArgumentException("Source <scraper.sources." + id + "> needs a positive requests-per-hour");
        }
        SourceCfg.FetchHints hints = cfg.getFetch();
        Duration waitFor = hints.getWaitFor();
        return SourceDescriptor.builder()
                .id(id)
                .displayName(cfg.getDisplayName() == null ? id : cfg.getDisplayName())
                .domainPatterns(cfg.getDomains())
                .categories(cfg.getCategories())
                .requestsPerHour(cfg.getRequestsPerHour())
                .selectors(cfg.getSelectors())
                .fetchHints(new SourceDescriptor.FetchHints(
                        waitFor == null ? null : waitFor.toMillis(),
                        hints.getHeaders(),
                        hints.getExcludeTags()))
                .build();
    }
}
