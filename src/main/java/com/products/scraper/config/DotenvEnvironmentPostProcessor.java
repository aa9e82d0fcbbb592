package com.products.scraper.config;

import io.github.cdimascio.dotenv.Dotenv;
import io.github.cdimascio.dotenv.DotenvEntry;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.env.EnvironmentPostProcessor;
import org.springframework.core.Ordered;
import org.springframework.core.env.ConfigurableEnvironment;
import org.springframework.core.env.MapPropertySource;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Loads a `.env` file from the working directory and adds the scraper related entries
 * as a high-priority property source so that `${FIRECRAWL_API_KEY}` and
 * `${OPENAI_API_KEY}` resolve without exporting them.
 */
public class DotenvEnvironmentPostProcessor
        implements EnvironmentPostProcessor, Ordered {

    static final String PROPERTY_SOURCE_NAME = "scraperDotenv";

    /** only these keys are lifted out of the file */
    static final List<String> ACCEPTED_PREFIXES = List.of("FIRECRAWL_", "OPENAI_", "SCRAPER_");

    @Override
    public int getOrder() {
        return Ordered.HIGHEST_PRECEDENCE;
    }

    @Override
    public void postProcessEnvironment(ConfigurableEnvironment env,
                                       SpringApplication application) {
        Dotenv dotenv = Dotenv.configure()
                .filename(".env")
                .ignoreIfMissing()
                .load();

        Map<String, Object> accepted = filter(dotenv.entries(Dotenv.Filter.DECLARED_IN_ENV_FILE));
        if (accepted.isEmpty()) {
            return;
        }
        env.getPropertySources()
                .addFirst(new MapPropertySource(PROPERTY_SOURCE_NAME, accepted));
    }

    static Map<String, Object> filter(Iterable<DotenvEntry> entries) {
        Map<String, Object> map = new HashMap<>();
        for (DotenvEntry e : entries) {
            if (ACCEPTED_PREFIXES.stream().anyMatch(e.getKey()::startsWith)) {
                map.put(e.getKey(), e.getValue());
            }
        }
        return map;
    }
}
