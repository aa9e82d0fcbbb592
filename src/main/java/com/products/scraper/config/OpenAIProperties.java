package com.products.scraper.config;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import org.apache.commons.lang3.StringUtils;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the optional OpenAI product insight enrichment.
 *
 * <p>Values are bound from properties prefixed with {@code openai.api} in your
 * Spring environment (e.g. application.yml or .env).</p>
 *
 * <p>Example application.yml snippet:
 * <pre>
 * openai:
 *   api:
 *     enabled: true
 *     key: ${OPENAI_API_KEY}
 *     default-model: gpt-4o-mini
 * </pre>
 * </p>
 */
@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "openai.api")
public class OpenAIProperties {

    /**
     * Master switch. Enrichment also stays off while no key is configured.
     */
    private boolean enabled;

    /**
     * API key for the LLM service.
     * <pre>
     * export OPENAI_API_KEY=your-key-here
     * </pre>
     */
    private String key;

    /** The base URL for OpenAI API calls. */
    @NotBlank
    private String baseUrl = "https://api.openai.com/v1";

    /**
     * The model used for chat/completions.
     */
    @NotBlank
    private String defaultModel = "gpt-4o-mini";

    /**
     * @return {@code true} when enrichment is switched on and a key is present
     */
    public boolean isUsable() {
        return enabled && StringUtils.isNotBlank(key);
    }
}
