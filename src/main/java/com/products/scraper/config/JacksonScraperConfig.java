package com.products.scraper.config;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class JacksonScraperConfig {

    /**
     * A dedicated {@link ObjectMapper} for the scraping layer.
     * <p>
     * • Has its own qualifier (<b>scraperObjectMapper</b>) so it never clashes with the
     * mapper Spring Boot auto‑configures for MVC.<br>
     * • Tolerates the extra fields the fetch service and the LLM add to their payloads.
     *
     * @return ObjectMapper for scraper
     */
    @Bean
    @Qualifier("scraperObjectMapper")
    public ObjectMapper scraperObjectMapper() {
        return create();
    }

    /**
     * Builds the scraper mapper outside of a Spring context, e.g. for tests.
     *
     * @return a newly configured mapper
     */
    public static ObjectMapper create() {
        ObjectMapper mapper = new ObjectMapper();

        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        mapper.setSerializationInclusion(JsonInclude.Include.NON_NULL);

        return mapper;
    }

}
