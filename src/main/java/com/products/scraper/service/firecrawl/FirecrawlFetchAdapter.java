package com.products.scraper.service.firecrawl;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.products.scraper.model.FetchedContent;
import com.products.scraper.model.PageMetadata;
import com.products.scraper.service.core.FetchAdapter;
import com.products.scraper.service.core.FetchOptions;
import com.products.scraper.service.core.FetchResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * {@link FetchAdapter} backed by the Firecrawl {@code /v1/scrape} endpoint.
 * <p>
 * Non-2xx answers and bodies flagged {@code success:false} become unsuccessful
 * {@link FetchResponse}s; transport errors propagate to the caller.
 * </p>
 *
 * <h3>Request body</h3>
 * <pre>{@code
 * {
 *   "url": "https://www.etsy.com/listing/123",
 *   "formats": ["markdown", "html"],
 *   "onlyMainContent": true,
 *   "timeout": 30000,
 *   "waitFor": 2000
 * }
 * }</pre>
 */
@Slf4j
@Component
public class FirecrawlFetchAdapter implements FetchAdapter {

    static final String SCRAPE_ENDPOINT = "/v1/scrape";

    private final WebClient webClient;

    private final ObjectMapper mapper;

    public FirecrawlFetchAdapter(@Qualifier("fetchServiceWebClient") final WebClient webClient,
                                 @Qualifier("scraperObjectMapper") final ObjectMapper mapper) {
        this.webClient = webClient;
        this.mapper = mapper;
    }

    @Override
    public FetchResponse fetch(final String url, final FetchOptions options) {
        Map<String, Object> body = requestBody(url, options);
        FetchResponse response = webClient.post()
                .uri(SCRAPE_ENDPOINT)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(body)
                .exchangeToMono(resp -> resp.bodyToMono(JsonNode.class)
                        .defaultIfEmpty(mapper.createObjectNode())
                        .map(json -> toResponse(resp.statusCode(), json)))
                .block();
        return response == null ? FetchResponse.failure("Empty response from fetch service") : response;
    }

    Map<String, Object> requestBody(final String url, final FetchOptions options) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("url", url);
        body.put("formats", options.formats());
        body.put("onlyMainContent", options.onlyMainContent());
        if (options.timeout() != null) {
            body.put("timeout", options.timeout().toMillis());
        }
        if (options.waitFor() != null) {
            body.put("waitFor", options.waitFor().toMillis());
        }
        if (!options.headers().isEmpty()) {
            body.put("headers", options.headers());
        }
        if (!options.excludeTags().isEmpty()) {
            body.put("excludeTags", options.excludeTags());
        }
        return body;
    }

    FetchResponse toResponse(final HttpStatusCode status, final JsonNode json) {
        if (!status.is2xxSuccessful()) {
            String error = text(json, "error");
            log.warn("Fetch service answered {}: {}", status.value(), error);
            return FetchResponse.failure(error == null ? "HTTP " + status.value() : error);
        }
        if (!json.path("success").asBoolean(false)) {
            return FetchResponse.failure(text(json, "error"));
        }
        JsonNode data = json.path("data");
        if (data.isMissingNode() || data.isNull()) {
            return FetchResponse.failure("Fetch service returned no data");
        }
        PageMetadata metadata = data.hasNonNull("metadata")
                ? mapper.convertValue(data.get("metadata"), PageMetadata.class)
                : PageMetadata.empty();
        return FetchResponse.success(new FetchedContent(text(data, "markdown"), text(data, "html"), metadata));
    }

    private static String text(final JsonNode node, final String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }
}
