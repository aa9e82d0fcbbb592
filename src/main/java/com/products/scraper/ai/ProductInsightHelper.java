package com.products.scraper.ai;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.products.scraper.config.OpenAIProperties;
import com.products.scraper.model.ProductExtract;
import com.products.scraper.model.ProductInsights;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.decorators.Decorators;
import io.github.resilience4j.retry.Retry;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Asks an OpenAI compatible chat completion endpoint for product insights: a category,
 * tags, the target audience and the main selling points.
 * <p>
 * Enrichment is best effort. Calls go through a Resilience4j {@link Retry} and
 * {@link CircuitBreaker}; any failure ends in "no insights" and never fails a scrape.
 * </p>
 */
@Slf4j
@Component
public class ProductInsightHelper {

    /**
     * Endpoint for completions.
     */
    private static final String CHAT_COMPLETION_ENDPOINT = "/chat/completions";

    /**
     * Timeout for the HTTP call.
     */
    private static final Duration TIMEOUT = Duration.ofSeconds(15);

    /**
     * Content sent to the model is cut to this many characters.
     */
    private static final int MAX_CONTENT_CHARS = 4000;

    private static final String SYSTEM_PROMPT = """
            You analyse digital product listings.
            Reply with a single JSON object and nothing else, using exactly these keys:
              "category": one short lowercase category such as template, course, ebook, software,
                          graphics, font, music, video or digital-product
              "tags": up to 10 short lowercase tags
              "targetAudience": one sentence describing who the product is for
              "sellingPoints": up to 5 short phrases
            """;

    private final OpenAIProperties props;

    private final Retry retry;

    private final CircuitBreaker circuitBreaker;

    private final ObjectMapper mapper;

    /**
     * Insights keyed by product URL.
     */
    private final Map<String, ProductInsights> cache = new ConcurrentHashMap<>();

    private final WebClient openAiClientWeb;

    /**
     * Creates the helper with a dedicated {@link WebClient} pointed at the configured
     * base URL and carrying the Bearer key.
     *
     * @param props          OpenAI settings
     * @param retry          retry policy of insight lookups
     * @param circuitBreaker breaker of insight lookups
     * @param mapper         mapper used to read the model's JSON answer
     */
    @Autowired
    public ProductInsightHelper(final OpenAIProperties props,
                                final Retry retry,
                                final CircuitBreaker circuitBreaker,
                                @Qualifier("scraperObjectMapper") final ObjectMapper mapper) {
        this(props, retry, circuitBreaker, mapper, WebClient.builder()
                .baseUrl(props.getBaseUrl())
                .defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + props.getKey())
                .build());
    }

    ProductInsightHelper(final OpenAIProperties props,
                         final Retry retry,
                         final CircuitBreaker circuitBreaker,
                         final ObjectMapper mapper,
                         final WebClient client) {
        this.props = Objects.requireNonNull(props);
        this.retry = Objects.requireNonNull(retry);
        this.circuitBreaker = Objects.requireNonNull(circuitBreaker);
        this.mapper = Objects.requireNonNull(mapper);
        this.openAiClientWeb = Objects.requireNonNull(client);
    }

    /**
     * @return {@code true} when enrichment is switched on and a key is configured
     */
    public boolean isEnabled() {
        return props.isUsable();
    }

    /**
     * Looks up insights for a product, from cache when the URL was seen before.
     *
     * @param product extracted product, its {@code content} is sent when present
     * @return the insights, empty when enrichment is off or the lookup failed
     */
    public Optional<ProductInsights> insightsFor(final ProductExtract product) {
        if (!isEnabled() || product == null || product.url() == null) {
            return Optional.empty();
        }
        ProductInsights cached = cache.get(product.url());
        if (cached != null) {
            return Optional.of(cached);
        }

        Supplier<Optional<ProductInsights>> lookup = () -> Optional.of(askModel(product));

        Optional<ProductInsights> insights = Decorators
                .ofSupplier(lookup)
                .withRetry(retry)
                .withCircuitBreaker(circuitBreaker)
                .withFallback(
                        List.of(Exception.class),
                        ex -> {
                            log.warn("Insight lookup failed for {}: {} → continuing without insights",
                                    product.url(), ex.toString());
                            return Optional.<ProductInsights>empty();
                        })
                .decorate()
                .get();

        insights.ifPresent(i -> cache.put(product.url(), i));
        return insights;
    }

    /**
     * Sends one chat completion request and parses the JSON object in the first choice.
     *
     * @throws IllegalStateException on an empty or malformed answer
     */
    private ProductInsights askModel(final ProductExtract product) {
        Map<String, Object> system = Map.of("role", "system", "content", SYSTEM_PROMPT);
        Map<String, Object> user = Map.of("role", "user", "content", describe(product));
        Map<String, Object> payload = Map.of(
                "model", props.getDefaultModel(),
                "temperature", 0,
                "response_format", Map.of("type", "json_object"),
                "messages", List.of(system, user)
        );
        log.info("Requesting insights for {}", product.url());
        JsonNode response = openAiClientWeb.post()
                .uri(CHAT_COMPLETION_ENDPOINT)
                .bodyValue(payload)
                .retrieve()
                .bodyToMono(JsonNode.class)
                .timeout(TIMEOUT)
                .block();

        if (response == null) {
            throw new IllegalStateException("Null response from LLM");
        }
        String content = stripCodeFence(response.at("/choices/0/message/content").asText());
        if (content.isEmpty()) {
            throw new IllegalStateException("Empty answer from LLM");
        }
        try {
            return mapper.readValue(content, ProductInsights.class);
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Malformed insight JSON: " + ex.getOriginalMessage(), ex);
        }
    }

    private static String describe(final ProductExtract product) {
        StringBuilder sb = new StringBuilder()
                .append("Title: ").append(product.title()).append('\n')
                .append("Description: ").append(product.description()).append('\n');
        if (!product.features().isEmpty()) {
            sb.append("Features: ").append(String.join("; ", product.features())).append('\n');
        }
        if (StringUtils.isNotBlank(product.content())) {
            sb.append("Content:\n").append(StringUtils.truncate(product.content(), MAX_CONTENT_CHARS));
        }
        return sb.toString();
    }

    static String stripCodeFence(final String raw) {
        String text = StringUtils.trimToEmpty(raw);
        if (text.startsWith("```")) {
            text = text.replaceFirst("^```[a-zA-Z]*\\s*", "");
            text = StringUtils.removeEnd(text.trim(), "```").trim();
        }
        return text;
    }
}
