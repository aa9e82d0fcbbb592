package com.products.scraper.ai;

import com.products.scraper.config.JacksonScraperConfig;
import com.products.scraper.config.OpenAIProperties;
import com.products.scraper.model.ProductExtract;
import com.products.scraper.model.ProductInsights;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class ProductInsightHelperTest {

    private static final String ANSWER = """
            {"category": "planner", "tags": ["productivity", "printable"],
             "targetAudience": "People organising their year", "sellingPoints": ["365 pages"]}
            """;

    private OpenAIProperties props;
    private AtomicInteger calls;
    private ProductExtract product;

    @BeforeEach
    void setUp() {
        props = new OpenAIProperties();
        props.setEnabled(true);
        props.setKey("sk-test");
        calls = new AtomicInteger();
        product = ProductExtract.builder()
                .url("https://www.etsy.com/listing/1")
                .title("Digital Planner")
                .description("Plan your year")
                .features(List.of("365 pages"))
                .content("# Digital Planner")
                .build();
    }

    private ProductInsightHelper helperAnswering(final HttpStatus status, final String body) {
        WebClient client = WebClient.builder()
                .baseUrl("https://llm.test/v1")
                .exchangeFunction(request -> {
                    calls.incrementAndGet();
                    return Mono.just(ClientResponse.create(status)
                            .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                            .body(body)
                            .build());
                })
                .build();
        Retry retry = Retry.of("test", RetryConfig.custom()
                .maxAttempts(2)
                .waitDuration(Duration.ofMillis(1))
                .build());
        return new ProductInsightHelper(props, retry, CircuitBreaker.ofDefaults("test"),
                JacksonScraperConfig.create(), client);
    }

    private static String completion(final String content) {
        String escaped = content.replace("\\", "\\\\").replace("\"", "\\\"").replace("\n", "\\n");
        return "{\"choices\":[{\"message\":{\"role\":\"assistant\",\"content\":\"" + escaped + "\"}}]}";
    }

    // ===== Switches =====

    @Test
    void shouldStayDisabledWithoutKey() {
        props.setKey(" ");
        ProductInsightHelper helper = helperAnswering(HttpStatus.OK, completion(ANSWER));

        assertFalse(helper.isEnabled());
        assertTrue(helper.insightsFor(product).isEmpty());
        assertEquals(0, calls.get());
    }

    @Test
    void shouldStayDisabledWhenSwitchedOff() {
        props.setEnabled(false);

        assertFalse(helperAnswering(HttpStatus.OK, completion(ANSWER)).isEnabled());
    }

    // ===== Lookups =====

    @Test
    void shouldParseModelAnswer() {
        Optional<ProductInsights> insights = helperAnswering(HttpStatus.OK, completion(ANSWER)).insightsFor(product);

        assertTrue(insights.isPresent());
        assertEquals("planner", insights.get().category());
        assertEquals(List.of("productivity", "printable"), insights.get().tags());
        assertEquals(List.of("365 pages"), insights.get().sellingPoints());
    }

    @Test
    void shouldAcceptFencedAnswer() {
        Optional<ProductInsights> insights = helperAnswering(HttpStatus.OK,
                completion("```json\n" + ANSWER + "```")).insightsFor(product);

        assertEquals("planner", insights.orElseThrow().category());
    }

    @Test
    void shouldCacheByUrl() {
        ProductInsightHelper helper = helperAnswering(HttpStatus.OK, completion(ANSWER));

        helper.insightsFor(product);
        helper.insightsFor(product);

        assertEquals(1, calls.get());
    }

    @Test
    void shouldFallBackToNothingOnHttpError() {
        ProductInsightHelper helper = helperAnswering(HttpStatus.INTERNAL_SERVER_ERROR, "{\"error\":\"down\"}");

        assertTrue(helper.insightsFor(product).isEmpty());
        assertEquals(2, calls.get());
    }

    @Test
    void shouldFallBackToNothingOnMalformedAnswer() {
        ProductInsightHelper helper = helperAnswering(HttpStatus.OK, completion("not json at all"));

        assertTrue(helper.insightsFor(product).isEmpty());
    }

    @Test
    void shouldNotCacheFailures() {
        ProductInsightHelper helper = helperAnswering(HttpStatus.OK, completion(""));

        helper.insightsFor(product);
        helper.insightsFor(product);

        assertEquals(4, calls.get());
    }

    // ===== Helpers =====

    @Test
    void shouldStripCodeFence() {
        assertEquals("{\"a\":1}", ProductInsightHelper.stripCodeFence("```json\n{\"a\":1}\n```"));
        assertEquals("{\"a\":1}", ProductInsightHelper.stripCodeFence("  {\"a\":1} "));
        assertEquals("", ProductInsightHelper.stripCodeFence(null));
    }
}
