package com.products.scraper.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.netty.channel.ChannelOption;
import io.netty.handler.logging.LogLevel;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.http.codec.json.Jackson2JsonDecoder;
import org.springframework.http.codec.json.Jackson2JsonEncoder;
import org.springframework.web.reactive.function.client.ExchangeFilterFunction;
import org.springframework.web.reactive.function.client.ExchangeStrategies;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.netty.http.client.HttpClient;
import reactor.netty.resources.ConnectionProvider;
import reactor.netty.transport.logging.AdvancedByteBufFormat;

import java.time.Duration;

/**
 * Builds the {@link WebClient} that talks to the content fetch service.
 */
@Configuration
@Slf4j
public class WebClientConfiguration {

    private static final Duration CONNECT_TIMEOUT = Duration.ofSeconds(20);

    /** page conversions routinely exceed the 256 KB default */
    private static final int MAX_IN_MEMORY_SIZE = 16 * 1024 * 1024;

    private static final int MAX_CONNECTIONS = 50;

    @Bean
    public WebClient fetchServiceWebClient(final ScraperProperties props,
                                           @Qualifier("scraperObjectMapper") final ObjectMapper mapper) {

        /* --- JSON codecs wired to the scraper ObjectMapper ----------------- */
        ExchangeStrategies strategies = ExchangeStrategies.builder()
                .codecs(cfg -> {
                    cfg.defaultCodecs()
                            .jackson2JsonEncoder(new Jackson2JsonEncoder(mapper, MediaType.APPLICATION_JSON));
                    cfg.defaultCodecs()
                            .jackson2JsonDecoder(new Jackson2JsonDecoder(mapper, MediaType.APPLICATION_JSON));
                    cfg.defaultCodecs().maxInMemorySize(MAX_IN_MEMORY_SIZE);
                })
                .build();

        ConnectionProvider pool = ConnectionProvider.builder("fetch-pool")
                .maxConnections(MAX_CONNECTIONS)
                .pendingAcquireTimeout(Duration.ofMillis(2000))
                .build();

        // response timeout stays above the per-attempt limit so the time limiter decides
        HttpClient tcpClient = HttpClient.create(pool)
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) CONNECT_TIMEOUT.toMillis())
                .responseTimeout(props.longestAttemptTimeout().plusSeconds(5))
                .wiretap("reactor.netty.http.client.HttpClient",
                        LogLevel.DEBUG, AdvancedByteBufFormat.TEXTUAL);

        WebClient.Builder builder = WebClient.builder()
                .baseUrl(props.getFetch().getBaseUrl())
                .clientConnector(new ReactorClientHttpConnector(tcpClient))
                .defaultHeader(HttpHeaders.ACCEPT, MediaType.APPLICATION_JSON_VALUE)
                .filter(logRequest())
                .filter(logResponse())
                .exchangeStrategies(strategies);

        String apiKey = props.getFetch().getApiKey();
        if (apiKey == null || apiKey.isBlank()) {
            log.warn("scraper.fetch.api-key is not set; fetch service calls will be rejected");
        } else {
            builder.defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + apiKey);
        }
        return builder.build();
    }

    private static ExchangeFilterFunction logRequest() {
        return ExchangeFilterFunction.ofRequestProcessor(req -> {
            log.debug("--> {} {}", req.method(), req.url());
            return Mono.just(req);
        });
    }

    private static ExchangeFilterFunction logResponse() {
        return ExchangeFilterFunction.ofResponseProcessor(res -> {
            log.debug("<-- {}  {}", res.statusCode().value(), res.headers().asHttpHeaders());
            return Mono.just(res);
        });
    }
}
