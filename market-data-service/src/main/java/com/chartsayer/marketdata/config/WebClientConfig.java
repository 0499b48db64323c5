package com.chartsayer.marketdata.config;

import com.chartsayer.marketdata.client.CoinMarketCapWebClient;
import com.chartsayer.marketdata.provider.MockPriceFeedProvider;
import com.chartsayer.marketdata.provider.PriceFeedProvider;
import io.netty.channel.ChannelOption;
import io.netty.handler.timeout.ReadTimeoutHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.ExchangeFilterFunction;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.netty.http.client.HttpClient;

import java.time.Clock;
import java.time.Duration;
import java.util.Random;
import java.util.concurrent.TimeUnit;
import com.fasterxml.jackson.databind.ObjectMapper;

@Configuration
public class WebClientConfig {

    private static final Logger log = LoggerFactory.getLogger(WebClientConfig.class);

    @Value("${coinmarketcap.base-url:https://pro-api.coinmarketcap.com}")
    private String baseUrl;

    @Value("${coinmarketcap.api-key:}")
    private String apiKey;

    @Bean
    public WebClient coinMarketCapWebClient(WebClient.Builder builder) {
        HttpClient httpClient = HttpClient.create()
            .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, 10_000)
            .responseTimeout(Duration.ofSeconds(15))
            .doOnConnected(conn ->
                conn.addHandlerLast(new ReadTimeoutHandler(15, TimeUnit.SECONDS))
            );

        return builder
            .baseUrl(baseUrl)
            .clientConnector(new ReactorClientHttpConnector(httpClient))
            .filter(serverErrorFilter())
            .filter(loggingFilter())
            .build();
    }

    /**
     * CoinMarketCap when {@code coinmarketcap.api-key} is set, the mock feed otherwise.
     */
    @Bean
    public PriceFeedProvider priceFeedProvider(WebClient coinMarketCapWebClient, ObjectMapper objectMapper, Clock clock) {
        if (apiKey == null || apiKey.isBlank()) {
            log.warn("No CoinMarketCap API key configured, serving mock prices");
            return new MockPriceFeedProvider(new Random(), clock);
        }
        log.info("Price feed initialized. provider=CoinMarketCap baseUrl={}", baseUrl);
        return new CoinMarketCapWebClient(coinMarketCapWebClient, objectMapper, apiKey);
    }

    private ExchangeFilterFunction serverErrorFilter() {
        return ExchangeFilterFunction.ofResponseProcessor(clientResponse -> {
            if (clientResponse.statusCode().is5xxServerError()) {
                return Mono.error(new RuntimeException("Price feed server error: " + clientResponse.statusCode()));
            }
            return Mono.just(clientResponse);
        });
    }

    private ExchangeFilterFunction loggingFilter() {
        return ExchangeFilterFunction.ofRequestProcessor(clientRequest -> {
            log.debug("Outbound request: {} {}", clientRequest.method(), clientRequest.url());
            return Mono.just(clientRequest);
        });
    }
}
