package com.chartsayer.marketdata.client;

import com.chartsayer.common.exception.PriceFeedException;
import com.chartsayer.common.model.PriceQuote;
import com.chartsayer.marketdata.config.MarketDataConfig;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class CoinMarketCapWebClientTest {

    private static final String RESPONSE = """
        {
          "status": {"error_code": 0},
          "data": {
            "BTC": {
              "symbol": "BTC", "name": "Bitcoin",
              "quote": {"USD": {"price": 40123.5, "percent_change_1h": 0.2,
                                "percent_change_24h": -1.5, "percent_change_7d": 4.0,
                                "market_cap": 780000000000.0, "volume_24h": 21000000000.0,
                                "last_updated": "2025-03-01T10:00:00.000Z"}}
            },
            "ETH": [{
              "symbol": "ETH", "name": "Ethereum",
              "quote": {"USD": {"price": 2050.0, "percent_change_1h": 0.1,
                                "percent_change_24h": 2.0, "percent_change_7d": -3.0,
                                "market_cap": 246000000000.0, "volume_24h": 9000000000.0,
                                "last_updated": "2025-03-01T10:00:00.000Z"}}
            }]
          }
        }
        """;

    private final AtomicReference<ClientRequest> captured = new AtomicReference<>();

    private CoinMarketCapWebClient client(HttpStatus status, String body) {
        WebClient webClient = WebClient.builder()
            .baseUrl("https://pro-api.coinmarketcap.com")
            .exchangeFunction(request -> {
                captured.set(request);
                return Mono.just(ClientResponse.create(status)
                    .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                    .body(body)
                    .build());
            })
            .build();
        return new CoinMarketCapWebClient(webClient, new MarketDataConfig().objectMapper(), "test-key");
    }

    @Test
    @DisplayName("one GET with comma-joined symbols, convert and the API key header")
    void requestShape() {
        client(HttpStatus.OK, RESPONSE).fetchQuotes(List.of("BTC", "ETH"), "USD").block();

        ClientRequest request = captured.get();
        assertEquals("/v1/cryptocurrency/quotes/latest", request.url().getPath());
        assertEquals("symbol=BTC,ETH&convert=USD", request.url().getRawQuery().replace("%2C", ","));
        assertEquals("test-key", request.headers().getFirst("X-CMC_PRO_API_KEY"));
    }

    @Test
    @DisplayName("object and array entries are both parsed")
    void parsesQuotes() {
        StepVerifier.create(client(HttpStatus.OK, RESPONSE).fetchQuotes(List.of("BTC", "ETH"), "USD"))
            .assertNext(quotes -> {
                PriceQuote btc = quotes.get("BTC");
                assertEquals("Bitcoin", btc.name());
                assertEquals(40123.5, btc.price());
                assertEquals(-1.5, btc.percentChange24h());
                assertEquals("USD", btc.currency());
                assertEquals("2025-03-01T10:00:00.000Z", btc.lastUpdated());
                assertEquals(2050.0, quotes.get("ETH").price());
            })
            .verifyComplete();
    }

    @Test
    @DisplayName("symbols missing from the response are left out")
    void missingSymbol() {
        StepVerifier.create(client(HttpStatus.OK, RESPONSE).fetchQuotes(List.of("BTC", "NEWCOIN"), "USD"))
            .assertNext(quotes -> assertEquals(List.of("BTC"), List.copyOf(quotes.keySet())))
            .verifyComplete();
    }

    @Test
    @DisplayName("response without data is a feed error")
    void noData() {
        StepVerifier.create(client(HttpStatus.OK, "{\"status\":{\"error_code\":1001}}")
                .fetchQuotes(List.of("BTC"), "USD"))
            .expectError(PriceFeedException.class)
            .verify();
    }

    @Test
    @DisplayName("HTTP error status propagates")
    void httpError() {
        StepVerifier.create(client(HttpStatus.UNAUTHORIZED, "{}").fetchQuotes(List.of("BTC"), "USD"))
            .expectError(WebClientResponseException.class)
            .verify();
    }

    @Test
    @DisplayName("empty symbol list makes no request")
    void emptyRequest() {
        StepVerifier.create(client(HttpStatus.OK, RESPONSE).fetchQuotes(List.of(), "USD"))
            .expectNext(Map.of())
            .verifyComplete();
        assertNull(captured.get());
    }
}
