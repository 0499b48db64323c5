package com.chartsayer.marketdata.client;

import com.chartsayer.common.exception.PriceFeedException;
import com.chartsayer.common.model.PriceQuote;
import com.chartsayer.marketdata.provider.PriceFeedProvider;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * CoinMarketCap {@code quotes/latest} client. One GET per call, all symbols comma-joined.
 */
public class CoinMarketCapWebClient implements PriceFeedProvider {

    private static final Logger log = LoggerFactory.getLogger(CoinMarketCapWebClient.class);

    static final String QUOTES_PATH    = "/v1/cryptocurrency/quotes/latest";
    static final String API_KEY_HEADER = "X-CMC_PRO_API_KEY";

    private final WebClient webClient;
    private final ObjectMapper objectMapper;
    private final String apiKey;

    public CoinMarketCapWebClient(WebClient coinMarketCapWebClient, ObjectMapper objectMapper, String apiKey) {
        this.webClient    = coinMarketCapWebClient;
        this.objectMapper = objectMapper;
        this.apiKey       = apiKey;
    }

    @Override
    public Mono<Map<String, PriceQuote>> fetchQuotes(Collection<String> symbols, String currency) {
        if (symbols.isEmpty()) {
            return Mono.just(Map.of());
        }
        String joined = String.join(",", symbols);
        log.info("Fetching quotes. provider=CoinMarketCap symbols={} currency={}", joined, currency);

        return webClient.get()
            .uri(uri -> uri.path(QUOTES_PATH)
                .queryParam("symbol", joined)
                .queryParam("convert", currency)
                .build())
            .header(API_KEY_HEADER, apiKey)
            .retrieve()
            .bodyToMono(String.class)
            .map(json -> parseQuotes(json, symbols, currency))
            .doOnSuccess(quotes -> log.info("Quotes fetched. provider=CoinMarketCap requested={} received={}",
                                            symbols.size(), quotes.size()))
            .doOnError(e -> log.error("CoinMarketCap fetch failed. symbols={}", joined, e));
    }

    Map<String, PriceQuote> parseQuotes(String json, Collection<String> symbols, String currency) {
        JsonNode data;
        try {
            data = objectMapper.readTree(json).path("data");
        } catch (Exception e) {
            throw new PriceFeedException("Unreadable CoinMarketCap response", e);
        }
        if (data.isMissingNode() || !data.isObject()) {
            throw new PriceFeedException("No data in CoinMarketCap response");
        }

        Map<String, PriceQuote> quotes = new LinkedHashMap<>();
        for (String symbol : symbols) {
            JsonNode entry = data.path(symbol);
            // newer API versions return an array of matches per symbol
            if (entry.isArray()) {
                entry = entry.path(0);
            }
            JsonNode quote = entry.path("quote").path(currency);
            if (entry.isMissingNode() || quote.isMissingNode()) {
                log.warn("Symbol not found in CoinMarketCap response. symbol={} currency={}", symbol, currency);
                continue;
            }
            quotes.put(symbol, new PriceQuote(
                entry.path("symbol").asText(symbol),
                entry.path("name").asText(symbol),
                quote.path("price").asDouble(),
                quote.path("percent_change_1h").asDouble(),
                quote.path("percent_change_24h").asDouble(),
                quote.path("percent_change_7d").asDouble(),
                quote.path("market_cap").asDouble(),
                quote.path("volume_24h").asDouble(),
                quote.path("last_updated").asText(null),
                currency));
        }
        return quotes;
    }
}
