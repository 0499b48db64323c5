package com.chartsayer.marketdata.provider;

import com.chartsayer.common.model.PriceQuote;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Random;

/**
 * Synthesizes quotes in realistic price ranges so bot flows work without a
 * CoinMarketCap key. Never fails and knows every symbol.
 */
public class MockPriceFeedProvider implements PriceFeedProvider {

    private static final Logger log = LoggerFactory.getLogger(MockPriceFeedProvider.class);

    record PriceRange(double min, double max) {}

    static final PriceRange DEFAULT_RANGE = new PriceRange(1, 100);

    static final Map<String, PriceRange> PRICE_RANGES = Map.of(
        "BTC",   new PriceRange(35_000, 45_000),
        "ETH",   new PriceRange(1_800, 2_400),
        "XRP",   new PriceRange(0.4, 0.7),
        "SOL",   new PriceRange(80, 150),
        "ADA",   new PriceRange(0.3, 0.5),
        "DOGE",  new PriceRange(0.05, 0.15),
        "DOT",   new PriceRange(5, 15),
        "MATIC", new PriceRange(0.5, 1.5),
        "LTC",   new PriceRange(50, 100),
        "LINK",  new PriceRange(10, 20)
    );

    private final Random random;
    private final Clock clock;

    public MockPriceFeedProvider(Random random, Clock clock) {
        this.random = random;
        this.clock  = clock;
    }

    @Override
    public Mono<Map<String, PriceQuote>> fetchQuotes(Collection<String> symbols, String currency) {
        return Mono.fromSupplier(() -> {
            Map<String, PriceQuote> quotes = new LinkedHashMap<>();
            for (String symbol : symbols) {
                quotes.put(symbol, mockQuote(symbol, currency));
            }
            log.debug("Mock quotes generated. symbols={} currency={}", quotes.keySet(), currency);
            return quotes;
        });
    }

    private PriceQuote mockQuote(String symbol, String currency) {
        PriceRange range = PRICE_RANGES.getOrDefault(symbol, DEFAULT_RANGE);
        double price = uniform(range.min(), range.max());
        return new PriceQuote(
            symbol,
            symbol + " Coin",
            price,
            uniform(-5, 5),
            uniform(-10, 10),
            uniform(-20, 20),
            price * uniform(1_000_000, 100_000_000),
            price * uniform(100_000, 10_000_000),
            LocalDateTime.now(clock).toString(),
            currency);
    }

    private double uniform(double min, double max) {
        return min + (max - min) * random.nextDouble();
    }
}
