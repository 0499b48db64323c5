package com.chartsayer.marketdata.cache;

import com.chartsayer.common.model.PriceQuote;
import com.chartsayer.marketdata.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static com.chartsayer.marketdata.support.Quotes.quote;
import static org.junit.jupiter.api.Assertions.*;

class PriceCacheTest {

    private MutableClock clock;
    private PriceCache cache;

    @BeforeEach
    void setUp() {
        clock = MutableClock.at("2025-03-01T10:00:00Z");
        cache = new PriceCache(clock);
    }

    @Test
    @DisplayName("key is SYMBOL:CURRENCY, uppercased")
    void cacheKey() {
        assertEquals("BTC:USD", PriceCache.cacheKey("btc", "usd"));
    }

    @Test
    @DisplayName("entry is fresh while younger than the max age")
    void freshness() {
        PriceQuote btc = quote("BTC", 40_000);
        cache.put("BTC:USD", btc);

        clock.advance(Duration.ofSeconds(299));
        assertSame(btc, cache.getFresh("BTC:USD", Duration.ofSeconds(300)).orElseThrow());

        clock.advance(Duration.ofSeconds(1));
        assertTrue(cache.getFresh("BTC:USD", Duration.ofSeconds(300)).isEmpty());
    }

    @Test
    @DisplayName("one entry serves callers with different freshness needs")
    void perCallerMaxAge() {
        cache.put("ETH:USD", quote("ETH", 2_000));
        clock.advance(Duration.ofSeconds(60));

        assertTrue(cache.getFresh("ETH:USD", Duration.ofSeconds(30)).isEmpty());
        assertTrue(cache.getFresh("ETH:USD", Duration.ofSeconds(120)).isPresent());
    }

    @Test
    @DisplayName("stale entries stay available as a fallback")
    void staleKept() {
        cache.put("SOL:USD", quote("SOL", 100));
        clock.advance(Duration.ofHours(2));

        assertTrue(cache.getFresh("SOL:USD", Duration.ofSeconds(300)).isEmpty());
        CachedPriceQuote stale = cache.getAnyAge("SOL:USD").orElseThrow();
        assertEquals(100, stale.quote().price());
        assertEquals(Duration.ofHours(2), stale.age(clock.instant()));
        assertEquals(1, cache.size());
    }

    @Test
    @DisplayName("put replaces the entry whole and restamps it")
    void replace() {
        cache.put("BTC:USD", quote("BTC", 40_000));
        clock.advance(Duration.ofSeconds(400));
        PriceQuote newer = quote("BTC", 41_000);
        cache.put("BTC:USD", newer);

        assertSame(newer, cache.getFresh("BTC:USD", Duration.ofSeconds(300)).orElseThrow());
    }

    @Test
    @DisplayName("clear drops everything")
    void clear() {
        cache.put("BTC:USD", quote("BTC", 40_000));
        cache.put("BTC:EUR", quote("BTC", 37_000));
        cache.clear();

        assertEquals(0, cache.size());
        assertTrue(cache.getAnyAge("BTC:USD").isEmpty());
    }
}
