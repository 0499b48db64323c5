package com.chartsayer.marketdata.service;

import com.chartsayer.common.exception.PriceFeedException;
import com.chartsayer.common.model.PriceQuote;
import com.chartsayer.marketdata.cache.PriceCache;
import com.chartsayer.marketdata.provider.PriceFeedProvider;
import com.chartsayer.marketdata.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static com.chartsayer.marketdata.support.Quotes.quote;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoMoreInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class PriceServiceTest {

    @Mock
    private PriceFeedProvider feed;

    private MutableClock clock;
    private PriceCache cache;
    private PriceService service;

    @BeforeEach
    void setUp() {
        clock = MutableClock.at("2025-03-01T10:00:00Z");
        cache = new PriceCache(clock);
        service = new PriceService(feed, cache, 300);
    }

    @Nested
    @DisplayName("getCryptoPrice")
    class Single {

        @Test
        @DisplayName("second call within max age is served from cache with the same instance")
        void cacheHit() {
            PriceQuote btc = quote("BTC", 40_000);
            when(feed.fetchQuotes(List.of("BTC"), "USD")).thenReturn(Mono.just(Map.of("BTC", btc)));

            PriceQuote first = service.getCryptoPrice("BTCUSDT").block();
            clock.advance(Duration.ofSeconds(100));
            PriceQuote second = service.getCryptoPrice("btc", "usd").block();

            assertSame(btc, first);
            assertSame(first, second);
            verify(feed, times(1)).fetchQuotes(anyCollection(), anyString());
        }

        @Test
        @DisplayName("entry older than max age triggers a refresh")
        void staleRefresh() {
            PriceQuote old = quote("ETH", 2_000);
            PriceQuote fresh = quote("ETH", 2_100);
            cache.put("ETH:USD", old);
            clock.advance(Duration.ofSeconds(301));
            when(feed.fetchQuotes(List.of("ETH"), "USD")).thenReturn(Mono.just(Map.of("ETH", fresh)));

            StepVerifier.create(service.getCryptoPrice("ETH")).expectNext(fresh).verifyComplete();
            assertSame(fresh, cache.getFresh("ETH:USD", Duration.ofSeconds(1)).orElseThrow());
        }

        @Test
        @DisplayName("caller-supplied max age overrides the default")
        void customMaxAge() {
            PriceQuote cached = quote("SOL", 100);
            cache.put("SOL:USD", cached);
            clock.advance(Duration.ofSeconds(400));

            StepVerifier.create(service.getCryptoPrice("SOL", "USD", Duration.ofMinutes(10)))
                .expectNext(cached)
                .verifyComplete();
            verify(feed, never()).fetchQuotes(anyCollection(), anyString());
        }

        @Test
        @DisplayName("feed failure falls back to a stale entry")
        void staleFallback() {
            PriceQuote old = quote("ETH", 2_000);
            cache.put("ETH:USD", old);
            clock.advance(Duration.ofHours(1));
            when(feed.fetchQuotes(anyCollection(), anyString()))
                .thenReturn(Mono.error(new PriceFeedException("down")));

            StepVerifier.create(service.getCryptoPrice("ETH")).expectNext(old).verifyComplete();
        }

        @Test
        @DisplayName("feed failure with nothing cached is empty")
        void failureWithoutCache() {
            when(feed.fetchQuotes(anyCollection(), anyString()))
                .thenReturn(Mono.error(new PriceFeedException("down")));

            StepVerifier.create(service.getCryptoPrice("NEWCOIN")).verifyComplete();
        }

        @Test
        @DisplayName("symbol unknown to the feed is empty and nothing is cached")
        void unknownSymbol() {
            when(feed.fetchQuotes(List.of("NOPE"), "USD")).thenReturn(Mono.just(Map.of()));

            StepVerifier.create(service.getCryptoPrice("NOPE")).verifyComplete();
            assertEquals(0, cache.size());
        }

        @Test
        @DisplayName("currencies are cached separately")
        void perCurrency() {
            when(feed.fetchQuotes(List.of("BTC"), "USD")).thenReturn(Mono.just(Map.of("BTC", quote("BTC", 40_000))));
            when(feed.fetchQuotes(List.of("BTC"), "EUR")).thenReturn(Mono.just(Map.of("BTC", quote("BTC", 37_000))));

            service.getCryptoPrice("BTC", "USD").block();
            service.getCryptoPrice("BTC", "EUR").block();

            assertEquals(2, cache.size());
        }
    }

    @Nested
    @DisplayName("getMultipleCryptoPrices")
    class Batch {

        @Test
        @DisplayName("fresh BTC, stale ETH, unseen NEWCOIN: one upstream call for ETH and NEWCOIN")
        void mixedBatch() {
            PriceQuote btc = quote("BTC", 40_000);
            cache.put("ETH:USD", quote("ETH", 1_900));
            clock.advance(Duration.ofSeconds(400));
            cache.put("BTC:USD", btc);
            clock.advance(Duration.ofSeconds(10));

            PriceQuote eth = quote("ETH", 2_000);
            PriceQuote newcoin = quote("NEWCOIN", 3);
            when(feed.fetchQuotes(List.of("ETH", "NEWCOIN"), "USD"))
                .thenReturn(Mono.just(Map.of("ETH", eth, "NEWCOIN", newcoin)));

            Map<String, PriceQuote> result =
                service.getMultipleCryptoPrices(List.of("BTC", "ETH", "NEWCOIN"), "USD").block();

            assertEquals(List.of("BTC", "ETH", "NEWCOIN"), List.copyOf(result.keySet()));
            assertSame(btc, result.get("BTC"));
            assertSame(eth, result.get("ETH"));
            assertSame(newcoin, result.get("NEWCOIN"));
            verify(feed).fetchQuotes(List.of("ETH", "NEWCOIN"), "USD");
            verifyNoMoreInteractions(feed);
        }

        @Test
        @DisplayName("all hits make no upstream call")
        void allHits() {
            cache.put("BTC:USD", quote("BTC", 40_000));
            cache.put("ETH:USD", quote("ETH", 2_000));

            StepVerifier.create(service.getMultipleCryptoPrices(List.of("btcusdt", "ETH"), "USD"))
                .assertNext(result -> assertEquals(List.of("BTC", "ETH"), List.copyOf(result.keySet())))
                .verifyComplete();
            verify(feed, never()).fetchQuotes(anyCollection(), any());
        }

        @Test
        @DisplayName("upstream failure returns the cache-resolved part")
        void partialOnFailure() {
            PriceQuote btc = quote("BTC", 40_000);
            cache.put("BTC:USD", btc);
            when(feed.fetchQuotes(List.of("NEWCOIN"), "USD"))
                .thenReturn(Mono.error(new PriceFeedException("down")));

            StepVerifier.create(service.getMultipleCryptoPrices(List.of("BTC", "NEWCOIN"), "USD"))
                .assertNext(result -> {
                    assertEquals(1, result.size());
                    assertSame(btc, result.get("BTC"));
                })
                .verifyComplete();
        }

        @Test
        @DisplayName("upstream failure serves stale entries for misses")
        void staleOnFailure() {
            PriceQuote oldEth = quote("ETH", 1_900);
            cache.put("ETH:USD", oldEth);
            clock.advance(Duration.ofHours(1));
            when(feed.fetchQuotes(List.of("ETH"), "USD"))
                .thenReturn(Mono.error(new PriceFeedException("down")));

            StepVerifier.create(service.getMultipleCryptoPrices(List.of("ETH"), "USD"))
                .assertNext(result -> assertSame(oldEth, result.get("ETH")))
                .verifyComplete();
        }

        @Test
        @DisplayName("duplicate and suffixed symbols collapse to one lookup")
        void duplicates() {
            PriceQuote btc = quote("BTC", 40_000);
            when(feed.fetchQuotes(List.of("BTC"), "USD")).thenReturn(Mono.just(Map.of("BTC", btc)));

            StepVerifier.create(service.getMultipleCryptoPrices(List.of("BTC", "btcusdt", "BTCUSD"), "USD"))
                .assertNext(result -> assertEquals(Map.of("BTC", btc), result))
                .verifyComplete();
        }
    }

    @Test
    @DisplayName("getPriceBySymbol returns price and currency, or a null price")
    void priceBySymbol() {
        when(feed.fetchQuotes(List.of("BTC"), "USD")).thenReturn(Mono.just(Map.of("BTC", quote("BTC", 40_000))));
        when(feed.fetchQuotes(List.of("NOPE"), "USD")).thenReturn(Mono.just(Map.of()));

        StepVerifier.create(service.getPriceBySymbol("BTCUSDT", "usd"))
            .assertNext(p -> {
                assertEquals(40_000.0, p.price());
                assertEquals("USD", p.currency());
            })
            .verifyComplete();
        StepVerifier.create(service.getPriceBySymbol("NOPE", "USD"))
            .assertNext(p -> {
                assertNull(p.price());
                assertEquals("USD", p.currency());
            })
            .verifyComplete();
    }

    @Test
    @DisplayName("clearPriceCache forces the next lookup upstream")
    void clear() {
        when(feed.fetchQuotes(List.of("BTC"), "USD")).thenReturn(Mono.just(Map.of("BTC", quote("BTC", 40_000))));

        service.getCryptoPrice("BTC").block();
        service.clearPriceCache();
        service.getCryptoPrice("BTC").block();

        verify(feed, times(2)).fetchQuotes(List.of("BTC"), "USD");
    }
}
