package com.chartsayer.marketdata.service;

import com.chartsayer.common.model.PriceQuote;
import com.chartsayer.marketdata.cache.CachedPriceQuote;
import com.chartsayer.marketdata.cache.PriceCache;
import com.chartsayer.marketdata.model.SymbolPrice;
import com.chartsayer.marketdata.provider.PriceFeedProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Price lookups through the {@link PriceCache}.
 *
 * <p><strong>Flow:</strong>
 * <ol>
 *   <li>Normalize the symbol ({@code btcusdt} to {@code BTC}) and the currency.</li>
 *   <li>On a fresh cache hit return the cached quote instance, no upstream call.</li>
 *   <li>On a miss ask the {@link PriceFeedProvider}, refresh the cache and return the new quote.</li>
 *   <li>If the feed fails or does not know the symbol, fall back to a stale cached quote,
 *       else emit nothing.</li>
 * </ol>
 *
 * <p>Batch lookups make exactly one upstream call covering every miss.
 */
@Service
public class PriceService {

    private static final Logger log = LoggerFactory.getLogger(PriceService.class);

    public static final String DEFAULT_CURRENCY = "USD";

    private final PriceFeedProvider feed;
    private final PriceCache cache;
    private final Duration defaultMaxAge;

    public PriceService(PriceFeedProvider feed,
                        PriceCache cache,
                        @Value("${price-cache.default-max-age-seconds:300}") long defaultMaxAgeSeconds) {
        this.feed          = feed;
        this.cache         = cache;
        this.defaultMaxAge = Duration.ofSeconds(defaultMaxAgeSeconds);
    }

    public Mono<PriceQuote> getCryptoPrice(String symbol) {
        return getCryptoPrice(symbol, DEFAULT_CURRENCY, defaultMaxAge);
    }

    public Mono<PriceQuote> getCryptoPrice(String symbol, String currency) {
        return getCryptoPrice(symbol, currency, defaultMaxAge);
    }

    public Mono<PriceQuote> getCryptoPrice(String symbol, String currency, Duration maxAge) {
        String normalized = SymbolNormalizer.normalize(symbol);
        String cur = SymbolNormalizer.normalizeCurrency(currency);
        if (normalized.isEmpty()) {
            return Mono.empty();
        }
        String key = PriceCache.cacheKey(normalized, cur);

        return Mono.defer(() -> {
            Optional<PriceQuote> fresh = cache.getFresh(key, maxAge);
            if (fresh.isPresent()) {
                log.debug("CACHE_HIT key={}", key);
                return Mono.just(fresh.get());
            }

            log.info("CACHE_MISS key={}", key);
            return feed.fetchQuotes(List.of(normalized), cur)
                .flatMap(quotes -> Mono.justOrEmpty(quotes.get(normalized)))
                .doOnNext(quote -> cache.put(key, quote))
                .onErrorResume(e -> {
                    log.warn("Price feed failed, trying stale cache. key={} error={}", key, e.getMessage());
                    return Mono.empty();
                })
                .switchIfEmpty(Mono.defer(() -> staleFallback(key)));
        });
    }

    /**
     * Quotes for several symbols keyed by normalized symbol, in input order. Fresh cache
     * hits are served directly and all misses go upstream in a single batched call. If that
     * call fails the result holds what the cache could provide.
     */
    public Mono<Map<String, PriceQuote>> getMultipleCryptoPrices(Collection<String> symbols, String currency) {
        return getMultipleCryptoPrices(symbols, currency, defaultMaxAge);
    }

    public Mono<Map<String, PriceQuote>> getMultipleCryptoPrices(Collection<String> symbols,
                                                                 String currency,
                                                                 Duration maxAge) {
        String cur = SymbolNormalizer.normalizeCurrency(currency);

        return Mono.defer(() -> {
            Set<String> normalized = new LinkedHashSet<>();
            for (String symbol : symbols) {
                String n = SymbolNormalizer.normalize(symbol);
                if (!n.isEmpty()) {
                    normalized.add(n);
                }
            }

            Map<String, PriceQuote> hits = new LinkedHashMap<>();
            List<String> misses = new ArrayList<>();
            for (String symbol : normalized) {
                cache.getFresh(PriceCache.cacheKey(symbol, cur), maxAge)
                    .ifPresentOrElse(quote -> hits.put(symbol, quote), () -> misses.add(symbol));
            }
            log.info("Batch price lookup. currency={} hits={} misses={}", cur, hits.keySet(), misses);

            if (misses.isEmpty()) {
                return Mono.just(ordered(normalized, cur, hits, Map.of()));
            }

            return feed.fetchQuotes(misses, cur)
                .map(fetched -> {
                    fetched.forEach((symbol, quote) -> {
                        if (misses.contains(symbol)) {
                            cache.put(PriceCache.cacheKey(symbol, cur), quote);
                        }
                    });
                    return fetched;
                })
                .onErrorResume(e -> {
                    log.warn("Batch price fetch failed, serving cached entries. symbols={} error={}",
                             misses, e.getMessage());
                    return Mono.just(Map.of());
                })
                .map(fetched -> ordered(normalized, cur, hits, fetched));
        });
    }

    /**
     * Price and currency for a symbol; the price is null when no quote is available.
     */
    public Mono<SymbolPrice> getPriceBySymbol(String symbol, String currency) {
        String cur = SymbolNormalizer.normalizeCurrency(currency);
        return getCryptoPrice(symbol, cur)
            .map(quote -> new SymbolPrice(quote.symbol(), quote.price(), quote.currency()))
            .defaultIfEmpty(new SymbolPrice(SymbolNormalizer.normalize(symbol), null, cur));
    }

    public void clearPriceCache() {
        cache.clear();
    }

    // ── internals ───────────────────────────────────────────────────────────

    private Mono<PriceQuote> staleFallback(String key) {
        Optional<CachedPriceQuote> stale = cache.getAnyAge(key);
        if (stale.isPresent()) {
            log.warn("Serving stale price. key={} fetchedAt={}", key, stale.get().fetchedAt());
            return Mono.just(stale.get().quote());
        }
        log.warn("No price available. key={}", key);
        return Mono.empty();
    }

    private Map<String, PriceQuote> ordered(Set<String> symbols,
                                            String currency,
                                            Map<String, PriceQuote> hits,
                                            Map<String, PriceQuote> fetched) {
        Map<String, PriceQuote> result = new LinkedHashMap<>();
        for (String symbol : symbols) {
            PriceQuote quote = hits.get(symbol);
            if (quote == null) {
                quote = fetched.get(symbol);
            }
            if (quote == null) {
                // best effort for misses the feed could not serve
                quote = cache.getAnyAge(PriceCache.cacheKey(symbol, currency))
                    .map(CachedPriceQuote::quote)
                    .orElse(null);
            }
            if (quote != null) {
                result.put(symbol, quote);
            }
        }
        return result;
    }
}
