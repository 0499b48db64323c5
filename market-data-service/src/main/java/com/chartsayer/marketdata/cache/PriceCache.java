package com.chartsayer.marketdata.cache;

import com.chartsayer.common.model.PriceQuote;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.Locale;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory price cache keyed by {@code <SYMBOL>:<CURRENCY>}.
 *
 * <p>Nothing is evicted in the background. Staleness is judged at read time against
 * the caller's max age, so one map serves callers with different freshness needs.
 * A stale entry stays in place as a fallback for when the upstream feed fails.
 *
 * <p>Thread-safe via {@link ConcurrentHashMap}; each put swaps in a new immutable
 * {@link CachedPriceQuote}, so a reader sees the old or the new quote, never a mix.
 */
@Component
public class PriceCache {

    private static final Logger log = LoggerFactory.getLogger(PriceCache.class);

    private final ConcurrentHashMap<String, CachedPriceQuote> store = new ConcurrentHashMap<>();
    private final Clock clock;

    public PriceCache(Clock clock) {
        this.clock = clock;
    }

    public static String cacheKey(String symbol, String currency) {
        return symbol.toUpperCase(Locale.ROOT) + ":" + currency.toUpperCase(Locale.ROOT);
    }

    /**
     * The cached quote if it is younger than {@code maxAge}.
     */
    public Optional<PriceQuote> getFresh(String key, Duration maxAge) {
        CachedPriceQuote entry = store.get(key);
        if (entry == null || !entry.isFresh(clock.instant(), maxAge)) {
            return Optional.empty();
        }
        return Optional.of(entry.quote());
    }

    /**
     * The cached quote regardless of age. Used as a fallback when the feed is down.
     */
    public Optional<CachedPriceQuote> getAnyAge(String key) {
        return Optional.ofNullable(store.get(key));
    }

    public void put(String key, PriceQuote quote) {
        store.put(key, new CachedPriceQuote(quote, clock.instant()));
        log.info("CACHE_REFRESH key={} price={}", key, quote.price());
    }

    public void clear() {
        int dropped = store.size();
        store.clear();
        log.info("Price cache cleared. entriesDropped={}", dropped);
    }

    public int size() {
        return store.size();
    }
}
