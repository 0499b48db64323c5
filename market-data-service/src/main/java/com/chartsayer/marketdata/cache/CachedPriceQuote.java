package com.chartsayer.marketdata.cache;

import com.chartsayer.common.model.PriceQuote;

import java.time.Duration;
import java.time.Instant;

/**
 * Immutable cache entry wrapping a {@link PriceQuote} with its fetch timestamp.
 * Entries are replaced whole, never mutated.
 */
public record CachedPriceQuote(
    PriceQuote quote,
    Instant fetchedAt
) {
    public Duration age(Instant now) {
        return Duration.between(fetchedAt, now);
    }

    /** Fresh while strictly younger than {@code maxAge}. */
    public boolean isFresh(Instant now, Duration maxAge) {
        return age(now).compareTo(maxAge) < 0;
    }
}
