package com.chartsayer.marketdata.provider;

import com.chartsayer.common.model.PriceQuote;
import reactor.core.publisher.Mono;

import java.util.Collection;
import java.util.Map;

/**
 * Upstream source of price quotes: CoinMarketCap when an API key is configured,
 * otherwise the mock feed.
 */
public interface PriceFeedProvider {

    /**
     * Fetches quotes for all {@code symbols} in one upstream round trip. The result is
     * keyed by normalized symbol; symbols the feed does not know are left out.
     */
    Mono<Map<String, PriceQuote>> fetchQuotes(Collection<String> symbols, String currency);
}
