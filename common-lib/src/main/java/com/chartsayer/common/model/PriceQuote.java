package com.chartsayer.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Price snapshot for one symbol in one quote currency. Immutable; a refresh
 * replaces the whole quote.
 */
public record PriceQuote(
    @JsonProperty("symbol")             String symbol,
    @JsonProperty("name")               String name,
    @JsonProperty("price")              double price,
    @JsonProperty("percent_change_1h")  double percentChange1h,
    @JsonProperty("percent_change_24h") double percentChange24h,
    @JsonProperty("percent_change_7d")  double percentChange7d,
    @JsonProperty("market_cap")         double marketCap,
    @JsonProperty("volume_24h")         double volume24h,
    @JsonProperty("last_updated")       String lastUpdated,
    @JsonProperty("currency")           String currency
) {}
