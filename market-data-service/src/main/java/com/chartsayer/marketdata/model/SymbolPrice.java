package com.chartsayer.marketdata.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Bare price of a symbol. {@code price} is null when no quote could be found.
 */
public record SymbolPrice(
    @JsonProperty("symbol")   String symbol,
    @JsonProperty("price")    Double price,
    @JsonProperty("currency") String currency
) {}
