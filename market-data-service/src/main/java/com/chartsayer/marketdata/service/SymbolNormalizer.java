package com.chartsayer.marketdata.service;

import java.util.List;
import java.util.Locale;

/**
 * Turns trading-pair symbols into the base asset symbol used for price lookups,
 * e.g. {@code btcusdt} to {@code BTC}.
 */
public final class SymbolNormalizer {

    // longest first, so ETHBUSD loses BUSD rather than USD
    static final List<String> QUOTE_SUFFIXES = List.of("USDT", "USDC", "BUSD", "USD");

    private SymbolNormalizer() {}

    /**
     * Uppercases and trims, then strips one quote-currency suffix if a non-empty base
     * symbol remains. A symbol that is only a suffix ({@code USD}, {@code USDT}) is kept.
     */
    public static String normalize(String symbol) {
        if (symbol == null) {
            return "";
        }
        String upper = symbol.trim().toUpperCase(Locale.ROOT);
        for (String suffix : QUOTE_SUFFIXES) {
            if (upper.endsWith(suffix) && upper.length() > suffix.length()) {
                return upper.substring(0, upper.length() - suffix.length());
            }
        }
        return upper;
    }

    public static String normalizeCurrency(String currency) {
        if (currency == null || currency.isBlank()) {
            return "USD";
        }
        return currency.trim().toUpperCase(Locale.ROOT);
    }
}
