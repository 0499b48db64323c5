package com.chartsayer.marketdata.service;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.assertEquals;

class SymbolNormalizerTest {

    @ParameterizedTest(name = "{0} -> {1}")
    @DisplayName("quote-currency suffix is stripped when a base symbol remains")
    @CsvSource({
        "BTCUSDT,  BTC",
        "btcusdt,  BTC",
        "' eth ',  ETH",
        "ETHUSD,   ETH",
        "SOLUSDC,  SOL",
        // stablecoin suffixes are tried before USD on purpose: ETHBUSD is ETH, never ETHB
        "ETHBUSD,  ETH",
        "DOGE,     DOGE",
        "USD,      USD",
        "USDT,     USDT",
        "USDC,     USDC",
        "USDUSDT,  USD",
        "BUSD,     B"
    })
    void normalize(String raw, String expected) {
        assertEquals(expected, SymbolNormalizer.normalize(raw));
    }

    @ParameterizedTest(name = "currency {0} -> {1}")
    @DisplayName("currency is uppercased and defaults to USD")
    @CsvSource({
        "usd, USD",
        "eur, EUR",
        "'',  USD"
    })
    void currency(String raw, String expected) {
        assertEquals(expected, SymbolNormalizer.normalizeCurrency(raw));
    }
}
