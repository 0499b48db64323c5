package com.chartsayer.marketdata.controller;

import com.chartsayer.common.model.PriceQuote;
import com.chartsayer.marketdata.model.SymbolPrice;
import com.chartsayer.marketdata.service.PriceService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/prices")
public class PriceController {

    private static final Logger log = LoggerFactory.getLogger(PriceController.class);

    private final PriceService priceService;

    public PriceController(PriceService priceService) {
        this.priceService = priceService;
    }

    @GetMapping("/{symbol}")
    public Mono<ResponseEntity<PriceQuote>> price(@PathVariable String symbol,
                                                  @RequestParam(defaultValue = "USD") String currency,
                                                  @RequestParam(required = false) Long maxAgeSeconds) {
        log.info("Price requested. symbol={} currency={}", symbol, currency);
        Mono<PriceQuote> quote = maxAgeSeconds != null
            ? priceService.getCryptoPrice(symbol, currency, Duration.ofSeconds(maxAgeSeconds))
            : priceService.getCryptoPrice(symbol, currency);
        return quote
            .map(ResponseEntity::ok)
            .defaultIfEmpty(ResponseEntity.notFound().build());
    }

    @GetMapping("/{symbol}/simple")
    public Mono<SymbolPrice> simplePrice(@PathVariable String symbol,
                                         @RequestParam(defaultValue = "USD") String currency) {
        return priceService.getPriceBySymbol(symbol, currency);
    }

    @GetMapping
    public Mono<Map<String, PriceQuote>> prices(@RequestParam String symbols,
                                                @RequestParam(defaultValue = "USD") String currency) {
        List<String> requested = Arrays.stream(symbols.split(","))
            .map(String::trim)
            .filter(s -> !s.isEmpty())
            .toList();
        log.info("Batch price requested. symbols={} currency={}", requested, currency);
        return priceService.getMultipleCryptoPrices(requested, currency);
    }

    @DeleteMapping("/cache")
    public Mono<ResponseEntity<Void>> clearCache() {
        log.info("Price cache clear requested");
        priceService.clearPriceCache();
        return Mono.just(ResponseEntity.noContent().build());
    }

    @GetMapping("/health")
    public Mono<ResponseEntity<String>> health() {
        return Mono.just(ResponseEntity.ok("OK"));
    }
}
