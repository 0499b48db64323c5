package com.chartsayer.common.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/**
 * Fields a caller supplies to open a position. Id, status and timestamps are
 * assigned by the registry.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record PositionCreateRequest(
    @JsonProperty("user_id")     String userId,
    @JsonProperty("platform")    Platform platform,
    @JsonProperty("symbol")      String symbol,
    @JsonProperty("type")        PositionType type,
    @JsonProperty("entry_price") Double entryPrice,
    @JsonProperty("take_profit") Double takeProfit,
    @JsonProperty("stop_loss")   Double stopLoss,
    @JsonProperty("quantity")    Double quantity,
    @JsonProperty("leverage")    Double leverage,
    @JsonProperty("notes")       String notes,
    @JsonProperty("metadata")    Map<String, Object> metadata
) {
    public PositionOwner owner() {
        return PositionOwner.of(userId, platform);
    }

    public PositionCreateRequest withSymbol(String newSymbol) {
        return new PositionCreateRequest(userId, platform, newSymbol, type, entryPrice,
            takeProfit, stopLoss, quantity, leverage, notes, metadata);
    }
}
