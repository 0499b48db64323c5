package com.chartsayer.common.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/**
 * Partial update of a position. A {@code null} component means "not provided"
 * and leaves the stored value untouched.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record PositionUpdateRequest(
    @JsonProperty("symbol")      String symbol,
    @JsonProperty("type")        PositionType type,
    @JsonProperty("entry_price") Double entryPrice,
    @JsonProperty("take_profit") Double takeProfit,
    @JsonProperty("stop_loss")   Double stopLoss,
    @JsonProperty("quantity")    Double quantity,
    @JsonProperty("leverage")    Double leverage,
    @JsonProperty("status")      PositionStatus status,
    @JsonProperty("notes")       String notes,
    @JsonProperty("metadata")    Map<String, Object> metadata
) {
    public static PositionUpdateRequest empty() {
        return new PositionUpdateRequest(null, null, null, null, null, null, null, null, null, null);
    }

    public PositionUpdateRequest withSymbol(String newSymbol) {
        return new PositionUpdateRequest(newSymbol, type, entryPrice, takeProfit, stopLoss,
            quantity, leverage, status, notes, metadata);
    }

    public PositionUpdateRequest withStatus(PositionStatus newStatus) {
        return new PositionUpdateRequest(symbol, type, entryPrice, takeProfit, stopLoss,
            quantity, leverage, newStatus, notes, metadata);
    }
}
