package com.chartsayer.common.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * A trading position owned by a (platform, user) pair.
 *
 * <p>Serialized to the key-value store as a snake_case JSON object. Timestamps are
 * UTC local date-times. {@code closedAt} is non-null exactly when the status is
 * {@link PositionStatus#CLOSED}; the mutators below keep that invariant.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class Position {

    @JsonProperty("id")
    private UUID id;

    @JsonProperty("user_id")
    private String userId;

    @JsonProperty("platform")
    private Platform platform;

    @JsonProperty("symbol")
    private String symbol;

    @JsonProperty("type")
    private PositionType type;

    @JsonProperty("entry_price")
    private Double entryPrice;

    @JsonProperty("take_profit")
    private Double takeProfit;

    @JsonProperty("stop_loss")
    private Double stopLoss;

    @JsonProperty("quantity")
    private Double quantity;

    @JsonProperty("leverage")
    private Double leverage;

    @Builder.Default
    @JsonProperty("status")
    private PositionStatus status = PositionStatus.ACTIVE;

    @JsonProperty("created_at")
    private LocalDateTime createdAt;

    @JsonProperty("updated_at")
    private LocalDateTime updatedAt;

    @JsonProperty("closed_at")
    private LocalDateTime closedAt;

    @JsonProperty("notes")
    private String notes;

    @Builder.Default
    @JsonProperty("metadata")
    private Map<String, Object> metadata = new LinkedHashMap<>();

    @JsonIgnore
    public PositionOwner getOwner() {
        return PositionOwner.of(userId, platform);
    }

    public boolean isOwnedBy(PositionOwner owner) {
        return owner != null
            && platform == owner.platform()
            && userId != null
            && userId.equals(owner.userId());
    }

    /**
     * Merges the provided (non-null) fields of {@code update} and refreshes {@code updatedAt}.
     */
    public void applyUpdate(PositionUpdateRequest update, LocalDateTime now) {
        if (update != null) {
            if (update.symbol() != null)     symbol = update.symbol();
            if (update.type() != null)       type = update.type();
            if (update.entryPrice() != null) entryPrice = update.entryPrice();
            if (update.takeProfit() != null) takeProfit = update.takeProfit();
            if (update.stopLoss() != null)   stopLoss = update.stopLoss();
            if (update.quantity() != null)   quantity = update.quantity();
            if (update.leverage() != null)   leverage = update.leverage();
            if (update.status() != null)     status = update.status();
            if (update.notes() != null)      notes = update.notes();
            if (update.metadata() != null)   metadata = new LinkedHashMap<>(update.metadata());
        }
        updatedAt = now;
        syncClosedAt(now);
    }

    /**
     * Marks the position CLOSED. {@code closedAt} is stamped only on the first transition.
     */
    public void close(PositionUpdateRequest extra, LocalDateTime now) {
        PositionUpdateRequest fields = extra != null ? extra : PositionUpdateRequest.empty();
        applyUpdate(fields.withStatus(PositionStatus.CLOSED), now);
    }

    /** Soft delete. */
    public void stop(LocalDateTime now) {
        status = PositionStatus.STOPPED;
        updatedAt = now;
        syncClosedAt(now);
    }

    private void syncClosedAt(LocalDateTime now) {
        if (status == PositionStatus.CLOSED) {
            if (closedAt == null) {
                closedAt = now;
            }
        } else {
            closedAt = null;
        }
    }
}
