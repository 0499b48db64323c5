package com.chartsayer.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Ownership key of a position: a user id scoped to its chat platform.
 */
public record PositionOwner(
    @JsonProperty("user_id")  String userId,
    @JsonProperty("platform") Platform platform
) {
    public static PositionOwner of(String userId, Platform platform) {
        return new PositionOwner(userId, platform);
    }
}
