package com.chartsayer.common.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Chat platform a user identity is scoped to. A user id is only unique
 * within its platform.
 */
public enum Platform {
    DISCORD("discord"),
    TELEGRAM("telegram");

    private final String value;

    Platform(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    /**
     * Case-insensitive lookup accepting either the wire value ({@code "discord"})
     * or the constant name ({@code "DISCORD"}).
     */
    @JsonCreator
    public static Platform fromValue(String raw) {
        if (raw != null) {
            for (Platform platform : values()) {
                if (platform.value.equalsIgnoreCase(raw.trim())) {
                    return platform;
                }
            }
        }
        throw new IllegalArgumentException("Unknown platform: " + raw);
    }
}
