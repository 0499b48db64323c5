package com.chartsayer.common.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Lifecycle status of a {@link Position}.
 *
 * <p>{@code ACTIVE} is the only non-terminal state. {@code CLOSED} marks a completed
 * trade; {@code STOPPED} is a soft delete (the user stopped tracking the position).
 */
public enum PositionStatus {
    ACTIVE("active"),
    CLOSED("closed"),
    STOPPED("stopped");

    private final String value;

    PositionStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    public boolean isTerminal() {
        return this != ACTIVE;
    }

    @JsonCreator
    public static PositionStatus fromValue(String raw) {
        if (raw != null) {
            for (PositionStatus status : values()) {
                if (status.value.equalsIgnoreCase(raw.trim())) {
                    return status;
                }
            }
        }
        throw new IllegalArgumentException("Unknown position status: " + raw);
    }
}
