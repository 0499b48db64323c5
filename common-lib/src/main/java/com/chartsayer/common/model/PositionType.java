package com.chartsayer.common.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum PositionType {
    LONG("long"),
    SHORT("short");

    private final String value;

    PositionType(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    @JsonCreator
    public static PositionType fromValue(String raw) {
        if (raw != null) {
            for (PositionType type : values()) {
                if (type.value.equalsIgnoreCase(raw.trim())) {
                    return type;
                }
            }
        }
        throw new IllegalArgumentException("Unknown position type: " + raw);
    }
}
