package com.chartsayer.common.exception;

public class ChartSayerException extends RuntimeException {
    private final String component;

    public ChartSayerException(String component, String message) {
        super("[" + component + "] " + message);
        this.component = component;
    }

    public ChartSayerException(String component, String message, Throwable cause) {
        super("[" + component + "] " + message, cause);
        this.component = component;
    }

    public String getComponent() {
        return component;
    }
}
