package com.chartsayer.common.exception;

public class PositionValidationException extends ChartSayerException {

    public PositionValidationException(String message) {
        super("PositionService", message);
    }

    public PositionValidationException(String message, Throwable cause) {
        super("PositionService", message, cause);
    }
}
