package com.chartsayer.common.exception;

public class PriceFeedException extends ChartSayerException {

    public PriceFeedException(String message) {
        super("PriceFeed", message);
    }

    public PriceFeedException(String message, Throwable cause) {
        super("PriceFeed", message, cause);
    }
}
