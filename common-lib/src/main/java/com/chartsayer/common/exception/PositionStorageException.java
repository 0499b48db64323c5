package com.chartsayer.common.exception;

/**
 * The backing store rejected or failed a write. The store itself never throws;
 * this is raised by the repository when a write reports failure.
 */
public class PositionStorageException extends ChartSayerException {
    private final String key;

    public PositionStorageException(String operation, String key) {
        super("PositionRepository", "Storage write failed. operation=" + operation + " key=" + key);
        this.key = key;
    }

    public String getKey() {
        return key;
    }
}
