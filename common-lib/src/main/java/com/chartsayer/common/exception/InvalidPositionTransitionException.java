package com.chartsayer.common.exception;

import com.chartsayer.common.model.PositionStatus;

import java.util.UUID;

/**
 * A close/stop (or status update) was requested on a position already in a terminal
 * state. Nothing was written.
 */
public class InvalidPositionTransitionException extends ChartSayerException {
    private final UUID positionId;
    private final PositionStatus currentStatus;
    private final PositionStatus requestedStatus;

    public InvalidPositionTransitionException(UUID positionId,
                                              PositionStatus currentStatus,
                                              PositionStatus requestedStatus) {
        super("PositionService", "Position " + positionId + " is already "
            + currentStatus.value() + " and cannot become " + requestedStatus.value());
        this.positionId      = positionId;
        this.currentStatus   = currentStatus;
        this.requestedStatus = requestedStatus;
    }

    public UUID getPositionId() {
        return positionId;
    }

    public PositionStatus getCurrentStatus() {
        return currentStatus;
    }

    public PositionStatus getRequestedStatus() {
        return requestedStatus;
    }
}
