package com.chartsayer.common.exception;

import com.chartsayer.common.model.PositionOwner;

import java.util.UUID;

/**
 * The position exists but belongs to a different (user, platform) pair.
 * Distinct from "not found" so callers can tell the user the position isn't theirs.
 */
public class PositionOwnershipException extends ChartSayerException {
    private final UUID positionId;
    private final PositionOwner requester;

    public PositionOwnershipException(UUID positionId, PositionOwner requester) {
        super("PositionService", "Position " + positionId + " is not owned by " + describe(requester));
        this.positionId = positionId;
        this.requester  = requester;
    }

    private static String describe(PositionOwner requester) {
        if (requester == null) {
            return "an anonymous requester";
        }
        String platform = requester.platform() != null ? requester.platform().value() : "unknown platform";
        return "user " + requester.userId() + " on " + platform;
    }

    public UUID getPositionId() {
        return positionId;
    }

    public PositionOwner getRequester() {
        return requester;
    }
}
