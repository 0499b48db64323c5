package com.chartsayer.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collection;

/**
 * Per-status position counts for one owner, stopped positions included.
 */
public record PositionsSummary(
    @JsonProperty("total")   int total,
    @JsonProperty("active")  int active,
    @JsonProperty("closed")  int closed,
    @JsonProperty("stopped") int stopped
) {
    public static PositionsSummary of(Collection<Position> positions) {
        int active = 0;
        int closed = 0;
        int stopped = 0;
        for (Position p : positions) {
            switch (p.getStatus()) {
                case ACTIVE  -> active++;
                case CLOSED  -> closed++;
                case STOPPED -> stopped++;
            }
        }
        return new PositionsSummary(positions.size(), active, closed, stopped);
    }
}
