package com.resourcex.locator;

import com.resourcex.exception.TimestepNotFoundException;
import com.resourcex.model.TimeAxis;

import java.time.Instant;

/**
 * Resolves timestamps to positions on a time axis. Only exact matches
 * resolve; there is no snapping to the nearest step.
 */
public class TemporalLocator {

    private final TimeAxis timeAxis;

    public TemporalLocator(TimeAxis timeAxis) {
        this.timeAxis = timeAxis;
    }

    public int positionOf(String timestep) {
        return positionOf(TimestampParser.parse(timestep));
    }

    public int positionOf(Instant timestep) {
        int position = timeAxis.positionOf(timestep);
        if (position < 0) {
            throw new TimestepNotFoundException(timestep);
        }
        return position;
    }
}
