package com.questrail.choreography.time;

import java.time.Instant;

/**
 * WallClock
 * =============================================================================
 * Wall-clock source used strictly for trace and observability timestamps.
 *
 * <p>
 * Simulation semantics never depend on time. A step taken at any instant has
 * the same outcome; only the timestamps attached to traces and sink events
 * come from this clock.
 * </p>
 */
public interface WallClock
{
    /**
     * Returns the current wall-clock time.
     */
    Instant now();
}
