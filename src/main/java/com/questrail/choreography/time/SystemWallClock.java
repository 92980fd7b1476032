package com.questrail.choreography.time;

import java.time.Instant;

/**
 * SystemWallClock
 * =============================================================================
 * Production {@link WallClock} backed by {@link Instant#now()}.
 *
 * <h2>Thread Safety</h2>
 * <p>Stateless and safe for concurrent use by any number of simulators.</p>
 */
public enum SystemWallClock implements WallClock {
    /**
     * Singleton instance.
     */
    INSTANCE;

    @Override
    public Instant now() {
        return Instant.now();
    }
}
