package com.questrail.choreography.observability;

import com.questrail.choreography.simulation.SimulationEvent;
import com.questrail.choreography.simulation.SimulatorState;

import java.time.Instant;

/**
 * Record of one committed simulator step.
 */
public record SimulationTransitionEvent(
    Instant timestamp,
    SimulatorState oldState,
    SimulatorState newState,
    SimulationEvent event
) {
    /**
     * Checks whether this step completed the protocol.
     */
    public boolean isCompletion() {
        return !oldState.completed() && newState.completed();
    }

    /**
     * Checks whether this step entered or left a parallel region.
     */
    public boolean isParallelBoundary() {
        return event.type() == SimulationEvent.Type.FORK || event.type() == SimulationEvent.Type.JOIN;
    }
}
