package com.questrail.choreography.observability;

import com.questrail.choreography.simulation.SimulatorState;
import com.questrail.choreography.simulation.StepError;

import java.time.Instant;

/**
 * Record of a refused step.
 *
 * @param requestedChoice the option label the caller passed, or {@code null}
 */
public record StepRejectedEvent(
    Instant timestamp,
    SimulatorState state,
    String requestedChoice,
    StepError error
) {
}
