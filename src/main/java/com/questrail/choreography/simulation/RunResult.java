package com.questrail.choreography.simulation;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of {@code Simulator.run}.
 *
 * @param completed  whether the protocol reached its end node
 * @param steps      successful steps taken by this run
 * @param events     events emitted by this run, in order
 * @param error      the failure that stopped the run, or {@code null}
 * @param finalState state after the run
 */
public record RunResult(boolean completed,
                        int steps,
                        List<SimulationEvent> events,
                        StepError error,
                        SimulatorState finalState)
{
    public RunResult {
        events = List.copyOf(Objects.requireNonNull(events, "events"));
        Objects.requireNonNull(finalState, "finalState");
    }

    public Optional<StepError> maybeError() {
        return Optional.ofNullable(error);
    }
}
