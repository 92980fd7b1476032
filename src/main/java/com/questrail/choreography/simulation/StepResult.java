package com.questrail.choreography.simulation;

import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of one {@code step} call.
 *
 * @param success whether the step was taken
 * @param event   the emitted event on success, otherwise {@code null}
 * @param error   the refusal reason on failure, otherwise {@code null}
 * @param state   the state after the call (the unchanged state on failure)
 */
public record StepResult(boolean success, SimulationEvent event, StepError error, SimulatorState state)
{
    public StepResult {
        Objects.requireNonNull(state, "state");
        if (success && (event == null || error != null)) {
            throw new IllegalArgumentException("A successful step carries an event and no error");
        }
        if (!success && (error == null || event != null)) {
            throw new IllegalArgumentException("A failed step carries an error and no event");
        }
    }

    public static StepResult ok(SimulationEvent event, SimulatorState state) {
        return new StepResult(true, event, null, state);
    }

    public static StepResult failed(StepError error, SimulatorState state) {
        return new StepResult(false, null, error, state);
    }

    public Optional<SimulationEvent> maybeEvent() {
        return Optional.ofNullable(event);
    }

    public Optional<StepError> maybeError() {
        return Optional.ofNullable(error);
    }
}
