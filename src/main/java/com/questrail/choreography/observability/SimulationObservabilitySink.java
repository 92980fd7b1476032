package com.questrail.choreography.observability;

/**
 * Receives simulator observability events.
 * Implementations can provide logging, metrics, or tracing.
 */
public interface SimulationObservabilitySink {
    /**
     * Called after a successful step committed a new simulator state.
     * @param event the transition details
     */
    void onStateTransition(SimulationTransitionEvent event);

    /**
     * Called when a step was refused; the simulator state is unchanged.
     * @param event the rejection details
     */
    void onStepRejected(StepRejectedEvent event);
}
