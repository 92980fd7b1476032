package com.questrail.choreography.observability;

/**
 * No-op implementation of SimulationObservabilitySink.
 */
public final class NullObservabilitySink implements SimulationObservabilitySink {
    public static final NullObservabilitySink INSTANCE = new NullObservabilitySink();

    private NullObservabilitySink() {}

    @Override
    public void onStateTransition(SimulationTransitionEvent event) {}

    @Override
    public void onStepRejected(StepRejectedEvent event) {}
}
