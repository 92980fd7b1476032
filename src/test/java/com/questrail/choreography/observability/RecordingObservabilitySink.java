package com.questrail.choreography.observability;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Test sink that records events for assertions.
 */
public final class RecordingObservabilitySink implements SimulationObservabilitySink {
    private final List<Object> events = new ArrayList<>();

    @Override
    public synchronized void onStateTransition(SimulationTransitionEvent event) {
        events.add(event);
    }

    @Override
    public synchronized void onStepRejected(StepRejectedEvent event) {
        events.add(event);
    }

    public synchronized List<Object> getAllEvents() {
        return new ArrayList<>(events);
    }

    public synchronized List<SimulationTransitionEvent> getStateTransitions() {
        return events.stream()
            .filter(e -> e instanceof SimulationTransitionEvent)
            .map(e -> (SimulationTransitionEvent) e)
            .collect(Collectors.toList());
    }

    public synchronized List<StepRejectedEvent> getRejections() {
        return events.stream()
            .filter(e -> e instanceof StepRejectedEvent)
            .map(e -> (StepRejectedEvent) e)
            .collect(Collectors.toList());
    }
}
