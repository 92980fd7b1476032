package com.questrail.choreography.observability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Production implementation of SimulationObservabilitySink that emits logs via SLF4J.
 */
public final class Slf4jSimulationObservabilitySink implements SimulationObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger(Slf4jSimulationObservabilitySink.class);

    @Override
    public void onStateTransition(SimulationTransitionEvent event) {
        if (event.isParallelBoundary()) {
            log.info("Simulation step {}: {}", event.event().stepNumber(), event.event());
        } else {
            log.debug("Simulation step {}: {}", event.event().stepNumber(), event.event());
        }

        if (event.isCompletion()) {
            log.info("Simulation completed after {} steps", event.newState().stepCount());
        }
    }

    @Override
    public void onStepRejected(StepRejectedEvent event) {
        log.warn("Simulation step rejected at step {}: {} ({})",
            event.state().stepCount(),
            event.error().kind(),
            event.error().message());
    }
}
