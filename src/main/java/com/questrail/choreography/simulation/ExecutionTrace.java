package com.questrail.choreography.simulation;

import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Recorded execution of one simulator run.
 *
 * @param events     emitted events in step order (empty when recording is off)
 * @param startTime  when the run started or was last reset
 * @param endTime    when the protocol completed, or {@code null} while running
 * @param completed  whether the protocol reached its end node
 * @param totalSteps successful steps taken
 */
public record ExecutionTrace(List<SimulationEvent> events,
                             Instant startTime,
                             Instant endTime,
                             boolean completed,
                             int totalSteps)
{
    public ExecutionTrace {
        events = List.copyOf(Objects.requireNonNull(events, "events"));
        Objects.requireNonNull(startTime, "startTime");
    }

    public Optional<Instant> finishedAt() {
        return Optional.ofNullable(endTime);
    }

    public List<SimulationEvent> eventsOfType(SimulationEvent.Type type) {
        return events.stream().filter(e -> e.type() == type).toList();
    }
}
