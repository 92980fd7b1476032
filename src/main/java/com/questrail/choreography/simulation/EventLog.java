package com.questrail.choreography.simulation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Append-only event history shared between successive {@link SimulatorState}s.
 *
 * <p>Each log is a link to its predecessor plus one event, so appending is
 * constant time and a snapshot taken earlier never sees later events.
 * {@link #toList()} materializes the events in step order.</p>
 */
final class EventLog
{
    static final EventLog EMPTY = new EventLog(null, null, 0);

    private final EventLog previous;
    private final SimulationEvent last;
    private final int size;

    private EventLog(EventLog previous, SimulationEvent last, int size) {
        this.previous = previous;
        this.last = last;
        this.size = size;
    }

    static EventLog of(List<SimulationEvent> events) {
        EventLog log = EMPTY;
        for (SimulationEvent event : events) {
            log = log.append(event);
        }
        return log;
    }

    EventLog append(SimulationEvent event) {
        return new EventLog(this, Objects.requireNonNull(event, "event"), size + 1);
    }

    int size() {
        return size;
    }

    List<SimulationEvent> toList() {
        if (size == 0) {
            return List.of();
        }
        List<SimulationEvent> events = new ArrayList<>(size);
        for (EventLog log = this; log.size > 0; log = log.previous) {
            events.add(log.last);
        }
        Collections.reverse(events);
        return Collections.unmodifiableList(events);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof EventLog that)) return false;
        if (size != that.size) return false;
        EventLog a = this;
        EventLog b = that;
        while (a != b && a.size > 0) {
            if (!a.last.equals(b.last)) return false;
            a = a.previous;
            b = b.previous;
        }
        return true;
    }

    @Override
    public int hashCode() {
        return toList().hashCode();
    }
}
