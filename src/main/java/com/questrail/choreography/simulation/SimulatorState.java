package com.questrail.choreography.simulation;

import java.util.List;
import java.util.Objects;

/**
 * SimulatorState
 * -----------------------------------------------------------------------------
 * Immutable snapshot of one simulated execution.
 *
 * <h2>Role in the architecture</h2>
 * This is the value consumed and produced by {@link SimulationReducer}. It is
 * pure data: a {@code SimulatorState} never changes, so a snapshot handed out
 * by {@link Simulator#getState()} stays valid after further steps and can be
 * passed back to {@link Simulator#restore(SimulatorState)}.
 *
 * <h2>Contents</h2>
 * <ul>
 *   <li>the root {@link ExecutionCursor} (with child cursors while in parallel)</li>
 *   <li>whether the protocol completed</li>
 *   <li>how many steps were taken</li>
 *   <li>the options of the pending choice point, if any</li>
 *   <li>the recorded events, when trace recording is on</li>
 * </ul>
 */
public final class SimulatorState
{
    private final ExecutionCursor cursor;
    private final boolean completed;
    private final int stepCount;
    private final List<ChoiceOption> availableChoices;
    private final EventLog events;

    private SimulatorState(ExecutionCursor cursor,
                           boolean completed,
                           int stepCount,
                           List<ChoiceOption> availableChoices,
                           EventLog events) {
        this.cursor = Objects.requireNonNull(cursor, "cursor");
        this.completed = completed;
        this.stepCount = stepCount;
        this.availableChoices = List.copyOf(availableChoices);
        this.events = Objects.requireNonNull(events, "events");
    }

    public static SimulatorState of(ExecutionCursor cursor,
                                    boolean completed,
                                    int stepCount,
                                    List<ChoiceOption> availableChoices,
                                    List<SimulationEvent> events) {
        return new SimulatorState(cursor, completed, stepCount, availableChoices, EventLog.of(events));
    }

    static SimulatorState of(ExecutionCursor cursor,
                             boolean completed,
                             int stepCount,
                             List<ChoiceOption> availableChoices,
                             EventLog events) {
        return new SimulatorState(cursor, completed, stepCount, availableChoices, events);
    }

    public ExecutionCursor cursor() {
        return cursor;
    }

    /**
     * Node the root cursor rests on. While in a parallel region this is the fork.
     */
    public int currentNodeId() {
        return cursor.nodeId();
    }

    public boolean completed() {
        return completed;
    }

    public int stepCount() {
        return stepCount;
    }

    public boolean atChoice() {
        return !availableChoices.isEmpty();
    }

    public List<ChoiceOption> availableChoices() {
        return availableChoices;
    }

    public boolean inParallel() {
        return cursor.inParallel();
    }

    public List<ExecutionCursor> activeBranches() {
        return cursor.branches();
    }

    public List<Integer> activeNodeIds() {
        return cursor.leafNodeIds();
    }

    /**
     * Events recorded so far; empty when trace recording is off. Each call
     * builds a fresh unmodifiable list.
     */
    public List<SimulationEvent> events() {
        return events.toList();
    }

    public int eventCount() {
        return events.size();
    }

    EventLog eventLog() {
        return events;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SimulatorState that)) return false;
        return completed == that.completed
                && stepCount == that.stepCount
                && cursor.equals(that.cursor)
                && availableChoices.equals(that.availableChoices)
                && events.equals(that.events);
    }

    @Override
    public int hashCode() {
        return Objects.hash(cursor, completed, stepCount, availableChoices, events);
    }

    @Override
    public String toString() {
        return "SimulatorState{" +
                "nodes=" + activeNodeIds() +
                ", completed=" + completed +
                ", steps=" + stepCount +
                ", atChoice=" + atChoice() +
                ", inParallel=" + inParallel() +
                '}';
    }
}
