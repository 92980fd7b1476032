package com.questrail.choreography.simulation;

import com.questrail.choreography.model.Role;
import com.questrail.choreography.model.TypeRef;

import java.util.Objects;

/**
 * SimulationEvent
 * -----------------------------------------------------------------------------
 * Observable outcome of one successful simulator step.
 *
 * <p>
 * Every successful step emits exactly one event. Traversal of initial, merge
 * and recursive nodes is silent and never produces an event of its own.
 * </p>
 */
public sealed interface SimulationEvent
{
    enum Type {
        MESSAGE,
        CHOICE,
        FORK,
        JOIN
    }

    Type type();

    /** One-based number of the step that emitted this event. */
    int stepNumber();

    /** The CFG node the step consumed. */
    int nodeId();

    // ---------------------------------------------------------------------
    // Variants
    // ---------------------------------------------------------------------

    /**
     * A message was exchanged.
     *
     * @param payload payload type, or {@code null} for an empty payload
     */
    record MessageEvent(int stepNumber, int nodeId, Role from, Role to, String label, TypeRef payload)
            implements SimulationEvent {
        public MessageEvent {
            Objects.requireNonNull(from, "from");
            Objects.requireNonNull(to, "to");
            Objects.requireNonNull(label, "label");
        }

        @Override
        public Type type() {
            return Type.MESSAGE;
        }

        @Override
        public String toString() {
            return "message " + from + " -> " + to + ": " + label
                    + "(" + (payload == null ? "" : payload.render()) + ")";
        }
    }

    /**
     * A choice point was resolved.
     *
     * @param selectedLabel the option edge label taken
     * @param targetNode    first node of the selected option
     */
    record ChoiceEvent(int stepNumber, int nodeId, Role at, String selectedLabel, int targetNode)
            implements SimulationEvent {
        public ChoiceEvent {
            Objects.requireNonNull(at, "at");
            Objects.requireNonNull(selectedLabel, "selectedLabel");
        }

        @Override
        public Type type() {
            return Type.CHOICE;
        }

        @Override
        public String toString() {
            return "choice at " + at + ": " + selectedLabel;
        }
    }

    record ForkEvent(int stepNumber, int nodeId, String parallelId, int branchCount)
            implements SimulationEvent {
        public ForkEvent {
            Objects.requireNonNull(parallelId, "parallelId");
        }

        @Override
        public Type type() {
            return Type.FORK;
        }

        @Override
        public String toString() {
            return "fork " + parallelId + " into " + branchCount + " branches";
        }
    }

    record JoinEvent(int stepNumber, int nodeId, String parallelId)
            implements SimulationEvent {
        public JoinEvent {
            Objects.requireNonNull(parallelId, "parallelId");
        }

        @Override
        public Type type() {
            return Type.JOIN;
        }

        @Override
        public String toString() {
            return "join " + parallelId;
        }
    }
}
