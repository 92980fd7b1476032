package com.questrail.choreography.simulation;

import java.util.Objects;
import java.util.Optional;

/**
 * Why a step was refused. A refused step leaves the simulator state unchanged.
 *
 * @param nodeId node the failure relates to, or {@code null}
 */
public record StepError(Kind kind, String message, Integer nodeId)
{
    public enum Kind {
        /** The protocol already reached its end node. */
        ALREADY_COMPLETED,
        /** The named option does not exist, or no choice is pending. */
        INVALID_CHOICE,
        /** A choice is pending and the strategy requires the caller to name one. */
        CHOICE_REQUIRED,
        /** The cursor rests on a node that cannot be stepped. */
        NODE_NOT_STEPPABLE,
        /** No observable action is reachable, for example an unguarded loop. */
        NO_PROGRESS,
        /** The configured step budget is exhausted. */
        STEP_LIMIT_REACHED,
        /** A recursion label was entered more often than configured. */
        RECURSION_LIMIT_REACHED
    }

    public StepError {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(message, "message");
    }

    public static StepError of(Kind kind, String message) {
        return new StepError(kind, message, null);
    }

    public static StepError at(Kind kind, String message, int nodeId) {
        return new StepError(kind, message, nodeId);
    }

    public Optional<Integer> node() {
        return Optional.ofNullable(nodeId);
    }

    @Override
    public String toString() {
        return kind + ": " + message;
    }
}
