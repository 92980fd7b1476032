package com.questrail.choreography.model;

import java.util.List;
import java.util.Objects;

/**
 * Concurrent composition. There is no ordering constraint between branches.
 */
public record Parallel(List<Interaction> branches, SourcePosition position) implements Interaction
{
    public Parallel {
        branches = List.copyOf(Objects.requireNonNull(branches, "branches"));
        Objects.requireNonNull(position, "position");
        if (branches.size() < 2) {
            throw new IllegalArgumentException("A parallel block needs at least two branches");
        }
    }

    public static Parallel of(Interaction... branches) {
        return new Parallel(List.of(branches), SourcePosition.UNKNOWN);
    }

    @Override
    public Kind kind() {
        return Kind.PARALLEL;
    }
}
