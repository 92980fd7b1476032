package com.questrail.choreography.model;

import java.util.List;
import java.util.Objects;

/**
 * Ordered composition of interactions. An empty sequence is the empty
 * protocol (it completes immediately).
 */
public record Sequence(List<Interaction> items, SourcePosition position) implements Interaction
{
    public Sequence {
        items = List.copyOf(Objects.requireNonNull(items, "items"));
        Objects.requireNonNull(position, "position");
    }

    public static Sequence of(Interaction... items) {
        return new Sequence(List.of(items), SourcePosition.UNKNOWN);
    }

    public boolean isEmpty() {
        return items.isEmpty();
    }

    @Override
    public Kind kind() {
        return Kind.SEQUENCE;
    }
}
