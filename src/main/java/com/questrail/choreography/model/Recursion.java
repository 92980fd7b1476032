package com.questrail.choreography.model;

import java.util.Objects;

/**
 * Loop entry point named {@code label}. A {@link Continue} with the same
 * label nested inside {@code body} jumps back here.
 */
public record Recursion(String label, Interaction body, SourcePosition position) implements Interaction
{
    public Recursion {
        Objects.requireNonNull(label, "label");
        Objects.requireNonNull(body, "body");
        Objects.requireNonNull(position, "position");
    }

    public static Recursion of(String label, Interaction body) {
        return new Recursion(label, body, SourcePosition.UNKNOWN);
    }

    @Override
    public Kind kind() {
        return Kind.RECURSION;
    }
}
