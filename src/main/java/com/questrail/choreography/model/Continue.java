package com.questrail.choreography.model;

import java.util.Objects;

/**
 * Jump back to the innermost enclosing {@link Recursion} declaring {@code label}.
 * Control never falls through a continue.
 */
public record Continue(String label, SourcePosition position) implements Interaction
{
    public Continue {
        Objects.requireNonNull(label, "label");
        Objects.requireNonNull(position, "position");
    }

    public static Continue of(String label) {
        return new Continue(label, SourcePosition.UNKNOWN);
    }

    @Override
    public Kind kind() {
        return Kind.CONTINUE;
    }
}
