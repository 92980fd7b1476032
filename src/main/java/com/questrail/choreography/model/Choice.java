package com.questrail.choreography.model;

import java.util.List;
import java.util.Objects;

/**
 * Exclusive alternative. {@code at} names the role whose local decision
 * selects the option; options keep their declaration order.
 */
public record Choice(Role at, List<Interaction> options, SourcePosition position) implements Interaction
{
    public Choice {
        Objects.requireNonNull(at, "at");
        options = List.copyOf(Objects.requireNonNull(options, "options"));
        Objects.requireNonNull(position, "position");
        if (options.size() < 2) {
            throw new IllegalArgumentException("A choice needs at least two options");
        }
    }

    public static Choice at(String role, Interaction... options) {
        return new Choice(Role.of(role), List.of(options), SourcePosition.UNKNOWN);
    }

    @Override
    public Kind kind() {
        return Kind.CHOICE;
    }
}
