package com.questrail.choreography.model;

import java.util.Objects;

/**
 * A named protocol participant.
 *
 * <p>
 * Roles are opaque: two roles are the same participant iff their names are
 * equal. A role is declared once in a protocol header and referenced by every
 * message action involving it.
 * </p>
 */
public record Role(String name)
{
    public Role {
        Objects.requireNonNull(name, "name");
        if (name.isBlank()) {
            throw new IllegalArgumentException("Role name must not be blank");
        }
    }

    public static Role of(String name) {
        return new Role(name);
    }

    @Override
    public String toString() {
        return name;
    }
}
