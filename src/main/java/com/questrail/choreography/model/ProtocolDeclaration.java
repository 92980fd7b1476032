package com.questrail.choreography.model;

import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * ProtocolDeclaration
 * -----------------------------------------------------------------------------
 * A named global protocol: its ordered role set and its root interaction.
 *
 * <p>
 * {@code global} records whether the declaration was written with the
 * {@code global} modifier. It has no effect on the interaction tree.
 * </p>
 */
public record ProtocolDeclaration(String name,
                                  boolean global,
                                  List<Role> roles,
                                  Interaction body,
                                  SourcePosition position)
{
    public ProtocolDeclaration {
        Objects.requireNonNull(name, "name");
        roles = List.copyOf(Objects.requireNonNull(roles, "roles"));
        Objects.requireNonNull(body, "body");
        Objects.requireNonNull(position, "position");

        Set<Role> seen = new HashSet<>();
        for (Role role : roles) {
            if (!seen.add(role)) {
                throw new IllegalArgumentException("Duplicate role: " + role);
            }
        }
    }

    public static ProtocolDeclaration of(String name, List<Role> roles, Interaction body) {
        return new ProtocolDeclaration(name, false, roles, body, SourcePosition.UNKNOWN);
    }

    public boolean declares(Role role) {
        return roles.contains(role);
    }
}
