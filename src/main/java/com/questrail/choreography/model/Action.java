package com.questrail.choreography.model;

import java.util.Objects;
import java.util.Optional;

/**
 * A single point-to-point message {@code from -> to: label(payload)}.
 *
 * @param from        sending role
 * @param to          receiving role
 * @param label       message label
 * @param payloadType payload type, or {@code null} for an empty payload
 * @param position    source location of the statement
 */
public record Action(Role from,
                     Role to,
                     String label,
                     TypeRef payloadType,
                     SourcePosition position) implements Interaction
{
    public Action {
        Objects.requireNonNull(from, "from");
        Objects.requireNonNull(to, "to");
        Objects.requireNonNull(label, "label");
        Objects.requireNonNull(position, "position");
    }

    public static Action of(String from, String to, String label) {
        return new Action(Role.of(from), Role.of(to), label, null, SourcePosition.UNKNOWN);
    }

    public Optional<TypeRef> payload() {
        return Optional.ofNullable(payloadType);
    }

    public boolean involves(Role role) {
        return from.equals(role) || to.equals(role);
    }

    @Override
    public Kind kind() {
        return Kind.ACTION;
    }

    @Override
    public String toString() {
        return from + " -> " + to + ": " + label + "(" + (payloadType == null ? "" : payloadType.render()) + ")";
    }
}
