package com.questrail.choreography.model;

import java.util.Objects;

/**
 * A module-level {@code type Name as Type;} declaration.
 *
 * <p>
 * Aliases are kept for display and tooling. Payload types in protocol
 * bodies are not rewritten through them.
 * </p>
 */
public record TypeAlias(String name, TypeRef type, SourcePosition position)
{
    public TypeAlias {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(position, "position");
    }

    public static TypeAlias of(String name, TypeRef type) {
        return new TypeAlias(name, type, SourcePosition.UNKNOWN);
    }

    @Override
    public String toString() {
        return "type " + name + " as " + type.render();
    }
}
