package com.questrail.choreography.model;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Reference to a payload type, e.g. {@code String} or {@code Map<Key, List<Item>>}.
 *
 * <p>
 * Types are carried through the pipeline for display only; no type checking
 * is performed on payloads.
 * </p>
 */
public record TypeRef(String name, List<TypeRef> arguments)
{
    public TypeRef {
        Objects.requireNonNull(name, "name");
        arguments = List.copyOf(Objects.requireNonNull(arguments, "arguments"));
    }

    public static TypeRef simple(String name) {
        return new TypeRef(name, List.of());
    }

    public static TypeRef parametric(String name, TypeRef... arguments) {
        return new TypeRef(name, List.of(arguments));
    }

    public boolean isParametric() {
        return !arguments.isEmpty();
    }

    /**
     * Renders the type back to its surface syntax.
     */
    public String render() {
        if (arguments.isEmpty()) {
            return name;
        }
        return name + arguments.stream()
                .map(TypeRef::render)
                .collect(Collectors.joining(", ", "<", ">"));
    }

    @Override
    public String toString() {
        return render();
    }
}
