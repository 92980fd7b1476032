package com.questrail.choreography.model;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * The result of parsing one source text: its imports, type aliases and
 * protocol declarations, each in source order. Protocol names are unique
 * within a module, and so are alias names.
 */
public record ProtocolModule(List<ImportDeclaration> imports,
                             List<TypeAlias> typeAliases,
                             List<ProtocolDeclaration> declarations)
{
    public ProtocolModule {
        imports = List.copyOf(Objects.requireNonNull(imports, "imports"));
        typeAliases = List.copyOf(Objects.requireNonNull(typeAliases, "typeAliases"));
        declarations = List.copyOf(Objects.requireNonNull(declarations, "declarations"));

        long distinct = declarations.stream().map(ProtocolDeclaration::name).distinct().count();
        if (distinct != declarations.size()) {
            throw new IllegalArgumentException("Protocol names must be unique within a module");
        }
        long distinctAliases = typeAliases.stream().map(TypeAlias::name).distinct().count();
        if (distinctAliases != typeAliases.size()) {
            throw new IllegalArgumentException("Type alias names must be unique within a module");
        }
    }

    public ProtocolModule(List<ProtocolDeclaration> declarations) {
        this(List.of(), List.of(), declarations);
    }

    public Optional<ProtocolDeclaration> find(String name) {
        return declarations.stream()
                .filter(d -> d.name().equals(name))
                .findFirst();
    }

    public Optional<TypeAlias> typeAlias(String name) {
        return typeAliases.stream()
                .filter(a -> a.name().equals(name))
                .findFirst();
    }

    public boolean isEmpty() {
        return declarations.isEmpty() && typeAliases.isEmpty() && imports.isEmpty();
    }
}
