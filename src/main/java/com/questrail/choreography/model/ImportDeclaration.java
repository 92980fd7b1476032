package com.questrail.choreography.model;

import java.util.List;
import java.util.Objects;

/**
 * A module-level {@code import "path" { A, B };} declaration.
 *
 * Imports are recorded as written; the path is never resolved.
 *
 * @param modulePath    the quoted path, without quotes
 * @param importedNames names listed in braces; empty when the whole module is imported
 * @param position      source location of the {@code import} keyword
 */
public record ImportDeclaration(String modulePath, List<String> importedNames, SourcePosition position)
{
    public ImportDeclaration {
        Objects.requireNonNull(modulePath, "modulePath");
        importedNames = List.copyOf(Objects.requireNonNull(importedNames, "importedNames"));
        Objects.requireNonNull(position, "position");
    }

    public boolean importsAll() {
        return importedNames.isEmpty();
    }
}
