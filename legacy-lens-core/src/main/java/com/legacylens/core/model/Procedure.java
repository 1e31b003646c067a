package com.legacylens.core.model;

import java.util.Objects;

/**
 * A procedure occurrence. Paragraph labels and invoked targets may share a name
 * and are kept as separate entries.
 *
 * @param name procedure name as written in the source
 * @param kind paragraph or invoked
 * @param lineNumber 1-based line of the occurrence
 */
public record Procedure(
    String name,
    ProcedureKind kind,
    int lineNumber
) {
    public Procedure {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(kind, "kind must not be null");
    }
}
