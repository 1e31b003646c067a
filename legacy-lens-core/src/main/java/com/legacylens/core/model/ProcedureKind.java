package com.legacylens.core.model;

/**
 * How a procedure name was found.
 */
public enum ProcedureKind {
    /** Standalone label line such as {@code MAIN-LOGIC.} */
    PARAGRAPH,
    /** Target of a {@code PERFORM} statement. */
    INVOKED
}
