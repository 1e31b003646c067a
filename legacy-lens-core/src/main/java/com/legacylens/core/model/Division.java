package com.legacylens.core.model;

import java.util.Objects;

/**
 * A division header occurrence.
 *
 * @param name upper-case division name (IDENTIFICATION, ENVIRONMENT, DATA, PROCEDURE)
 * @param startLine 1-based line of the header
 */
public record Division(
    String name,
    int startLine
) {
    public Division {
        Objects.requireNonNull(name, "name must not be null");
    }
}
