package com.legacylens.core.model;

import java.util.Objects;

/**
 * How many programs of a portfolio call a dependency.
 *
 * @param name dependency name
 * @param count number of programs referencing it
 */
public record DependencyUsage(
    String name,
    int count
) {
    public DependencyUsage {
        Objects.requireNonNull(name, "name must not be null");
    }
}
