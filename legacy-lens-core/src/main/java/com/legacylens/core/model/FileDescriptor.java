package com.legacylens.core.model;

import java.util.Objects;

/**
 * A file description entry ({@code FD}) from the file section.
 *
 * @param name file name
 * @param rawDefinition matched {@code FD <name>} text
 */
public record FileDescriptor(
    String name,
    String rawDefinition
) {
    public FileDescriptor {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(rawDefinition, "rawDefinition must not be null");
    }
}
