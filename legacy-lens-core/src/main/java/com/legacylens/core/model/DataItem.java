package com.legacylens.core.model;

import java.util.Objects;

/**
 * A storage declaration from the working-storage region.
 *
 * @param level two-digit level number (01, 05, 77, 88, ...)
 * @param name declared name
 * @param lineNumber 1-based line of the declaration
 * @param rawDefinition trimmed declaration line
 * @param picture PIC clause (e.g. {@code X(10)}, {@code 9(5)V99}), or null when absent
 */
public record DataItem(
    int level,
    String name,
    int lineNumber,
    String rawDefinition,
    String picture
) {
    public DataItem {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(rawDefinition, "rawDefinition must not be null");
    }

    public boolean hasPicture() {
        return picture != null;
    }
}
