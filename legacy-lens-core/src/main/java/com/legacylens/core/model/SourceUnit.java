package com.legacylens.core.model;

import java.util.Objects;

/**
 * The immutable input of one analysis: decoded source text plus an optional display name.
 *
 * <p>The text is taken as-is. Any string is accepted, including empty and malformed
 * sources; only {@code null} text is rejected.
 *
 * @param text decoded source text
 * @param displayName originating file name or path, may be null
 */
public record SourceUnit(
    String text,
    String displayName
) {
    /**
     * Compact constructor with validation.
     */
    public SourceUnit {
        Objects.requireNonNull(text, "text must not be null");
    }

    /**
     * Creates a source unit without a display name.
     *
     * @param text decoded source text
     * @return source unit
     */
    public static SourceUnit of(String text) {
        return new SourceUnit(text, null);
    }

    /**
     * Returns the display name, or the given fallback when none was provided.
     *
     * @param fallback value used when no display name is set
     * @return display name or fallback
     */
    public String displayNameOr(String fallback) {
        return displayName == null || displayName.isBlank() ? fallback : displayName;
    }
}
