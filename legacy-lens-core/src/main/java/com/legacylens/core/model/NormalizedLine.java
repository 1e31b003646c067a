package com.legacylens.core.model;

import java.util.Objects;

/**
 * One physical source line after sequence-area stripping and trailing-whitespace trimming.
 *
 * @param lineNumber 1-based line number in the original text
 * @param text normalized line text
 * @param lineClass blank, comment or code
 */
public record NormalizedLine(
    int lineNumber,
    String text,
    LineClass lineClass
) {
    /**
     * Compact constructor with validation.
     */
    public NormalizedLine {
        Objects.requireNonNull(text, "text must not be null");
        Objects.requireNonNull(lineClass, "lineClass must not be null");
        if (lineNumber < 1) {
            throw new IllegalArgumentException("lineNumber must be 1-based: " + lineNumber);
        }
    }

    public boolean isCode() {
        return lineClass == LineClass.CODE;
    }

    public boolean isComment() {
        return lineClass == LineClass.COMMENT;
    }

    public boolean isBlank() {
        return lineClass == LineClass.BLANK;
    }
}
