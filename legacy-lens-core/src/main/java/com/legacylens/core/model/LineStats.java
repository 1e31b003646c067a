package com.legacylens.core.model;

import java.util.List;

/**
 * Line counts of a source unit.
 *
 * <p>{@code code + comment + blank} always equals {@code total}.
 *
 * @param total number of physical lines
 * @param code number of code lines
 * @param comment number of comment lines
 * @param blank number of blank lines
 */
public record LineStats(
    int total,
    int code,
    int comment,
    int blank
) {
    /**
     * Compact constructor with validation.
     */
    public LineStats {
        if (total < 0 || code < 0 || comment < 0 || blank < 0) {
            throw new IllegalArgumentException("Line counts must not be negative");
        }
        if (code + comment + blank != total) {
            throw new IllegalArgumentException(
                "Line counts do not add up: " + code + " + " + comment + " + " + blank + " != " + total);
        }
    }

    /**
     * Counts the classes of the given normalized lines.
     *
     * @param lines normalized lines
     * @return line statistics
     */
    public static LineStats of(List<NormalizedLine> lines) {
        int code = 0;
        int comment = 0;
        int blank = 0;
        for (NormalizedLine line : lines) {
            switch (line.lineClass()) {
                case CODE -> code++;
                case COMMENT -> comment++;
                case BLANK -> blank++;
            }
        }
        return new LineStats(lines.size(), code, comment, blank);
    }

    public static LineStats empty() {
        return new LineStats(0, 0, 0, 0);
    }

    /**
     * Comment lines divided by total lines, with the denominator floored at 1.
     *
     * @return comment ratio in [0, 1]
     */
    public double commentRatio() {
        return (double) comment / Math.max(1, total);
    }
}
