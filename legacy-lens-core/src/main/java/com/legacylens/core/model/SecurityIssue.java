package com.legacylens.core.model;

import java.util.Objects;

/**
 * A line matched by a security heuristic.
 *
 * @param kind rule identifier (e.g. {@code DYNAMIC_SQL})
 * @param severity rule severity
 * @param description human-readable description
 * @param lineNumber 1-based line of the match
 * @param lineContent trimmed text of the matching line
 */
public record SecurityIssue(
    String kind,
    Rating severity,
    String description,
    int lineNumber,
    String lineContent
) {
    public SecurityIssue {
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(severity, "severity must not be null");
        Objects.requireNonNull(description, "description must not be null");
    }
}
