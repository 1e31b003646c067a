package com.legacylens.core.model;

import java.util.List;
import java.util.Objects;

/**
 * Security facet of the metrics bundle.
 *
 * @param riskLevel highest risk reached while scanning
 * @param issues every match in scan order, duplicates across lines kept
 * @param score {@code max(0, 100 - 10 * issues)}
 * @param recommendations remediation advice per issue kind found
 */
public record SecurityAssessment(
    Rating riskLevel,
    List<SecurityIssue> issues,
    int score,
    List<String> recommendations
) {
    public SecurityAssessment {
        Objects.requireNonNull(riskLevel, "riskLevel must not be null");
        issues = issues == null ? List.of() : List.copyOf(issues);
        recommendations = recommendations == null ? List.of() : List.copyOf(recommendations);
        if (score < 0 || score > 100) {
            throw new IllegalArgumentException("score out of range: " + score);
        }
    }

    public static SecurityAssessment defaults() {
        return new SecurityAssessment(Rating.LOW, List.of(), 100, List.of());
    }
}
