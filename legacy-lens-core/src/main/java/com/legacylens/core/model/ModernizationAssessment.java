package com.legacylens.core.model;

import java.util.List;
import java.util.Objects;

/**
 * Modernization facet of the metrics bundle.
 *
 * @param score readiness score in [0, 100], lower means more remediation
 * @param priority modernization urgency
 * @param opportunities legacy patterns found, one entry per failed check
 * @param challenges patterns that complicate migration
 * @param effortDays estimated effort, at least one day
 * @param recommendedApproach migration strategy for the score tier
 * @param targetTechnologies suggested replacement technologies
 */
public record ModernizationAssessment(
    int score,
    Priority priority,
    List<String> opportunities,
    List<String> challenges,
    int effortDays,
    String recommendedApproach,
    List<String> targetTechnologies
) {
    public ModernizationAssessment {
        Objects.requireNonNull(priority, "priority must not be null");
        Objects.requireNonNull(recommendedApproach, "recommendedApproach must not be null");
        opportunities = opportunities == null ? List.of() : List.copyOf(opportunities);
        challenges = challenges == null ? List.of() : List.copyOf(challenges);
        targetTechnologies = targetTechnologies == null ? List.of() : List.copyOf(targetTechnologies);
        if (score < 0 || score > 100) {
            throw new IllegalArgumentException("score out of range: " + score);
        }
        if (effortDays < 1) {
            throw new IllegalArgumentException("effortDays must be at least 1: " + effortDays);
        }
    }

    public static ModernizationAssessment defaults() {
        return new ModernizationAssessment(100, Priority.LOW, List.of(), List.of(), 1,
            "Maintenance mode - minor enhancements only", List.of());
    }
}
