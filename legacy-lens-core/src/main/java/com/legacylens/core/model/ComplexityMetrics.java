package com.legacylens.core.model;

import java.util.Objects;

/**
 * Complexity facet of the metrics bundle.
 *
 * @param cyclomatic 1 plus the number of code lines holding a decision keyword
 * @param cognitive nesting-weighted decision count
 * @param maintainabilityIndex bounded maintainability estimate in [0, 100]
 * @param technicalDebtHours estimated remediation effort in hours
 * @param rating complexity rating derived from the cyclomatic value
 * @param refactoringPriority urgency of refactoring work
 */
public record ComplexityMetrics(
    int cyclomatic,
    int cognitive,
    double maintainabilityIndex,
    double technicalDebtHours,
    Rating rating,
    Priority refactoringPriority
) {
    public ComplexityMetrics {
        Objects.requireNonNull(rating, "rating must not be null");
        Objects.requireNonNull(refactoringPriority, "refactoringPriority must not be null");
        if (cyclomatic < 1) {
            throw new IllegalArgumentException("cyclomatic must be at least 1: " + cyclomatic);
        }
        if (maintainabilityIndex < 0 || maintainabilityIndex > 100) {
            throw new IllegalArgumentException("maintainabilityIndex out of range: " + maintainabilityIndex);
        }
    }

    /**
     * Values used when the complexity facet cannot be computed.
     *
     * @return neutral complexity metrics
     */
    public static ComplexityMetrics defaults() {
        return new ComplexityMetrics(1, 0, 100.0, 0.0, Rating.LOW, Priority.LOW);
    }
}
