package com.legacylens.core.model;

import java.util.List;
import java.util.Objects;

/**
 * Performance facet of the metrics bundle.
 *
 * @param score performance score in [0, 100]
 * @param issues detected performance risks
 * @param executionComplexity {@code procedures * 2 + dependencies * 3}
 * @param optimizationOpportunities suggested optimizations
 * @param resourceUsage resource usage estimate
 */
public record PerformanceAssessment(
    int score,
    List<String> issues,
    int executionComplexity,
    List<String> optimizationOpportunities,
    ResourceUsage resourceUsage
) {
    public PerformanceAssessment {
        Objects.requireNonNull(resourceUsage, "resourceUsage must not be null");
        issues = issues == null ? List.of() : List.copyOf(issues);
        optimizationOpportunities = optimizationOpportunities == null ? List.of() : List.copyOf(optimizationOpportunities);
        if (score < 0 || score > 100) {
            throw new IllegalArgumentException("score out of range: " + score);
        }
    }

    public static PerformanceAssessment defaults() {
        return new PerformanceAssessment(100, List.of(), 0, List.of(), ResourceUsage.low());
    }
}
