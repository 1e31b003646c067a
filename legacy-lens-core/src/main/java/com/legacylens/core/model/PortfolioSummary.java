package com.legacylens.core.model;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Aggregate view over many analyzed programs.
 *
 * @param programCount number of programs
 * @param totalLines sum of physical lines
 * @param complexityBreakdown programs per structural complexity seed, every rating present
 * @param commonDependencies most referenced dependencies, most used first
 * @param callRelationships caller-to-callee edges
 * @param averageQualityScore mean quality score, 0 for an empty portfolio
 * @param degradedPrograms source names whose extraction was degraded
 */
public record PortfolioSummary(
    int programCount,
    int totalLines,
    Map<Rating, Integer> complexityBreakdown,
    List<DependencyUsage> commonDependencies,
    List<CallRelationship> callRelationships,
    double averageQualityScore,
    List<String> degradedPrograms
) {
    public PortfolioSummary {
        Map<Rating, Integer> breakdown = new EnumMap<>(Rating.class);
        for (Rating rating : Rating.values()) {
            breakdown.put(rating, complexityBreakdown == null ? 0 : complexityBreakdown.getOrDefault(rating, 0));
        }
        complexityBreakdown = Collections.unmodifiableMap(breakdown);
        commonDependencies = commonDependencies == null ? List.of() : List.copyOf(commonDependencies);
        callRelationships = callRelationships == null ? List.of() : List.copyOf(callRelationships);
        degradedPrograms = degradedPrograms == null ? List.of() : List.copyOf(degradedPrograms);
    }
}
