package com.legacylens.core.model;

import java.util.Objects;

/**
 * All metric facets computed for one source unit.
 *
 * @param complexity complexity facet
 * @param security security facet
 * @param modernization modernization facet
 * @param performance performance facet
 * @param profile behavioural profile
 * @param qualityScore weighted composite in [0, 100]
 */
public record MetricsBundle(
    ComplexityMetrics complexity,
    SecurityAssessment security,
    ModernizationAssessment modernization,
    PerformanceAssessment performance,
    ProgramProfile profile,
    double qualityScore
) {
    public MetricsBundle {
        Objects.requireNonNull(complexity, "complexity must not be null");
        Objects.requireNonNull(security, "security must not be null");
        Objects.requireNonNull(modernization, "modernization must not be null");
        Objects.requireNonNull(performance, "performance must not be null");
        Objects.requireNonNull(profile, "profile must not be null");
        if (qualityScore < 0 || qualityScore > 100) {
            throw new IllegalArgumentException("qualityScore out of range: " + qualityScore);
        }
    }
}
