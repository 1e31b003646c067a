package com.legacylens.core.metrics;

import com.legacylens.core.heuristics.HeuristicTables;
import com.legacylens.core.model.ComplexityMetrics;
import com.legacylens.core.model.PerformanceAssessment;
import com.legacylens.core.model.SecurityAssessment;
import com.legacylens.core.util.ScoreMath;

/**
 * Utility for the composite quality score.
 *
 * <p>{@code 0.3 * max(0, 100 - 5 * cc) + 0.25 * security + 0.25 * performance + 0.2 * mi},
 * clamped to [0, 100] and rounded to two decimals.
 */
public final class QualityScoreCalculator {

    private QualityScoreCalculator() {
        // Utility class
    }

    /**
     * Calculates the quality score from the facets it weights.
     *
     * @param complexity complexity facet
     * @param security security facet
     * @param performance performance facet
     * @return quality score in [0, 100]
     */
    public static double calculate(
        ComplexityMetrics complexity,
        SecurityAssessment security,
        PerformanceAssessment performance
    ) {
        double complexityComponent = complexityComponent(complexity.cyclomatic());

        double score = HeuristicTables.QUALITY_COMPLEXITY_WEIGHT * complexityComponent
            + HeuristicTables.QUALITY_SECURITY_WEIGHT * security.score()
            + HeuristicTables.QUALITY_PERFORMANCE_WEIGHT * performance.score()
            + HeuristicTables.QUALITY_MAINTAINABILITY_WEIGHT * complexity.maintainabilityIndex();

        return ScoreMath.percentage(score);
    }

    static double complexityComponent(int cyclomatic) {
        return Math.max(0, 100 - cyclomatic * HeuristicTables.QUALITY_PENALTY_PER_DECISION);
    }
}
