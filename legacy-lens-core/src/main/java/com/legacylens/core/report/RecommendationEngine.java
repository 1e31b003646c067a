package com.legacylens.core.report;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

import com.legacylens.core.model.MetricsBundle;
import com.legacylens.core.model.Priority;
import com.legacylens.core.model.Rating;
import com.legacylens.core.model.Recommendation;
import com.legacylens.core.model.RecommendationCategory;
import com.legacylens.core.model.StructuralModel;

/**
 * Derives actionable recommendations from metric thresholds.
 *
 * <p>Rules fire independently; the result is sorted Critical, High, Medium, Low and keeps rule
 * order within a priority.
 */
public class RecommendationEngine {

    static final int COMPLEXITY_THRESHOLD = 15;
    static final int MODERNIZATION_THRESHOLD = 70;
    static final int PERFORMANCE_THRESHOLD = 80;
    static final double MAINTAINABILITY_THRESHOLD = 50.0;
    static final double COMMENT_RATIO_THRESHOLD = 0.2;

    /**
     * Applies the rule table.
     *
     * @param model structural model
     * @param metrics metrics bundle
     * @return recommendations, most urgent first
     */
    public List<Recommendation> recommend(StructuralModel model, MetricsBundle metrics) {
        Objects.requireNonNull(model, "model must not be null");
        Objects.requireNonNull(metrics, "metrics must not be null");

        List<Recommendation> recommendations = new ArrayList<>();

        if (metrics.complexity().cyclomatic() > COMPLEXITY_THRESHOLD) {
            recommendations.add(new Recommendation(Priority.HIGH, RecommendationCategory.COMPLEXITY,
                "Reduce Cyclomatic Complexity",
                "Break down complex procedures into smaller, more manageable paragraphs"));
        }

        Rating risk = metrics.security().riskLevel();
        if (risk == Rating.HIGH) {
            recommendations.add(new Recommendation(Priority.CRITICAL, RecommendationCategory.SECURITY,
                "Address Security Vulnerabilities",
                "Review and remediate the " + metrics.security().issues().size() + " identified security issues"));
        } else if (risk == Rating.MEDIUM) {
            recommendations.add(new Recommendation(Priority.MEDIUM, RecommendationCategory.SECURITY,
                "Review Security Findings",
                "Validate inputs and credentials handling flagged by the security scan"));
        }

        if (metrics.modernization().score() < MODERNIZATION_THRESHOLD) {
            recommendations.add(new Recommendation(Priority.MEDIUM, RecommendationCategory.MODERNIZATION,
                "Modernization Opportunities",
                "Consider modernizing legacy patterns and technologies: " + metrics.modernization().recommendedApproach()));
        }

        if (metrics.performance().score() < PERFORMANCE_THRESHOLD) {
            recommendations.add(new Recommendation(Priority.MEDIUM, RecommendationCategory.PERFORMANCE,
                "Optimize Performance Hotspots",
                "Review sort, search and PERFORM-heavy sections for batch window impact"));
        }

        if (metrics.complexity().maintainabilityIndex() < MAINTAINABILITY_THRESHOLD) {
            recommendations.add(new Recommendation(Priority.HIGH, RecommendationCategory.MAINTAINABILITY,
                "Improve Maintainability",
                "Split long procedures and remove dead code to raise the maintainability index"));
        }

        if (model.lineStats().commentRatio() < COMMENT_RATIO_THRESHOLD) {
            recommendations.add(new Recommendation(Priority.LOW, RecommendationCategory.DOCUMENTATION,
                "Improve Inline Documentation",
                "Add comments describing business rules and data usage"));
        }

        recommendations.sort(Comparator.comparing(Recommendation::priority));
        return recommendations;
    }
}
