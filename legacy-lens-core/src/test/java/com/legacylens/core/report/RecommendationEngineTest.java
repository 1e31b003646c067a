package com.legacylens.core.report;

import com.legacylens.core.model.ComplexityMetrics;
import com.legacylens.core.model.LineStats;
import com.legacylens.core.model.MetricsBundle;
import com.legacylens.core.model.ModernizationAssessment;
import com.legacylens.core.model.PerformanceAssessment;
import com.legacylens.core.model.Priority;
import com.legacylens.core.model.ProgramProfile;
import com.legacylens.core.model.Rating;
import com.legacylens.core.model.Recommendation;
import com.legacylens.core.model.RecommendationCategory;
import com.legacylens.core.model.ResourceUsage;
import com.legacylens.core.model.SecurityAssessment;
import com.legacylens.core.model.StructuralModel;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link RecommendationEngine}.
 */
class RecommendationEngineTest {

    private final RecommendationEngine engine = new RecommendationEngine();

    @Test
    void recommend_healthyWellCommentedProgram_returnsNothing() {
        List<Recommendation> recommendations = engine.recommend(
            model(new LineStats(10, 5, 5, 0)), metrics(5, 90.0, Rating.LOW, 90, 100));

        assertThat(recommendations).isEmpty();
    }

    @Test
    void recommend_everyRuleTriggered_sortsByPriorityKeepingRuleOrder() {
        // Given
        StructuralModel model = model(new LineStats(10, 10, 0, 0));
        MetricsBundle metrics = metrics(25, 40.0, Rating.HIGH, 50, 70);

        // When
        List<Recommendation> recommendations = engine.recommend(model, metrics);

        // Then
        assertThat(recommendations).extracting(Recommendation::priority, Recommendation::category)
            .containsExactly(
                tuple(Priority.CRITICAL, RecommendationCategory.SECURITY),
                tuple(Priority.HIGH, RecommendationCategory.COMPLEXITY),
                tuple(Priority.HIGH, RecommendationCategory.MAINTAINABILITY),
                tuple(Priority.MEDIUM, RecommendationCategory.MODERNIZATION),
                tuple(Priority.MEDIUM, RecommendationCategory.PERFORMANCE),
                tuple(Priority.LOW, RecommendationCategory.DOCUMENTATION));
    }

    @Test
    void recommend_mediumSecurityRisk_addsReviewRecommendation() {
        List<Recommendation> recommendations = engine.recommend(
            model(new LineStats(10, 5, 5, 0)), metrics(5, 90.0, Rating.MEDIUM, 90, 100));

        assertThat(recommendations).singleElement()
            .extracting(Recommendation::priority, Recommendation::title)
            .containsExactly(Priority.MEDIUM, "Review Security Findings");
    }

    @Test
    void recommend_thresholdValues_doNotTrigger() {
        // cyclomatic 15, modernization 70, performance 80, maintainability 50, comment ratio 0.2
        List<Recommendation> recommendations = engine.recommend(
            model(new LineStats(10, 8, 2, 0)), metrics(15, 50.0, Rating.LOW, 70, 80));

        assertThat(recommendations).isEmpty();
    }

    @Test
    void recommend_modernizationRecommendation_mentionsApproach() {
        List<Recommendation> recommendations = engine.recommend(
            model(new LineStats(10, 5, 5, 0)), metrics(5, 90.0, Rating.LOW, 50, 100));

        assertThat(recommendations).singleElement()
            .extracting(Recommendation::description).asString()
            .endsWith("Significant refactoring - modernize in phases");
    }

    private static StructuralModel model(LineStats lineStats) {
        return new StructuralModel("PGM", null, null, null, null, null, null, lineStats, Rating.LOW, null);
    }

    private static MetricsBundle metrics(int cyclomatic, double maintainability, Rating risk,
                                         int modernizationScore, int performanceScore) {
        ComplexityMetrics complexity = new ComplexityMetrics(cyclomatic, 0, maintainability, 1.0,
            Rating.LOW, Priority.LOW);
        SecurityAssessment security = new SecurityAssessment(risk, List.of(), 100, List.of());
        ModernizationAssessment modernization = new ModernizationAssessment(modernizationScore, Priority.LOW,
            List.of(), List.of(), 1, "Significant refactoring - modernize in phases", List.of());
        PerformanceAssessment performance = new PerformanceAssessment(performanceScore, List.of(), 0, List.of(),
            ResourceUsage.low());
        return new MetricsBundle(complexity, security, modernization, performance, ProgramProfile.empty(), 75.0);
    }
}
