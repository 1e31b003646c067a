package com.legacylens.core.metrics;

import java.util.List;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.legacylens.core.model.ComplexityMetrics;
import com.legacylens.core.model.MetricsBundle;
import com.legacylens.core.model.ModernizationAssessment;
import com.legacylens.core.model.NormalizedLine;
import com.legacylens.core.model.PerformanceAssessment;
import com.legacylens.core.model.ProgramProfile;
import com.legacylens.core.model.SecurityAssessment;
import com.legacylens.core.model.StructuralModel;

/**
 * Computes the {@link MetricsBundle} of a structural model.
 *
 * <p>Each facet runs independently. A facet that throws is replaced by its
 * {@link MetricFacet#fallback()} value and logged, so computing a bundle never fails for a
 * valid model. The engine holds no mutable state and may be shared across threads.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * MetricsEngine engine = new MetricsEngine();
 * MetricsBundle metrics = engine.compute(model, normalizedLines);
 * metrics.qualityScore(); // e.g. 78.35
 * }</pre>
 */
public class MetricsEngine {

    private static final Logger log = LoggerFactory.getLogger(MetricsEngine.class);

    private final MetricFacet<ComplexityMetrics> complexity;
    private final MetricFacet<SecurityAssessment> security;
    private final MetricFacet<ModernizationAssessment> modernization;
    private final MetricFacet<PerformanceAssessment> performance;
    private final MetricFacet<ProgramProfile> profiler;

    public MetricsEngine() {
        this(new ComplexityAnalyzer(), new SecurityAnalyzer(), new ModernizationAnalyzer(),
            new PerformanceAnalyzer(), new ProgramProfiler());
    }

    public MetricsEngine(
        MetricFacet<ComplexityMetrics> complexity,
        MetricFacet<SecurityAssessment> security,
        MetricFacet<ModernizationAssessment> modernization,
        MetricFacet<PerformanceAssessment> performance,
        MetricFacet<ProgramProfile> profiler
    ) {
        this.complexity = Objects.requireNonNull(complexity, "complexity must not be null");
        this.security = Objects.requireNonNull(security, "security must not be null");
        this.modernization = Objects.requireNonNull(modernization, "modernization must not be null");
        this.performance = Objects.requireNonNull(performance, "performance must not be null");
        this.profiler = Objects.requireNonNull(profiler, "profiler must not be null");
    }

    /**
     * Computes every facet and the composite quality score.
     *
     * @param model structural model
     * @param lines normalized lines the model was extracted from
     * @return metrics bundle
     * @throws NullPointerException if model or lines is null
     */
    public MetricsBundle compute(StructuralModel model, List<NormalizedLine> lines) {
        Objects.requireNonNull(model, "model must not be null");
        Objects.requireNonNull(lines, "lines must not be null");

        ComplexityMetrics complexityMetrics = evaluate(complexity, model, lines);
        SecurityAssessment securityAssessment = evaluate(security, model, lines);
        ModernizationAssessment modernizationAssessment = evaluate(modernization, model, lines);
        PerformanceAssessment performanceAssessment = evaluate(performance, model, lines);
        ProgramProfile profile = evaluate(profiler, model, lines);

        double qualityScore = QualityScoreCalculator.calculate(
            complexityMetrics, securityAssessment, performanceAssessment);

        log.debug("Metrics for {}: cyclomatic={}, risk={}, modernization={}, performance={}, quality={}",
            model.programId(), complexityMetrics.cyclomatic(), securityAssessment.riskLevel(),
            modernizationAssessment.score(), performanceAssessment.score(), qualityScore);

        return new MetricsBundle(complexityMetrics, securityAssessment, modernizationAssessment,
            performanceAssessment, profile, qualityScore);
    }

    private <T> T evaluate(MetricFacet<T> facet, StructuralModel model, List<NormalizedLine> lines) {
        try {
            return facet.analyze(model, lines);
        } catch (RuntimeException e) {
            log.warn("Metric facet '{}' failed for program {}, using defaults: {}",
                facet.name(), model.programId(), e.getMessage());
            return facet.fallback();
        }
    }
}
