package com.legacylens.core.engine;

import java.util.List;
import java.util.Map;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.legacylens.core.extractor.LineNormalizer;
import com.legacylens.core.extractor.StructuralExtractor;
import com.legacylens.core.metrics.MetricsEngine;
import com.legacylens.core.model.AnalysisResult;
import com.legacylens.core.model.Diagram;
import com.legacylens.core.model.MetricsBundle;
import com.legacylens.core.model.NormalizedLine;
import com.legacylens.core.model.Recommendation;
import com.legacylens.core.model.ReportSection;
import com.legacylens.core.model.SourceUnit;
import com.legacylens.core.model.StructuralModel;
import com.legacylens.core.report.DiagramSynthesizer;
import com.legacylens.core.report.RecommendationEngine;
import com.legacylens.core.report.ReportSynthesizer;

/**
 * Entry point of the analysis pipeline.
 *
 * <p>Runs the stages strictly forward, each producing a new immutable value:
 * <ol>
 *   <li>{@link LineNormalizer}: raw text to classified lines</li>
 *   <li>{@link StructuralExtractor}: lines to {@link StructuralModel}</li>
 *   <li>{@link MetricsEngine}: model and lines to {@link MetricsBundle}</li>
 *   <li>{@link RecommendationEngine}, {@link DiagramSynthesizer} and {@link ReportSynthesizer}:
 *       recommendations, diagrams and report sections</li>
 * </ol>
 *
 * <p>The engine is synchronous, performs no I/O and keeps no state between calls, so one
 * instance can serve many threads. It accepts any text: malformed input yields a degraded but
 * complete result rather than an exception.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * SourceAnalysisEngine engine = new SourceAnalysisEngine();
 * AnalysisResult result = engine.analyze(new SourceUnit(text, "PAYROLL.cbl"));
 * result.metrics().qualityScore();
 * }</pre>
 */
public class SourceAnalysisEngine {

    private static final Logger log = LoggerFactory.getLogger(SourceAnalysisEngine.class);

    private final LineNormalizer normalizer;
    private final StructuralExtractor extractor;
    private final MetricsEngine metricsEngine;
    private final RecommendationEngine recommendationEngine;
    private final DiagramSynthesizer diagramSynthesizer;
    private final ReportSynthesizer reportSynthesizer;

    public SourceAnalysisEngine() {
        this(new StructuralExtractor(), new MetricsEngine());
    }

    public SourceAnalysisEngine(StructuralExtractor extractor, MetricsEngine metricsEngine) {
        this.normalizer = new LineNormalizer();
        this.extractor = Objects.requireNonNull(extractor, "extractor must not be null");
        this.metricsEngine = Objects.requireNonNull(metricsEngine, "metricsEngine must not be null");
        this.recommendationEngine = new RecommendationEngine();
        this.diagramSynthesizer = new DiagramSynthesizer();
        this.reportSynthesizer = new ReportSynthesizer();
    }

    /**
     * Analyzes one source unit.
     *
     * @param unit source unit
     * @return complete analysis result
     * @throws NullPointerException if unit is null
     */
    public AnalysisResult analyze(SourceUnit unit) {
        Objects.requireNonNull(unit, "unit must not be null");

        List<NormalizedLine> lines = normalizer.normalize(unit.text());
        StructuralModel model = extractor.extract(lines);
        MetricsBundle metrics = metricsEngine.compute(model, lines);
        List<Recommendation> recommendations = recommendationEngine.recommend(model, metrics);
        List<Diagram> diagrams = diagramSynthesizer.synthesize(model);
        Map<ReportSection, String> reports = reportSynthesizer.synthesize(model, metrics);

        String sourceName = unit.displayNameOr(model.programId());
        log.info("Analyzed {} (program {}): {} lines, cyclomatic {}, risk {}, quality {}",
            sourceName, model.programId(), model.lineStats().total(),
            metrics.complexity().cyclomatic(), metrics.security().riskLevel(), metrics.qualityScore());
        if (model.isDegraded()) {
            log.warn("Analysis of {} used a degraded structural model: {}", sourceName, model.error());
        }

        return new AnalysisResult(sourceName, model, metrics, recommendations, diagrams, reports);
    }
}
