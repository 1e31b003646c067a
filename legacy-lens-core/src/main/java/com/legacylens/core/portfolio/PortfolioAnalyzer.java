package com.legacylens.core.portfolio;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.legacylens.core.model.AnalysisResult;
import com.legacylens.core.model.CallRelationship;
import com.legacylens.core.model.DependencyUsage;
import com.legacylens.core.model.PortfolioSummary;
import com.legacylens.core.model.Rating;
import com.legacylens.core.model.StructuralModel;
import com.legacylens.core.util.ScoreMath;

/**
 * Aggregates many analysis results into a {@link PortfolioSummary}.
 *
 * <p>Dependency usage counts each program once per dependency. Call relationships only use
 * literal call targets; {@code DYNAMIC:} targets do not name a program.
 */
public class PortfolioAnalyzer {

    private static final Logger log = LoggerFactory.getLogger(PortfolioAnalyzer.class);

    public static final int TOP_DEPENDENCIES = 5;

    /**
     * Summarizes the results.
     *
     * @param results analysis results
     * @return portfolio summary
     */
    public PortfolioSummary summarize(List<AnalysisResult> results) {
        Objects.requireNonNull(results, "results must not be null");

        int totalLines = 0;
        double qualityTotal = 0.0;
        Map<Rating, Integer> breakdown = new EnumMap<>(Rating.class);
        Map<String, Integer> dependencyCounts = new LinkedHashMap<>();
        List<CallRelationship> relationships = new ArrayList<>();
        List<String> degraded = new ArrayList<>();

        for (AnalysisResult result : results) {
            StructuralModel model = result.model();
            totalLines += model.lineStats().total();
            qualityTotal += result.metrics().qualityScore();
            breakdown.merge(model.estimatedComplexity(), 1, Integer::sum);

            for (String dependency : model.dependencies()) {
                dependencyCounts.merge(dependency, 1, Integer::sum);
                if (!dependency.startsWith(StructuralModel.DYNAMIC_PREFIX)) {
                    relationships.add(new CallRelationship(model.programId(), dependency));
                }
            }
            if (model.isDegraded()) {
                degraded.add(result.sourceName());
            }
        }

        List<DependencyUsage> common = dependencyCounts.entrySet().stream()
            .map(entry -> new DependencyUsage(entry.getKey(), entry.getValue()))
            .sorted(Comparator.comparingInt(DependencyUsage::count).reversed()
                .thenComparing(DependencyUsage::name))
            .limit(TOP_DEPENDENCIES)
            .toList();

        double averageQuality = results.isEmpty() ? 0.0 : ScoreMath.round(qualityTotal / results.size(), 2);

        log.info("Portfolio of {} programs: {} lines, {} call relationships, {} degraded",
            results.size(), totalLines, relationships.size(), degraded.size());

        return new PortfolioSummary(results.size(), totalLines, breakdown, common, relationships,
            averageQuality, degraded);
    }
}
