package com.legacylens.core.metrics;

import java.util.ArrayList;
import java.util.List;

import com.legacylens.core.heuristics.HeuristicTables;
import com.legacylens.core.heuristics.Keyword;
import com.legacylens.core.model.NormalizedLine;
import com.legacylens.core.model.PerformanceAssessment;
import com.legacylens.core.model.Rating;
import com.legacylens.core.model.ResourceUsage;
import com.legacylens.core.model.StructuralModel;
import com.legacylens.core.util.ScoreMath;

/**
 * Flags performance-sensitive constructs and estimates execution cost and resource usage.
 */
public class PerformanceAnalyzer implements MetricFacet<PerformanceAssessment> {

    @Override
    public String name() {
        return "performance";
    }

    @Override
    public PerformanceAssessment analyze(StructuralModel model, List<NormalizedLine> lines) {
        String code = String.join("\n", MetricFacet.codeText(lines));
        int procedures = model.procedures().size();
        int dependencies = model.dependencies().size();

        int score = 100;
        List<String> issues = new ArrayList<>();
        if (Keyword.SORT.occursIn(code)) {
            score -= HeuristicTables.SORT_PENALTY;
            issues.add("Sorting operations detected - ensure optimal sort keys and work files");
        }
        int performs = Keyword.PERFORM.countIn(code);
        if (performs > HeuristicTables.PERFORM_HEAVY_THRESHOLD) {
            score -= HeuristicTables.PERFORM_HEAVY_PENALTY;
            issues.add("High number of PERFORM statements (" + performs + ") - consider optimization");
        }
        if (Keyword.SEARCH_ALL.occursIn(code)) {
            score -= HeuristicTables.SEARCH_ALL_PENALTY;
            issues.add("Binary search operations - verify table ordering and size");
        }

        int executionComplexity = procedures * HeuristicTables.EXECUTION_WEIGHT_PER_PROCEDURE
            + dependencies * HeuristicTables.EXECUTION_WEIGHT_PER_DEPENDENCY;

        return new PerformanceAssessment(
            ScoreMath.clamp(score, 0, 100),
            issues,
            executionComplexity,
            optimizationOpportunities(model),
            resourceUsage(model, code)
        );
    }

    @Override
    public PerformanceAssessment fallback() {
        return PerformanceAssessment.defaults();
    }

    private List<String> optimizationOpportunities(StructuralModel model) {
        List<String> opportunities = new ArrayList<>();
        if (model.procedures().size() > 15) {
            opportunities.add("Consider procedure consolidation");
        }
        if (model.dependencies().size() > 10) {
            opportunities.add("Review dependency management");
        }
        if (model.dataItems().size() > 50) {
            opportunities.add("Optimize data structure usage");
        }
        return opportunities;
    }

    private ResourceUsage resourceUsage(StructuralModel model, String code) {
        int dataItems = model.dataItems().size();
        int procedures = model.procedures().size();
        int ioStatements = Keyword.OPEN.countIn(code) + Keyword.EXEC_SQL.countIn(code);

        return new ResourceUsage(
            tier(dataItems, 50, 100),
            tier(procedures, 15, 30),
            tier(ioStatements, 5, 10)
        );
    }

    private static Rating tier(int value, int mediumAbove, int highAbove) {
        if (value > highAbove) {
            return Rating.HIGH;
        }
        return value > mediumAbove ? Rating.MEDIUM : Rating.LOW;
    }
}
