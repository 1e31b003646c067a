package com.legacylens.core.metrics;

import java.util.ArrayList;
import java.util.List;

import com.legacylens.core.heuristics.HeuristicTables;
import com.legacylens.core.heuristics.Keyword;
import com.legacylens.core.model.ModernizationAssessment;
import com.legacylens.core.model.NormalizedLine;
import com.legacylens.core.model.Priority;
import com.legacylens.core.model.StructuralModel;
import com.legacylens.core.util.ScoreMath;

/**
 * Estimates how much legacy-pattern remediation a program needs before migration.
 *
 * <p>The score starts at 100 and each failed check subtracts a fixed penalty and records an
 * opportunity. Challenges never change the score; they raise the priority by one step.
 */
public class ModernizationAnalyzer implements MetricFacet<ModernizationAssessment> {

    @Override
    public String name() {
        return "modernization";
    }

    @Override
    public ModernizationAssessment analyze(StructuralModel model, List<NormalizedLine> lines) {
        String code = String.join("\n", MetricFacet.codeText(lines));
        int procedures = model.procedures().size();
        int dependencies = model.dependencies().size();

        int score = 100;
        List<String> opportunities = new ArrayList<>();
        if (!Keyword.OBJECT_COMPUTER.occursIn(code)) {
            score -= HeuristicTables.MISSING_OBJECT_COMPUTER_PENALTY;
            opportunities.add("Add OBJECT-COMPUTER paragraph for explicit hardware configuration");
        }
        if (!Keyword.FUNCTION.occursIn(code)) {
            score -= HeuristicTables.NO_INTRINSIC_FUNCTIONS_PENALTY;
            opportunities.add("Consider using intrinsic functions for better maintainability");
        }
        if (procedures > HeuristicTables.LARGE_PROGRAM_PROCEDURES) {
            score -= HeuristicTables.LARGE_PROGRAM_PENALTY;
            opportunities.add("Break down large program into smaller, modular components");
        }
        if (Keyword.EXEC_SQL.occursIn(code)) {
            score -= HeuristicTables.EMBEDDED_SQL_PENALTY;
            opportunities.add("Consider modernizing database access patterns");
        }
        if (Keyword.GO_TO.occursIn(code)) {
            score -= HeuristicTables.GO_TO_PENALTY;
            opportunities.add("Replace GO TO statements with structured PERFORM logic");
        }
        if (dependencies > HeuristicTables.MANY_DEPENDENCIES) {
            score -= HeuristicTables.MANY_DEPENDENCIES_PENALTY;
            opportunities.add("Reduce coupling to " + dependencies + " external programs");
        }
        score = ScoreMath.clamp(score, 0, 100);

        List<String> challenges = challenges(model, code);
        Priority priority = priority(score);
        if (!challenges.isEmpty()) {
            priority = priority.escalate();
        }

        return new ModernizationAssessment(
            score,
            priority,
            opportunities,
            challenges,
            effortDays(opportunities.size(), procedures, dependencies),
            approach(score),
            targetTechnologies(model, code)
        );
    }

    @Override
    public ModernizationAssessment fallback() {
        return ModernizationAssessment.defaults();
    }

    private List<String> challenges(StructuralModel model, String code) {
        List<String> challenges = new ArrayList<>();
        if (Keyword.ALTER.occursIn(code)) {
            challenges.add("ALTER statements make control flow depend on runtime state");
        }
        int copybooks = model.copyDependencies().size();
        if (copybooks > HeuristicTables.MANY_COPYBOOKS) {
            challenges.add("Heavy copybook usage (" + copybooks + " copybooks) couples shared data layouts");
        }
        int dynamicCalls = model.dynamicDependencies().size();
        if (dynamicCalls > 0) {
            challenges.add("Dynamic calls (" + dynamicCalls + ") hide call targets until run time");
        }
        return challenges;
    }

    static Priority priority(int score) {
        if (score < HeuristicTables.MODERNIZATION_CRITICAL_BELOW) {
            return Priority.CRITICAL;
        }
        if (score < HeuristicTables.MODERNIZATION_HIGH_BELOW) {
            return Priority.HIGH;
        }
        return score < HeuristicTables.MODERNIZATION_MEDIUM_BELOW ? Priority.MEDIUM : Priority.LOW;
    }

    static int effortDays(int opportunities, int procedures, int dependencies) {
        double days = opportunities * HeuristicTables.EFFORT_DAYS_PER_OPPORTUNITY
            + procedures * HeuristicTables.EFFORT_DAYS_PER_PROCEDURE
            + dependencies * HeuristicTables.EFFORT_DAYS_PER_DEPENDENCY;
        return (int) Math.max(1, Math.round(days));
    }

    static String approach(int score) {
        if (score < HeuristicTables.MODERNIZATION_CRITICAL_BELOW) {
            return "Complete rewrite recommended - consider modern languages";
        }
        if (score < HeuristicTables.MODERNIZATION_HIGH_BELOW) {
            return "Significant refactoring - modernize in phases";
        }
        if (score < HeuristicTables.MODERNIZATION_MEDIUM_BELOW) {
            return "Incremental improvements - focus on critical areas";
        }
        return "Maintenance mode - minor enhancements only";
    }

    private List<String> targetTechnologies(StructuralModel model, String code) {
        List<String> targets = new ArrayList<>();
        if (!model.fileDescriptors().isEmpty()) {
            targets.add("Relational database for file-based records");
            targets.add("REST API layer over record access");
        }
        if (Keyword.EXEC_SQL.occursIn(code)) {
            targets.add("REST APIs for database access");
        }
        if (model.procedures().size() > HeuristicTables.LARGE_PROGRAM_PROCEDURES) {
            targets.add("Service decomposition along procedure boundaries");
        }
        targets.add("Containerized deployment");
        targets.add("CI/CD pipeline with automated regression tests");
        return targets;
    }
}
