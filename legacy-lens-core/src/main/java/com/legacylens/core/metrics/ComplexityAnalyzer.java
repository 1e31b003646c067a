package com.legacylens.core.metrics;

import java.util.List;

import com.legacylens.core.heuristics.HeuristicTables;
import com.legacylens.core.heuristics.Keyword;
import com.legacylens.core.model.ComplexityMetrics;
import com.legacylens.core.model.LineStats;
import com.legacylens.core.model.NormalizedLine;
import com.legacylens.core.model.Priority;
import com.legacylens.core.model.Rating;
import com.legacylens.core.model.StructuralModel;
import com.legacylens.core.util.ScoreMath;

/**
 * Computes cyclomatic and cognitive complexity, maintainability index and technical debt.
 *
 * <ul>
 *   <li><b>Cyclomatic:</b> 1 plus the number of code lines holding any decision keyword; a line
 *       counts once however many keywords it holds</li>
 *   <li><b>Cognitive:</b> an opening keyword raises nesting and adds the new nesting level, a
 *       closing marker lowers it (never below zero), {@code GO TO} and {@code ALTER} add 2</li>
 *   <li><b>Maintainability index:</b>
 *       {@code 171 - 5.2 * cc^0.23 - 0.23 * loc - 16.2 * (1 - commentRatio)}, clamped to
 *       [0, 100]</li>
 *   <li><b>Technical debt:</b> {@code 0.1 * loc + (cc / 10) * 5 + 0.5 * dependencies} hours</li>
 * </ul>
 */
public class ComplexityAnalyzer implements MetricFacet<ComplexityMetrics> {

    @Override
    public String name() {
        return "complexity";
    }

    @Override
    public ComplexityMetrics analyze(StructuralModel model, List<NormalizedLine> lines) {
        List<String> code = MetricFacet.codeText(lines);
        LineStats stats = model.lineStats();

        int cyclomatic = cyclomatic(code);
        int cognitive = cognitive(code);
        double maintainability = maintainabilityIndex(cyclomatic, stats.code(), stats.commentRatio());
        double debt = technicalDebtHours(cyclomatic, stats.code(), model.dependencies().size());

        return new ComplexityMetrics(
            cyclomatic,
            cognitive,
            maintainability,
            debt,
            rate(cyclomatic),
            refactoringPriority(cyclomatic, maintainability, debt)
        );
    }

    @Override
    public ComplexityMetrics fallback() {
        return ComplexityMetrics.defaults();
    }

    static int cyclomatic(List<String> code) {
        int decisions = 0;
        for (String line : code) {
            if (containsAny(line, HeuristicTables.DECISION_KEYWORDS)) {
                decisions++;
            }
        }
        return 1 + decisions;
    }

    static int cognitive(List<String> code) {
        int score = 0;
        int nesting = 0;
        for (String line : code) {
            if (containsAny(line, HeuristicTables.NESTING_OPENERS)) {
                nesting++;
                score += nesting;
            }
            if (containsAny(line, HeuristicTables.NESTING_CLOSERS)) {
                nesting = Math.max(0, nesting - 1);
            }
            if (containsAny(line, HeuristicTables.JUMP_KEYWORDS)) {
                score += HeuristicTables.JUMP_PENALTY;
            }
        }
        return score;
    }

    static double maintainabilityIndex(int cyclomatic, int codeLines, double commentRatio) {
        double raw = HeuristicTables.MI_BASE
            - HeuristicTables.MI_COMPLEXITY_FACTOR * Math.pow(cyclomatic, HeuristicTables.MI_COMPLEXITY_EXPONENT)
            - HeuristicTables.MI_LOC_FACTOR * codeLines
            - HeuristicTables.MI_COMMENT_FACTOR * (1 - commentRatio);
        return ScoreMath.percentage(raw);
    }

    static double technicalDebtHours(int cyclomatic, int codeLines, int dependencyCount) {
        double hours = HeuristicTables.DEBT_HOURS_PER_LINE * codeLines
            + (cyclomatic / 10.0) * HeuristicTables.DEBT_HOURS_PER_TEN_DECISIONS
            + HeuristicTables.DEBT_HOURS_PER_DEPENDENCY * dependencyCount;
        return ScoreMath.round(hours, 1);
    }

    static Rating rate(int cyclomatic) {
        if (cyclomatic <= HeuristicTables.COMPLEXITY_LOW_MAX) {
            return Rating.LOW;
        }
        return cyclomatic <= HeuristicTables.COMPLEXITY_MEDIUM_MAX ? Rating.MEDIUM : Rating.HIGH;
    }

    static Priority refactoringPriority(int cyclomatic, double maintainability, double debtHours) {
        if (cyclomatic > 20 || maintainability < 30 || debtHours > 40) {
            return Priority.CRITICAL;
        }
        if (cyclomatic > 15 || maintainability < 50 || debtHours > 20) {
            return Priority.HIGH;
        }
        if (cyclomatic > 10 || maintainability < 70 || debtHours > 10) {
            return Priority.MEDIUM;
        }
        return Priority.LOW;
    }

    private static boolean containsAny(String line, List<Keyword> keywords) {
        for (Keyword keyword : keywords) {
            if (keyword.occursIn(line)) {
                return true;
            }
        }
        return false;
    }
}
