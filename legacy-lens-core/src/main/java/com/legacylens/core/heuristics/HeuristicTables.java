package com.legacylens.core.heuristics;

import java.util.List;

/**
 * The canonical constant set behind every score.
 *
 * <p>Several calibrations of the same heuristics circulated for these programs. This class
 * holds the adopted one; the rejected constants are kept under {@link Rejected} so reports can
 * be reconciled with older figures.
 */
public final class HeuristicTables {

    private HeuristicTables() {
        // Utility class
    }

    // ==================== Complexity ====================

    /** A code line holding any of these adds one to cyclomatic complexity. */
    public static final List<Keyword> DECISION_KEYWORDS = List.of(
        Keyword.IF, Keyword.PERFORM, Keyword.EVALUATE, Keyword.WHEN, Keyword.GO_TO, Keyword.CALL);

    public static final List<Keyword> NESTING_OPENERS = List.of(
        Keyword.IF, Keyword.PERFORM, Keyword.EVALUATE);

    public static final List<Keyword> NESTING_CLOSERS = List.of(
        Keyword.END_IF, Keyword.END_PERFORM, Keyword.END_EVALUATE);

    /** Each adds a flat amount to cognitive complexity regardless of nesting. */
    public static final List<Keyword> JUMP_KEYWORDS = List.of(Keyword.GO_TO, Keyword.ALTER);
    public static final int JUMP_PENALTY = 2;

    // Maintainability index: 171 - 5.2 * cc^0.23 - 0.23 * loc - 16.2 * (1 - commentRatio)
    public static final double MI_BASE = 171.0;
    public static final double MI_COMPLEXITY_FACTOR = 5.2;
    public static final double MI_COMPLEXITY_EXPONENT = 0.23;
    public static final double MI_LOC_FACTOR = 0.23;
    public static final double MI_COMMENT_FACTOR = 16.2;

    // Technical debt: 0.1 * loc + (cc / 10) * 5 + 0.5 * dependencies
    public static final double DEBT_HOURS_PER_LINE = 0.1;
    public static final double DEBT_HOURS_PER_TEN_DECISIONS = 5.0;
    public static final double DEBT_HOURS_PER_DEPENDENCY = 0.5;

    public static final int COMPLEXITY_LOW_MAX = 10;
    public static final int COMPLEXITY_MEDIUM_MAX = 20;

    // Structural seed: loc * 0.1 + procedures * 2 + IF * 1.5 + PERFORM * 1 + CALL * 2
    public static final double SEED_LINE_WEIGHT = 0.1;
    public static final double SEED_PROCEDURE_WEIGHT = 2.0;
    public static final double SEED_IF_WEIGHT = 1.5;
    public static final double SEED_PERFORM_WEIGHT = 1.0;
    public static final double SEED_CALL_WEIGHT = 2.0;
    public static final double SEED_LOW_BELOW = 50.0;
    public static final double SEED_MEDIUM_BELOW = 150.0;

    // ==================== Security ====================

    public static final int SECURITY_PENALTY_PER_ISSUE = 10;

    // ==================== Modernization ====================

    public static final int MISSING_OBJECT_COMPUTER_PENALTY = 10;
    public static final int NO_INTRINSIC_FUNCTIONS_PENALTY = 5;
    public static final int LARGE_PROGRAM_PENALTY = 15;
    public static final int LARGE_PROGRAM_PROCEDURES = 20;
    public static final int EMBEDDED_SQL_PENALTY = 5;
    public static final int GO_TO_PENALTY = 10;
    public static final int MANY_DEPENDENCIES_PENALTY = 5;
    public static final int MANY_DEPENDENCIES = 5;
    public static final int MANY_COPYBOOKS = 10;

    public static final int MODERNIZATION_CRITICAL_BELOW = 40;
    public static final int MODERNIZATION_HIGH_BELOW = 60;
    public static final int MODERNIZATION_MEDIUM_BELOW = 80;

    public static final double EFFORT_DAYS_PER_OPPORTUNITY = 2.0;
    public static final double EFFORT_DAYS_PER_PROCEDURE = 0.1;
    public static final double EFFORT_DAYS_PER_DEPENDENCY = 0.2;

    // ==================== Performance ====================

    public static final int SORT_PENALTY = 10;
    public static final int PERFORM_HEAVY_PENALTY = 15;
    public static final int PERFORM_HEAVY_THRESHOLD = 50;
    public static final int SEARCH_ALL_PENALTY = 5;
    public static final int EXECUTION_WEIGHT_PER_PROCEDURE = 2;
    public static final int EXECUTION_WEIGHT_PER_DEPENDENCY = 3;

    // ==================== Quality score ====================

    public static final double QUALITY_COMPLEXITY_WEIGHT = 0.3;
    public static final double QUALITY_SECURITY_WEIGHT = 0.25;
    public static final double QUALITY_PERFORMANCE_WEIGHT = 0.25;
    public static final double QUALITY_MAINTAINABILITY_WEIGHT = 0.2;
    public static final int QUALITY_PENALTY_PER_DECISION = 5;

    /**
     * Alternative calibrations that were evaluated and not adopted.
     */
    public static final class Rejected {

        private Rejected() {
        }

        /** Linear form: {@code 100 - 2 * cc - 0.1 * loc + 20 * commentRatio}. */
        public static final double LINEAR_MI_COMPLEXITY_FACTOR = 2.0;
        public static final double LINEAR_MI_LOC_FACTOR = 0.1;
        public static final double LINEAR_MI_COMMENT_FACTOR = 20.0;

        /** Three-facet quality weighting over {@code 100 - 2 * cc}, security and performance. */
        public static final double QUALITY_COMPLEXITY_WEIGHT = 0.4;
        public static final double QUALITY_SECURITY_WEIGHT = 0.3;
        public static final double QUALITY_PERFORMANCE_WEIGHT = 0.3;
        public static final int QUALITY_PENALTY_PER_DECISION = 2;

        /** Rating cut-offs of 5 and 15 instead of 10 and 20. */
        public static final int COMPLEXITY_LOW_MAX = 5;
        public static final int COMPLEXITY_MEDIUM_MAX = 15;

        public static final int SECURITY_PENALTY_PER_ISSUE = 15;

        /** Opportunity-driven score: {@code 20 * opportunities - 15 * challenges}. */
        public static final int POINTS_PER_OPPORTUNITY = 20;
        public static final int POINTS_PER_CHALLENGE = 15;
    }
}
