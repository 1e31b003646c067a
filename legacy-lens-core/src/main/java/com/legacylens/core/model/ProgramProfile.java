package com.legacylens.core.model;

import java.util.Objects;

/**
 * Behavioural profile of a program: which kinds of work it does and how much I/O it performs.
 *
 * @param hasMainLogic a procedure division header is present
 * @param hasErrorHandling error, exception or invalid-key handling is present
 * @param hasFileOperations file verbs are used
 * @param hasDatabaseOperations embedded SQL is used
 * @param hasCalculations arithmetic verbs are used
 * @param flowComplexity density of conditionals
 * @param dataComplexity size of working storage
 * @param fileOperationCount occurrences of OPEN, READ, WRITE and CLOSE
 * @param screenOperationCount occurrences of DISPLAY and ACCEPT
 * @param databaseOperationCount occurrences of EXEC SQL
 */
public record ProgramProfile(
    boolean hasMainLogic,
    boolean hasErrorHandling,
    boolean hasFileOperations,
    boolean hasDatabaseOperations,
    boolean hasCalculations,
    FlowComplexity flowComplexity,
    Rating dataComplexity,
    int fileOperationCount,
    int screenOperationCount,
    int databaseOperationCount
) {
    public ProgramProfile {
        Objects.requireNonNull(flowComplexity, "flowComplexity must not be null");
        Objects.requireNonNull(dataComplexity, "dataComplexity must not be null");
    }

    public static ProgramProfile empty() {
        return new ProgramProfile(false, false, false, false, false,
            FlowComplexity.SIMPLE, Rating.LOW, 0, 0, 0);
    }
}
