package com.legacylens.core;

/**
 * COBOL fixtures shared by the tests.
 */
public final class SampleSources {

    private SampleSources() {
        // Utility class
    }

    /**
     * Small payroll program, 20 lines without trailing newline.
     */
    public static final String PAYROLL = String.join("\n",
        "       IDENTIFICATION DIVISION.",
        "       PROGRAM-ID. PAYROLL.",
        "       ENVIRONMENT DIVISION.",
        "       DATA DIVISION.",
        "       FILE SECTION.",
        "       FD EMPLOYEE-FILE.",
        "       01 EMPLOYEE-RECORD.",
        "          05 EMP-ID PIC 9(5).",
        "       WORKING-STORAGE SECTION.",
        "       01 WS-TOTAL PIC 9(7)V99 VALUE 0.",
        "       01 WS-NAME PIC X(30).",
        "       COPY EMPCOPY.",
        "       PROCEDURE DIVISION.",
        "       MAIN-PARA.",
        "           PERFORM CALC-PARA.",
        "           CALL 'SUBPGM'.",
        "           CALL WS-ROUTINE.",
        "           STOP RUN.",
        "       CALC-PARA.",
        "           ADD 1 TO WS-TOTAL.");

    /**
     * Program without an identity marker or division headers.
     */
    public static final String ANONYMOUS = String.join("\n",
        "      * scratch snippet",
        "           DISPLAY 'HELLO'.",
        "           STOP RUN.");

    /**
     * Builds {@code count} copies of a code line, newline separated.
     *
     * @param line line text
     * @param count number of lines
     * @return joined text
     */
    public static String repeat(String line, int count) {
        StringBuilder text = new StringBuilder();
        for (int i = 0; i < count; i++) {
            if (i > 0) {
                text.append('\n');
            }
            text.append(line);
        }
        return text.toString();
    }
}
