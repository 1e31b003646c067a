package com.legacylens.core.extractor;

import java.util.regex.Pattern;

/**
 * Precompiled patterns used by {@link StructuralExtractor}.
 *
 * <p>All patterns are case-insensitive. Keyword tokens are guarded so they never match inside
 * a hyphenated name ({@code END-CALL}, {@code COPY-FLAG}).
 */
final class SourcePatterns {

    private SourcePatterns() {
        // Utility class
    }

    private static final String NOT_AFTER_NAME_CHAR = "(?<![A-Za-z0-9-])";
    private static final String IDENTIFIER = "[A-Za-z][A-Za-z0-9-]*";

    /** {@code PROGRAM-ID. NAME} or {@code PROGRAM-ID NAME}, optionally quoted. */
    static final Pattern PROGRAM_ID = Pattern.compile(
        NOT_AFTER_NAME_CHAR + "PROGRAM-ID(?:\\.\\s*|\\s+)['\"]?([A-Za-z0-9-]+)",
        Pattern.CASE_INSENSITIVE);

    static final Pattern DIVISION = Pattern.compile(
        NOT_AFTER_NAME_CHAR + "(IDENTIFICATION|ENVIRONMENT|DATA|PROCEDURE)\\s+DIVISION(?![A-Za-z0-9-])",
        Pattern.CASE_INSENSITIVE);

    /** Whole trimmed line: a name followed by exactly one period. */
    static final Pattern PARAGRAPH = Pattern.compile("^(" + IDENTIFIER + ")\\.$");

    static final Pattern PERFORM_TARGET = Pattern.compile(
        NOT_AFTER_NAME_CHAR + "PERFORM\\s+(" + IDENTIFIER + ")",
        Pattern.CASE_INSENSITIVE);

    static final Pattern WORKING_STORAGE_HEADER = Pattern.compile(
        NOT_AFTER_NAME_CHAR + "WORKING-STORAGE\\s+SECTION(?![A-Za-z0-9-])",
        Pattern.CASE_INSENSITIVE);

    static final Pattern FILE_SECTION_HEADER = Pattern.compile(
        NOT_AFTER_NAME_CHAR + "FILE\\s+SECTION(?![A-Za-z0-9-])",
        Pattern.CASE_INSENSITIVE);

    /** Any section or division header at the start of a trimmed line; closes a bounded region. */
    static final Pattern REGION_BOUNDARY = Pattern.compile(
        "^[A-Za-z0-9-]+\\s+(?:SECTION|DIVISION)(?![A-Za-z0-9-])",
        Pattern.CASE_INSENSITIVE);

    static final Pattern DATA_ITEM = Pattern.compile("^(\\d{2})\\s+(" + IDENTIFIER + ")");

    static final Pattern PICTURE = Pattern.compile(
        NOT_AFTER_NAME_CHAR + "PIC(?:TURE)?(?:\\s+IS)?\\s+([^\\s.]+(?:\\.[^\\s.]+)*)",
        Pattern.CASE_INSENSITIVE);

    static final Pattern FILE_DESCRIPTOR = Pattern.compile(
        NOT_AFTER_NAME_CHAR + "FD\\s+(" + IDENTIFIER + ")",
        Pattern.CASE_INSENSITIVE);

    /** Group 2 holds a quoted literal target, group 3 a variable target. */
    static final Pattern CALL_TARGET = Pattern.compile(
        NOT_AFTER_NAME_CHAR + "CALL\\s+(?:(['\"])([A-Za-z0-9-]+)\\1|(" + IDENTIFIER + "))",
        Pattern.CASE_INSENSITIVE);

    static final Pattern COPY_TARGET = Pattern.compile(
        NOT_AFTER_NAME_CHAR + "COPY\\s+['\"]?([A-Za-z0-9-]+)",
        Pattern.CASE_INSENSITIVE);
}
