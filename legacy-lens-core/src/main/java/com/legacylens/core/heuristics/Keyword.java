package com.legacylens.core.heuristics;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Source keywords the metrics and extractor look for.
 *
 * <p>A keyword occurs in a line when it appears as a token: case-insensitive and not adjacent
 * to a letter, digit or hyphen. {@code END-IF} is therefore not an {@code IF}, and
 * {@code SORT-FILE} is not a {@code SORT}. Words of multi-word keywords may be separated by
 * any run of whitespace.
 */
public enum Keyword {
    IF("IF"),
    PERFORM("PERFORM"),
    EVALUATE("EVALUATE"),
    WHEN("WHEN"),
    GO_TO("GO TO"),
    CALL("CALL"),
    ALTER("ALTER"),
    END_IF("END-IF"),
    END_PERFORM("END-PERFORM"),
    END_EVALUATE("END-EVALUATE"),
    SORT("SORT"),
    SEARCH_ALL("SEARCH ALL"),
    OBJECT_COMPUTER("OBJECT-COMPUTER"),
    FUNCTION("FUNCTION"),
    EXEC_SQL("EXEC SQL"),
    PROCEDURE_DIVISION("PROCEDURE DIVISION"),
    OPEN("OPEN"),
    READ("READ"),
    WRITE("WRITE"),
    CLOSE("CLOSE"),
    DISPLAY("DISPLAY"),
    ACCEPT("ACCEPT"),
    COMPUTE("COMPUTE"),
    ADD("ADD"),
    SUBTRACT("SUBTRACT"),
    MULTIPLY("MULTIPLY"),
    DIVIDE("DIVIDE"),
    ERROR("ERROR"),
    EXCEPTION("EXCEPTION"),
    INVALID("INVALID");

    private static final String TOKEN_BOUNDARY = "[A-Za-z0-9-]";

    private final String text;
    private final Pattern pattern;

    Keyword(String text) {
        this.text = text;
        this.pattern = Pattern.compile(
            "(?<!" + TOKEN_BOUNDARY + ")" + text.replace(" ", "\\s+") + "(?!" + TOKEN_BOUNDARY + ")",
            Pattern.CASE_INSENSITIVE);
    }

    /**
     * Returns the keyword as written in source.
     *
     * @return keyword text
     */
    public String text() {
        return text;
    }

    /**
     * Checks whether the keyword occurs in the text.
     *
     * @param text text to search
     * @return true if the keyword occurs at least once
     */
    public boolean occursIn(String text) {
        return pattern.matcher(text).find();
    }

    /**
     * Counts non-overlapping occurrences of the keyword.
     *
     * @param text text to search
     * @return occurrence count
     */
    public int countIn(String text) {
        Matcher matcher = pattern.matcher(text);
        int count = 0;
        while (matcher.find()) {
            count++;
        }
        return count;
    }
}
