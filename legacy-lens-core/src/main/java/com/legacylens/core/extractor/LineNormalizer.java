package com.legacylens.core.extractor;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

import com.legacylens.core.model.LineClass;
import com.legacylens.core.model.NormalizedLine;

/**
 * Normalizes fixed-format source lines.
 *
 * <p>For each physical line (text split on {@code \n}, trailing empty piece included):
 * <ol>
 *   <li>a line of at least 7 characters whose first 6 characters are decimal digits loses that
 *       sequence-number prefix</li>
 *   <li>the remainder is truncated to 72 characters</li>
 *   <li>trailing whitespace, carriage returns included, is removed</li>
 *   <li>the line is classified as blank, comment (first non-space character is {@code *})
 *       or code</li>
 * </ol>
 *
 * <p>Normalization never fails: every line maps to some normalized line, and the output has
 * exactly as many lines as the input.
 */
public class LineNormalizer {

    static final int SEQUENCE_AREA_WIDTH = 6;
    static final int MAX_LINE_WIDTH = 72;
    private static final char COMMENT_INDICATOR = '*';

    /**
     * Normalizes every line of the text.
     *
     * @param text raw source text
     * @return normalized lines, numbered from 1
     * @throws NullPointerException if text is null
     */
    public List<NormalizedLine> normalize(String text) {
        Objects.requireNonNull(text, "text must not be null");

        String[] rawLines = text.split("\n", -1);
        List<NormalizedLine> lines = new ArrayList<>(rawLines.length);
        for (int i = 0; i < rawLines.length; i++) {
            String normalized = normalizeLine(rawLines[i]);
            lines.add(new NormalizedLine(i + 1, normalized, classify(normalized)));
        }
        return lines;
    }

    /**
     * Applies sequence-area stripping, truncation and trailing trim to one line.
     *
     * @param rawLine physical line without its line terminator
     * @return normalized text
     */
    public static String normalizeLine(String rawLine) {
        String line = rawLine;
        if (line.length() > SEQUENCE_AREA_WIDTH && hasSequenceNumber(line)) {
            line = line.substring(SEQUENCE_AREA_WIDTH);
        }
        if (line.length() > MAX_LINE_WIDTH) {
            line = line.substring(0, MAX_LINE_WIDTH);
        }
        return line.stripTrailing();
    }

    /**
     * Classifies an already normalized line.
     *
     * @param line normalized line text
     * @return line class
     */
    public static LineClass classify(String line) {
        String stripped = line.strip();
        if (stripped.isEmpty()) {
            return LineClass.BLANK;
        }
        return stripped.charAt(0) == COMMENT_INDICATOR ? LineClass.COMMENT : LineClass.CODE;
    }

    /**
     * Joins normalized lines back into one text.
     *
     * @param lines normalized lines
     * @return text with lines separated by {@code \n}
     */
    public static String toText(List<NormalizedLine> lines) {
        return lines.stream()
            .map(NormalizedLine::text)
            .collect(Collectors.joining("\n"));
    }

    private static boolean hasSequenceNumber(String line) {
        for (int i = 0; i < SEQUENCE_AREA_WIDTH; i++) {
            char c = line.charAt(i);
            if (c < '0' || c > '9') {
                return false;
            }
        }
        return true;
    }
}
