package com.legacylens.core.extractor.base;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.MatchResult;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.legacylens.core.model.NormalizedLine;

/**
 * Base class for extractors that pull facts out of normalized source text with regular
 * expressions.
 *
 * <p>Provides:
 * <ul>
 *   <li>One logger per concrete extractor class</li>
 *   <li>Match helpers over whole text and single lines</li>
 *   <li>Group extraction that tolerates absent groups</li>
 *   <li>Line filters (code lines, bounded regions)</li>
 * </ul>
 *
 * <p>Extraction is pattern matching over text, not parsing: no grammar is validated and
 * malformed input simply yields fewer facts.
 */
public abstract class AbstractRegexExtractor {

    protected final Logger log;

    protected AbstractRegexExtractor() {
        this.log = LoggerFactory.getLogger(getClass());
    }

    // ==================== Pattern Matching Utilities ====================

    /**
     * Finds all matches of a compiled pattern in the given text.
     *
     * @param pattern compiled regex pattern
     * @param text text to search
     * @return immutable match results in order of appearance
     */
    protected List<MatchResult> findMatches(Pattern pattern, String text) {
        List<MatchResult> matches = new ArrayList<>();
        Matcher matcher = pattern.matcher(text);
        while (matcher.find()) {
            matches.add(matcher.toMatchResult());
        }
        return matches;
    }

    /**
     * Finds the first match of a pattern in the text.
     *
     * @param pattern compiled regex pattern
     * @param text text to search
     * @return matcher if found, null otherwise
     */
    protected Matcher findFirst(Pattern pattern, String text) {
        Matcher matcher = pattern.matcher(text);
        return matcher.find() ? matcher : null;
    }

    /**
     * Checks if a pattern matches anywhere in the text.
     *
     * @param pattern compiled regex pattern
     * @param text text to search
     * @return true if pattern matches
     */
    protected boolean matches(Pattern pattern, String text) {
        return pattern.matcher(text).find();
    }

    /**
     * Extracts a numbered group from a match.
     *
     * @param match match result
     * @param groupIndex index of the capture group (1-based)
     * @return captured text, or null if the group did not participate
     */
    protected String extractGroup(MatchResult match, int groupIndex) {
        try {
            return match.group(groupIndex);
        } catch (IndexOutOfBoundsException | IllegalStateException e) {
            return null;
        }
    }

    // ==================== Line Utilities ====================

    /**
     * Keeps only code lines.
     *
     * @param lines normalized lines
     * @return code lines in order
     */
    protected List<NormalizedLine> codeLines(List<NormalizedLine> lines) {
        return lines.stream().filter(NormalizedLine::isCode).toList();
    }

    /**
     * Returns the code lines of the first region opened by {@code header} and closed by the next
     * line matching {@code boundary}, or by the end of the text.
     *
     * <p>The header line itself is excluded. When no header exists the region is empty.
     *
     * @param lines normalized lines
     * @param header pattern of the opening line
     * @param boundary pattern, applied to trimmed code lines, that closes the region
     * @return code lines inside the region
     */
    protected List<NormalizedLine> boundedRegion(List<NormalizedLine> lines, Pattern header, Pattern boundary) {
        List<NormalizedLine> code = codeLines(lines);
        int start = -1;
        for (int i = 0; i < code.size(); i++) {
            if (matches(header, code.get(i).text())) {
                start = i + 1;
                break;
            }
        }
        if (start < 0) {
            return List.of();
        }

        int end = code.size();
        for (int i = start; i < code.size(); i++) {
            if (matches(boundary, code.get(i).text().strip())) {
                end = i;
                break;
            }
        }
        return code.subList(start, end);
    }
}
