package com.legacylens.core.heuristics;

import java.util.List;
import java.util.Locale;

import com.legacylens.core.model.Rating;

/**
 * Security heuristics, in evaluation order.
 *
 * <p>A rule matches a line when the upper-cased line contains any of its patterns. Each rule
 * reports a line at most once.
 */
public enum SecurityRule {
    SYSTEM_CALL(
        List.of("CALL SYSTEM", "CALL 'SYSTEM'", "CALL \"SYSTEM\""),
        Rating.HIGH,
        "System call security risk",
        "Replace system calls with vetted service interfaces"),
    DYNAMIC_SQL(
        List.of("EXECUTE IMMEDIATE"),
        Rating.HIGH,
        "Dynamic SQL statement may allow SQL injection",
        "Implement parameterized queries to prevent SQL injection"),
    CONSOLE_INPUT(
        List.of("FROM CONSOLE"),
        Rating.MEDIUM,
        "Console input requires validation",
        "Validate all console input before use"),
    HARDCODED_CREDENTIALS(
        List.of("PASSWORD", "USERID", "USER-ID"),
        Rating.MEDIUM,
        "Potential hardcoded credentials",
        "Move credentials to secure configuration files"),
    FILE_APPEND(
        List.of("OPEN EXTEND"),
        Rating.MEDIUM,
        "File append without validation",
        "Implement proper file access controls and validation"),
    TABLE_BOUNDS(
        List.of("OCCURS"),
        Rating.MEDIUM,
        "Table definition, review bounds checking",
        "Add bounds checking for array operations"),
    INFORMATION_DISCLOSURE(
        List.of("DISPLAY"),
        Rating.LOW,
        "Potential information disclosure",
        "Review displayed data for sensitive information");

    private final List<String> patterns;
    private final Rating severity;
    private final String description;
    private final String recommendation;

    SecurityRule(List<String> patterns, Rating severity, String description, String recommendation) {
        this.patterns = patterns;
        this.severity = severity;
        this.description = description;
        this.recommendation = recommendation;
    }

    public List<String> patterns() {
        return patterns;
    }

    public Rating severity() {
        return severity;
    }

    public String description() {
        return description;
    }

    public String recommendation() {
        return recommendation;
    }

    /**
     * Checks whether any pattern of this rule is contained in the line.
     *
     * @param line source line
     * @return true if the rule matches
     */
    public boolean matches(String line) {
        String upper = line.toUpperCase(Locale.ROOT);
        for (String pattern : patterns) {
            if (upper.contains(pattern)) {
                return true;
            }
        }
        return false;
    }
}
