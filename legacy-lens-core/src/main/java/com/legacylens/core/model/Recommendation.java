package com.legacylens.core.model;

import java.util.Objects;

/**
 * An actionable recommendation derived from metric thresholds.
 *
 * @param priority urgency
 * @param category area addressed
 * @param title short title
 * @param description what to do
 */
public record Recommendation(
    Priority priority,
    RecommendationCategory category,
    String title,
    String description
) {
    public Recommendation {
        Objects.requireNonNull(priority, "priority must not be null");
        Objects.requireNonNull(category, "category must not be null");
        Objects.requireNonNull(title, "title must not be null");
        Objects.requireNonNull(description, "description must not be null");
    }
}
