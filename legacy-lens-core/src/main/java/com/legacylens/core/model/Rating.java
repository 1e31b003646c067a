package com.legacylens.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Three-level rating used for complexity, risk, severity and resource estimates.
 */
public enum Rating {
    LOW("Low"),
    MEDIUM("Medium"),
    HIGH("High");

    private final String label;

    Rating(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }

    /**
     * Returns the more severe of this rating and the other one.
     *
     * @param other rating to compare with
     * @return the higher rating
     */
    public Rating atLeast(Rating other) {
        return other.ordinal() > ordinal() ? other : this;
    }
}
