package com.legacylens.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Urgency of a finding. Declaration order is the sort order: most urgent first.
 */
public enum Priority {
    CRITICAL("Critical"),
    HIGH("High"),
    MEDIUM("Medium"),
    LOW("Low");

    private final String label;

    Priority(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }

    /**
     * Returns the next more urgent priority, staying at {@link #CRITICAL}.
     *
     * @return escalated priority
     */
    public Priority escalate() {
        return this == CRITICAL ? CRITICAL : values()[ordinal() - 1];
    }
}
