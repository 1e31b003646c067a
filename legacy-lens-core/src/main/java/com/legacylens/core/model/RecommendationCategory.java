package com.legacylens.core.model;

/**
 * Area a recommendation addresses.
 */
public enum RecommendationCategory {
    COMPLEXITY,
    SECURITY,
    MODERNIZATION,
    PERFORMANCE,
    MAINTAINABILITY,
    DOCUMENTATION
}
