package com.legacylens.core.model;

/**
 * Narrative report sections, in document order.
 */
public enum ReportSection {
    EXECUTIVE_SUMMARY("Executive Summary"),
    TECHNICAL_OVERVIEW("Technical Overview"),
    COMPLEXITY_REPORT("Complexity Analysis"),
    SECURITY_REPORT("Security Assessment"),
    MODERNIZATION_ROADMAP("Modernization Roadmap"),
    PERFORMANCE_REPORT("Performance Analysis"),
    MAINTENANCE_GUIDE("Maintenance Guide"),
    TESTING_RECOMMENDATIONS("Testing Recommendations");

    private final String title;

    ReportSection(String title) {
        this.title = title;
    }

    public String title() {
        return title;
    }
}
