package com.legacylens.core.report;

import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

import com.legacylens.core.model.ComplexityMetrics;
import com.legacylens.core.model.MetricsBundle;
import com.legacylens.core.model.ModernizationAssessment;
import com.legacylens.core.model.PerformanceAssessment;
import com.legacylens.core.model.Rating;
import com.legacylens.core.model.ReportSection;
import com.legacylens.core.model.SecurityAssessment;
import com.legacylens.core.model.SecurityIssue;
import com.legacylens.core.model.StructuralModel;

/**
 * Renders the narrative report sections from fixed templates.
 *
 * <p>Every {@link ReportSection} is always produced. Templates only branch on thresholds that
 * were already computed by the metrics engine.
 */
public class ReportSynthesizer {

    private static final String BULLET = "- ";
    private static final String NEWLINE = "\n";

    /**
     * Renders all sections in document order.
     *
     * @param model structural model
     * @param metrics metrics bundle
     * @return section text keyed by section
     */
    public Map<ReportSection, String> synthesize(StructuralModel model, MetricsBundle metrics) {
        Objects.requireNonNull(model, "model must not be null");
        Objects.requireNonNull(metrics, "metrics must not be null");

        Map<ReportSection, String> sections = new EnumMap<>(ReportSection.class);
        for (ReportSection section : ReportSection.values()) {
            sections.put(section, render(section, model, metrics));
        }
        return sections;
    }

    String render(ReportSection section, StructuralModel model, MetricsBundle metrics) {
        return switch (section) {
            case EXECUTIVE_SUMMARY -> executiveSummary(model, metrics);
            case TECHNICAL_OVERVIEW -> technicalOverview(model, metrics);
            case COMPLEXITY_REPORT -> complexityReport(metrics.complexity());
            case SECURITY_REPORT -> securityReport(metrics.security());
            case MODERNIZATION_ROADMAP -> modernizationRoadmap(metrics.modernization());
            case PERFORMANCE_REPORT -> performanceReport(metrics.performance());
            case MAINTENANCE_GUIDE -> maintenanceGuide(model, metrics.complexity());
            case TESTING_RECOMMENDATIONS -> testingRecommendations(model, metrics.complexity());
        };
    }

    private String executiveSummary(StructuralModel model, MetricsBundle metrics) {
        ComplexityMetrics complexity = metrics.complexity();
        boolean urgent = metrics.security().riskLevel() == Rating.HIGH || complexity.cyclomatic() > 20;

        StringBuilder summary = new StringBuilder();
        summary.append("Program ").append(model.programId()).append(" Analysis Summary:").append(NEWLINE);
        summary.append(BULLET).append("Total Lines: ").append(model.lineStats().total()).append(NEWLINE);
        summary.append(BULLET).append("Complexity: ").append(complexity.rating().label()).append(NEWLINE);
        summary.append(BULLET).append("Security Risk: ").append(metrics.security().riskLevel().label()).append(NEWLINE);
        summary.append(BULLET).append("Maintainability Index: ").append(decimal(complexity.maintainabilityIndex())).append(NEWLINE);
        summary.append(BULLET).append("Quality Score: ").append(decimal(metrics.qualityScore())).append(NEWLINE);
        summary.append(NEWLINE);
        summary.append("This program requires ")
            .append(urgent ? "immediate attention" : "routine maintenance")
            .append(".");
        if (model.isDegraded()) {
            summary.append(NEWLINE).append(NEWLINE)
                .append("Structural extraction was incomplete: ").append(model.error());
        }
        return summary.toString();
    }

    private String technicalOverview(StructuralModel model, MetricsBundle metrics) {
        return """
            Technical Structure:
            - Program ID: %s
            - Divisions: %d
            - Procedures: %d
            - Data Items: %d
            - File Descriptors: %d
            - Dependencies: %d
            - Copybooks: %d
            - Lines: %d total, %d code, %d comment, %d blank

            Program Flow: %s
            Data Complexity: %s""".formatted(
            model.programId(),
            model.divisions().size(),
            model.procedures().size(),
            model.dataItems().size(),
            model.fileDescriptors().size(),
            model.dependencies().size(),
            model.copyDependencies().size(),
            model.lineStats().total(),
            model.lineStats().code(),
            model.lineStats().comment(),
            model.lineStats().blank(),
            metrics.profile().flowComplexity(),
            metrics.profile().dataComplexity().label());
    }

    private String complexityReport(ComplexityMetrics complexity) {
        return """
            Complexity Analysis:
            - Cyclomatic Complexity: %d
            - Cognitive Complexity: %d
            - Maintainability Index: %s
            - Technical Debt: %s hours
            - Rating: %s
            - Refactoring Priority: %s""".formatted(
            complexity.cyclomatic(),
            complexity.cognitive(),
            decimal(complexity.maintainabilityIndex()),
            decimal(complexity.technicalDebtHours()),
            complexity.rating().label(),
            complexity.refactoringPriority().label());
    }

    private String securityReport(SecurityAssessment security) {
        StringBuilder report = new StringBuilder();
        report.append("Security Assessment:").append(NEWLINE);
        report.append(BULLET).append("Overall Risk Level: ").append(security.riskLevel().label()).append(NEWLINE);
        report.append(BULLET).append("Security Score: ").append(security.score()).append("/100").append(NEWLINE);
        report.append(BULLET).append("Issues Found: ").append(security.issues().size()).append(NEWLINE);

        if (!security.issues().isEmpty()) {
            report.append(NEWLINE).append("Security Issues:").append(NEWLINE);
            for (SecurityIssue issue : security.issues()) {
                report.append(BULLET).append(issue.kind()).append(": ").append(issue.description())
                    .append(" (line ").append(issue.lineNumber())
                    .append(", severity ").append(issue.severity().label()).append(")").append(NEWLINE);
            }
        }
        appendList(report, "Recommendations:", security.recommendations());
        return report.toString().stripTrailing();
    }

    private String modernizationRoadmap(ModernizationAssessment modernization) {
        StringBuilder roadmap = new StringBuilder();
        roadmap.append("Modernization Roadmap:").append(NEWLINE);
        roadmap.append(BULLET).append("Modernization Score: ").append(modernization.score()).append("/100").append(NEWLINE);
        roadmap.append(BULLET).append("Priority: ").append(modernization.priority().label()).append(NEWLINE);
        roadmap.append(BULLET).append("Estimated Effort: ").append(modernization.effortDays()).append(" days").append(NEWLINE);
        roadmap.append(BULLET).append("Recommended Approach: ").append(modernization.recommendedApproach()).append(NEWLINE);

        appendList(roadmap, "Modernization Opportunities:", modernization.opportunities());
        appendList(roadmap, "Challenges:", modernization.challenges());
        appendList(roadmap, "Target Technologies:", modernization.targetTechnologies());
        return roadmap.toString().stripTrailing();
    }

    private String performanceReport(PerformanceAssessment performance) {
        StringBuilder report = new StringBuilder();
        report.append("Performance Analysis:").append(NEWLINE);
        report.append(BULLET).append("Performance Score: ").append(performance.score()).append("/100").append(NEWLINE);
        report.append(BULLET).append("Execution Complexity: ").append(performance.executionComplexity()).append(NEWLINE);
        report.append(BULLET).append("Performance Issues: ").append(performance.issues().size()).append(NEWLINE);
        report.append(BULLET).append("Resource Usage: memory ").append(performance.resourceUsage().memory().label())
            .append(", CPU ").append(performance.resourceUsage().cpu().label())
            .append(", I/O ").append(performance.resourceUsage().ioIntensity().label()).append(NEWLINE);

        appendList(report, "Performance Issues:", performance.issues());
        appendList(report, "Optimization Opportunities:", performance.optimizationOpportunities());
        return report.toString().stripTrailing();
    }

    private String maintenanceGuide(StructuralModel model, ComplexityMetrics complexity) {
        StringBuilder guide = new StringBuilder();
        guide.append("Maintenance Guide:").append(NEWLINE);

        if (complexity.cyclomatic() > 15) {
            appendList(guide, "High Complexity Areas:", List.of(
                "Focus on reducing cyclomatic complexity",
                "Break down large procedures",
                "Add regression tests around complex paragraphs"));
        }
        if (model.dependencies().size() > 10) {
            appendList(guide, "Dependency Management:", List.of(
                "Document all external dependencies",
                "Keep the dependency map current",
                "Coordinate changes with called programs"));
        }
        appendList(guide, "Regular Maintenance Tasks:", List.of(
            "Review and update documentation",
            "Perform code quality checks",
            "Monitor performance metrics",
            "Update security assessments"));
        return guide.toString().stripTrailing();
    }

    private String testingRecommendations(StructuralModel model, ComplexityMetrics complexity) {
        StringBuilder testing = new StringBuilder();
        testing.append("Testing Recommendations:").append(NEWLINE);

        appendList(testing, "Unit Testing:", List.of(
            "Create " + model.procedures().size() + " unit tests (one per procedure)",
            "Focus on edge cases and error conditions",
            "Test data validation routines"));
        if (!model.dependencies().isEmpty()) {
            appendList(testing, "Integration Testing:", List.of(
                "Test all external dependencies",
                "Verify data flow between modules",
                "Test error handling across module boundaries"));
        }
        if (complexity.cyclomatic() > 10) {
            appendList(testing, "Performance Testing:", List.of(
                "Load test critical procedures",
                "Monitor memory usage",
                "Test with production-size data"));
        }
        testing.append(NEWLINE).append("Test Coverage Target: 90% or higher");
        return testing.toString();
    }

    private static void appendList(StringBuilder target, String heading, List<String> items) {
        if (items.isEmpty()) {
            return;
        }
        target.append(NEWLINE).append(heading).append(NEWLINE);
        for (String item : items) {
            target.append(BULLET).append(item).append(NEWLINE);
        }
    }

    private static String decimal(double value) {
        return String.format(Locale.ROOT, "%.2f", value);
    }
}
