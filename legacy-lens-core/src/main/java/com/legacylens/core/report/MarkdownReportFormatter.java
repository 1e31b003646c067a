package com.legacylens.core.report;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

import com.legacylens.core.generator.GeneratedDiagram;
import com.legacylens.core.model.AnalysisResult;
import com.legacylens.core.model.MetricsBundle;
import com.legacylens.core.model.Recommendation;
import com.legacylens.core.model.ReportSection;

/**
 * Formats one analysis result as a single Markdown document: score table, report sections,
 * recommendations table and embedded diagrams.
 */
public class MarkdownReportFormatter {

    private static final String NEWLINE = "\n";
    private static final String H1 = "# ";
    private static final String H2 = "## ";
    private static final String H3 = "### ";

    /**
     * Formats the report.
     *
     * @param result analysis result
     * @param diagrams rendered diagrams to embed, may be empty
     * @return Markdown document
     */
    public String format(AnalysisResult result, List<GeneratedDiagram> diagrams) {
        Objects.requireNonNull(result, "result must not be null");
        Objects.requireNonNull(diagrams, "diagrams must not be null");

        StringBuilder md = new StringBuilder();
        md.append(H1).append("Analysis Report: ").append(result.programId()).append(NEWLINE).append(NEWLINE);
        md.append("Source: `").append(result.sourceName()).append("`").append(NEWLINE).append(NEWLINE);

        appendScores(md, result.metrics());

        for (Map.Entry<ReportSection, String> section : result.reports().entrySet()) {
            md.append(H2).append(section.getKey().title()).append(NEWLINE).append(NEWLINE);
            md.append(section.getValue()).append(NEWLINE).append(NEWLINE);
        }

        appendRecommendations(md, result.recommendations());

        if (!diagrams.isEmpty()) {
            md.append(H2).append("Diagrams").append(NEWLINE).append(NEWLINE);
            for (GeneratedDiagram diagram : diagrams) {
                md.append(embed(diagram)).append(NEWLINE);
            }
        }
        return md.toString().stripTrailing() + NEWLINE;
    }

    private void appendScores(StringBuilder md, MetricsBundle metrics) {
        md.append(H2).append("Scores").append(NEWLINE).append(NEWLINE);
        md.append("| Metric | Value |").append(NEWLINE);
        md.append("|--------|-------|").append(NEWLINE);
        row(md, "Quality Score", decimal(metrics.qualityScore()));
        row(md, "Cyclomatic Complexity",
            metrics.complexity().cyclomatic() + " (" + metrics.complexity().rating().label() + ")");
        row(md, "Cognitive Complexity", String.valueOf(metrics.complexity().cognitive()));
        row(md, "Maintainability Index", decimal(metrics.complexity().maintainabilityIndex()));
        row(md, "Technical Debt", decimal(metrics.complexity().technicalDebtHours()) + " hours");
        row(md, "Security", metrics.security().score() + "/100 ("
            + metrics.security().riskLevel().label() + " risk)");
        row(md, "Modernization", metrics.modernization().score() + "/100 ("
            + metrics.modernization().priority().label() + " priority)");
        row(md, "Performance", metrics.performance().score() + "/100");
        md.append(NEWLINE);
    }

    private void appendRecommendations(StringBuilder md, List<Recommendation> recommendations) {
        md.append(H2).append("Recommendations").append(NEWLINE).append(NEWLINE);
        if (recommendations.isEmpty()) {
            md.append("No recommendations.").append(NEWLINE).append(NEWLINE);
            return;
        }
        md.append("| Priority | Category | Title | Description |").append(NEWLINE);
        md.append("|----------|----------|-------|-------------|").append(NEWLINE);
        for (Recommendation recommendation : recommendations) {
            md.append("| ").append(recommendation.priority().label())
                .append(" | ").append(recommendation.category())
                .append(" | ").append(cell(recommendation.title()))
                .append(" | ").append(cell(recommendation.description()))
                .append(" |").append(NEWLINE);
        }
        md.append(NEWLINE);
    }

    /**
     * Demotes the diagram's own top-level heading so it nests under the Diagrams section.
     */
    private String embed(GeneratedDiagram diagram) {
        String content = diagram.content();
        if (content.startsWith(H1)) {
            return H3 + content.substring(H1.length());
        }
        return content;
    }

    private static void row(StringBuilder md, String metric, String value) {
        md.append("| ").append(metric).append(" | ").append(cell(value)).append(" |").append(NEWLINE);
    }

    private static String cell(String text) {
        return text.replace("|", "\\|").replace("\n", " ");
    }

    private static String decimal(double value) {
        return String.format(Locale.ROOT, "%.2f", value);
    }
}
