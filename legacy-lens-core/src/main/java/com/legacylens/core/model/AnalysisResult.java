package com.legacylens.core.model;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Complete outcome of analyzing one source unit.
 *
 * @param sourceName display name of the analyzed source, or the program id when none was given
 * @param model structural model
 * @param metrics metrics bundle
 * @param recommendations recommendations sorted most urgent first
 * @param diagrams flow, data and dependency diagrams
 * @param reports narrative sections keyed by section, in document order
 */
public record AnalysisResult(
    String sourceName,
    StructuralModel model,
    MetricsBundle metrics,
    List<Recommendation> recommendations,
    List<Diagram> diagrams,
    Map<ReportSection, String> reports
) {
    public AnalysisResult {
        Objects.requireNonNull(sourceName, "sourceName must not be null");
        Objects.requireNonNull(model, "model must not be null");
        Objects.requireNonNull(metrics, "metrics must not be null");
        recommendations = recommendations == null ? List.of() : List.copyOf(recommendations);
        diagrams = diagrams == null ? List.of() : List.copyOf(diagrams);
        reports = reports == null || reports.isEmpty()
            ? Map.of()
            : Collections.unmodifiableMap(new EnumMap<>(reports));
    }

    public String programId() {
        return model.programId();
    }

    /**
     * Finds the diagram of the given kind.
     *
     * @param kind diagram kind
     * @return diagram, or null when it was not synthesized
     */
    public Diagram diagram(DiagramKind kind) {
        return diagrams.stream()
            .filter(diagram -> diagram.kind() == kind)
            .findFirst()
            .orElse(null);
    }
}
