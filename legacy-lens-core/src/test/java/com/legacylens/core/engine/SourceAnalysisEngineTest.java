package com.legacylens.core.engine;

import com.legacylens.core.SampleSources;
import com.legacylens.core.extractor.StructuralExtractor;
import com.legacylens.core.metrics.MetricsEngine;
import com.legacylens.core.model.AnalysisResult;
import com.legacylens.core.model.DiagramKind;
import com.legacylens.core.model.NormalizedLine;
import com.legacylens.core.model.Procedure;
import com.legacylens.core.model.Recommendation;
import com.legacylens.core.model.ReportSection;
import com.legacylens.core.model.SourceUnit;
import com.legacylens.core.model.StructuralModel;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link SourceAnalysisEngine}.
 */
class SourceAnalysisEngineTest {

    private SourceAnalysisEngine engine;

    @BeforeEach
    void setUp() {
        engine = new SourceAnalysisEngine();
    }

    @Test
    void analyze_payroll_producesCompleteResult() {
        AnalysisResult result = engine.analyze(SourceUnit.of(SampleSources.PAYROLL));

        assertThat(result.programId()).isEqualTo("PAYROLL");
        assertThat(result.sourceName()).isEqualTo("PAYROLL");
        assertThat(result.recommendations()).extracting(Recommendation::title)
            .containsExactly("Improve Inline Documentation");
        assertThat(result.diagrams()).hasSize(3);
        assertThat(result.diagram(DiagramKind.FLOW).nodes()).hasSize(5);
        assertThat(result.reports()).hasSize(ReportSection.values().length);
    }

    @Test
    void analyze_withDisplayName_keepsIt() {
        AnalysisResult result = engine.analyze(new SourceUnit(SampleSources.PAYROLL, "legacy/PAYROLL.cbl"));

        assertThat(result.sourceName()).isEqualTo("legacy/PAYROLL.cbl");
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "\n", "\u0000\u0001garbage￿", "PROGRAM-ID.", "CALL", "       COPY"})
    void analyze_anyText_neverFails(String text) {
        AnalysisResult result = engine.analyze(SourceUnit.of(text));

        assertThat(result.metrics().qualityScore()).isBetween(0.0, 100.0);
        assertThat(result.metrics().complexity().cyclomatic()).isGreaterThanOrEqualTo(1);
    }

    @Test
    void analyze_extractionFault_continuesWithDegradedModel() {
        // Given
        StructuralExtractor failing = new StructuralExtractor() {
            @Override
            protected List<Procedure> extractProcedures(List<NormalizedLine> lines) {
                throw new IllegalStateException("boom");
            }
        };
        SourceAnalysisEngine degradedEngine = new SourceAnalysisEngine(failing, new MetricsEngine());

        // When
        AnalysisResult result = degradedEngine.analyze(SourceUnit.of(SampleSources.PAYROLL));

        // Then
        assertThat(result.model().isDegraded()).isTrue();
        assertThat(result.programId()).isEqualTo(StructuralModel.UNKNOWN_PROGRAM);
        assertThat(result.reports().get(ReportSection.EXECUTIVE_SUMMARY)).contains("Structural extraction was incomplete");
        assertThat(result.diagrams()).hasSize(3);
    }

    @Test
    void analyze_nullUnit_throwsNullPointerException() {
        assertThatThrownBy(() -> engine.analyze(null)).isInstanceOf(NullPointerException.class);
    }
}
