package com.legacylens.core.extractor;

import com.legacylens.core.SampleSources;
import com.legacylens.core.model.DataItem;
import com.legacylens.core.model.Division;
import com.legacylens.core.model.FileDescriptor;
import com.legacylens.core.model.NormalizedLine;
import com.legacylens.core.model.Procedure;
import com.legacylens.core.model.ProcedureKind;
import com.legacylens.core.model.Rating;
import com.legacylens.core.model.SourceUnit;
import com.legacylens.core.model.StructuralModel;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link StructuralExtractor}.
 */
class StructuralExtractorTest {

    private StructuralExtractor extractor;

    @BeforeEach
    void setUp() {
        extractor = new StructuralExtractor();
    }

    @Test
    void extract_payrollProgram_readsProgramIdAndDivisions() {
        StructuralModel model = extractor.extract(SourceUnit.of(SampleSources.PAYROLL));

        assertThat(model.programId()).isEqualTo("PAYROLL");
        assertThat(model.divisions()).containsExactly(
            new Division("IDENTIFICATION", 1),
            new Division("ENVIRONMENT", 3),
            new Division("DATA", 4),
            new Division("PROCEDURE", 13));
        assertThat(model.isDegraded()).isFalse();
    }

    @Test
    void extract_payrollProgram_recordsParagraphsAndPerformTargets() {
        StructuralModel model = extractor.extract(SourceUnit.of(SampleSources.PAYROLL));

        assertThat(model.procedures()).containsExactly(
            new Procedure("MAIN-PARA", ProcedureKind.PARAGRAPH, 14),
            new Procedure("CALC-PARA", ProcedureKind.INVOKED, 15),
            new Procedure("CALC-PARA", ProcedureKind.PARAGRAPH, 19));
    }

    @Test
    void extract_payrollProgram_readsWorkingStorageItemsWithPictures() {
        StructuralModel model = extractor.extract(SourceUnit.of(SampleSources.PAYROLL));

        assertThat(model.dataItems()).extracting(DataItem::name, DataItem::level, DataItem::lineNumber, DataItem::picture)
            .containsExactly(
                tuple("WS-TOTAL", 1, 10, "9(7)V99"),
                tuple("WS-NAME", 1, 11, "X(30)"));
    }

    @Test
    void extract_payrollProgram_readsFileDescriptorsFromFileSectionOnly() {
        StructuralModel model = extractor.extract(SourceUnit.of(SampleSources.PAYROLL));

        assertThat(model.fileDescriptors()).containsExactly(
            new FileDescriptor("EMPLOYEE-FILE", "FD EMPLOYEE-FILE"));
    }

    @Test
    void extract_payrollProgram_collectsDependenciesInFirstSeenOrder() {
        StructuralModel model = extractor.extract(SourceUnit.of(SampleSources.PAYROLL));

        assertThat(model.dependencies()).containsExactly("SUBPGM", "DYNAMIC:WS-ROUTINE");
        assertThat(model.copyDependencies()).containsExactly("EMPCOPY");
        assertThat(model.dynamicDependencies()).containsExactly("DYNAMIC:WS-ROUTINE");
    }

    @Test
    void extract_payrollProgram_countsLinesAndSeedsLowComplexity() {
        StructuralModel model = extractor.extract(SourceUnit.of(SampleSources.PAYROLL));

        assertThat(model.lineStats().total()).isEqualTo(20);
        assertThat(model.lineStats().code()).isEqualTo(20);
        assertThat(model.estimatedComplexity()).isEqualTo(Rating.LOW);
    }

    @Test
    void extract_withoutProgramIdentity_returnsUnknownAndNoDivisions() {
        StructuralModel model = extractor.extract(SourceUnit.of(SampleSources.ANONYMOUS));

        assertThat(model.programId()).isEqualTo(StructuralModel.UNKNOWN_PROGRAM);
        assertThat(model.divisions()).isEmpty();
        assertThat(model.estimatedComplexity()).isEqualTo(Rating.LOW);
        assertThat(model.lineStats().comment()).isEqualTo(1);
    }

    @Test
    void extract_callToQuotedLiteral_recordsPlainName() {
        StructuralModel model = extractor.extract(SourceUnit.of("           CALL \"SUBPGM\" USING WS-AREA."));

        assertThat(model.dependencies()).containsExactly("SUBPGM");
    }

    @Test
    void extract_callToIdentifier_recordsDynamicDependency() {
        StructuralModel model = extractor.extract(SourceUnit.of("           CALL SUBRTN USING WS-AREA."));

        assertThat(model.dependencies()).containsExactly("DYNAMIC:SUBRTN");
    }

    @Test
    void extract_repeatedCalls_deduplicatesDependencies() {
        String text = "           CALL 'A'.\n           CALL 'B'.\n           CALL 'A'.";

        StructuralModel model = extractor.extract(SourceUnit.of(text));

        assertThat(model.dependencies()).containsExactly("A", "B");
    }

    @Test
    void extract_hyphenatedKeywordLikeNames_areNotMatched() {
        String text = "           MOVE END-CALL TO COPY-FLAG.";

        StructuralModel model = extractor.extract(SourceUnit.of(text));

        assertThat(model.dependencies()).isEmpty();
        assertThat(model.copyDependencies()).isEmpty();
    }

    @Test
    void extract_lowerCaseSource_matchesCaseInsensitively() {
        String text = "       program-id. lowprog.\n       procedure division.\n           call 'helper'.";

        StructuralModel model = extractor.extract(SourceUnit.of(text));

        assertThat(model.programId()).isEqualTo("lowprog");
        assertThat(model.divisions()).extracting(Division::name).containsExactly("PROCEDURE");
        assertThat(model.dependencies()).containsExactly("helper");
    }

    @Test
    void extract_workingStorageEndsAtNextSection() {
        String text = String.join("\n",
            "       WORKING-STORAGE SECTION.",
            "       01 WS-A PIC X.",
            "       LINKAGE SECTION.",
            "       01 LK-B PIC X.");

        StructuralModel model = extractor.extract(SourceUnit.of(text));

        assertThat(model.dataItems()).extracting(DataItem::name).containsExactly("WS-A");
    }

    @Test
    void extract_commentedOutDataItem_isIgnored() {
        String text = String.join("\n",
            "       WORKING-STORAGE SECTION.",
            "      *01 WS-OLD PIC X.",
            "       01 WS-NEW PIC X.");

        StructuralModel model = extractor.extract(SourceUnit.of(text));

        assertThat(model.dataItems()).extracting(DataItem::name).containsExactly("WS-NEW");
    }

    @Test
    void extract_manyDecisions_seedsHighComplexity() {
        StructuralModel model = extractor.extract(SourceUnit.of(SampleSources.repeat("           IF A > B", 200)));

        assertThat(model.estimatedComplexity()).isEqualTo(Rating.HIGH);
    }

    @Test
    void extract_moderateCalls_seedsMediumComplexity() {
        StructuralModel model = extractor.extract(SourceUnit.of(SampleSources.repeat("           CALL 'A'.", 60)));

        assertThat(model.estimatedComplexity()).isEqualTo(Rating.MEDIUM);
    }

    @Test
    void extract_internalFault_returnsDegradedModel() {
        // Given
        StructuralExtractor failing = new StructuralExtractor() {
            @Override
            protected List<Procedure> extractProcedures(List<NormalizedLine> lines) {
                throw new IllegalStateException("boom");
            }
        };

        // When
        StructuralModel model = failing.extract(SourceUnit.of(SampleSources.PAYROLL));

        // Then
        assertThat(model.isDegraded()).isTrue();
        assertThat(model.error()).isEqualTo("IllegalStateException: boom");
        assertThat(model.programId()).isEqualTo(StructuralModel.UNKNOWN_PROGRAM);
        assertThat(model.lineStats().total()).isEqualTo(20);
        assertThat(model.procedures()).isEmpty();
    }

    @Test
    void extract_nullUnit_throwsNullPointerException() {
        assertThatThrownBy(() -> extractor.extract((SourceUnit) null))
            .isInstanceOf(NullPointerException.class);
    }

    @Test
    void extract_normalizedTextAgain_yieldsSameModel() {
        // Given
        LineNormalizer normalizer = new LineNormalizer();
        String raw = "000100 PROGRAM-ID. SEQPGM.\n000200 PROCEDURE DIVISION.\n000300     CALL 'X'.";
        String normalized = LineNormalizer.toText(normalizer.normalize(raw));

        // When
        StructuralModel first = extractor.extract(SourceUnit.of(raw));
        StructuralModel second = extractor.extract(SourceUnit.of(normalized));

        // Then
        assertThat(second).isEqualTo(first);
    }
}
