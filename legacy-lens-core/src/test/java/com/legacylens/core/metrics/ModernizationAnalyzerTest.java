package com.legacylens.core.metrics;

import com.legacylens.core.SampleSources;
import com.legacylens.core.model.ModernizationAssessment;
import com.legacylens.core.model.Priority;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link ModernizationAnalyzer}.
 */
class ModernizationAnalyzerTest {

    private final ModernizationAnalyzer analyzer = new ModernizationAnalyzer();

    @Test
    void analyze_payroll_deductsForMissingConfigurationAndFunctions() {
        ModernizationAssessment assessment = MetricsTestSupport.analyze(analyzer, SampleSources.PAYROLL);

        assertThat(assessment.score()).isEqualTo(85);
        assertThat(assessment.opportunities()).hasSize(2);
        assertThat(assessment.recommendedApproach()).isEqualTo("Maintenance mode - minor enhancements only");
        assertThat(assessment.targetTechnologies()).contains("Relational database for file-based records");
    }

    @Test
    void analyze_dynamicCall_addsChallengeAndEscalatesPriority() {
        ModernizationAssessment assessment = MetricsTestSupport.analyze(analyzer, SampleSources.PAYROLL);

        assertThat(assessment.challenges()).singleElement().asString().startsWith("Dynamic calls (1)");
        assertThat(assessment.priority()).isEqualTo(Priority.MEDIUM);
    }

    @Test
    void analyze_payroll_estimatesEffortFromOpportunitiesProceduresAndDependencies() {
        // 2 * 2.0 + 3 * 0.1 + 2 * 0.2 = 4.7
        ModernizationAssessment assessment = MetricsTestSupport.analyze(analyzer, SampleSources.PAYROLL);

        assertThat(assessment.effortDays()).isEqualTo(5);
    }

    @Test
    void analyze_modernProgram_scoresFullAndStaysLowPriority() {
        String text = String.join("\n",
            "       OBJECT-COMPUTER. IBM-Z.",
            "           COMPUTE WS-LEN = FUNCTION LENGTH(WS-NAME).");

        ModernizationAssessment assessment = MetricsTestSupport.analyze(analyzer, text);

        assertThat(assessment.score()).isEqualTo(100);
        assertThat(assessment.opportunities()).isEmpty();
        assertThat(assessment.challenges()).isEmpty();
        assertThat(assessment.priority()).isEqualTo(Priority.LOW);
        assertThat(assessment.effortDays()).isEqualTo(1);
    }

    @Test
    void analyze_gotoSqlAndAlter_combinesDeductionsAndChallenges() {
        // Given
        String text = String.join("\n",
            "           GO TO P1.",
            "           EXEC SQL SELECT 1 INTO :WS-X FROM T END-EXEC.",
            "           ALTER P1 TO PROCEED TO P2.");

        // When
        ModernizationAssessment assessment = MetricsTestSupport.analyze(analyzer, text);

        // Then
        assertThat(assessment.score()).isEqualTo(70);
        assertThat(assessment.priority()).isEqualTo(Priority.HIGH);
        assertThat(assessment.challenges()).hasSize(1);
        assertThat(assessment.recommendedApproach()).isEqualTo("Incremental improvements - focus on critical areas");
        assertThat(assessment.targetTechnologies()).contains("REST APIs for database access");
    }

    @Test
    void analyze_manyCopybooks_isAChallenge() {
        StringBuilder text = new StringBuilder("       OBJECT-COMPUTER. X.\n       MOVE FUNCTION UPPER-CASE(A) TO B.");
        for (int i = 1; i <= 11; i++) {
            text.append("\n       COPY BOOK").append(i).append('.');
        }

        ModernizationAssessment assessment = MetricsTestSupport.analyze(analyzer, text.toString());

        assertThat(assessment.challenges()).singleElement().asString().contains("11 copybooks");
        assertThat(assessment.priority()).isEqualTo(Priority.MEDIUM);
    }

    @ParameterizedTest
    @CsvSource({
        "0, CRITICAL",
        "39, CRITICAL",
        "40, HIGH",
        "59, HIGH",
        "60, MEDIUM",
        "79, MEDIUM",
        "80, LOW",
        "100, LOW"
    })
    void priority_mapsScoreBands(int score, Priority expected) {
        assertThat(ModernizationAnalyzer.priority(score)).isEqualTo(expected);
    }

    @Test
    void effortDays_neverBelowOne() {
        assertThat(ModernizationAnalyzer.effortDays(0, 0, 0)).isEqualTo(1);
    }

    @Test
    void approach_lowScore_recommendsRewrite() {
        assertThat(ModernizationAnalyzer.approach(20)).startsWith("Complete rewrite");
        assertThat(ModernizationAnalyzer.approach(50)).startsWith("Significant refactoring");
    }
}
