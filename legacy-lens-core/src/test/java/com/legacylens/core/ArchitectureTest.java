package com.legacylens.core;

import com.tngtech.archunit.core.domain.JavaClasses;
import com.tngtech.archunit.core.importer.ClassFileImporter;
import com.tngtech.archunit.core.importer.ImportOption;
import com.tngtech.archunit.lang.ArchRule;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.*;

/**
 * ArchUnit tests to validate architectural rules.
 *
 * <p>These tests ensure:
 * <ul>
 *   <li>Domain models are immutable records or enums</li>
 *   <li>The analysis pipeline never touches the file system</li>
 *   <li>Pipeline stages only depend forward</li>
 * </ul>
 */
class ArchitectureTest {

    private static JavaClasses classes;

    @BeforeAll
    static void importClasses() {
        classes = new ClassFileImporter()
            .withImportOption(ImportOption.Predefined.DO_NOT_INCLUDE_TESTS)
            .importPackages("com.legacylens.core");
    }

    /**
     * Verifies all domain models in the model package are implemented as Java records.
     */
    @Test
    void models_shouldBeRecords() {
        ArchRule rule = classes()
            .that().resideInAPackage("..model..")
            .and().areTopLevelClasses()
            .and().areNotEnums()
            .should().beRecords();

        rule.check(classes);
    }

    /**
     * Verifies analysis packages work on text only. Reading sources and writing output belong to
     * the source, config and renderer packages.
     */
    @Test
    void analysisPackages_shouldNotAccessFileSystem() {
        ArchRule rule = noClasses()
            .that().resideInAnyPackage(
                "..core.model..", "..core.extractor..", "..core.metrics..", "..core.report..",
                "..core.engine..", "..core.portfolio..", "..core.generator..", "..core.heuristics..",
                "..core.util..", "..core.export..")
            .should().dependOnClassesThat().resideInAPackage("java.nio.file..")
            .orShould().dependOnClassesThat().haveFullyQualifiedName("java.io.File");

        rule.check(classes);
    }

    /**
     * Verifies the model layer has no dependencies on the stages that produce or consume it.
     */
    @Test
    void models_shouldNotDependOnPipelineStages() {
        ArchRule rule = noClasses()
            .that().resideInAPackage("..model..")
            .should().dependOnClassesThat().resideInAnyPackage(
                "..extractor..", "..metrics..", "..report..", "..engine..", "..generator..", "..renderer..");

        rule.check(classes);
    }

    /**
     * Verifies the extractor does not depend on later stages.
     */
    @Test
    void extractor_shouldNotDependOnLaterStages() {
        ArchRule rule = noClasses()
            .that().resideInAPackage("..extractor..")
            .should().dependOnClassesThat().resideInAnyPackage("..metrics..", "..report..", "..engine..");

        rule.check(classes);
    }

    /**
     * Verifies metric facets do not depend on report synthesis.
     */
    @Test
    void metrics_shouldNotDependOnReports() {
        ArchRule rule = noClasses()
            .that().resideInAPackage("..metrics..")
            .should().dependOnClassesThat().resideInAnyPackage("..report..", "..engine..");

        rule.check(classes);
    }
}
