package com.sopgenerator.core;

import com.tngtech.archunit.core.domain.JavaClasses;
import com.tngtech.archunit.core.importer.ClassFileImporter;
import com.tngtech.archunit.core.importer.ImportOption;
import com.tngtech.archunit.lang.ArchRule;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.*;

/**
 * ArchUnit tests to validate the layering of the generator.
 *
 * <p>These tests ensure:
 * <ul>
 *   <li>Domain models are implemented as immutable records</li>
 *   <li>Models depend on no pipeline stage</li>
 *   <li>Pipeline stages only depend on earlier stages</li>
 *   <li>Renderer implementations implement the renderer SPI</li>
 * </ul>
 */
class ArchitectureTest {

    private static JavaClasses classes;

    @BeforeAll
    static void importClasses() {
        classes = new ClassFileImporter()
            .withImportOption(ImportOption.Predefined.DO_NOT_INCLUDE_TESTS)
            .importPackages("com.sopgenerator.core");
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
     * Verifies the model layer has no dependencies on the stages that produce or consume it.
     */
    @Test
    void models_shouldNotDependOnStages() {
        ArchRule rule = noClasses()
            .that().resideInAPackage("..model..")
            .should().dependOnClassesThat().resideInAnyPackage(
                "..parser..", "..linearizer..", "..synthesis..", "..renderer..", "..pipeline..", "..session..");

        rule.check(classes);
    }

    /**
     * Verifies the parser knows nothing about later stages.
     */
    @Test
    void parser_shouldNotDependOnLaterStages() {
        ArchRule rule = noClasses()
            .that().resideInAPackage("..parser..")
            .should().dependOnClassesThat().resideInAnyPackage(
                "..linearizer..", "..synthesis..", "..renderer..", "..pipeline..");

        rule.check(classes);
    }

    /**
     * Verifies the renderers work on the document context only.
     */
    @Test
    void renderers_shouldNotDependOnParserOrLinearizer() {
        ArchRule rule = noClasses()
            .that().resideInAPackage("..renderer..")
            .should().dependOnClassesThat().resideInAnyPackage("..parser..", "..linearizer..", "..pipeline..");

        rule.check(classes);
    }

    /**
     * Verifies renderer implementations implement the renderer SPI.
     */
    @Test
    void rendererImplementations_shouldImplementSpi() {
        ArchRule rule = classes()
            .that().resideInAPackage("..renderer.impl..")
            .and().haveSimpleNameEndingWith("Renderer")
            .should().implement("com.sopgenerator.core.renderer.DocumentRenderer");

        rule.check(classes);
    }

    /**
     * Verifies utility classes don't depend on pipeline stages.
     */
    @Test
    void utilClasses_shouldNotDependOnStages() {
        ArchRule rule = noClasses()
            .that().resideInAPackage("..util..")
            .should().dependOnClassesThat().resideInAnyPackage(
                "..model..", "..parser..", "..linearizer..", "..renderer..");

        rule.check(classes);
    }
}
