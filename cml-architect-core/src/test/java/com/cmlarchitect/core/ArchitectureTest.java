package com.cmlarchitect.core;

import com.tngtech.archunit.core.domain.JavaClasses;
import com.tngtech.archunit.core.importer.ClassFileImporter;
import com.tngtech.archunit.core.importer.ImportOption;
import com.tngtech.archunit.lang.ArchRule;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.*;

/**
 * ArchUnit tests to validate package layering.
 *
 * <p>These tests ensure:
 * <ul>
 *   <li>Domain models are implemented as immutable records</li>
 *   <li>The model depends on nothing else in the project</li>
 *   <li>Parsing, validation and writing stay independent of the workspace</li>
 * </ul>
 */
class ArchitectureTest {

    private static JavaClasses classes;

    @BeforeAll
    static void importClasses() {
        classes = new ClassFileImporter()
            .withImportOption(ImportOption.Predefined.DO_NOT_INCLUDE_TESTS)
            .importPackages("com.cmlarchitect.core");
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
            .and().areNotInterfaces()
            .should().beRecords();

        rule.check(classes);
    }

    @Test
    void models_shouldNotDependOnOtherLayers() {
        ArchRule rule = noClasses()
            .that().resideInAPackage("..core.model..")
            .should().dependOnClassesThat().resideInAnyPackage(
                "..core.parser..", "..core.validation..", "..core.writer..", "..core.workspace..", "..core.config..");

        rule.check(classes);
    }

    @Test
    void parser_shouldNotDependOnWriterOrWorkspace() {
        ArchRule rule = noClasses()
            .that().resideInAPackage("..core.parser..")
            .should().dependOnClassesThat().resideInAnyPackage(
                "..core.writer..", "..core.workspace..", "..core.config..", "..core.validation..");

        rule.check(classes);
    }

    /**
     * Verifies the writer never reparses text; escaping relies on the keyword tables only.
     */
    @Test
    void writer_shouldNotDependOnParserOrWorkspace() {
        ArchRule rule = noClasses()
            .that().resideInAPackage("..core.writer..")
            .should().dependOnClassesThat().resideInAnyPackage("..core.parser..", "..core.workspace..");

        rule.check(classes);
    }

    @Test
    void validation_shouldNotDependOnWorkspace() {
        ArchRule rule = noClasses()
            .that().resideInAPackage("..core.validation..")
            .should().dependOnClassesThat().resideInAnyPackage("..core.workspace..", "..core.writer..");

        rule.check(classes);
    }

    /**
     * Verifies utility classes don't depend on the domain.
     */
    @Test
    void utilClasses_shouldNotDependOnDomain() {
        ArchRule rule = noClasses()
            .that().resideInAPackage("..core.util..")
            .should().dependOnClassesThat().resideInAnyPackage(
                "..core.model..", "..core.parser..", "..core.validation..", "..core.writer..", "..core.workspace..");

        rule.check(classes);
    }
}
