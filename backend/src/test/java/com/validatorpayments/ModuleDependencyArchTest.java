package com.validatorpayments;

import com.tngtech.archunit.core.domain.JavaClasses;
import com.tngtech.archunit.core.importer.ClassFileImporter;
import com.tngtech.archunit.core.importer.ImportOption;
import com.tngtech.archunit.lang.ArchRule;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.noClasses;
import static com.tngtech.archunit.library.dependencies.SlicesRuleDefinition.slices;

/**
 * Package boundaries: api -> payments -> chain -> common.
 */
class ModuleDependencyArchTest {

    private static JavaClasses classes;

    @BeforeAll
    static void scan() {
        classes = new ClassFileImporter()
                .withImportOption(ImportOption.Predefined.DO_NOT_INCLUDE_TESTS)
                .importPackages("com.validatorpayments");
    }

    @Test
    void common_must_not_depend_on_other_app_modules() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("..common..")
                .should().dependOnClassesThat().resideInAnyPackage("..chain..", "..payments..", "..api..", "..config..");
        rule.check(classes);
    }

    @Test
    void chain_must_not_depend_on_payments_or_api() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("..chain..")
                .should().dependOnClassesThat().resideInAnyPackage("..payments..", "..api..");
        rule.check(classes);
    }

    @Test
    void payments_must_not_depend_on_api() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("..payments..")
                .should().dependOnClassesThat().resideInAPackage("..api..");
        rule.check(classes);
    }

    @Test
    void api_must_not_call_chain_adapters_directly() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("..api..")
                .should().dependOnClassesThat().resideInAPackage("..chain..");
        rule.check(classes);
    }

    @Test
    void no_cyclic_dependencies_between_slices() {
        ArchRule rule = slices()
                .matching("com.validatorpayments.(*)..")
                .should().beFreeOfCycles();
        rule.check(classes);
    }
}
