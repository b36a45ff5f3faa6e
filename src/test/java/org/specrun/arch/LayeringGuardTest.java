package org.specrun.arch;

import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.noClasses;

import com.tngtech.archunit.core.importer.ImportOption;
import com.tngtech.archunit.junit.AnalyzeClasses;
import com.tngtech.archunit.junit.ArchTest;
import com.tngtech.archunit.lang.ArchRule;

@AnalyzeClasses(packages = "org.specrun", importOptions = ImportOption.DoNotIncludeTests.class)
class LayeringGuardTest {
    @ArchTest
    static final ArchRule model_does_not_depend_on_runner = noClasses()
            .that()
            .resideInAnyPackage(
                    "org.specrun.clock..",
                    "org.specrun.diff..",
                    "org.specrun.result..",
                    "org.specrun.tree..")
            .should()
            .dependOnClassesThat()
            .resideInAnyPackage(
                    "org.specrun.config..",
                    "org.specrun.engine..",
                    "org.specrun.format..",
                    "org.specrun.report..");

    @ArchTest
    static final ArchRule formatters_do_not_depend_on_engine = noClasses()
            .that()
            .resideInAnyPackage("org.specrun.format..", "org.specrun.report..", "org.specrun.obs..")
            .should()
            .dependOnClassesThat()
            .resideInAnyPackage("org.specrun.engine..");
}
