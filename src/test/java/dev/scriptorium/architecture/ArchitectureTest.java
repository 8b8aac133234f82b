package dev.scriptorium.architecture;

import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.noClasses;
import static com.tngtech.archunit.library.dependencies.SlicesRuleDefinition.slices;

import com.tngtech.archunit.core.importer.ImportOption;
import com.tngtech.archunit.junit.AnalyzeClasses;
import com.tngtech.archunit.junit.ArchTest;
import com.tngtech.archunit.lang.ArchRule;

@AnalyzeClasses(packages = "dev.scriptorium", importOptions = ImportOption.DoNotIncludeTests.class)
class ArchitectureTest {

  // Feature packages should not depend on the REST adapter.
  @ArchTest
  static final ArchRule features_should_not_depend_on_api =
      noClasses()
          .that()
          .resideInAnyPackage("..ingestion..", "..search..", "..document..")
          .should()
          .dependOnClassesThat()
          .resideInAnyPackage("..api..");

  // Config wires features together but is never wired into them.
  @ArchTest
  static final ArchRule features_should_not_depend_on_config =
      noClasses()
          .that()
          .resideInAnyPackage("..ingestion..", "..search..", "..document..")
          .should()
          .dependOnClassesThat()
          .resideInAPackage("..config..");

  @ArchTest
  static final ArchRule config_should_not_depend_on_api =
      noClasses()
          .that()
          .resideInAPackage("..config..")
          .should()
          .dependOnClassesThat()
          .resideInAPackage("..api..");

  // The corpus layer sits below ingestion and search.
  @ArchTest
  static final ArchRule document_should_not_depend_on_features =
      noClasses()
          .that()
          .resideInAPackage("..document..")
          .should()
          .dependOnClassesThat()
          .resideInAnyPackage("..ingestion..", "..search..");

  // No cyclic dependencies between top-level packages
  @ArchTest
  static final ArchRule no_package_cycles =
      slices().matching("dev.scriptorium.(*)..").should().beFreeOfCycles();
}
