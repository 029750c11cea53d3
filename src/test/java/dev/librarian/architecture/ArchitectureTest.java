package dev.librarian.architecture;

import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.noClasses;
import static com.tngtech.archunit.library.dependencies.SlicesRuleDefinition.slices;

import com.tngtech.archunit.core.importer.ImportOption;
import com.tngtech.archunit.junit.AnalyzeClasses;
import com.tngtech.archunit.junit.ArchTest;
import com.tngtech.archunit.lang.ArchRule;

@AnalyzeClasses(packages = "dev.librarian", importOptions = ImportOption.DoNotIncludeTests.class)
class ArchitectureTest {

  // Feature packages should not depend on adapter packages.
  @ArchTest
  static final ArchRule features_should_not_depend_on_adapters =
      noClasses()
          .that()
          .resideInAnyPackage(
              "..taxonomy..",
              "..classification..",
              "..llm..",
              "..files..",
              "..item..",
              "..migration..",
              "..session..")
          .should()
          .dependOnClassesThat()
          .resideInAnyPackage("..mcp..", "..api..");

  // Adapter packages should not depend on each other
  @ArchTest
  static final ArchRule adapters_should_not_depend_on_each_other =
      noClasses()
          .that()
          .resideInAPackage("..mcp..")
          .should()
          .dependOnClassesThat()
          .resideInAPackage("..api..");

  @ArchTest
  static final ArchRule api_should_not_depend_on_mcp =
      noClasses()
          .that()
          .resideInAPackage("..api..")
          .should()
          .dependOnClassesThat()
          .resideInAPackage("..mcp..");

  // Language model adapters stay independent of the classification logic that uses them
  @ArchTest
  static final ArchRule llm_should_not_depend_on_classification =
      noClasses()
          .that()
          .resideInAPackage("..llm..")
          .should()
          .dependOnClassesThat()
          .resideInAPackage("..classification..");

  @ArchTest
  static final ArchRule config_should_not_depend_on_adapters =
      noClasses()
          .that()
          .resideInAPackage("..config..")
          .should()
          .dependOnClassesThat()
          .resideInAnyPackage("..mcp..", "..api..");

  // No cyclic dependencies between top-level packages
  @ArchTest
  static final ArchRule no_package_cycles =
      slices().matching("dev.librarian.(*)..").should().beFreeOfCycles();
}
