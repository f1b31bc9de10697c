package io.packageoperator.manager.architecture;

import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.noClasses;

import com.tngtech.archunit.core.domain.JavaClasses;
import com.tngtech.archunit.core.importer.ClassFileImporter;
import com.tngtech.archunit.core.importer.ImportOption;
import com.tngtech.archunit.lang.ArchRule;
import org.junit.jupiter.api.Test;

class ArchitectureTest {

  private static final JavaClasses CLASSES = new ClassFileImporter()
      .withImportOption(ImportOption.Predefined.DO_NOT_INCLUDE_TESTS)
      .importPackages("io.packageoperator.manager");

  @Test
  void slicesDoNotDependOnControllers() {
    ArchRule rule = noClasses().that().resideInAPackage("..manager.slices..")
        .should().dependOnClassesThat()
        .resideInAnyPackage("..manager.objectdeployments..", "..manager.objectsets..", "..manager.config..");
    rule.check(CLASSES);
  }

  @Test
  void controllersDoNotDependOnEachOther() {
    noClasses().that().resideInAPackage("..manager.objectdeployments..")
        .should().dependOnClassesThat().resideInAPackage("..manager.objectsets..")
        .check(CLASSES);
    noClasses().that().resideInAPackage("..manager.objectsets..")
        .should().dependOnClassesThat().resideInAPackage("..manager.objectdeployments..")
        .check(CLASSES);
  }

  @Test
  void probesOnlyReadObjects() {
    ArchRule rule = noClasses().that().resideInAPackage("..objectsets.probing..")
        .should().dependOnClassesThat()
        .resideInAnyPackage("io.packageoperator.store..", "io.packageoperator.dynamiccache..");
    rule.check(CLASSES);
  }

  @Test
  void springStaysInTheConfigLayer() {
    ArchRule rule = noClasses().that()
        .resideInAnyPackage("..manager.slices..", "..manager.objectdeployments..", "..manager.objectsets..")
        .should().dependOnClassesThat().resideInAPackage("org.springframework..");
    rule.check(CLASSES);
  }
}
