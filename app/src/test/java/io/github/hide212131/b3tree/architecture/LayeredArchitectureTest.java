package io.github.hide212131.b3tree.architecture;

import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.classes;
import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.noClasses;

import com.tngtech.archunit.core.importer.ImportOption;
import com.tngtech.archunit.junit.AnalyzeClasses;
import com.tngtech.archunit.junit.ArchTest;
import com.tngtech.archunit.lang.ArchRule;

@AnalyzeClasses(
        packages = "io.github.hide212131.b3tree",
        importOptions = ImportOption.DoNotIncludeTests.class)
class LayeredArchitectureTest {

    private static final String APP = "io.github.hide212131.b3tree.app..";
    private static final String RUNTIME = "io.github.hide212131.b3tree.runtime..";
    private static final String INFRA = "io.github.hide212131.b3tree.infra..";
    private static final String MODEL = "io.github.hide212131.b3tree.runtime.model..";
    private static final String STATUS = "io.github.hide212131.b3tree.runtime.status..";
    private static final String REGISTRY = "io.github.hide212131.b3tree.runtime.registry..";
    private static final String IO = "io.github.hide212131.b3tree.runtime.io..";
    private static final String DIAGNOSTIC = "io.github.hide212131.b3tree.runtime.diagnostic..";
    private static final String RESOLVE = "io.github.hide212131.b3tree.runtime.resolve..";
    private static final String VALIDATE = "io.github.hide212131.b3tree.runtime.validate..";
    private static final String BUILD = "io.github.hide212131.b3tree.runtime.build..";

    @ArchTest
    static final ArchRule appModuleShouldOnlyDependOnAllowedLayers =
            classes()
                    .that()
                    .resideInAPackage(APP)
                    .should()
                    .onlyDependOnClassesThat()
                    .resideInAnyPackage(
                            APP,
                            RUNTIME,
                            INFRA,
                            "java..",
                            "javax..",
                            "picocli..");

    @ArchTest
    static final ArchRule runtimeModuleShouldNotDependOnAppNorOtherLayers =
            classes()
                    .that()
                    .resideInAPackage(RUNTIME)
                    .should()
                    .onlyDependOnClassesThat()
                    .resideInAnyPackage(
                            RUNTIME,
                            INFRA,
                            "java..",
                            "javax..",
                            "org.yaml..",
                            "com.fasterxml.jackson..",
                            "com.github.javaparser..");

    @ArchTest
    static final ArchRule infraModuleShouldBeLeafLayer =
            classes()
                    .that()
                    .resideInAPackage(INFRA)
                    .should()
                    .onlyDependOnClassesThat()
                    .resideInAnyPackage(INFRA, "java..", "javax..", "io.github.cdimascio..");

    @ArchTest
    static final ArchRule modelShouldNotDependOnResolution =
            noClasses()
                    .that()
                    .resideInAPackage(MODEL)
                    .should()
                    .dependOnClassesThat()
                    .resideInAnyPackage(RESOLVE, VALIDATE, BUILD);

    @ArchTest
    static final ArchRule statusAlgebraShouldOnlyReadDefinitionsAndNodes =
            classes()
                    .that()
                    .resideInAPackage(STATUS)
                    .should()
                    .onlyDependOnClassesThat()
                    .resideInAnyPackage(STATUS, MODEL, REGISTRY, "java..");

    @ArchTest
    static final ArchRule registryShouldNotDependOnPipelineStages =
            noClasses()
                    .that()
                    .resideInAPackage(REGISTRY)
                    .should()
                    .dependOnClassesThat()
                    .resideInAnyPackage(DIAGNOSTIC, RESOLVE, VALIDATE, BUILD);

    @ArchTest
    static final ArchRule treeIoShouldNotDependOnPipelineStages =
            noClasses()
                    .that()
                    .resideInAPackage(IO)
                    .should()
                    .dependOnClassesThat()
                    .resideInAnyPackage(RESOLVE, VALIDATE, BUILD);

    @ArchTest
    static final ArchRule resolveShouldNotDependOnValidationNorBuild =
            noClasses()
                    .that()
                    .resideInAPackage(RESOLVE)
                    .should()
                    .dependOnClassesThat()
                    .resideInAnyPackage(VALIDATE, BUILD);

    @ArchTest
    static final ArchRule validateShouldNotDependOnBuild =
            noClasses()
                    .that()
                    .resideInAPackage(VALIDATE)
                    .should()
                    .dependOnClassesThat()
                    .resideInAPackage(BUILD);

    @ArchTest
    static final ArchRule onlyBuildShouldLoadScripts =
            noClasses()
                    .that()
                    .resideOutsideOfPackage(BUILD)
                    .should()
                    .dependOnClassesThat()
                    .haveFullyQualifiedName("java.util.ServiceLoader")
                    .orShould()
                    .dependOnClassesThat()
                    .haveFullyQualifiedName("java.net.URLClassLoader");

    @ArchTest
    static final ArchRule yamlShouldStayInBuildReport =
            noClasses()
                    .that()
                    .resideOutsideOfPackage(BUILD)
                    .should()
                    .dependOnClassesThat()
                    .resideInAPackage("org.yaml..");

    @ArchTest
    static final ArchRule expressionParserShouldStayInValidation =
            noClasses()
                    .that()
                    .resideOutsideOfPackage(VALIDATE)
                    .should()
                    .dependOnClassesThat()
                    .resideInAPackage("com.github.javaparser..");
}
