package org.fastbuild.lsp.evaluator.functions;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * The FASTBuild functions that declare a build target, e.g. {@code Executable('MyApp') { ... }}.
 * <p>
 * The required properties are metadata for editor features such as completion; evaluation does not
 * enforce them. The target-list properties name other targets and feed target references.
 */
public enum GenericFunction {
    ALIAS("Alias", List.of("Targets"), List.of("Targets")),
    COMPILER("Compiler", List.of("Executable"), List.of()),
    COPY("Copy", List.of("Source", "Dest"), List.of()),
    COPY_DIR("CopyDir", List.of("SourcePaths", "Dest"), List.of()),
    CS_ASSEMBLY("CSAssembly", List.of("Compiler", "CompilerOptions", "CompilerOutput"), List.of()),
    DLL("DLL", List.of("Linker", "LinkerOutput", "LinkerOptions", "Libraries"), List.of("Libraries")),
    EXEC("Exec", List.of("ExecExecutable", "ExecOutput"), List.of()),
    EXECUTABLE("Executable", List.of("Linker", "LinkerOutput", "LinkerOptions", "Libraries"), List.of("Libraries")),
    LIBRARY("Library", List.of("Compiler", "CompilerOptions", "Librarian", "LibrarianOptions", "LibrarianOutput"), List.of()),
    LIST_DEPENDENCIES("ListDependencies", List.of("Source", "Dest"), List.of()),
    OBJECT_LIST("ObjectList", List.of("Compiler", "CompilerOptions"), List.of()),
    REMOVE_DIR("RemoveDir", List.of("RemovePaths"), List.of()),
    TEST("Test", List.of("TestExecutable", "TestOutput"), List.of()),
    TEXT_FILE("TextFile", List.of("TextFileOutput", "TextFileInputStrings"), List.of()),
    UNITY("Unity", List.of("UnityOutputPath"), List.of()),
    VCX_PROJECT("VCXProject", List.of("ProjectOutput"), List.of()),
    VS_PROJECT_EXTERNAL("VSProjectExternal", List.of("ExternalProjectPath"), List.of()),
    VS_SOLUTION("VSSolution", List.of("SolutionOutput"), List.of()),
    XCODE_PROJECT("XCodeProject", List.of("ProjectOutput"), List.of());

    /** Properties of every build-declaration function that list targets to build first. */
    public static final String PRE_BUILD_DEPENDENCIES = "PreBuildDependencies";

    private final String functionName;
    private final List<String> requiredProperties;
    private final List<String> targetListProperties;

    GenericFunction(String functionName, List<String> requiredProperties, List<String> targetListProperties) {
        this.functionName = functionName;
        this.requiredProperties = requiredProperties;
        this.targetListProperties = targetListProperties;
    }

    /**
     * @return The name as written in BFF source.
     */
    public String functionName() {
        return functionName;
    }

    public List<String> requiredProperties() {
        return requiredProperties;
    }

    /**
     * @return The properties whose values are target names, {@value #PRE_BUILD_DEPENDENCIES} included.
     */
    public List<String> targetListProperties() {
        if (targetListProperties.isEmpty()) {
            return List.of(PRE_BUILD_DEPENDENCIES);
        }
        List<String> properties = new ArrayList<>(targetListProperties);
        properties.add(PRE_BUILD_DEPENDENCIES);
        return properties;
    }

    /**
     * Looks up a function by its source name. Names are case-sensitive.
     * @param name The name.
     * @return The function, if {@code name} is a build-declaration function.
     */
    public static Optional<GenericFunction> fromName(String name) {
        for (GenericFunction function : values()) {
            if (function.functionName.equals(name)) {
                return Optional.of(function);
            }
        }
        return Optional.empty();
    }
}
