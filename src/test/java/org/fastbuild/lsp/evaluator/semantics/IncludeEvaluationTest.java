package org.fastbuild.lsp.evaluator.semantics;

import org.fastbuild.lsp.evaluator.api.EvaluatedData;
import org.fastbuild.lsp.evaluator.api.EvaluatedVariable;
import org.fastbuild.lsp.evaluator.api.EvaluationResult;
import org.fastbuild.lsp.evaluator.api.SourceException;
import org.fastbuild.lsp.evaluator.api.SourceRange;
import org.fastbuild.lsp.evaluator.api.VariableDefinition;
import org.fastbuild.lsp.evaluator.io.FileUris;
import org.fastbuild.lsp.evaluator.io.InMemoryFileSystem;
import org.fastbuild.lsp.evaluator.value.Value;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.fastbuild.lsp.evaluator.EvaluatorTestHelper.ROOT_FILE;
import static org.fastbuild.lsp.evaluator.EvaluatorTestHelper.ROOT_URI;
import static org.fastbuild.lsp.evaluator.EvaluatorTestHelper.WORKSPACE;
import static org.fastbuild.lsp.evaluator.EvaluatorTestHelper.definitionNamed;
import static org.fastbuild.lsp.evaluator.EvaluatorTestHelper.evaluate;
import static org.fastbuild.lsp.evaluator.EvaluatorTestHelper.evaluatedValues;
import static org.fastbuild.lsp.evaluator.EvaluatorTestHelper.evaluatedValuesOnLine;
import static org.fastbuild.lsp.evaluator.EvaluatorTestHelper.lines;
import static org.fastbuild.lsp.evaluator.EvaluatorTestHelper.str;

/**
 * Contains tests for {@code #include} and {@code #once}, run against an in-memory workspace.
 */
public class IncludeEvaluationTest {

    private static final Path SUB_INCLUDE = WORKSPACE.resolve("sub/inc.bff");
    private static final String SUB_INCLUDE_URI = FileUris.toUri(SUB_INCLUDE);

    private static EvaluatedData evaluateSuccessfully(InMemoryFileSystem fileSystem) {
        EvaluationResult result = evaluate(fileSystem, Map.of());
        assertThat(result.getError()).isEmpty();
        return result.getData();
    }

    /**
     * Verifies that included statements run in the including scope, that their locations carry the
     * included file's uri and that {@code _CURRENT_BFF_DIR_} follows the include and is restored.
     */
    @Test
    @Tag("unit")
    void testIncludeSharesScopeAndTracksCurrentDirectory() {
        // Arrange
        InMemoryFileSystem fileSystem = new InMemoryFileSystem()
                .withFile(ROOT_FILE, lines(
                        ".Root = 'r'",
                        "#include \"sub/inc.bff\"",
                        ".After = '$_CURRENT_BFF_DIR_$'"))
                .withFile(SUB_INCLUDE, lines(
                        ".Dir = '$_CURRENT_BFF_DIR_$'",
                        ".FromRoot = .Root"));

        // Act
        EvaluatedData data = evaluateSuccessfully(fileSystem);

        // Assert
        VariableDefinition dir = definitionNamed(data, "Dir");
        assertThat(dir.range()).isEqualTo(SourceRange.of(SUB_INCLUDE_URI, 0, 0, 0, 4));
        assertThat(definitionNamed(data, "FromRoot").range().uri()).isEqualTo(SUB_INCLUDE_URI);
        assertThat(data.findReferencesTo(definitionNamed(data, "Root")))
                .anySatisfy(reference -> assertThat(reference.range().uri()).isEqualTo(SUB_INCLUDE_URI));
        assertThat(data.findEvaluatedVariablesAt(SUB_INCLUDE_URI, dir.range().start()))
                .extracting(EvaluatedVariable::getValue)
                .contains(str("sub"));
        assertThat(evaluatedValuesOnLine(data, 2)).contains(str(""));
    }

    /**
     * Verifies that an include path is resolved against the directory of the file containing it.
     */
    @Test
    @Tag("unit")
    void testNestedIncludeIsRelativeToIncludingFile() {
        // Arrange
        InMemoryFileSystem fileSystem = new InMemoryFileSystem()
                .withFile(ROOT_FILE, "#include \"sub/inc.bff\"")
                .withFile(SUB_INCLUDE, "#include \"common.bff\"")
                .withFile(WORKSPACE.resolve("sub/common.bff"), ".Common = '$_CURRENT_BFF_DIR_$'");

        // Act
        EvaluatedData data = evaluateSuccessfully(fileSystem);

        // Assert
        assertThat(evaluatedValues(data)).contains(str("sub"));
        assertThat(definitionNamed(data, "Common").range().uri())
                .isEqualTo(FileUris.toUri(WORKSPACE.resolve("sub/common.bff")));
    }

    /**
     * Verifies that a file containing {@code #once} is evaluated only the first time it is
     * included, however its path is spelled.
     */
    @Test
    @Tag("unit")
    void testOnceSkipsLaterIncludes() {
        // Arrange
        InMemoryFileSystem fileSystem = new InMemoryFileSystem()
                .withFile(ROOT_FILE, lines(
                        ".Count = 0",
                        "#include \"once.bff\"",
                        "#include \"once.bff\"",
                        "#include \"sub/../once.bff\""))
                .withFile(WORKSPACE.resolve("once.bff"), lines(
                        "#once",
                        ".Count + 1"));

        // Act
        EvaluatedData data = evaluateSuccessfully(fileSystem);

        // Assert
        assertThat(evaluatedValues(data)).containsExactly(new Value.Int(0), new Value.Int(1));
    }

    /**
     * Verifies that a file without {@code #once} runs on every include.
     */
    @Test
    @Tag("unit")
    void testFileWithoutOnceRunsEveryTime() {
        // Arrange
        InMemoryFileSystem fileSystem = new InMemoryFileSystem()
                .withFile(ROOT_FILE, lines(
                        ".Count = 0",
                        "#include \"count.bff\"",
                        "#include \"count.bff\""))
                .withFile(WORKSPACE.resolve("count.bff"), ".Count + 1");

        // Act
        EvaluatedData data = evaluateSuccessfully(fileSystem);

        // Assert
        assertThat(evaluatedValues(data)).containsExactly(new Value.Int(0), new Value.Int(1), new Value.Int(2));
    }

    /**
     * Verifies that an include that cannot be read is an error at the path.
     */
    @Test
    @Tag("unit")
    void testMissingInclude() {
        // Arrange
        InMemoryFileSystem fileSystem = new InMemoryFileSystem()
                .withFile(ROOT_FILE, "#include \"missing.bff\"");

        // Act
        EvaluationResult result = evaluate(fileSystem, Map.of());

        // Assert
        SourceException error = result.getError().orElseThrow();
        assertThat(error.getKind()).isEqualTo("EvaluationError");
        assertThat(error.getMessage()).startsWith("Unable to open include: ");
        assertThat(error.getRange()).isEqualTo(SourceRange.of(ROOT_URI, 0, 9, 0, 22));
    }

    /**
     * Verifies that a syntax error in an included file ends the evaluation with a parse error located
     * in that file, keeping what was recorded before it.
     */
    @Test
    @Tag("unit")
    void testParseErrorInInclude() {
        // Arrange
        InMemoryFileSystem fileSystem = new InMemoryFileSystem()
                .withFile(ROOT_FILE, lines(
                        ".Before = 1",
                        "#include \"sub/inc.bff\""))
                .withFile(SUB_INCLUDE, ".Broken = ");

        // Act
        EvaluationResult result = evaluate(fileSystem, Map.of());

        // Assert
        SourceException error = result.getError().orElseThrow();
        assertThat(error.getKind()).isEqualTo("ParseError");
        assertThat(error.getRange().uri()).isEqualTo(SUB_INCLUDE_URI);
        assertThat(result.getData().getVariableDefinitions()).extracting(VariableDefinition::name).containsExactly("Before");
    }

    /**
     * Verifies that a file including itself is an error at the include path instead of endless
     * recursion, and that what ran before the include is kept.
     */
    @Test
    @Tag("unit")
    void testSelfIncludeIsAnError() {
        // Arrange
        InMemoryFileSystem fileSystem = new InMemoryFileSystem()
                .withFile(ROOT_FILE, lines(
                        ".A = 1",
                        "#include \"fbuild.bff\""));

        // Act
        EvaluationResult result = evaluate(fileSystem, Map.of());

        // Assert
        assertThat(result.hasError()).isTrue();
        SourceException error = result.getError().orElseThrow();
        assertThat(error.getKind()).isEqualTo("EvaluationError");
        assertThat(error.getMessage()).startsWith("Cyclic #include of \"fbuild.bff\"");
        assertThat(error.getRange()).isEqualTo(SourceRange.of(ROOT_URI, 1, 9, 1, 21));
        assertThat(result.getData().getVariableDefinitions()).extracting(VariableDefinition::name).containsExactly("A");
    }

    /**
     * Verifies that a cycle through several files is reported in the file that closes it.
     */
    @Test
    @Tag("unit")
    void testIncludeCycleAcrossFilesIsAnError() {
        // Arrange
        InMemoryFileSystem fileSystem = new InMemoryFileSystem()
                .withFile(ROOT_FILE, lines(
                        ".A = 1",
                        "#include \"sub/inc.bff\""))
                .withFile(SUB_INCLUDE, lines(
                        ".B = 2",
                        "#include \"../fbuild.bff\""));

        // Act
        EvaluationResult result = evaluate(fileSystem, Map.of());

        // Assert
        SourceException error = result.getError().orElseThrow();
        assertThat(error.getMessage()).startsWith("Cyclic #include of \"../fbuild.bff\"");
        assertThat(error.getRange().uri()).isEqualTo(SUB_INCLUDE_URI);
        assertThat(result.getData().getVariableDefinitions()).extracting(VariableDefinition::name).containsExactly("A", "B");
    }

    /**
     * Verifies that a file marked {@code #once} may include itself, since the nested include is
     * skipped.
     */
    @Test
    @Tag("unit")
    void testSelfIncludeOfOnceFileIsSkipped() {
        // Arrange
        InMemoryFileSystem fileSystem = new InMemoryFileSystem()
                .withFile(ROOT_FILE, lines(
                        "#once",
                        ".A = 1",
                        "#include \"fbuild.bff\""));

        // Act
        EvaluatedData data = evaluateSuccessfully(fileSystem);

        // Assert
        assertThat(evaluatedValues(data)).containsExactly(new Value.Int(1));
    }
}
