package org.fastbuild.lsp.evaluator.semantics;

import org.fastbuild.lsp.evaluator.api.EvaluatedData;
import org.fastbuild.lsp.evaluator.api.SourceException;
import org.fastbuild.lsp.evaluator.api.SourceRange;
import org.fastbuild.lsp.evaluator.api.TargetDefinition;
import org.fastbuild.lsp.evaluator.api.TargetReference;
import org.fastbuild.lsp.evaluator.api.UnresolvedTargetReference;
import org.fastbuild.lsp.evaluator.api.VariableDefinition;
import org.fastbuild.lsp.evaluator.value.Value;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.fastbuild.lsp.evaluator.EvaluatorTestHelper.ROOT_URI;
import static org.fastbuild.lsp.evaluator.EvaluatorTestHelper.evaluateSuccessfully;
import static org.fastbuild.lsp.evaluator.EvaluatorTestHelper.evaluateWithError;
import static org.fastbuild.lsp.evaluator.EvaluatorTestHelper.evaluatedValues;
import static org.fastbuild.lsp.evaluator.EvaluatorTestHelper.lines;

/**
 * Contains tests for the build-declaration functions and the functions that only check their
 * arguments ({@code Print}, {@code Error}, {@code Settings}).
 */
public class BuildFunctionEvaluationTest {

    /**
     * Verifies that targets are defined at their name and that target-list properties are resolved
     * after the whole file has run, so a target can be used before it is declared.
     */
    @Test
    @Tag("unit")
    void testTargetDefinitionsAndForwardReferences() {
        // Arrange
        String source = lines(
                "Alias('all')",
                "{",
                "  .Targets = {'lib', 'missing'}",
                "}",
                "Library('lib')",
                "{",
                "  .Compiler = 'cl'",
                "}");

        // Act
        EvaluatedData data = evaluateSuccessfully(source);

        // Assert
        assertThat(data.getTargetDefinitions()).extracting(TargetDefinition::name).containsExactly("all", "lib");
        TargetDefinition lib = data.getTargetDefinitions().get(1);
        assertThat(lib.range()).isEqualTo(SourceRange.of(ROOT_URI, 4, 8, 4, 13));

        SourceRange targetsProperty = SourceRange.of(ROOT_URI, 2, 2, 2, 10);
        assertThat(data.getTargetReferences()).extracting(TargetReference::range).containsExactly(
                SourceRange.of(ROOT_URI, 0, 6, 0, 11),
                lib.range(),
                targetsProperty);
        assertThat(data.getTargetReferences().get(2).definition()).isEqualTo(lib);
        assertThat(data.getUnresolvedTargetReferences())
                .containsExactly(new UnresolvedTargetReference("missing", targetsProperty));
    }

    /**
     * Verifies that a single String in {@code .PreBuildDependencies} is a target reference.
     */
    @Test
    @Tag("unit")
    void testPreBuildDependenciesAreTargetReferences() {
        // Arrange
        String source = lines(
                "Exec('generate') { .ExecExecutable = 'gen' }",
                "Copy('copy')",
                "{",
                "  .PreBuildDependencies = 'generate'",
                "}");

        // Act
        EvaluatedData data = evaluateSuccessfully(source);

        // Assert
        assertThat(data.getTargetReferences()).hasSize(3);
        assertThat(data.getTargetReferences().get(2).definition().name()).isEqualTo("generate");
        assertThat(data.getUnresolvedTargetReferences()).isEmpty();
    }

    /**
     * Verifies that target names may be variables and that target ids share the counter of variable
     * definitions.
     */
    @Test
    @Tag("unit")
    void testTargetNameFromVariable() {
        // Arrange
        String source = lines(
                ".Name = 'app'",
                "Executable(.Name)",
                "{",
                "}");

        // Act
        EvaluatedData data = evaluateSuccessfully(source);

        // Assert
        VariableDefinition name = data.getVariableDefinitions().get(0);
        TargetDefinition app = data.getTargetDefinitions().get(0);
        assertThat(app.name()).isEqualTo("app");
        assertThat(app.range()).isEqualTo(SourceRange.of(ROOT_URI, 1, 11, 1, 16));
        assertThat(app.id()).isEqualTo(name.id() + 1);
    }

    /**
     * Verifies that the body of a build-declaration function is a child scope.
     */
    @Test
    @Tag("unit")
    void testFunctionBodyIsChildScope() {
        // Act
        SourceException error = evaluateWithError(lines(
                "Alias('all') { .Targets = 'x' }",
                ".Copy = .Targets"));

        // Assert
        assertThat(error.getMessage()).contains("\"Targets\"");
    }

    /**
     * Verifies that a target name must be a String.
     */
    @Test
    @Tag("unit")
    void testTargetNameMustBeString() {
        // Act
        SourceException error = evaluateWithError("Alias(1) {}");

        // Assert
        assertThat(error.getMessage()).isEqualTo("Target name must evaluate to a String, but instead evaluates to an Integer");
        assertThat(error.getRange()).isEqualTo(SourceRange.of(ROOT_URI, 0, 6, 0, 7));
    }

    /**
     * Verifies that {@code Print} accepts variables of any type and Strings, and nothing else.
     */
    @Test
    @Tag("unit")
    void testPrintArguments() {
        // Act
        EvaluatedData data = evaluateSuccessfully(lines(".I = 1", "Print(.I)", "Print('text $I$')"));
        SourceException error = evaluateWithError("Print(1)");

        // Assert
        assertThat(evaluatedValues(data)).containsExactly(new Value.Int(1), new Value.Int(1), new Value.Int(1));
        assertThat(error.getMessage()).isEqualTo(
                "'Print' argument must either be a variable or evaluate to a String, but instead is an Integer");
        assertThat(error.getRange()).isEqualTo(SourceRange.of(ROOT_URI, 0, 0, 0, 8));
    }

    /**
     * Verifies that {@code Error} only checks its argument and does not stop evaluation.
     */
    @Test
    @Tag("unit")
    void testErrorArguments() {
        // Act
        EvaluatedData data = evaluateSuccessfully(lines("Error('stop here')", ".After = 1"));
        SourceException error = evaluateWithError("Error(true)");

        // Assert
        assertThat(data.getVariableDefinitions()).extracting(VariableDefinition::name).containsExactly("After");
        assertThat(error.getMessage()).isEqualTo("'Error' argument must evaluate to a String, but instead evaluates to a Boolean");
    }

    /**
     * Verifies that the body of {@code Settings} is evaluated for its definitions.
     */
    @Test
    @Tag("unit")
    void testSettingsBodyIsEvaluated() {
        // Act
        EvaluatedData data = evaluateSuccessfully(lines(
                "Settings",
                "{",
                "  .CachePath = '/tmp/cache'",
                "}"));

        // Assert
        assertThat(data.getVariableDefinitions()).extracting(VariableDefinition::name).containsExactly("CachePath");
    }
}
