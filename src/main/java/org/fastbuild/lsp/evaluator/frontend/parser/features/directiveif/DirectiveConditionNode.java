package org.fastbuild.lsp.evaluator.frontend.parser.features.directiveif;

import org.fastbuild.lsp.evaluator.api.SourceRange;
import org.fastbuild.lsp.evaluator.frontend.parser.features.condition.LogicalOperator;

/**
 * The condition of a {@code #if} directive.
 */
public sealed interface DirectiveConditionNode {

    /**
     * @return The source range of the condition.
     */
    SourceRange range();

    /**
     * A defined-symbol test, {@code SYMBOL}.
     * @param symbol The symbol.
     * @param range The source range.
     */
    record SymbolDefined(String symbol, SourceRange range) implements DirectiveConditionNode {}

    /**
     * {@code exists(VAR)}: whether an environment variable is set.
     * @param variable The environment variable name.
     * @param range The source range.
     */
    record EnvironmentVariableExists(String variable, SourceRange range) implements DirectiveConditionNode {}

    /**
     * {@code file_exists("path")}.
     * @param path The path, relative to the current file's directory or absolute.
     * @param range The source range.
     */
    record FileExists(String path, SourceRange range) implements DirectiveConditionNode {}

    /**
     * {@code !term}.
     * @param operand The negated condition.
     * @param range The source range.
     */
    record Not(DirectiveConditionNode operand, SourceRange range) implements DirectiveConditionNode {}

    /**
     * {@code lhs && rhs} or {@code lhs || rhs}.
     * @param lhs The left condition.
     * @param operator The operator.
     * @param rhs The right condition.
     * @param range The source range.
     */
    record Logical(DirectiveConditionNode lhs, LogicalOperator operator, DirectiveConditionNode rhs, SourceRange range)
            implements DirectiveConditionNode {}
}
