package org.fastbuild.lsp.evaluator.frontend.parser.features.assignment;

import org.fastbuild.lsp.evaluator.api.SourceRange;
import org.fastbuild.lsp.evaluator.frontend.parser.ast.AstNode;
import org.fastbuild.lsp.evaluator.frontend.parser.ast.VariableLhs;

/**
 * An assignment, {@code .Name = value}.
 *
 * @param lhs The assigned variable.
 * @param rhs The value expression.
 * @param range The source range of the statement.
 */
public record VariableDefinitionNode(VariableLhs lhs, AstNode rhs, SourceRange range) implements AstNode {
}
