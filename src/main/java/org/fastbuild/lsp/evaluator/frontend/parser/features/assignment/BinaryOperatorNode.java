package org.fastbuild.lsp.evaluator.frontend.parser.features.assignment;

import org.fastbuild.lsp.evaluator.api.SourceRange;
import org.fastbuild.lsp.evaluator.frontend.parser.ast.AstNode;
import org.fastbuild.lsp.evaluator.frontend.parser.ast.BinaryOperator;
import org.fastbuild.lsp.evaluator.frontend.parser.ast.VariableLhs;

/**
 * A modification of a named variable, {@code .Name + value} or {@code .Name - value}.
 *
 * @param lhs The modified variable.
 * @param operator The operator.
 * @param rhs The operand expression.
 * @param range The source range of the statement.
 */
public record BinaryOperatorNode(VariableLhs lhs, BinaryOperator operator, AstNode rhs, SourceRange range) implements AstNode {
}
