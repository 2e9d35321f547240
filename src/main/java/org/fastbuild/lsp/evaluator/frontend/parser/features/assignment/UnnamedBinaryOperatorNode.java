package org.fastbuild.lsp.evaluator.frontend.parser.features.assignment;

import org.fastbuild.lsp.evaluator.api.SourceRange;
import org.fastbuild.lsp.evaluator.frontend.parser.ast.AstNode;
import org.fastbuild.lsp.evaluator.frontend.parser.ast.BinaryOperator;

/**
 * A line that starts with {@code +} or {@code -} and continues the previous assignment or
 * modification.
 *
 * @param operator The operator.
 * @param rhs The operand expression.
 * @param range The source range from the operator to the end of the operand.
 */
public record UnnamedBinaryOperatorNode(BinaryOperator operator, AstNode rhs, SourceRange range) implements AstNode {
}
