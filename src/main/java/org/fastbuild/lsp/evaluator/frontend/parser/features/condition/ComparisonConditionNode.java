package org.fastbuild.lsp.evaluator.frontend.parser.features.condition;

import org.fastbuild.lsp.evaluator.api.SourceRange;
import org.fastbuild.lsp.evaluator.frontend.parser.ast.AstNode;

/**
 * {@code lhs <op> rhs}.
 *
 * @param lhs The left operand.
 * @param operator The operator.
 * @param operatorRange The range of the operator token.
 * @param rhs The right operand.
 * @param range The source range of the comparison.
 */
public record ComparisonConditionNode(
        AstNode lhs,
        ComparisonOperator operator,
        SourceRange operatorRange,
        AstNode rhs,
        SourceRange range
) implements ConditionNode {
}
