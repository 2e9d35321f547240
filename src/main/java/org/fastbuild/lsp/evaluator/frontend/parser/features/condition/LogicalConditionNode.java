package org.fastbuild.lsp.evaluator.frontend.parser.features.condition;

import org.fastbuild.lsp.evaluator.api.SourceRange;

/**
 * @param lhs The left condition.
 * @param operator The operator.
 * @param rhs The right condition.
 * @param range The source range.
 */
public record LogicalConditionNode(ConditionNode lhs, LogicalOperator operator, ConditionNode rhs, SourceRange range)
        implements ConditionNode {
}
