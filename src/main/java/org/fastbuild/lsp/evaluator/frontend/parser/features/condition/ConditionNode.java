package org.fastbuild.lsp.evaluator.frontend.parser.features.condition;

import org.fastbuild.lsp.evaluator.frontend.parser.ast.AstNode;

/**
 * A condition of an {@code If} statement.
 */
public sealed interface ConditionNode extends AstNode
        permits BooleanConditionNode, ComparisonConditionNode, InConditionNode, LogicalConditionNode {
}
