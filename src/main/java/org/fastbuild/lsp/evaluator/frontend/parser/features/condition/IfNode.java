package org.fastbuild.lsp.evaluator.frontend.parser.features.condition;

import org.fastbuild.lsp.evaluator.api.SourceRange;
import org.fastbuild.lsp.evaluator.frontend.parser.ast.AstNode;

import java.util.List;

/**
 * {@code If(condition) { ... }}.
 *
 * @param condition The condition.
 * @param statements The body, evaluated in a child scope when the condition holds.
 * @param range The source range of the statement.
 */
public record IfNode(ConditionNode condition, List<AstNode> statements, SourceRange range) implements AstNode {
}
