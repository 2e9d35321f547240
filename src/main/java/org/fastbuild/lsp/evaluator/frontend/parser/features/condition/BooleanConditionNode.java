package org.fastbuild.lsp.evaluator.frontend.parser.features.condition;

import org.fastbuild.lsp.evaluator.api.SourceRange;
import org.fastbuild.lsp.evaluator.frontend.parser.ast.AstNode;

/**
 * {@code .Flag} or {@code !.Flag}.
 *
 * @param value The operand, which must evaluate to a Boolean.
 * @param invert true for the {@code !} form.
 * @param range The source range.
 */
public record BooleanConditionNode(AstNode value, boolean invert, SourceRange range) implements ConditionNode {
}
