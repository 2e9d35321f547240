package org.fastbuild.lsp.evaluator.frontend.parser.features.condition;

import org.fastbuild.lsp.evaluator.api.SourceRange;
import org.fastbuild.lsp.evaluator.frontend.parser.ast.AstNode;

/**
 * {@code lhs in rhs} or {@code lhs not in rhs}.
 *
 * @param lhs The String or Array of Strings to look for.
 * @param rhs The Array of Strings to look in.
 * @param invert true for the {@code not in} form.
 * @param range The source range.
 */
public record InConditionNode(AstNode lhs, AstNode rhs, boolean invert, SourceRange range) implements ConditionNode {
}
