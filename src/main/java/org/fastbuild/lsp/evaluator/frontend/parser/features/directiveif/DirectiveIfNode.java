package org.fastbuild.lsp.evaluator.frontend.parser.features.directiveif;

import org.fastbuild.lsp.evaluator.api.SourceRange;
import org.fastbuild.lsp.evaluator.frontend.parser.ast.AstNode;

import java.util.List;

/**
 * {@code #if condition ... [#else ...] #endif}. Appears both as a statement and as an item of an
 * array literal; in the latter case the branches hold array items.
 *
 * @param condition The condition.
 * @param ifBranch The nodes used when the condition holds.
 * @param elseBranch The nodes used otherwise; empty without {@code #else}.
 * @param range The source range from {@code #if} to {@code #endif}.
 */
public record DirectiveIfNode(
        DirectiveConditionNode condition,
        List<AstNode> ifBranch,
        List<AstNode> elseBranch,
        SourceRange range
) implements AstNode {
}
