package org.fastbuild.lsp.evaluator.frontend.parser.features.scope;

import org.fastbuild.lsp.evaluator.api.SourceRange;
import org.fastbuild.lsp.evaluator.frontend.parser.ast.AstNode;

import java.util.List;

/**
 * A bare <code>{ ... }</code> block, evaluated in a child scope.
 *
 * @param statements The statements of the block.
 * @param range The source range, braces included.
 */
public record ScopedStatementsNode(List<AstNode> statements, SourceRange range) implements AstNode {
}
