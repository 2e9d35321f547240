package org.fastbuild.lsp.evaluator.frontend.parser.ast;

import org.fastbuild.lsp.evaluator.api.SourceRange;

import java.util.List;

/**
 * A struct literal, <code>[ .A = 1 ]</code>. The statements are evaluated in a child scope whose
 * bindings become the members.
 *
 * @param statements The body statements.
 * @param range The source range, brackets included.
 */
public record StructLiteralNode(List<AstNode> statements, SourceRange range) implements AstNode {
}
