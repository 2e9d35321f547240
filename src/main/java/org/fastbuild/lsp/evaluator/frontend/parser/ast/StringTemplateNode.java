package org.fastbuild.lsp.evaluator.frontend.parser.ast;

import org.fastbuild.lsp.evaluator.api.SourceRange;

import java.util.List;

/**
 * A string with embedded {@code $Name$} variables.
 *
 * @param parts {@link StringLiteralNode}s and {@link EvaluatedVariableNode}s, in order.
 * @param range The source range of the whole string.
 */
public record StringTemplateNode(List<AstNode> parts, SourceRange range) implements AstNode {
}
