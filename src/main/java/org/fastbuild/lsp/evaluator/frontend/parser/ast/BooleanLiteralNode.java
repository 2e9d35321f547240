package org.fastbuild.lsp.evaluator.frontend.parser.ast;

import org.fastbuild.lsp.evaluator.api.SourceRange;

/**
 * @param value The boolean value.
 * @param range The source range.
 */
public record BooleanLiteralNode(boolean value, SourceRange range) implements AstNode {
}
