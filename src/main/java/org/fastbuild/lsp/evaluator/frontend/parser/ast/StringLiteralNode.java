package org.fastbuild.lsp.evaluator.frontend.parser.ast;

import org.fastbuild.lsp.evaluator.api.SourceRange;

/**
 * A string without embedded variables. Escapes are already resolved.
 *
 * @param value The string value.
 * @param range The source range.
 */
public record StringLiteralNode(String value, SourceRange range) implements AstNode {
}
