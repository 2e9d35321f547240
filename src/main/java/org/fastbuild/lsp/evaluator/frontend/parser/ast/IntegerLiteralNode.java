package org.fastbuild.lsp.evaluator.frontend.parser.ast;

import org.fastbuild.lsp.evaluator.api.SourceRange;

/**
 * @param value The integer value.
 * @param range The source range.
 */
public record IntegerLiteralNode(int value, SourceRange range) implements AstNode {
}
