package org.fastbuild.lsp.evaluator.frontend.parser.ast;

import org.fastbuild.lsp.evaluator.api.SourceRange;

import java.util.List;

/**
 * An array literal, <code>{ 'a', .B }</code>. Items may include {@code #if} directives.
 *
 * @param items The item expressions.
 * @param range The source range, braces included.
 */
public record ArrayLiteralNode(List<AstNode> items, SourceRange range) implements AstNode {
}
