package org.fastbuild.lsp.evaluator.frontend.parser.features.define;

import org.fastbuild.lsp.evaluator.api.SourceRange;
import org.fastbuild.lsp.evaluator.frontend.parser.ast.AstNode;

/**
 * {@code #import VAR}: binds the environment variable {@code VAR} as a BFF variable.
 *
 * @param symbol The environment variable name.
 * @param symbolRange The range of the name.
 * @param range The source range of the directive.
 */
public record ImportNode(String symbol, SourceRange symbolRange, SourceRange range) implements AstNode {
}
