package org.fastbuild.lsp.evaluator.frontend.parser.features.define;

import org.fastbuild.lsp.evaluator.api.SourceRange;
import org.fastbuild.lsp.evaluator.frontend.parser.ast.AstNode;

/**
 * {@code #define SYMBOL}.
 *
 * @param symbol The symbol.
 * @param symbolRange The range of the symbol.
 * @param range The source range of the directive.
 */
public record DefineNode(String symbol, SourceRange symbolRange, SourceRange range) implements AstNode {
}
