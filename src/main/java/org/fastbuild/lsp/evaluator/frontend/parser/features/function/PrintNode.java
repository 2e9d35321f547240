package org.fastbuild.lsp.evaluator.frontend.parser.features.function;

import org.fastbuild.lsp.evaluator.api.SourceRange;
import org.fastbuild.lsp.evaluator.frontend.parser.ast.AstNode;

/**
 * @param value The printed expression.
 * @param range The source range of the statement.
 */
public record PrintNode(AstNode value, SourceRange range) implements AstNode {
}
