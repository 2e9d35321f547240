package org.fastbuild.lsp.evaluator.frontend.parser.features.function;

import org.fastbuild.lsp.evaluator.api.SourceRange;
import org.fastbuild.lsp.evaluator.frontend.parser.ast.AstNode;

/**
 * The {@code Error('message')} function.
 *
 * @param value The message expression.
 * @param range The source range of the statement.
 */
public record ErrorNode(AstNode value, SourceRange range) implements AstNode {
}
