package org.fastbuild.lsp.evaluator.frontend.parser.features.include;

import org.fastbuild.lsp.evaluator.api.SourceRange;
import org.fastbuild.lsp.evaluator.frontend.parser.ast.AstNode;
import org.fastbuild.lsp.evaluator.frontend.parser.ast.StringLiteralNode;

/**
 * {@code #include "path"}.
 *
 * @param path The included path, relative to the including file or absolute.
 * @param range The source range of the directive.
 */
public record IncludeNode(StringLiteralNode path, SourceRange range) implements AstNode {
}
