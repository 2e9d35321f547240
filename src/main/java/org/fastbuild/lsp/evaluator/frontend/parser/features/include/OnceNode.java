package org.fastbuild.lsp.evaluator.frontend.parser.features.include;

import org.fastbuild.lsp.evaluator.api.SourceRange;
import org.fastbuild.lsp.evaluator.frontend.parser.ast.AstNode;

/**
 * {@code #once}: later includes of the file are skipped.
 *
 * @param range The source range of the directive.
 */
public record OnceNode(SourceRange range) implements AstNode {
}
