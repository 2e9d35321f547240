package org.fastbuild.lsp.evaluator.frontend.parser.ast;

import org.fastbuild.lsp.evaluator.api.SourceRange;

/**
 * The base interface for all nodes of the statement tree produced by the parser.
 */
public interface AstNode {
    /**
     * @return The source range the node was parsed from.
     */
    SourceRange range();
}
