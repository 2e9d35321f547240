package org.fastbuild.lsp.evaluator.io;

import org.fastbuild.lsp.evaluator.frontend.parser.ast.AstNode;

import java.nio.file.Path;
import java.util.List;

/**
 * The parsed form of one file.
 *
 * @param path The file path.
 * @param uri The uri used in the ranges of the statements.
 * @param statements The top-level statements.
 */
public record ParseData(Path path, String uri, List<AstNode> statements) {

    public ParseData {
        statements = List.copyOf(statements);
    }
}
