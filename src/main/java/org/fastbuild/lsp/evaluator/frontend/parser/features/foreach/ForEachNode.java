package org.fastbuild.lsp.evaluator.frontend.parser.features.foreach;

import org.fastbuild.lsp.evaluator.api.SourceRange;
import org.fastbuild.lsp.evaluator.frontend.parser.ast.AstNode;

import java.util.List;

/**
 * {@code ForEach(.A in .As, .B in .Bs) { ... }}. All arrays are iterated in lockstep.
 *
 * @param iterators The loop clauses.
 * @param statements The loop body.
 * @param range The source range of the statement.
 */
public record ForEachNode(List<ForEachIterator> iterators, List<AstNode> statements, SourceRange range) implements AstNode {
}
