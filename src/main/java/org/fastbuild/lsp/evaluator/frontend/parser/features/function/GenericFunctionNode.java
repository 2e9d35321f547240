package org.fastbuild.lsp.evaluator.frontend.parser.features.function;

import org.fastbuild.lsp.evaluator.api.SourceRange;
import org.fastbuild.lsp.evaluator.frontend.parser.ast.AstNode;
import org.fastbuild.lsp.evaluator.functions.GenericFunction;

import java.util.List;

/**
 * A build-declaration function such as {@code Executable('MyApp') { ... }}.
 *
 * @param function The function.
 * @param targetName The target name expression.
 * @param statements The body.
 * @param range The source range of the statement.
 */
public record GenericFunctionNode(GenericFunction function, AstNode targetName, List<AstNode> statements, SourceRange range)
        implements AstNode {
}
