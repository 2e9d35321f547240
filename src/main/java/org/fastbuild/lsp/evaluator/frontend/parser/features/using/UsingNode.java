package org.fastbuild.lsp.evaluator.frontend.parser.features.using;

import org.fastbuild.lsp.evaluator.api.SourceRange;
import org.fastbuild.lsp.evaluator.frontend.parser.ast.AstNode;
import org.fastbuild.lsp.evaluator.frontend.parser.ast.EvaluatedVariableNode;

/**
 * {@code Using(.Struct)}: binds the members of a struct in the current scope.
 *
 * @param struct The struct variable.
 * @param range The source range of the statement.
 */
public record UsingNode(EvaluatedVariableNode struct, SourceRange range) implements AstNode {
}
