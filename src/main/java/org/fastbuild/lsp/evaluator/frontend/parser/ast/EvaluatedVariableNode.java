package org.fastbuild.lsp.evaluator.frontend.parser.ast;

import org.fastbuild.lsp.evaluator.api.SourceRange;
import org.fastbuild.lsp.evaluator.scope.ScopeLocation;

/**
 * A variable read, {@code .Name}, {@code ^Name}, {@code ."Name_$X$"} or {@code $Name$} in a string.
 *
 * @param name The name expression, a {@link StringLiteralNode} or {@link StringTemplateNode}.
 * @param scope Where the lookup starts.
 * @param range The range of the whole occurrence, sigil included.
 */
public record EvaluatedVariableNode(AstNode name, ScopeLocation scope, SourceRange range) implements AstNode {
}
