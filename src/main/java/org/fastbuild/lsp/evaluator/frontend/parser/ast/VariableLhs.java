package org.fastbuild.lsp.evaluator.frontend.parser.ast;

import org.fastbuild.lsp.evaluator.api.SourceRange;
import org.fastbuild.lsp.evaluator.scope.ScopeLocation;

/**
 * The variable on the left-hand side of an assignment or modification, or a loop variable.
 *
 * @param name The name expression, a {@link StringLiteralNode} or {@link StringTemplateNode}.
 * @param scope Where the binding is looked up.
 * @param range The range of the whole occurrence, sigil included.
 */
public record VariableLhs(AstNode name, ScopeLocation scope, SourceRange range) implements AstNode {
}
