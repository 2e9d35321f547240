package org.fastbuild.lsp.evaluator.semantics.handlers;

import org.fastbuild.lsp.evaluator.frontend.parser.ast.AstNode;
import org.fastbuild.lsp.evaluator.semantics.EvaluationContext;
import org.fastbuild.lsp.evaluator.semantics.IStatementHandler;
import org.fastbuild.lsp.evaluator.semantics.LhsBinding;

import java.util.Optional;

/**
 * Handles {@code #once}: later includes of the current file are skipped for the rest of the session.
 */
public class OnceStatementHandler implements IStatementHandler {

    @Override
    public Optional<LhsBinding> evaluate(AstNode statement, EvaluationContext context) {
        context.getSession().markIncludedOnce(context.getCurrentFile());
        return Optional.empty();
    }
}
