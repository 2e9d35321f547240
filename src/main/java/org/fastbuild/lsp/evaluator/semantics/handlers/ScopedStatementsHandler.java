package org.fastbuild.lsp.evaluator.semantics.handlers;

import org.fastbuild.lsp.evaluator.api.SourceException;
import org.fastbuild.lsp.evaluator.frontend.parser.ast.AstNode;
import org.fastbuild.lsp.evaluator.frontend.parser.features.scope.ScopedStatementsNode;
import org.fastbuild.lsp.evaluator.semantics.EvaluationContext;
import org.fastbuild.lsp.evaluator.semantics.IStatementHandler;
import org.fastbuild.lsp.evaluator.semantics.LhsBinding;
import org.fastbuild.lsp.evaluator.semantics.StatementEvaluator;

import java.util.Optional;

/**
 * Handles a bare {@code { ... }} block.
 */
public class ScopedStatementsHandler implements IStatementHandler {

    private final StatementEvaluator statements;

    public ScopedStatementsHandler(StatementEvaluator statements) {
        this.statements = statements;
    }

    @Override
    public Optional<LhsBinding> evaluate(AstNode statement, EvaluationContext context) throws SourceException {
        statements.evaluateInChildScope(((ScopedStatementsNode) statement).statements(), context);
        return Optional.empty();
    }
}
