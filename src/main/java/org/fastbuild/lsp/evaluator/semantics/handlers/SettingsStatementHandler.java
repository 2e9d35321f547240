package org.fastbuild.lsp.evaluator.semantics.handlers;

import org.fastbuild.lsp.evaluator.api.SourceException;
import org.fastbuild.lsp.evaluator.frontend.parser.ast.AstNode;
import org.fastbuild.lsp.evaluator.frontend.parser.features.function.SettingsNode;
import org.fastbuild.lsp.evaluator.semantics.EvaluationContext;
import org.fastbuild.lsp.evaluator.semantics.IStatementHandler;
import org.fastbuild.lsp.evaluator.semantics.LhsBinding;
import org.fastbuild.lsp.evaluator.semantics.StatementEvaluator;

import java.util.Optional;

/**
 * Handles {@code Settings { ... }}. The body is evaluated in a child scope.
 */
public class SettingsStatementHandler implements IStatementHandler {

    private final StatementEvaluator statements;

    public SettingsStatementHandler(StatementEvaluator statements) {
        this.statements = statements;
    }

    @Override
    public Optional<LhsBinding> evaluate(AstNode statement, EvaluationContext context) throws SourceException {
        statements.evaluateInChildScope(((SettingsNode) statement).statements(), context);
        return Optional.empty();
    }
}
