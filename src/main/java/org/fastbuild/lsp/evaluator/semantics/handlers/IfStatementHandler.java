package org.fastbuild.lsp.evaluator.semantics.handlers;

import org.fastbuild.lsp.evaluator.api.SourceException;
import org.fastbuild.lsp.evaluator.frontend.parser.ast.AstNode;
import org.fastbuild.lsp.evaluator.frontend.parser.features.condition.IfNode;
import org.fastbuild.lsp.evaluator.semantics.ConditionEvaluator;
import org.fastbuild.lsp.evaluator.semantics.EvaluationContext;
import org.fastbuild.lsp.evaluator.semantics.IStatementHandler;
import org.fastbuild.lsp.evaluator.semantics.LhsBinding;
import org.fastbuild.lsp.evaluator.semantics.StatementEvaluator;

import java.util.Optional;

/**
 * Handles {@code If(condition) { ... }}. The body is evaluated in a child scope only when the
 * condition holds.
 */
public class IfStatementHandler implements IStatementHandler {

    private final StatementEvaluator statements;
    private final ConditionEvaluator conditions;

    public IfStatementHandler(StatementEvaluator statements, ConditionEvaluator conditions) {
        this.statements = statements;
        this.conditions = conditions;
    }

    @Override
    public Optional<LhsBinding> evaluate(AstNode statement, EvaluationContext context) throws SourceException {
        IfNode node = (IfNode) statement;
        if (conditions.evaluate(node.condition(), context)) {
            statements.evaluateInChildScope(node.statements(), context);
        }
        return Optional.empty();
    }
}
