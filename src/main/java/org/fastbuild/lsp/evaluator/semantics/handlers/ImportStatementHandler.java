package org.fastbuild.lsp.evaluator.semantics.handlers;

import org.fastbuild.lsp.evaluator.api.EvaluationException;
import org.fastbuild.lsp.evaluator.api.VariableDefinition;
import org.fastbuild.lsp.evaluator.frontend.parser.ast.AstNode;
import org.fastbuild.lsp.evaluator.frontend.parser.features.define.ImportNode;
import org.fastbuild.lsp.evaluator.scope.ScopeStack;
import org.fastbuild.lsp.evaluator.semantics.EvaluationContext;
import org.fastbuild.lsp.evaluator.semantics.IStatementHandler;
import org.fastbuild.lsp.evaluator.semantics.LhsBinding;
import org.fastbuild.lsp.evaluator.value.Value;

import java.util.List;
import java.util.Optional;

/**
 * Handles {@code #import VAR}.
 * <p>
 * The value the variable will have when the build runs is unknown, so it is bound to a placeholder.
 */
public class ImportStatementHandler implements IStatementHandler {

    @Override
    public Optional<LhsBinding> evaluate(AstNode statement, EvaluationContext context) throws EvaluationException {
        ImportNode node = (ImportNode) statement;
        String variable = node.symbol();
        if (!context.getSession().getEnvironment().containsKey(variable)) {
            throw new EvaluationException("Cannot #import environment variable \"" + variable
                    + "\" because it does not exist.", node.symbolRange());
        }

        ScopeStack scopes = context.getScopes();
        VariableDefinition definition = scopes.createVariableDefinition(node.range(), variable);
        context.getData().addVariableDefinition(definition);
        scopes.setInCurrentScope(variable, new Value.Str("placeholder-" + variable + "-value"), List.of(definition));
        return Optional.empty();
    }
}
