package org.fastbuild.lsp.evaluator.semantics.handlers;

import org.fastbuild.lsp.evaluator.api.EvaluatedData;
import org.fastbuild.lsp.evaluator.api.EvaluationException;
import org.fastbuild.lsp.evaluator.api.ReferenceType;
import org.fastbuild.lsp.evaluator.api.SourceException;
import org.fastbuild.lsp.evaluator.api.VariableReference;
import org.fastbuild.lsp.evaluator.diagnostics.EvaluatorLogger;
import org.fastbuild.lsp.evaluator.frontend.parser.ast.AstNode;
import org.fastbuild.lsp.evaluator.frontend.parser.features.userfunction.UserFunctionCallNode;
import org.fastbuild.lsp.evaluator.functions.UserFunction;
import org.fastbuild.lsp.evaluator.scope.ScopeStack;
import org.fastbuild.lsp.evaluator.semantics.EvaluationContext;
import org.fastbuild.lsp.evaluator.semantics.ExpressionEvaluator;
import org.fastbuild.lsp.evaluator.semantics.IStatementHandler;
import org.fastbuild.lsp.evaluator.semantics.LhsBinding;
import org.fastbuild.lsp.evaluator.semantics.StatementEvaluator;
import org.fastbuild.lsp.evaluator.value.Value;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Handles a call of a user function.
 * <p>
 * The arguments are evaluated in the caller's scope. The body runs in a private scope, so it only sees
 * its parameters, and with its own set of preprocessor symbols.
 */
public class UserFunctionCallStatementHandler implements IStatementHandler {

    private final StatementEvaluator statements;
    private final ExpressionEvaluator expressions;

    public UserFunctionCallStatementHandler(StatementEvaluator statements, ExpressionEvaluator expressions) {
        this.statements = statements;
        this.expressions = expressions;
    }

    /**
     * {@inheritDoc}
     */
    @Override
    public Optional<LhsBinding> evaluate(AstNode statement, EvaluationContext context) throws SourceException {
        UserFunctionCallNode node = (UserFunctionCallNode) statement;
        EvaluatedData data = context.getData();
        ScopeStack scopes = context.getScopes();

        UserFunction function = context.getSession().getUserFunctions().find(node.name())
                .orElseThrow(() -> new EvaluationException("No function exists with the name \"" + node.name() + "\".",
                        node.nameRange()));
        data.addVariableReference(new VariableReference(List.of(function.definition()), node.nameRange(), ReferenceType.READ));

        int expected = function.parameters().size();
        if (node.arguments().size() != expected) {
            throw new EvaluationException("User function \"" + node.name() + "\" takes " + expected
                    + (expected == 1 ? " argument" : " arguments") + " but passing " + node.arguments().size() + ".",
                    node.range());
        }

        int maxScopeDepth = context.getSession().getSettings().getMaxScopeDepth();
        if (scopes.getDepth() > maxScopeDepth) {
            throw new EvaluationException("Excessive scope depth. Possible infinite recursion from user function calls.",
                    node.range());
        }

        List<Value> arguments = new ArrayList<>(expected);
        for (AstNode argument : node.arguments()) {
            arguments.add(expressions.evaluate(argument, context).value());
        }

        EvaluatorLogger.debug("Calling user function '{}' at scope depth {}", node.name(), scopes.getDepth());
        EvaluationContext callContext = context.forFunctionCall();
        scopes.enterPrivateScope();
        try {
            for (int i = 0; i < expected; i++) {
                UserFunction.Parameter parameter = function.parameters().get(i);
                Value argument = arguments.get(i);
                scopes.setInCurrentScope(parameter.name(), argument, List.of(parameter.definition()));
                data.recordEvaluatedVariable(argument, parameter.definition().range());
                data.addVariableReference(new VariableReference(List.of(parameter.definition()),
                        parameter.definition().range(), ReferenceType.WRITE));
            }
            statements.evaluateStatements(function.statements(), callContext);
        } finally {
            scopes.leaveScope();
        }
        return Optional.empty();
    }
}
