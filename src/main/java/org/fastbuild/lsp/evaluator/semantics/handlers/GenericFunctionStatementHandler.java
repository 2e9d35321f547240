package org.fastbuild.lsp.evaluator.semantics.handlers;

import org.fastbuild.lsp.evaluator.api.EvaluatedData;
import org.fastbuild.lsp.evaluator.api.EvaluationException;
import org.fastbuild.lsp.evaluator.api.SourceException;
import org.fastbuild.lsp.evaluator.api.SourceRange;
import org.fastbuild.lsp.evaluator.api.TargetDefinition;
import org.fastbuild.lsp.evaluator.api.TargetReference;
import org.fastbuild.lsp.evaluator.api.VariableDefinition;
import org.fastbuild.lsp.evaluator.diagnostics.EvaluatorLogger;
import org.fastbuild.lsp.evaluator.frontend.parser.ast.AstNode;
import org.fastbuild.lsp.evaluator.frontend.parser.features.function.GenericFunctionNode;
import org.fastbuild.lsp.evaluator.functions.GenericFunction;
import org.fastbuild.lsp.evaluator.functions.TargetRegistry;
import org.fastbuild.lsp.evaluator.scope.ScopeStack;
import org.fastbuild.lsp.evaluator.scope.ScopeVariable;
import org.fastbuild.lsp.evaluator.semantics.EvaluatedValue;
import org.fastbuild.lsp.evaluator.semantics.EvaluationContext;
import org.fastbuild.lsp.evaluator.semantics.EvaluationSession;
import org.fastbuild.lsp.evaluator.semantics.ExpressionEvaluator;
import org.fastbuild.lsp.evaluator.semantics.IStatementHandler;
import org.fastbuild.lsp.evaluator.semantics.LhsBinding;
import org.fastbuild.lsp.evaluator.semantics.StatementEvaluator;
import org.fastbuild.lsp.evaluator.value.Value;
import org.fastbuild.lsp.evaluator.value.ValueOperations;

import java.util.List;
import java.util.Optional;

/**
 * Handles the build-declaration functions such as {@code Alias('name') { ... }} and
 * {@code Executable('name') { ... }}.
 * <p>
 * The target name is defined where it is written. Names listed in the function's target-list
 * properties (e.g. {@code .Targets}) are collected as pending target references and resolved once the
 * whole session has run, so a target may be referenced before it is declared.
 */
public class GenericFunctionStatementHandler implements IStatementHandler {

    private final StatementEvaluator statements;
    private final ExpressionEvaluator expressions;

    public GenericFunctionStatementHandler(StatementEvaluator statements, ExpressionEvaluator expressions) {
        this.statements = statements;
        this.expressions = expressions;
    }

    /**
     * {@inheritDoc}
     */
    @Override
    public Optional<LhsBinding> evaluate(AstNode statement, EvaluationContext context) throws SourceException {
        GenericFunctionNode node = (GenericFunctionNode) statement;
        EvaluatedValue targetName = expressions.evaluate(node.targetName(), context);
        if (!(targetName.value() instanceof Value.Str name)) {
            throw new EvaluationException("Target name must evaluate to a String, but instead evaluates to "
                    + ValueOperations.describeOperand(targetName.value()), targetName.range());
        }

        ScopeStack scopes = context.getScopes();
        EvaluatedData data = context.getData();
        TargetRegistry targets = context.getSession().getTargets();

        TargetDefinition definition = scopes.createTargetDefinition(targetName.range(), name.value());
        data.addTargetDefinition(definition);
        data.addTargetReference(new TargetReference(definition, targetName.range()));
        targets.register(definition);
        EvaluatorLogger.debug("{} target '{}'", node.function().functionName(), name.value());

        scopes.enterScope();
        try {
            context.setPreviousStatementLhs(null);
            statements.evaluateStatements(node.statements(), context);
            collectTargetReferences(node.function(), scopes, targets);
        } finally {
            scopes.leaveScope();
        }
        return Optional.empty();
    }

    private static void collectTargetReferences(GenericFunction function, ScopeStack scopes, TargetRegistry targets) {
        for (String property : function.targetListProperties()) {
            Optional<ScopeVariable> variable = scopes.findStartingFromCurrentScope(property);
            if (variable.isEmpty()) {
                continue;
            }
            List<VariableDefinition> definitions = variable.get().getDefinitions();
            VariableDefinition definition = definitions.get(definitions.size() - 1);
            if (definition.id() == EvaluationSession.BUILT_IN_DEFINITION_ID) {
                continue;
            }
            SourceRange range = definition.range();
            Value value = variable.get().getValue();
            if (value instanceof Value.Str str) {
                targets.addReference(str.value(), range);
            } else if (value instanceof Value.Array array) {
                for (Value item : array.items()) {
                    if (item instanceof Value.Str str) {
                        targets.addReference(str.value(), range);
                    }
                }
            }
        }
    }
}
