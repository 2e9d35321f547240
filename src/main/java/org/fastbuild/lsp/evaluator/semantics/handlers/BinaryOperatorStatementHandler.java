package org.fastbuild.lsp.evaluator.semantics.handlers;

import org.fastbuild.lsp.evaluator.api.EvaluatedData;
import org.fastbuild.lsp.evaluator.api.EvaluatedVariable;
import org.fastbuild.lsp.evaluator.api.ReferenceType;
import org.fastbuild.lsp.evaluator.api.SourceException;
import org.fastbuild.lsp.evaluator.api.SourceRange;
import org.fastbuild.lsp.evaluator.api.VariableDefinition;
import org.fastbuild.lsp.evaluator.api.VariableReference;
import org.fastbuild.lsp.evaluator.frontend.parser.ast.AstNode;
import org.fastbuild.lsp.evaluator.frontend.parser.ast.VariableLhs;
import org.fastbuild.lsp.evaluator.frontend.parser.features.assignment.BinaryOperatorNode;
import org.fastbuild.lsp.evaluator.scope.ScopeLocation;
import org.fastbuild.lsp.evaluator.scope.ScopeStack;
import org.fastbuild.lsp.evaluator.scope.ScopeVariable;
import org.fastbuild.lsp.evaluator.semantics.EvaluatedValue;
import org.fastbuild.lsp.evaluator.semantics.EvaluationContext;
import org.fastbuild.lsp.evaluator.semantics.ExpressionEvaluator;
import org.fastbuild.lsp.evaluator.semantics.IStatementHandler;
import org.fastbuild.lsp.evaluator.semantics.LhsBinding;
import org.fastbuild.lsp.evaluator.value.Value;

import java.util.List;
import java.util.Optional;

/**
 * Handles {@code .Name + value} and {@code .Name - value}.
 * <p>
 * Modifying a name that is only visible from a parent scope binds the result in the current scope
 * under a new definition and leaves the parent's value untouched.
 */
public class BinaryOperatorStatementHandler implements IStatementHandler {

    private final ExpressionEvaluator expressions;

    public BinaryOperatorStatementHandler(ExpressionEvaluator expressions) {
        this.expressions = expressions;
    }

    /**
     * {@inheritDoc}
     */
    @Override
    public Optional<LhsBinding> evaluate(AstNode statement, EvaluationContext context) throws SourceException {
        BinaryOperatorNode node = (BinaryOperatorNode) statement;
        VariableLhs lhs = node.lhs();
        String name = expressions.evaluateName(lhs.name(), context);
        ScopeStack scopes = context.getScopes();
        EvaluatedData data = context.getData();

        ScopeVariable variable;
        Optional<ScopeVariable> inherited = lhs.scope() == ScopeLocation.CURRENT && scopes.findInCurrentScope(name).isEmpty()
                ? scopes.findStartingFromCurrentScope(name)
                : Optional.empty();
        if (inherited.isPresent()) {
            VariableDefinition definition = scopes.createVariableDefinition(lhs.range(), name);
            data.addVariableDefinition(definition);
            variable = scopes.setInCurrentScope(name, inherited.get().getValue(), List.of(definition));
        } else {
            variable = scopes.getForModification(lhs.scope(), name, lhs.range());
        }

        EvaluatedValue rhs = expressions.evaluate(node.rhs(), context);
        SourceRange operationRange = SourceRange.between(lhs.range(), rhs.range());
        Value result = ExpressionEvaluator.apply(node.operator(), variable.getValue(), rhs.value(), operationRange);
        variable.setValue(result);

        EvaluatedVariable evaluatedVariable = data.recordEvaluatedVariable(result, lhs.range());
        data.addVariableReference(new VariableReference(variable.getDefinitions(), lhs.range(), ReferenceType.READ_WRITE));
        return Optional.of(new LhsBinding(variable, evaluatedVariable));
    }
}
