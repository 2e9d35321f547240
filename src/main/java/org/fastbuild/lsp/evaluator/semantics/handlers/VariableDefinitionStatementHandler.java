package org.fastbuild.lsp.evaluator.semantics.handlers;

import org.fastbuild.lsp.evaluator.api.EvaluatedData;
import org.fastbuild.lsp.evaluator.api.EvaluatedVariable;
import org.fastbuild.lsp.evaluator.api.EvaluationException;
import org.fastbuild.lsp.evaluator.api.ReferenceType;
import org.fastbuild.lsp.evaluator.api.SourceException;
import org.fastbuild.lsp.evaluator.api.SourceRange;
import org.fastbuild.lsp.evaluator.api.VariableDefinition;
import org.fastbuild.lsp.evaluator.api.VariableReference;
import org.fastbuild.lsp.evaluator.frontend.parser.ast.AstNode;
import org.fastbuild.lsp.evaluator.frontend.parser.ast.VariableLhs;
import org.fastbuild.lsp.evaluator.frontend.parser.features.assignment.VariableDefinitionNode;
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
 * Handles {@code .Name = value} and {@code ^Name = value}.
 * <p>
 * Only the first assignment of a name in a scope creates a definition; later assignments reuse it.
 * Assigning a single String or Struct to an existing Array replaces it with a one-item Array.
 */
public class VariableDefinitionStatementHandler implements IStatementHandler {

    private final ExpressionEvaluator expressions;

    public VariableDefinitionStatementHandler(ExpressionEvaluator expressions) {
        this.expressions = expressions;
    }

    /**
     * {@inheritDoc}
     */
    @Override
    public Optional<LhsBinding> evaluate(AstNode statement, EvaluationContext context) throws SourceException {
        VariableDefinitionNode node = (VariableDefinitionNode) statement;
        EvaluatedValue rhs = expressions.evaluate(node.rhs(), context);

        VariableLhs lhs = node.lhs();
        String name = expressions.evaluateName(lhs.name(), context);
        ScopeStack scopes = context.getScopes();
        EvaluatedData data = context.getData();

        ScopeVariable variable;
        Value value;
        if (lhs.scope() == ScopeLocation.PARENT) {
            variable = scopes.getStartingFromParentScope(name, lhs.range());
            value = coerceToExisting(variable.getValue(), rhs);
            variable.setValue(value);
        } else {
            Optional<ScopeVariable> existing = scopes.findInCurrentScope(name);
            if (existing.isPresent()) {
                variable = existing.get();
                value = coerceToExisting(variable.getValue(), rhs);
                variable.setValue(value);
            } else {
                value = rhs.value();
                VariableDefinition definition = scopes.createVariableDefinition(lhs.range(), name);
                data.addVariableDefinition(definition);
                variable = scopes.setInCurrentScope(name, value, List.of(definition));
            }
        }

        EvaluatedVariable evaluatedVariable = data.recordEvaluatedVariable(value, lhs.range());
        data.addVariableReference(new VariableReference(variable.getDefinitions(), lhs.range(), ReferenceType.WRITE));
        return Optional.of(new LhsBinding(variable, evaluatedVariable));
    }

    private static Value coerceToExisting(Value existing, EvaluatedValue rhs) throws EvaluationException {
        Value value = rhs.value();
        if (!(existing instanceof Value.Array existingArray) || value instanceof Value.Array) {
            return value;
        }
        SourceRange range = rhs.range();
        if (existingArray.isEmpty()) {
            if (!(value instanceof Value.Str) && !(value instanceof Value.Struct)) {
                throw new EvaluationException("Cannot assign " + value.describe()
                        + " to an Array. Arrays can only contain Strings or Structs.", range);
            }
        } else if (existingArray.elementType().orElseThrow() != value.type()) {
            throw new EvaluationException("Cannot assign " + value.describe() + " to "
                    + existingArray.describeWithElements() + ".", range);
        }
        return new Value.Array(List.of(value));
    }
}
