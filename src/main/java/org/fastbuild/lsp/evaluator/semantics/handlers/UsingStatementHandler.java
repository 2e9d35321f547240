package org.fastbuild.lsp.evaluator.semantics.handlers;

import org.fastbuild.lsp.evaluator.api.EvaluatedData;
import org.fastbuild.lsp.evaluator.api.EvaluationException;
import org.fastbuild.lsp.evaluator.api.ReferenceType;
import org.fastbuild.lsp.evaluator.api.SourceException;
import org.fastbuild.lsp.evaluator.api.SourceRange;
import org.fastbuild.lsp.evaluator.api.VariableDefinition;
import org.fastbuild.lsp.evaluator.api.VariableReference;
import org.fastbuild.lsp.evaluator.frontend.parser.ast.AstNode;
import org.fastbuild.lsp.evaluator.frontend.parser.features.using.UsingNode;
import org.fastbuild.lsp.evaluator.scope.ScopeStack;
import org.fastbuild.lsp.evaluator.scope.ScopeVariable;
import org.fastbuild.lsp.evaluator.semantics.EvaluationContext;
import org.fastbuild.lsp.evaluator.semantics.ExpressionEvaluator;
import org.fastbuild.lsp.evaluator.semantics.IStatementHandler;
import org.fastbuild.lsp.evaluator.semantics.LhsBinding;
import org.fastbuild.lsp.evaluator.value.StructMember;
import org.fastbuild.lsp.evaluator.value.Value;
import org.fastbuild.lsp.evaluator.value.ValueOperations;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Handles {@code Using(.Struct)}, which binds every member of a struct in the current scope.
 * <p>
 * A member that is new to the scope is defined at the {@code Using} statement and also owned by the
 * member's own definitions, so that go-to-definition from a later read leads to both places.
 */
public class UsingStatementHandler implements IStatementHandler {

    private final ExpressionEvaluator expressions;

    public UsingStatementHandler(ExpressionEvaluator expressions) {
        this.expressions = expressions;
    }

    /**
     * {@inheritDoc}
     */
    @Override
    public Optional<LhsBinding> evaluate(AstNode statement, EvaluationContext context) throws SourceException {
        UsingNode node = (UsingNode) statement;
        Value value = expressions.readVariable(node.struct(), context).getValue();
        if (!(value instanceof Value.Struct struct)) {
            throw new EvaluationException("'Using' parameter must be a Struct, but instead is "
                    + ValueOperations.describeOperand(value), node.struct().range());
        }

        ScopeStack scopes = context.getScopes();
        EvaluatedData data = context.getData();
        SourceRange statementRange = node.range();
        for (Map.Entry<String, StructMember> entry : struct.members().entrySet()) {
            String memberName = entry.getKey();
            StructMember member = entry.getValue();

            ScopeVariable variable;
            Optional<ScopeVariable> existing = scopes.findInCurrentScope(memberName);
            if (existing.isPresent()) {
                variable = existing.get();
                variable.setValue(member.value());
            } else {
                VariableDefinition definition = scopes.createVariableDefinition(statementRange, memberName);
                data.addVariableDefinition(definition);
                List<VariableDefinition> owners = new ArrayList<>(member.definitions());
                owners.add(definition);
                variable = scopes.setInCurrentScope(memberName, member.value(), owners);
            }

            data.addVariableReference(new VariableReference(variable.getDefinitions(), statementRange, ReferenceType.WRITE));
            data.addVariableReference(new VariableReference(member.definitions(), statementRange, ReferenceType.READ));
            for (VariableDefinition memberDefinition : member.definitions()) {
                data.addVariableReference(new VariableReference(variable.getDefinitions(), memberDefinition.range(), ReferenceType.READ));
            }
        }
        return Optional.empty();
    }
}
