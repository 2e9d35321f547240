package org.fastbuild.lsp.evaluator.semantics.handlers;

import org.fastbuild.lsp.evaluator.api.EvaluatedData;
import org.fastbuild.lsp.evaluator.api.EvaluationException;
import org.fastbuild.lsp.evaluator.api.ReferenceType;
import org.fastbuild.lsp.evaluator.api.SourceException;
import org.fastbuild.lsp.evaluator.api.VariableDefinition;
import org.fastbuild.lsp.evaluator.api.VariableReference;
import org.fastbuild.lsp.evaluator.frontend.parser.ast.AstNode;
import org.fastbuild.lsp.evaluator.frontend.parser.features.userfunction.ParameterNode;
import org.fastbuild.lsp.evaluator.frontend.parser.features.userfunction.UserFunctionDeclarationNode;
import org.fastbuild.lsp.evaluator.functions.UserFunction;
import org.fastbuild.lsp.evaluator.functions.UserFunctionRegistry;
import org.fastbuild.lsp.evaluator.scope.ScopeStack;
import org.fastbuild.lsp.evaluator.semantics.EvaluationContext;
import org.fastbuild.lsp.evaluator.semantics.IStatementHandler;
import org.fastbuild.lsp.evaluator.semantics.LhsBinding;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Handles {@code function Name(.A, .B) { ... }}. Registers the function; the body is not evaluated
 * until a call.
 */
public class UserFunctionDeclarationStatementHandler implements IStatementHandler {

    /**
     * {@inheritDoc}
     */
    @Override
    public Optional<LhsBinding> evaluate(AstNode statement, EvaluationContext context) throws SourceException {
        UserFunctionDeclarationNode node = (UserFunctionDeclarationNode) statement;
        ScopeStack scopes = context.getScopes();
        EvaluatedData data = context.getData();
        UserFunctionRegistry functions = context.getSession().getUserFunctions();

        VariableDefinition nameDefinition = scopes.createVariableDefinition(node.nameRange(), node.name());
        data.addVariableDefinition(nameDefinition);
        data.addVariableReference(new VariableReference(List.of(nameDefinition), node.nameRange(), ReferenceType.WRITE));

        if (UserFunctionRegistry.isReserved(node.name())) {
            throw new EvaluationException("Cannot use function name \"" + node.name() + "\" because it is reserved.",
                    node.nameRange());
        }
        if (functions.contains(node.name())) {
            throw new EvaluationException("Cannot use function name \"" + node.name()
                    + "\" because it is already used by another user function. Functions must be uniquely named.",
                    node.nameRange());
        }

        Set<String> usedNames = new HashSet<>();
        List<UserFunction.Parameter> parameters = new ArrayList<>();
        for (ParameterNode parameter : node.parameters()) {
            if (!usedNames.add(parameter.name())) {
                throw new EvaluationException("User-function argument names must be unique.", parameter.range());
            }
            VariableDefinition definition = scopes.createVariableDefinition(parameter.range(), parameter.name());
            data.addVariableDefinition(definition);
            data.addVariableReference(new VariableReference(List.of(definition), parameter.range(), ReferenceType.WRITE));
            parameters.add(new UserFunction.Parameter(parameter.name(), definition));
        }

        functions.register(new UserFunction(node.name(), nameDefinition, parameters, node.statements()));
        return Optional.empty();
    }
}
