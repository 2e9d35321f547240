package org.fastbuild.lsp.evaluator.semantics.handlers;

import org.fastbuild.lsp.evaluator.api.EvaluatedData;
import org.fastbuild.lsp.evaluator.api.EvaluationException;
import org.fastbuild.lsp.evaluator.api.ReferenceType;
import org.fastbuild.lsp.evaluator.api.SourceException;
import org.fastbuild.lsp.evaluator.api.VariableDefinition;
import org.fastbuild.lsp.evaluator.api.VariableReference;
import org.fastbuild.lsp.evaluator.frontend.parser.ast.AstNode;
import org.fastbuild.lsp.evaluator.frontend.parser.ast.VariableLhs;
import org.fastbuild.lsp.evaluator.frontend.parser.features.foreach.ForEachIterator;
import org.fastbuild.lsp.evaluator.frontend.parser.features.foreach.ForEachNode;
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
 * Handles {@code ForEach(.Item in .Items[, ...]) { ... }}. All arrays are walked in lockstep, one child
 * scope per index.
 */
public class ForEachStatementHandler implements IStatementHandler {

    private record Iteration(String loopVariableName, VariableLhs loopVariable, VariableDefinition definition, Value.Array items) {}

    private final StatementEvaluator statements;
    private final ExpressionEvaluator expressions;

    public ForEachStatementHandler(StatementEvaluator statements, ExpressionEvaluator expressions) {
        this.statements = statements;
        this.expressions = expressions;
    }

    /**
     * {@inheritDoc}
     */
    @Override
    public Optional<LhsBinding> evaluate(AstNode statement, EvaluationContext context) throws SourceException {
        ForEachNode node = (ForEachNode) statement;
        ScopeStack scopes = context.getScopes();
        EvaluatedData data = context.getData();

        List<Iteration> iterations = new ArrayList<>();
        for (ForEachIterator iterator : node.iterators()) {
            Value value = expressions.readVariable(iterator.arrayToLoopOver(), context).getValue();
            if (!(value instanceof Value.Array items)) {
                throw new EvaluationException("'ForEach' variable to loop over must be an Array, but instead is "
                        + value.describe(), iterator.arrayToLoopOver().range());
            }
            if (!iterations.isEmpty() && items.items().size() != iterations.get(0).items().items().size()) {
                throw new EvaluationException("'ForEach' Array variable to loop over contains " + items.items().size()
                        + " elements, but the loop is for " + iterations.get(0).items().items().size() + " elements.",
                        iterator.arrayToLoopOver().range());
            }

            VariableLhs loopVariable = iterator.loopVariable();
            String name = expressions.evaluateName(loopVariable.name(), context);
            VariableDefinition definition = scopes.createVariableDefinition(loopVariable.range(), name);
            data.addVariableDefinition(definition);
            iterations.add(new Iteration(name, loopVariable, definition, items));
        }

        int length = iterations.isEmpty() ? 0 : iterations.get(0).items().items().size();
        for (int index = 0; index < length; index++) {
            scopes.enterScope();
            try {
                for (Iteration iteration : iterations) {
                    Value item = iteration.items().items().get(index);
                    scopes.setInCurrentScope(iteration.loopVariableName(), item, List.of(iteration.definition()));
                    data.recordEvaluatedVariable(item, iteration.loopVariable().range());
                    data.addVariableReference(new VariableReference(List.of(iteration.definition()),
                            iteration.loopVariable().range(), ReferenceType.WRITE));
                }
                context.setPreviousStatementLhs(null);
                statements.evaluateStatements(node.statements(), context);
            } finally {
                scopes.leaveScope();
            }
        }
        return Optional.empty();
    }
}
