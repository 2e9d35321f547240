package org.fastbuild.lsp.evaluator.semantics.handlers;

import org.fastbuild.lsp.evaluator.api.EvaluationException;
import org.fastbuild.lsp.evaluator.api.SourceException;
import org.fastbuild.lsp.evaluator.frontend.parser.ast.AstNode;
import org.fastbuild.lsp.evaluator.frontend.parser.features.function.ErrorNode;
import org.fastbuild.lsp.evaluator.semantics.EvaluatedValue;
import org.fastbuild.lsp.evaluator.semantics.EvaluationContext;
import org.fastbuild.lsp.evaluator.semantics.ExpressionEvaluator;
import org.fastbuild.lsp.evaluator.semantics.IStatementHandler;
import org.fastbuild.lsp.evaluator.semantics.LhsBinding;
import org.fastbuild.lsp.evaluator.value.Value;

import java.util.Optional;

/**
 * Handles {@code Error(...)}. A build would stop here; the evaluator only checks the argument.
 */
public class ErrorStatementHandler implements IStatementHandler {

    private final ExpressionEvaluator expressions;

    public ErrorStatementHandler(ExpressionEvaluator expressions) {
        this.expressions = expressions;
    }

    @Override
    public Optional<LhsBinding> evaluate(AstNode statement, EvaluationContext context) throws SourceException {
        ErrorNode node = (ErrorNode) statement;
        EvaluatedValue value = expressions.evaluate(node.value(), context);
        if (!(value.value() instanceof Value.Str)) {
            throw new EvaluationException("'Error' argument must evaluate to a String, but instead evaluates to "
                    + value.value().describe(), node.range());
        }
        return Optional.empty();
    }
}
