package org.fastbuild.lsp.evaluator.semantics.handlers;

import org.fastbuild.lsp.evaluator.api.EvaluationException;
import org.fastbuild.lsp.evaluator.api.SourceException;
import org.fastbuild.lsp.evaluator.diagnostics.EvaluatorLogger;
import org.fastbuild.lsp.evaluator.frontend.parser.ast.AstNode;
import org.fastbuild.lsp.evaluator.frontend.parser.ast.EvaluatedVariableNode;
import org.fastbuild.lsp.evaluator.frontend.parser.features.function.PrintNode;
import org.fastbuild.lsp.evaluator.semantics.EvaluatedValue;
import org.fastbuild.lsp.evaluator.semantics.EvaluationContext;
import org.fastbuild.lsp.evaluator.semantics.ExpressionEvaluator;
import org.fastbuild.lsp.evaluator.semantics.IStatementHandler;
import org.fastbuild.lsp.evaluator.semantics.LhsBinding;
import org.fastbuild.lsp.evaluator.value.Value;

import java.util.Optional;

/**
 * Handles {@code Print(...)}. The argument is evaluated for its references; nothing is printed.
 */
public class PrintStatementHandler implements IStatementHandler {

    private final ExpressionEvaluator expressions;

    public PrintStatementHandler(ExpressionEvaluator expressions) {
        this.expressions = expressions;
    }

    @Override
    public Optional<LhsBinding> evaluate(AstNode statement, EvaluationContext context) throws SourceException {
        PrintNode node = (PrintNode) statement;
        EvaluatedValue value = expressions.evaluate(node.value(), context);
        if (!(node.value() instanceof EvaluatedVariableNode) && !(value.value() instanceof Value.Str)) {
            throw new EvaluationException("'Print' argument must either be a variable or evaluate to a String, but instead is "
                    + value.value().describe(), node.range());
        }
        EvaluatorLogger.trace("Print: {}", value.value());
        return Optional.empty();
    }
}
