package org.fastbuild.lsp.evaluator.semantics.handlers;

import org.fastbuild.lsp.evaluator.api.EvaluationException;
import org.fastbuild.lsp.evaluator.api.SourceException;
import org.fastbuild.lsp.evaluator.api.SourceRange;
import org.fastbuild.lsp.evaluator.frontend.parser.ast.AstNode;
import org.fastbuild.lsp.evaluator.frontend.parser.features.assignment.UnnamedBinaryOperatorNode;
import org.fastbuild.lsp.evaluator.semantics.EvaluatedValue;
import org.fastbuild.lsp.evaluator.semantics.EvaluationContext;
import org.fastbuild.lsp.evaluator.semantics.ExpressionEvaluator;
import org.fastbuild.lsp.evaluator.semantics.IStatementHandler;
import org.fastbuild.lsp.evaluator.semantics.LhsBinding;
import org.fastbuild.lsp.evaluator.value.Value;

import java.util.Optional;

/**
 * Handles a {@code + value} or {@code - value} line that continues the preceding assignment.
 * The value recorded at the assignment's left-hand side follows the continuation.
 */
public class UnnamedBinaryOperatorStatementHandler implements IStatementHandler {

    private final ExpressionEvaluator expressions;

    public UnnamedBinaryOperatorStatementHandler(ExpressionEvaluator expressions) {
        this.expressions = expressions;
    }

    /**
     * {@inheritDoc}
     */
    @Override
    public Optional<LhsBinding> evaluate(AstNode statement, EvaluationContext context) throws SourceException {
        UnnamedBinaryOperatorNode node = (UnnamedBinaryOperatorNode) statement;
        LhsBinding binding = context.getPreviousStatementLhs();
        if (binding == null) {
            throw new EvaluationException("Unnamed modification must follow a variable assignment in the same scope.",
                    node.range());
        }

        EvaluatedValue rhs = expressions.evaluate(node.rhs(), context);
        SourceRange operationRange = SourceRange.between(node.range(), rhs.range());
        Value result = ExpressionEvaluator.apply(node.operator(), binding.variable().getValue(), rhs.value(), operationRange);
        binding.variable().setValue(result);
        binding.evaluatedVariable().updateValue(result);
        return Optional.of(binding);
    }
}
