package org.fastbuild.lsp.evaluator.semantics;

import org.fastbuild.lsp.evaluator.api.SourceException;
import org.fastbuild.lsp.evaluator.frontend.parser.ast.AstNode;

import java.util.Optional;

/**
 * Interface for specialized handlers of the statement dispatcher.
 * Each handler is responsible for evaluating a specific type of statement node.
 */
@FunctionalInterface
public interface IStatementHandler {
    /**
     * Evaluates a single statement.
     * @param statement The statement to evaluate.
     * @param context The evaluation context.
     * @return The binding the statement assigned, which a following unnamed modification continues.
     * @throws SourceException if the statement, or a file it includes, cannot be evaluated.
     */
    Optional<LhsBinding> evaluate(AstNode statement, EvaluationContext context) throws SourceException;
}
