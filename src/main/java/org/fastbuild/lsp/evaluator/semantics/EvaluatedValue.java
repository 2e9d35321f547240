package org.fastbuild.lsp.evaluator.semantics;

import org.fastbuild.lsp.evaluator.api.SourceRange;
import org.fastbuild.lsp.evaluator.value.Value;

/**
 * The result of evaluating an expression.
 *
 * @param value The value.
 * @param range The range of the expression.
 */
public record EvaluatedValue(Value value, SourceRange range) {
}
