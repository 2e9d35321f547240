package org.fastbuild.lsp.evaluator.semantics;

import org.fastbuild.lsp.evaluator.api.EvaluatedVariable;
import org.fastbuild.lsp.evaluator.scope.ScopeVariable;

/**
 * The variable a statement assigned or modified, kept so that a following unnamed {@code +}/{@code -}
 * line can continue the statement.
 *
 * @param variable The binding.
 * @param evaluatedVariable The value recorded at the statement's left-hand side, updated by the
 *                          continuation.
 */
public record LhsBinding(ScopeVariable variable, EvaluatedVariable evaluatedVariable) {
}
