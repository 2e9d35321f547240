package org.fastbuild.lsp.evaluator.preprocessor;

import org.fastbuild.lsp.evaluator.frontend.parser.features.condition.LogicalOperator;
import org.fastbuild.lsp.evaluator.frontend.parser.features.directiveif.DirectiveConditionNode;
import org.fastbuild.lsp.evaluator.semantics.EvaluationContext;

import java.nio.file.Path;

/**
 * Evaluates {@code #if} conditions. Terms have no side effects, so {@code &&} and {@code ||}
 * short-circuit.
 */
public class DirectiveConditionEvaluator {

    /**
     * @param condition The condition.
     * @param context The evaluation context, providing the defined symbols, the environment and the
     *                directory of the current file.
     * @return The truth value.
     */
    public boolean evaluate(DirectiveConditionNode condition, EvaluationContext context) {
        if (condition instanceof DirectiveConditionNode.SymbolDefined symbol) {
            return context.getDefines().isDefined(symbol.symbol());
        }
        if (condition instanceof DirectiveConditionNode.EnvironmentVariableExists exists) {
            return context.getSession().getEnvironment().containsKey(exists.variable());
        }
        if (condition instanceof DirectiveConditionNode.FileExists fileExists) {
            Path path = context.resolveRelativeToCurrentFile(fileExists.path());
            return context.getSession().getFileSystem().fileExists(path);
        }
        if (condition instanceof DirectiveConditionNode.Not not) {
            return !evaluate(not.operand(), context);
        }
        DirectiveConditionNode.Logical logical = (DirectiveConditionNode.Logical) condition;
        if (logical.operator() == LogicalOperator.AND) {
            return evaluate(logical.lhs(), context) && evaluate(logical.rhs(), context);
        }
        return evaluate(logical.lhs(), context) || evaluate(logical.rhs(), context);
    }
}
