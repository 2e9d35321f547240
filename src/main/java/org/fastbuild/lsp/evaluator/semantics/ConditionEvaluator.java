package org.fastbuild.lsp.evaluator.semantics;

import org.fastbuild.lsp.evaluator.api.EvaluationException;
import org.fastbuild.lsp.evaluator.api.SourceException;
import org.fastbuild.lsp.evaluator.api.SourceRange;
import org.fastbuild.lsp.evaluator.frontend.parser.ast.EvaluatedVariableNode;
import org.fastbuild.lsp.evaluator.frontend.parser.features.condition.BooleanConditionNode;
import org.fastbuild.lsp.evaluator.frontend.parser.features.condition.ComparisonConditionNode;
import org.fastbuild.lsp.evaluator.frontend.parser.features.condition.ComparisonOperator;
import org.fastbuild.lsp.evaluator.frontend.parser.features.condition.ConditionNode;
import org.fastbuild.lsp.evaluator.frontend.parser.features.condition.InConditionNode;
import org.fastbuild.lsp.evaluator.frontend.parser.features.condition.LogicalConditionNode;
import org.fastbuild.lsp.evaluator.frontend.parser.features.condition.LogicalOperator;
import org.fastbuild.lsp.evaluator.value.Value;
import org.fastbuild.lsp.evaluator.value.ValueOperations;
import org.fastbuild.lsp.evaluator.value.ValueType;

/**
 * Evaluates the condition of an {@code If} statement.
 * <p>
 * Both operands of {@code &&} and {@code ||} are always evaluated, so every variable in the condition
 * is recorded regardless of the outcome.
 */
public class ConditionEvaluator {

    private final ExpressionEvaluator expressions;

    public ConditionEvaluator(ExpressionEvaluator expressions) {
        this.expressions = expressions;
    }

    /**
     * Evaluates a condition.
     * @param condition The condition node.
     * @param context The evaluation context.
     * @return Whether the condition holds.
     * @throws SourceException if an operand cannot be evaluated or has an unsupported type.
     */
    public boolean evaluate(ConditionNode condition, EvaluationContext context) throws SourceException {
        if (condition instanceof BooleanConditionNode bool) {
            return evaluateBoolean(bool, context);
        }
        if (condition instanceof ComparisonConditionNode comparison) {
            return evaluateComparison(comparison, context);
        }
        if (condition instanceof InConditionNode in) {
            return evaluateIn(in, context);
        }
        LogicalConditionNode logical = (LogicalConditionNode) condition;
        boolean lhs = evaluate(logical.lhs(), context);
        boolean rhs = evaluate(logical.rhs(), context);
        return logical.operator() == LogicalOperator.AND ? lhs && rhs : lhs || rhs;
    }

    private boolean evaluateBoolean(BooleanConditionNode condition, EvaluationContext context) throws SourceException {
        EvaluatedValue evaluated = expressions.evaluate(condition.value(), context);
        if (!(evaluated.value() instanceof Value.Bool bool)) {
            throw new EvaluationException("Condition must evaluate to a Boolean, but instead evaluates to "
                    + ValueOperations.describeOperand(evaluated.value()), evaluated.range());
        }
        return condition.invert() != bool.value();
    }

    private boolean evaluateComparison(ComparisonConditionNode condition, EvaluationContext context) throws SourceException {
        Value lhs = expressions.evaluate(condition.lhs(), context).value();
        Value rhs = expressions.evaluate(condition.rhs(), context).value();
        ComparisonOperator operator = condition.operator();

        // Only the left type is checked here; the type match below covers the right one.
        if (operator.isEquality()) {
            if (!(lhs instanceof Value.Bool) && !(lhs instanceof Value.Str) && !(lhs instanceof Value.Int)) {
                throw new EvaluationException("'If' comparison using '" + operator.symbol()
                        + "' only supports comparing Booleans, Strings, and Integers, but "
                        + ValueOperations.describeOperand(lhs) + " is used", condition.operatorRange());
            }
        } else if (!(lhs instanceof Value.Str) && !(lhs instanceof Value.Int)) {
            throw new EvaluationException("'If' comparison using '" + operator.symbol()
                    + "' only supports comparing Strings and Integers, but "
                    + ValueOperations.describeOperand(lhs) + " is used", condition.operatorRange());
        }

        if (lhs.type() != rhs.type()) {
            throw new EvaluationException("'If' condition comparison must compare variables of the same type, but LHS is "
                    + ValueOperations.describeOperand(lhs) + " and RHS is " + ValueOperations.describeOperand(rhs),
                    SourceRange.between(condition.lhs().range(), condition.rhs().range()));
        }

        return switch (operator) {
            case EQUAL -> lhs.equals(rhs);
            case NOT_EQUAL -> !lhs.equals(rhs);
            case LESS -> compare(lhs, rhs) < 0;
            case LESS_OR_EQUAL -> compare(lhs, rhs) <= 0;
            case GREATER -> compare(lhs, rhs) > 0;
            case GREATER_OR_EQUAL -> compare(lhs, rhs) >= 0;
        };
    }

    private static int compare(Value lhs, Value rhs) {
        if (lhs instanceof Value.Int lhsInt) {
            return Integer.compare(lhsInt.value(), ((Value.Int) rhs).value());
        }
        return ((Value.Str) lhs).value().compareTo(((Value.Str) rhs).value());
    }

    private boolean evaluateIn(InConditionNode condition, EvaluationContext context) throws SourceException {
        Value lhs = expressions.evaluate(condition.lhs(), context).value();
        Value rhs = expressions.evaluate(condition.rhs(), context).value();
        SourceRange lhsRange = condition.lhs().range();
        SourceRange rhsRange = condition.rhs().range();

        if (!(rhs instanceof Value.Array rhsArray)) {
            throw new EvaluationException("'If' 'in' condition right-hand-side value must be an Array of Strings, but instead is "
                    + rhs.describe(), rhsRange);
        }
        if (!(condition.rhs() instanceof EvaluatedVariableNode)) {
            throw new EvaluationException("'If' 'in' condition right-hand-side value cannot be a literal Array Of Strings. "
                    + "Instead use an evaluated variable.", rhsRange);
        }

        boolean isPresent;
        if (rhsArray.isEmpty()) {
            isPresent = false;
        } else if (rhsArray.elementType().orElseThrow() != ValueType.STRING) {
            throw new EvaluationException("'If' 'in' condition right-hand-side value must be an Array of Strings, but instead is "
                    + rhsArray.describeWithElements(), rhsRange);
        } else if (lhs instanceof Value.Str) {
            isPresent = rhsArray.items().contains(lhs);
        } else if (lhs instanceof Value.Array lhsArray) {
            if (!(condition.lhs() instanceof EvaluatedVariableNode)) {
                throw new EvaluationException("'If' 'in' condition left-hand-side value cannot be a literal Array Of Strings. "
                        + "Instead use an evaluated variable.", lhsRange);
            }
            if (lhsArray.isEmpty()) {
                isPresent = false;
            } else if (lhsArray.elementType().orElseThrow() != ValueType.STRING) {
                throw new EvaluationException("'If' 'in' condition left-hand-side value must be either a String or an Array of Strings, but instead is "
                        + lhsArray.describeWithElements(), lhsRange);
            } else {
                isPresent = rhsArray.items().containsAll(lhsArray.items());
            }
        } else {
            throw new EvaluationException("'If' 'in' condition left-hand-side value must be either a String or an Array of Strings, but instead is "
                    + lhs.describe(), lhsRange);
        }

        return condition.invert() != isPresent;
    }
}
