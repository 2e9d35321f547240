package org.fastbuild.lsp.evaluator.value;

import org.fastbuild.lsp.evaluator.api.EvaluationException;
import org.fastbuild.lsp.evaluator.api.SourceRange;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The {@code +} and {@code -} algebra of BFF values.
 * <p>
 * The range passed to each operation is the range of the whole operation (left operand start to right
 * operand end) and is used for the error.
 */
public final class ValueOperations {

    private ValueOperations() {}

    private static int exact(int lhs, char operator, int rhs, SourceRange range) throws EvaluationException {
        try {
            return operator == '+' ? Math.addExact(lhs, rhs) : Math.subtractExact(lhs, rhs);
        } catch (ArithmeticException e) {
            throw new EvaluationException("Integer overflow: " + lhs + " " + operator + " " + rhs
                    + " is outside the range of a 32-bit Integer.", range, e);
        }
    }

    /**
     * Computes {@code existing + operand}.
     * @param existing The left operand.
     * @param operand The right operand.
     * @param range The range of the operation.
     * @return The result. Neither operand is modified.
     * @throws EvaluationException if the operand types cannot be added, or an Integer sum overflows.
     */
    public static Value add(Value existing, Value operand, SourceRange range) throws EvaluationException {
        if (existing instanceof Value.Int lhs) {
            if (operand instanceof Value.Int rhs) {
                return new Value.Int(exact(lhs.value(), '+', rhs.value(), range));
            }
            throw new EvaluationException(cannotAdd(operand, existing) + " Can only add an Integer.", range);
        }
        if (existing instanceof Value.Str lhs) {
            if (operand instanceof Value.Str rhs) {
                return new Value.Str(lhs.value() + rhs.value());
            }
            throw new EvaluationException(cannotAdd(operand, existing) + " Can only add a String.", range);
        }
        if (existing instanceof Value.Array lhs) {
            return addToArray(lhs, operand, range);
        }
        if (existing instanceof Value.Struct lhs) {
            if (operand instanceof Value.Struct rhs) {
                Map<String, StructMember> merged = new LinkedHashMap<>(lhs.members());
                merged.putAll(rhs.members());
                return new Value.Struct(merged);
            }
            throw new EvaluationException(cannotAdd(operand, existing) + " Can only add a Struct.", range);
        }
        throw new EvaluationException("Cannot add to a Boolean.", range);
    }

    /**
     * Computes {@code existing - operand}.
     * @param existing The left operand.
     * @param operand The right operand.
     * @param range The range of the operation.
     * @return The result. Neither operand is modified.
     * @throws EvaluationException if the operand types cannot be subtracted, or an Integer difference
     *         overflows.
     */
    public static Value subtract(Value existing, Value operand, SourceRange range) throws EvaluationException {
        if (existing instanceof Value.Int lhs) {
            if (operand instanceof Value.Int rhs) {
                return new Value.Int(exact(lhs.value(), '-', rhs.value(), range));
            }
            throw new EvaluationException(cannotSubtract(operand, existing) + " Can only subtract an Integer.", range);
        }
        if (existing instanceof Value.Str lhs) {
            if (operand instanceof Value.Str rhs) {
                return new Value.Str(lhs.value().replace(rhs.value(), ""));
            }
            throw new EvaluationException(cannotSubtract(operand, existing) + " Can only subtract a String.", range);
        }
        if (existing instanceof Value.Array lhs) {
            return subtractFromArray(lhs, operand, range);
        }
        if (existing instanceof Value.Struct) {
            throw new EvaluationException("Cannot subtract from a Struct.", range);
        }
        throw new EvaluationException("Cannot subtract from a Boolean.", range);
    }

    private static Value addToArray(Value.Array existing, Value operand, SourceRange range) throws EvaluationException {
        if (operand instanceof Value.Array rhs) {
            if (existing.isEmpty()) {
                return rhs;
            }
            if (rhs.isEmpty()) {
                return existing;
            }
            ValueType elementType = existing.elementType().orElseThrow();
            if (rhs.elementType().orElseThrow() != elementType) {
                throw new EvaluationException(cannotAdd(operand, existing) + canOnlyAddTo(elementType), range);
            }
            List<Value> items = new ArrayList<>(existing.items());
            items.addAll(rhs.items());
            return new Value.Array(items);
        }

        if (operand instanceof Value.Str || operand instanceof Value.Struct) {
            if (existing.isEmpty() || existing.elementType().orElseThrow() == operand.type()) {
                List<Value> items = new ArrayList<>(existing.items());
                items.add(operand);
                return new Value.Array(items);
            }
        } else if (existing.isEmpty()) {
            throw new EvaluationException("Cannot add " + operand.describe()
                    + " to an Array. Arrays can only contain Strings or Structs.", range);
        }
        throw new EvaluationException(cannotAdd(operand, existing) + canOnlyAddTo(existing.elementType().orElseThrow()), range);
    }

    private static Value subtractFromArray(Value.Array existing, Value operand, SourceRange range) throws EvaluationException {
        if (existing.isEmpty()) {
            if (operand instanceof Value.Str) {
                return existing;
            }
            throw new EvaluationException("Cannot subtract " + describeOperand(operand)
                    + " from an Array. Can only subtract a String.", range);
        }
        if (existing.elementType().orElseThrow() == ValueType.STRUCT) {
            throw new EvaluationException(
                    "Cannot subtract from an Array of Structs. Can only subtract from an Array if it is an Array of Strings.", range);
        }
        if (operand instanceof Value.Str rhs) {
            List<Value> items = new ArrayList<>();
            for (Value item : existing.items()) {
                if (!item.equals(rhs)) {
                    items.add(item);
                }
            }
            return new Value.Array(items);
        }
        throw new EvaluationException(cannotSubtract(operand, existing) + " Can only subtract a String.", range);
    }

    private static String canOnlyAddTo(ValueType elementType) {
        return " Can only add " + elementType.withArticle() + " or an Array of " + elementType.plural() + ".";
    }

    private static String cannotAdd(Value operand, Value existing) {
        return "Cannot add " + describeOperand(operand) + " to " + describeOperand(existing) + ".";
    }

    private static String cannotSubtract(Value operand, Value existing) {
        return "Cannot subtract " + describeOperand(operand) + " from " + describeOperand(existing) + ".";
    }

    /**
     * Describes a value for an error message. Non-empty arrays include their element type.
     * @param value The value.
     * @return e.g. "an Integer" or "an Array of Structs".
     */
    public static String describeOperand(Value value) {
        if (value instanceof Value.Array array && !array.isEmpty()) {
            return array.describeWithElements();
        }
        return value.describe();
    }
}
