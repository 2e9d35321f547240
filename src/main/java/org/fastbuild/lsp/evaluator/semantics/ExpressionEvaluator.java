package org.fastbuild.lsp.evaluator.semantics;

import org.fastbuild.lsp.evaluator.api.EvaluationException;
import org.fastbuild.lsp.evaluator.api.InternalEvaluationException;
import org.fastbuild.lsp.evaluator.api.ReferenceType;
import org.fastbuild.lsp.evaluator.api.SourceException;
import org.fastbuild.lsp.evaluator.api.SourceRange;
import org.fastbuild.lsp.evaluator.api.VariableReference;
import org.fastbuild.lsp.evaluator.frontend.parser.ast.ArrayLiteralNode;
import org.fastbuild.lsp.evaluator.frontend.parser.ast.AstNode;
import org.fastbuild.lsp.evaluator.frontend.parser.ast.BinaryOperator;
import org.fastbuild.lsp.evaluator.frontend.parser.ast.BooleanLiteralNode;
import org.fastbuild.lsp.evaluator.frontend.parser.ast.EvaluatedVariableNode;
import org.fastbuild.lsp.evaluator.frontend.parser.ast.IntegerLiteralNode;
import org.fastbuild.lsp.evaluator.frontend.parser.ast.StringLiteralNode;
import org.fastbuild.lsp.evaluator.frontend.parser.ast.StringTemplateNode;
import org.fastbuild.lsp.evaluator.frontend.parser.ast.StructLiteralNode;
import org.fastbuild.lsp.evaluator.frontend.parser.ast.SumNode;
import org.fastbuild.lsp.evaluator.frontend.parser.features.directiveif.DirectiveIfNode;
import org.fastbuild.lsp.evaluator.preprocessor.DirectiveConditionEvaluator;
import org.fastbuild.lsp.evaluator.scope.ScopeLocation;
import org.fastbuild.lsp.evaluator.scope.ScopeStack;
import org.fastbuild.lsp.evaluator.scope.ScopeVariable;
import org.fastbuild.lsp.evaluator.value.StructMember;
import org.fastbuild.lsp.evaluator.value.Value;
import org.fastbuild.lsp.evaluator.value.ValueOperations;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Evaluates right-hand-side expressions: literals, string templates, variable reads, array and
 * struct literals and same-line sums.
 * <p>
 * Every variable read records the value seen at the occurrence and a read reference to the
 * definitions of the binding it resolved to.
 */
public class ExpressionEvaluator {

    private final StatementEvaluator statements;
    private final DirectiveConditionEvaluator directiveConditions = new DirectiveConditionEvaluator();

    /**
     * @param statements The statement evaluator, used for the bodies of struct literals.
     */
    public ExpressionEvaluator(StatementEvaluator statements) {
        this.statements = statements;
    }

    /**
     * Evaluates an expression.
     * @param expression The expression node.
     * @param context The evaluation context.
     * @return The value with the range of the expression.
     * @throws SourceException if the expression cannot be evaluated.
     */
    public EvaluatedValue evaluate(AstNode expression, EvaluationContext context) throws SourceException {
        if (expression instanceof StringLiteralNode literal) {
            return new EvaluatedValue(new Value.Str(literal.value()), literal.range());
        }
        if (expression instanceof IntegerLiteralNode literal) {
            return new EvaluatedValue(new Value.Int(literal.value()), literal.range());
        }
        if (expression instanceof BooleanLiteralNode literal) {
            return new EvaluatedValue(new Value.Bool(literal.value()), literal.range());
        }
        if (expression instanceof StringTemplateNode template) {
            return new EvaluatedValue(new Value.Str(evaluateTemplate(template, context)), template.range());
        }
        if (expression instanceof EvaluatedVariableNode variable) {
            return new EvaluatedValue(readVariable(variable, context).getValue(), variable.range());
        }
        if (expression instanceof ArrayLiteralNode array) {
            return new EvaluatedValue(evaluateArray(array, context), array.range());
        }
        if (expression instanceof StructLiteralNode struct) {
            return new EvaluatedValue(evaluateStruct(struct, context), struct.range());
        }
        if (expression instanceof SumNode sum) {
            return evaluateSum(sum, context);
        }
        throw new InternalEvaluationException("Unsupported expression: " + expression.getClass().getSimpleName(),
                expression.range());
    }

    /**
     * Resolves a {@code .Name} or {@code ^Name} read and records it.
     * @param node The variable occurrence.
     * @param context The evaluation context.
     * @return The binding the name resolved to.
     * @throws SourceException if the name cannot be evaluated or is not visible.
     */
    public ScopeVariable readVariable(EvaluatedVariableNode node, EvaluationContext context) throws SourceException {
        String name = evaluateName(node.name(), context);
        ScopeStack scopes = context.getScopes();
        ScopeVariable variable = node.scope() == ScopeLocation.PARENT
                ? scopes.getStartingFromParentScope(name, node.range())
                : scopes.getStartingFromCurrentScope(name, node.range());

        context.getData().recordEvaluatedVariable(variable.getValue(), node.range());
        context.getData().addVariableReference(
                new VariableReference(variable.getDefinitions(), node.range(), ReferenceType.READ));
        return variable;
    }

    /**
     * Evaluates the name part of a variable occurrence, which may itself be a string template.
     * @param name The name node.
     * @param context The evaluation context.
     * @return The variable name.
     * @throws SourceException if the name does not evaluate to a String.
     */
    public String evaluateName(AstNode name, EvaluationContext context) throws SourceException {
        EvaluatedValue evaluated = evaluate(name, context);
        if (evaluated.value() instanceof Value.Str str) {
            return str.value();
        }
        throw new EvaluationException("Variable name must evaluate to a String, but instead evaluates to "
                + ValueOperations.describeOperand(evaluated.value()), name.range());
    }

    private String evaluateTemplate(StringTemplateNode template, EvaluationContext context) throws SourceException {
        StringBuilder result = new StringBuilder();
        for (AstNode part : template.parts()) {
            if (part instanceof StringLiteralNode literal) {
                result.append(literal.value());
                continue;
            }
            Value value = readVariable((EvaluatedVariableNode) part, context).getValue();
            if (value instanceof Value.Str str) {
                result.append(str.value());
            } else if (value instanceof Value.Int integer) {
                result.append(integer.value());
            } else if (value instanceof Value.Bool bool) {
                result.append(bool.value());
            } else {
                throw new EvaluationException("Cannot use " + ValueOperations.describeOperand(value)
                        + " in a string template. Only Strings, Integers and Booleans can be embedded.", part.range());
            }
        }
        return result.toString();
    }

    private Value evaluateArray(ArrayLiteralNode array, EvaluationContext context) throws SourceException {
        List<Value> items = new ArrayList<>();
        collectArrayItems(array.items(), items, context);
        return new Value.Array(items);
    }

    private void collectArrayItems(List<AstNode> nodes, List<Value> items, EvaluationContext context) throws SourceException {
        for (AstNode node : nodes) {
            if (node instanceof DirectiveIfNode directiveIf) {
                List<AstNode> branch = directiveConditions.evaluate(directiveIf.condition(), context)
                        ? directiveIf.ifBranch()
                        : directiveIf.elseBranch();
                collectArrayItems(branch, items, context);
                continue;
            }

            EvaluatedValue evaluated = evaluate(node, context);
            Value value = evaluated.value();
            if (value instanceof Value.Array nested) {
                for (Value nestedItem : nested.items()) {
                    addArrayItem(items, nestedItem, node.range());
                }
                continue;
            }
            if (value instanceof Value.Struct && !(node instanceof EvaluatedVariableNode)) {
                throw new EvaluationException(
                        "Cannot have an Array of literal Structs. Use an Array of evaluated variables instead.", node.range());
            }
            addArrayItem(items, value, node.range());
        }
    }

    private static void addArrayItem(List<Value> items, Value item, SourceRange range) throws EvaluationException {
        if (items.isEmpty()) {
            if (!(item instanceof Value.Str) && !(item instanceof Value.Struct)) {
                throw new EvaluationException("Cannot have an Array of " + item.type().plural()
                        + ". Only Arrays of Strings and Arrays of Structs are allowed.", range);
            }
        } else if (items.get(0).type() != item.type()) {
            throw new EvaluationException("All values in an Array must have the same type, but the first item is "
                    + items.get(0).describe() + " and this item is " + item.describe(), range);
        }
        items.add(item);
    }

    private Value evaluateStruct(StructLiteralNode struct, EvaluationContext context) throws SourceException {
        ScopeStack scopes = context.getScopes();
        LhsBinding previousLhs = context.getPreviousStatementLhs();
        scopes.enterScope();
        try {
            context.setPreviousStatementLhs(null);
            statements.evaluateStatements(struct.statements(), context);

            Map<String, StructMember> members = new LinkedHashMap<>();
            for (Map.Entry<String, ScopeVariable> entry : scopes.getCurrentScopeVariables().entrySet()) {
                ScopeVariable variable = entry.getValue();
                members.put(entry.getKey(), new StructMember(variable.getValue(), variable.getDefinitions()));
            }
            return new Value.Struct(members);
        } finally {
            scopes.leaveScope();
            context.setPreviousStatementLhs(previousLhs);
        }
    }

    private EvaluatedValue evaluateSum(SumNode sum, EvaluationContext context) throws SourceException {
        EvaluatedValue first = evaluate(sum.first(), context);
        Value result = first.value();
        SourceRange previousRange = first.range();
        for (SumNode.Summand summand : sum.summands()) {
            EvaluatedValue operand = evaluate(summand.value(), context);
            SourceRange operationRange = SourceRange.between(previousRange, operand.range());
            result = apply(summand.operator(), result, operand.value(), operationRange);
            previousRange = operand.range();
        }
        return new EvaluatedValue(result, sum.range());
    }

    /**
     * Applies a {@code +} or {@code -} operator.
     * @param operator The operator.
     * @param existing The left operand.
     * @param operand The right operand.
     * @param range The range of the operation.
     * @return The result.
     * @throws EvaluationException if the operand types do not support the operator.
     */
    public static Value apply(BinaryOperator operator, Value existing, Value operand, SourceRange range)
            throws EvaluationException {
        return operator == BinaryOperator.ADD
                ? ValueOperations.add(existing, operand, range)
                : ValueOperations.subtract(existing, operand, range);
    }
}
