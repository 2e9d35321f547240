package org.fastbuild.lsp.evaluator.frontend;

import org.fastbuild.lsp.evaluator.api.ParseException;
import org.fastbuild.lsp.evaluator.api.SourceRange;
import org.fastbuild.lsp.evaluator.frontend.lexer.Lexer;
import org.fastbuild.lsp.evaluator.frontend.lexer.Token;
import org.fastbuild.lsp.evaluator.frontend.parser.BffParser;
import org.fastbuild.lsp.evaluator.frontend.parser.Parser;
import org.fastbuild.lsp.evaluator.frontend.parser.ast.AstNode;
import org.fastbuild.lsp.evaluator.frontend.parser.ast.BinaryOperator;
import org.fastbuild.lsp.evaluator.frontend.parser.ast.EvaluatedVariableNode;
import org.fastbuild.lsp.evaluator.frontend.parser.ast.IntegerLiteralNode;
import org.fastbuild.lsp.evaluator.frontend.parser.ast.StringLiteralNode;
import org.fastbuild.lsp.evaluator.frontend.parser.ast.StringTemplateNode;
import org.fastbuild.lsp.evaluator.frontend.parser.ast.SumNode;
import org.fastbuild.lsp.evaluator.frontend.parser.features.assignment.UnnamedBinaryOperatorNode;
import org.fastbuild.lsp.evaluator.frontend.parser.features.assignment.VariableDefinitionNode;
import org.fastbuild.lsp.evaluator.frontend.parser.features.condition.BooleanConditionNode;
import org.fastbuild.lsp.evaluator.frontend.parser.features.condition.ComparisonConditionNode;
import org.fastbuild.lsp.evaluator.frontend.parser.features.condition.IfNode;
import org.fastbuild.lsp.evaluator.frontend.parser.features.condition.InConditionNode;
import org.fastbuild.lsp.evaluator.frontend.parser.features.condition.LogicalConditionNode;
import org.fastbuild.lsp.evaluator.frontend.parser.features.condition.LogicalOperator;
import org.fastbuild.lsp.evaluator.frontend.parser.features.directiveif.DirectiveConditionNode;
import org.fastbuild.lsp.evaluator.frontend.parser.features.directiveif.DirectiveIfNode;
import org.fastbuild.lsp.evaluator.frontend.parser.features.foreach.ForEachNode;
import org.fastbuild.lsp.evaluator.frontend.parser.features.function.GenericFunctionNode;
import org.fastbuild.lsp.evaluator.frontend.parser.features.userfunction.ParameterNode;
import org.fastbuild.lsp.evaluator.frontend.parser.features.userfunction.UserFunctionCallNode;
import org.fastbuild.lsp.evaluator.frontend.parser.features.userfunction.UserFunctionDeclarationNode;
import org.fastbuild.lsp.evaluator.functions.GenericFunction;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Contains unit tests for the {@link Parser}.
 * These tests verify the syntax tree built for each statement form and the syntax errors reported for
 * malformed input.
 */
public class ParserTest {

    private static final String URI = "file:///workspace/fbuild.bff";

    private static List<AstNode> parse(String source) throws ParseException {
        List<Token> tokens = new Lexer(source, URI).scanTokens();
        return new Parser(tokens, URI).parse();
    }

    /**
     * Verifies that '+' and '-' on the line of an assignment extend its value, while on a new line
     * they start an unnamed modification.
     */
    @Test
    @Tag("unit")
    void testSameLineSumAndUnnamedModification() throws ParseException {
        // Arrange
        String source = String.join("\n",
                ".A = 'a' + 'b'",
                "  - 'c'");

        // Act
        List<AstNode> ast = parse(source);

        // Assert
        assertThat(ast).hasSize(2);
        VariableDefinitionNode definition = (VariableDefinitionNode) ast.get(0);
        assertThat(definition.rhs()).isInstanceOf(SumNode.class);
        SumNode sum = (SumNode) definition.rhs();
        assertThat(sum.summands()).singleElement().extracting(SumNode.Summand::operator).isEqualTo(BinaryOperator.ADD);
        assertThat(sum.range()).isEqualTo(SourceRange.of(URI, 0, 5, 0, 14));

        assertThat(ast.get(1)).isInstanceOf(UnnamedBinaryOperatorNode.class);
        UnnamedBinaryOperatorNode modification = (UnnamedBinaryOperatorNode) ast.get(1);
        assertThat(modification.operator()).isEqualTo(BinaryOperator.SUBTRACT);
        assertThat(modification.range()).isEqualTo(SourceRange.of(URI, 1, 2, 1, 7));
    }

    /**
     * Verifies that a string with {@code $Name$} becomes a template whose parts carry their own ranges.
     */
    @Test
    @Tag("unit")
    void testStringTemplate() throws ParseException {
        // Act
        List<AstNode> ast = parse(".A = 'x$Name$y'");

        // Assert
        AstNode rhs = ((VariableDefinitionNode) ast.get(0)).rhs();
        assertThat(rhs).isInstanceOf(StringTemplateNode.class);
        List<AstNode> parts = ((StringTemplateNode) rhs).parts();
        assertThat(parts).hasSize(3);
        assertThat(parts.get(0)).isEqualTo(new StringLiteralNode("x", SourceRange.of(URI, 0, 6, 0, 7)));
        assertThat(parts.get(1)).isInstanceOf(EvaluatedVariableNode.class);
        assertThat(parts.get(1).range()).isEqualTo(SourceRange.of(URI, 0, 7, 0, 13));
        assertThat(((EvaluatedVariableNode) parts.get(1)).name()).extracting(n -> ((StringLiteralNode) n).value()).isEqualTo("Name");
        assertThat(parts.get(2)).isEqualTo(new StringLiteralNode("y", SourceRange.of(URI, 0, 13, 0, 14)));
    }

    /**
     * Verifies that escapes are resolved in plain strings and that an escaped '$' does not start a
     * template variable.
     */
    @Test
    @Tag("unit")
    void testEscapedStringIsLiteral() throws ParseException {
        // Act
        List<AstNode> ast = parse(".A = 'cost: ^$5 ^^'");

        // Assert
        AstNode rhs = ((VariableDefinitionNode) ast.get(0)).rhs();
        assertThat(rhs).isInstanceOf(StringLiteralNode.class);
        assertThat(((StringLiteralNode) rhs).value()).isEqualTo("cost: $5 ^");
    }

    /**
     * Verifies that a '-' directly in front of a number is part of the literal.
     */
    @Test
    @Tag("unit")
    void testNegativeIntegerLiteral() throws ParseException {
        // Act
        List<AstNode> ast = parse(".A = -5");

        // Assert
        AstNode rhs = ((VariableDefinitionNode) ast.get(0)).rhs();
        assertThat(rhs).isEqualTo(new IntegerLiteralNode(-5, SourceRange.of(URI, 0, 5, 0, 7)));
    }

    /**
     * Verifies the precedence of '&&' over '||' in 'If' conditions and the condition node kinds.
     */
    @Test
    @Tag("unit")
    void testIfConditionStructure() throws ParseException {
        // Act
        List<AstNode> ast = parse("If (.A == 1 && !.B || .C not in .D) { }");

        // Assert
        IfNode ifNode = (IfNode) ast.get(0);
        assertThat(ifNode.statements()).isEmpty();
        LogicalConditionNode or = (LogicalConditionNode) ifNode.condition();
        assertThat(or.operator()).isEqualTo(LogicalOperator.OR);
        LogicalConditionNode and = (LogicalConditionNode) or.lhs();
        assertThat(and.operator()).isEqualTo(LogicalOperator.AND);
        assertThat(and.lhs()).isInstanceOf(ComparisonConditionNode.class);
        assertThat(((ComparisonConditionNode) and.lhs()).operatorRange()).isEqualTo(SourceRange.of(URI, 0, 7, 0, 9));
        assertThat(and.rhs()).isInstanceOfSatisfying(BooleanConditionNode.class, b -> assertThat(b.invert()).isTrue());
        assertThat(or.rhs()).isInstanceOfSatisfying(InConditionNode.class, in -> assertThat(in.invert()).isTrue());
    }

    /**
     * Verifies the nodes of user-function declarations and calls, and of build-declaration functions.
     */
    @Test
    @Tag("unit")
    void testFunctions() throws ParseException {
        // Arrange
        String source = String.join("\n",
                "function Build(.Name, .Flags) { }",
                "Build('app', '-O2')",
                "Executable('app') { .Libraries = { 'lib' } }");

        // Act
        List<AstNode> ast = parse(source);

        // Assert
        UserFunctionDeclarationNode declaration = (UserFunctionDeclarationNode) ast.get(0);
        assertThat(declaration.name()).isEqualTo("Build");
        assertThat(declaration.nameRange()).isEqualTo(SourceRange.of(URI, 0, 9, 0, 14));
        assertThat(declaration.parameters()).extracting(ParameterNode::name).containsExactly("Name", "Flags");

        UserFunctionCallNode call = (UserFunctionCallNode) ast.get(1);
        assertThat(call.arguments()).hasSize(2);
        assertThat(call.range()).isEqualTo(SourceRange.of(URI, 1, 0, 1, 19));

        GenericFunctionNode executable = (GenericFunctionNode) ast.get(2);
        assertThat(executable.function()).isEqualTo(GenericFunction.EXECUTABLE);
        assertThat(executable.statements()).hasSize(1);
    }

    /**
     * Verifies that 'ForEach' accepts several comma-separated iterators.
     */
    @Test
    @Tag("unit")
    void testForEachIterators() throws ParseException {
        // Act
        List<AstNode> ast = parse("ForEach(.A in .As, .B in .Bs) { }");

        // Assert
        ForEachNode forEach = (ForEachNode) ast.get(0);
        assertThat(forEach.iterators()).hasSize(2);
        assertThat(forEach.iterators().get(1).arrayToLoopOver().range()).isEqualTo(SourceRange.of(URI, 0, 25, 0, 28));
    }

    /**
     * Verifies the '#if' tree: the condition, both branches and the directive inside an Array literal.
     */
    @Test
    @Tag("unit")
    void testDirectiveIf() throws ParseException {
        // Arrange
        String source = String.join("\n",
                "#if exists(HOME) && !file_exists('x.bff')",
                ".A = { 'a'",
                "#if __WINDOWS__",
                "  'w'",
                "#endif",
                "}",
                "#else",
                ".B = 1",
                "#endif");

        // Act
        List<AstNode> ast = BffParser.parse(source, URI);

        // Assert
        assertThat(ast).hasSize(1);
        DirectiveIfNode directive = (DirectiveIfNode) ast.get(0);
        assertThat(directive.condition()).isInstanceOf(DirectiveConditionNode.Logical.class);
        DirectiveConditionNode.Logical and = (DirectiveConditionNode.Logical) directive.condition();
        assertThat(and.lhs()).isEqualTo(new DirectiveConditionNode.EnvironmentVariableExists("HOME", SourceRange.of(URI, 0, 4, 0, 16)));
        assertThat(and.rhs()).isInstanceOf(DirectiveConditionNode.Not.class);
        assertThat(directive.ifBranch()).hasSize(1);
        assertThat(directive.elseBranch()).hasSize(1);
        assertThat(directive.range()).isEqualTo(SourceRange.of(URI, 0, 0, 8, 6));
    }

    /**
     * Verifies the syntax errors reported for malformed statements.
     */
    @Test
    @Tag("unit")
    void testSyntaxErrors() {
        // Act & Assert
        assertThatThrownBy(() -> parse("#pragma once"))
                .isInstanceOf(ParseException.class)
                .hasMessage("Unknown directive '#pragma'.");
        assertThatThrownBy(() -> parse("#else"))
                .hasMessage("'#else' without a matching '#if'.");
        assertThatThrownBy(() -> parse(String.join("\n", "#if X", ".A = 1")))
                .hasMessage("Expected '#endif', but reached the end of the file.");
        assertThatThrownBy(() -> parse(".A"))
                .hasMessage("Expected '=', '+' or '-' after variable, but found end of file.");
        assertThatThrownBy(() -> parse("Unknown"))
                .hasMessage("Unknown function \"Unknown\". Expected '(' after a function name.");
        assertThatThrownBy(() -> parse(".A = { #define X }"))
                .hasMessage("Only '#if' directives are allowed inside an Array.");
        assertThatThrownBy(() -> parse(".A = '$Bad Name$'"))
                .hasMessage("Invalid variable name \"Bad Name\" in string.");
        assertThatThrownBy(() -> parse("{ .A = 1"))
                .hasMessage("Expected '}', but reached the end of the file.");
    }
}
