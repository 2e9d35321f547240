package org.fastbuild.lsp.evaluator.frontend.parser.features.directiveif;

import org.fastbuild.lsp.evaluator.api.ParseException;
import org.fastbuild.lsp.evaluator.api.SourceRange;
import org.fastbuild.lsp.evaluator.frontend.directive.IDirectiveHandler;
import org.fastbuild.lsp.evaluator.frontend.lexer.Token;
import org.fastbuild.lsp.evaluator.frontend.lexer.TokenType;
import org.fastbuild.lsp.evaluator.frontend.parser.ParsingContext;
import org.fastbuild.lsp.evaluator.frontend.parser.StringContents;
import org.fastbuild.lsp.evaluator.frontend.parser.ast.AstNode;
import org.fastbuild.lsp.evaluator.frontend.parser.features.condition.LogicalOperator;

import java.util.List;

/**
 * Handler for the {@code #if} / {@code #else} / {@code #endif} directives.
 * <p>
 * The condition must fit on the line of the {@code #if}. {@code &&} binds tighter than {@code ||}.
 */
public class IfDirectiveHandler implements IDirectiveHandler {

    @Override
    public AstNode parse(ParsingContext context) throws ParseException {
        Token ifToken = context.advance();
        int line = ifToken.line();
        DirectiveConditionNode condition = or(context, line);
        if (context.isOnLine(line)) {
            throw context.error(context.peek(), "Unexpected '" + context.peek().text() + "' after '#if' condition.");
        }

        List<AstNode> ifBranch = context.parseConditionalBranch();
        List<AstNode> elseBranch = List.of();
        if (context.isDirective("else")) {
            Token elseToken = context.advance();
            if (context.isOnLine(elseToken.line())) {
                throw context.error(context.peek(), "Unexpected '" + context.peek().text() + "' after '#else'.");
            }
            elseBranch = context.parseConditionalBranch();
        }
        if (!context.isDirective("endif")) {
            throw context.error(context.peek(), "Expected '#endif' to close the '#if' on line " + (line + 1) + ".");
        }
        Token endifToken = context.advance();
        return new DirectiveIfNode(condition, ifBranch, elseBranch, SourceRange.between(ifToken.range(), endifToken.range()));
    }

    private DirectiveConditionNode or(ParsingContext context, int line) throws ParseException {
        DirectiveConditionNode left = and(context, line);
        while (context.isOnLine(line) && context.match(TokenType.OR_OR)) {
            DirectiveConditionNode right = and(context, line);
            left = new DirectiveConditionNode.Logical(left, LogicalOperator.OR, right, SourceRange.between(left.range(), right.range()));
        }
        return left;
    }

    private DirectiveConditionNode and(ParsingContext context, int line) throws ParseException {
        DirectiveConditionNode left = unary(context, line);
        while (context.isOnLine(line) && context.match(TokenType.AND_AND)) {
            DirectiveConditionNode right = unary(context, line);
            left = new DirectiveConditionNode.Logical(left, LogicalOperator.AND, right, SourceRange.between(left.range(), right.range()));
        }
        return left;
    }

    private DirectiveConditionNode unary(ParsingContext context, int line) throws ParseException {
        Token token = expectOnLine(context, line);
        if (context.match(TokenType.BANG)) {
            DirectiveConditionNode operand = unary(context, line);
            return new DirectiveConditionNode.Not(operand, SourceRange.between(token.range(), operand.range()));
        }
        if (context.match(TokenType.LEFT_PAREN)) {
            DirectiveConditionNode inner = or(context, line);
            expectOnLine(context, line);
            context.consume(TokenType.RIGHT_PAREN, "Expected ')' in '#if' condition.");
            return inner;
        }
        if (!context.check(TokenType.IDENTIFIER)) {
            throw context.error(token, "Unexpected '" + token.text() + "' in '#if' condition.");
        }
        context.advance();
        if (token.text().equals("exists") && context.isOnLine(line) && context.match(TokenType.LEFT_PAREN)) {
            expectOnLine(context, line);
            Token variable = context.consume(TokenType.IDENTIFIER, "Expected an environment variable name in 'exists(...)'.");
            expectOnLine(context, line);
            Token close = context.consume(TokenType.RIGHT_PAREN, "Expected ')' after 'exists(" + variable.text() + "'.");
            return new DirectiveConditionNode.EnvironmentVariableExists(variable.text(), SourceRange.between(token.range(), close.range()));
        }
        if (token.text().equals("file_exists") && context.isOnLine(line) && context.match(TokenType.LEFT_PAREN)) {
            expectOnLine(context, line);
            Token path = context.consume(TokenType.STRING, "Expected a quoted path in 'file_exists(...)'.");
            expectOnLine(context, line);
            Token close = context.consume(TokenType.RIGHT_PAREN, "Expected ')' after 'file_exists(" + path.text() + "'.");
            return new DirectiveConditionNode.FileExists(StringContents.unescape((String) path.value()),
                    SourceRange.between(token.range(), close.range()));
        }
        return new DirectiveConditionNode.SymbolDefined(token.text(), token.range());
    }

    private static Token expectOnLine(ParsingContext context, int line) throws ParseException {
        if (!context.isOnLine(line)) {
            throw context.error(context.previous(), "Unexpected end of line in '#if' condition.");
        }
        return context.peek();
    }
}
