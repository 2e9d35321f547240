package org.fastbuild.lsp.evaluator.frontend.parser;

import org.fastbuild.lsp.evaluator.api.ParseException;
import org.fastbuild.lsp.evaluator.frontend.lexer.Token;
import org.fastbuild.lsp.evaluator.frontend.lexer.TokenType;
import org.fastbuild.lsp.evaluator.frontend.parser.ast.AstNode;

import java.util.List;

/**
 * An interface that encapsulates the contextual state during parsing.
 * It provides directive handlers with access to the token stream without coupling them directly to
 * the parser.
 */
public interface ParsingContext {
    /**
     * Checks if the current token matches any of the given types. If so, consumes it.
     * @param types The token types to match.
     * @return true if the current token matches one of the types, false otherwise.
     */
    boolean match(TokenType... types);

    /**
     * Checks if the current token is of the given type without consuming it.
     * @param type The token type to check.
     * @return true if the current token is of the given type, false otherwise.
     */
    boolean check(TokenType type);

    /**
     * Consumes the current token and returns it.
     * @return The consumed token.
     */
    Token advance();

    /**
     * Returns the current token without consuming it.
     * @return The current token.
     */
    Token peek();

    /**
     * Returns the previously consumed token.
     * @return The previous token.
     */
    Token previous();

    /**
     * Consumes the current token if it is of the expected type.
     * @param type The expected token type.
     * @param errorMessage The error message if the token type does not match.
     * @return The consumed token.
     * @throws ParseException if the current token is of another type.
     */
    Token consume(TokenType type, String errorMessage) throws ParseException;

    /**
     * Checks if the end of the token stream has been reached.
     * @return true if at the end of the stream, false otherwise.
     */
    boolean isAtEnd();

    /**
     * Checks whether the current token is on the given line. Directives end at the end of their line.
     * @param line The 0-based line.
     * @return true if there is a current token and it is on {@code line}.
     */
    boolean isOnLine(int line);

    /**
     * Checks whether the current token is the given directive.
     * @param directiveName The lower-case directive name without '#', e.g. "endif".
     * @return true if the current token is that directive.
     */
    boolean isDirective(String directiveName);

    /**
     * Parses the statements of a {@code #if} or {@code #else} branch up to the next {@code #else} or
     * {@code #endif}. Inside an array literal the branch holds array items instead of statements.
     * @return The parsed nodes.
     * @throws ParseException if the branch is malformed.
     */
    List<AstNode> parseConditionalBranch() throws ParseException;

    /**
     * Creates an error located at a token.
     * @param token The offending token.
     * @param message The message.
     * @return The exception, for the caller to throw.
     */
    ParseException error(Token token, String message);

    /**
     * @return The uri of the file being parsed.
     */
    String getUri();
}
