package org.fastbuild.lsp.evaluator.frontend.lexer;

import org.fastbuild.lsp.evaluator.api.SourceRange;

/**
 * Represents a single token extracted from the source code by the {@link Lexer}.
 * Tokens never span lines.
 *
 * @param type The type of the token.
 * @param text The exact text of the token from the source code.
 * @param value The processed value of the token: the name of a variable, the raw contents of a
 *              string, the integer value of a number or the lower-case name of a directive.
 * @param line The 0-based line where the token was found.
 * @param column The 0-based column where the token begins.
 * @param uri The uri of the file the token belongs to.
 */
public record Token(
        TokenType type,
        String text,
        Object value,
        int line,
        int column,
        String uri
) {

    /**
     * @return The range the token covers.
     */
    public SourceRange range() {
        return SourceRange.of(uri, line, column, line, column + text.length());
    }

    /**
     * @return The column just after the token.
     */
    public int endColumn() {
        return column + text.length();
    }
}
