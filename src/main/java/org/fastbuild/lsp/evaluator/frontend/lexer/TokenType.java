package org.fastbuild.lsp.evaluator.frontend.lexer;

/**
 * Defines all possible types of tokens that the {@link Lexer} can produce.
 */
public enum TokenType {
    // Single-character tokens
    LEFT_PAREN, RIGHT_PAREN,
    LEFT_BRACE, RIGHT_BRACE,
    LEFT_BRACKET, RIGHT_BRACKET,
    COMMA, EQUALS, PLUS, MINUS, BANG,
    LESS, GREATER,

    // Two-character tokens
    EQUAL_EQUAL, BANG_EQUAL,
    LESS_EQUAL, GREATER_EQUAL,
    AND_AND, OR_OR,

    // Variables: .Name or ^Name, and ."Name" or ^"Name" with a (possibly templated) string name
    VARIABLE,
    DYNAMIC_VARIABLE,

    // Literals and keywords
    IDENTIFIER,
    INTEGER,
    STRING,

    // Preprocessor directives (#include, #if, ...)
    DIRECTIVE,

    // Control
    END_OF_FILE
}
