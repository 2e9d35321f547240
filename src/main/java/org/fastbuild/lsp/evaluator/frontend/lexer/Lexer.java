package org.fastbuild.lsp.evaluator.frontend.lexer;

import org.fastbuild.lsp.evaluator.api.ParseException;
import org.fastbuild.lsp.evaluator.api.SourceRange;

import java.util.ArrayList;
import java.util.List;

/**
 * The Lexer (also known as Tokenizer or Scanner) converts BFF source text into a sequence of tokens.
 * Lines and columns are 0-based. Comments start with {@code //} or {@code ;} and run to the end of
 * the line.
 */
public class Lexer {

    private final String source;
    private final String uri;
    private final List<Token> tokens = new ArrayList<>();
    private int start = 0;
    private int current = 0;
    private int line = 0;
    private int column = 0;
    private int startColumn = 0;

    /**
     * Creates a new Lexer.
     * @param source The source code as a single string.
     * @param uri The uri of the file being lexed, for token ranges and errors.
     */
    public Lexer(String source, String uri) {
        this.source = source;
        this.uri = uri;
    }

    /**
     * Performs the tokenization of the entire source code.
     * @return A list of the recognized tokens, ending with {@link TokenType#END_OF_FILE}.
     * @throws ParseException if the source contains a character sequence that is not a token.
     */
    public List<Token> scanTokens() throws ParseException {
        while (!isAtEnd()) {
            start = current;
            startColumn = column;
            scanToken();
        }
        tokens.add(new Token(TokenType.END_OF_FILE, "", null, line, column, uri));
        return tokens;
    }

    private void scanToken() throws ParseException {
        char c = advance();
        switch (c) {
            case '(': addToken(TokenType.LEFT_PAREN); break;
            case ')': addToken(TokenType.RIGHT_PAREN); break;
            case '{': addToken(TokenType.LEFT_BRACE); break;
            case '}': addToken(TokenType.RIGHT_BRACE); break;
            case '[': addToken(TokenType.LEFT_BRACKET); break;
            case ']': addToken(TokenType.RIGHT_BRACKET); break;
            case ',': addToken(TokenType.COMMA); break;
            case '+': addToken(TokenType.PLUS); break;
            case '-': addToken(TokenType.MINUS); break;
            case '=': addToken(match('=') ? TokenType.EQUAL_EQUAL : TokenType.EQUALS); break;
            case '!': addToken(match('=') ? TokenType.BANG_EQUAL : TokenType.BANG); break;
            case '<': addToken(match('=') ? TokenType.LESS_EQUAL : TokenType.LESS); break;
            case '>': addToken(match('=') ? TokenType.GREATER_EQUAL : TokenType.GREATER); break;
            case '&':
                if (!match('&')) throw error("Unexpected character '&'. Did you mean '&&'?");
                addToken(TokenType.AND_AND);
                break;
            case '|':
                if (!match('|')) throw error("Unexpected character '|'. Did you mean '||'?");
                addToken(TokenType.OR_OR);
                break;
            case ';':
                skipToEndOfLine();
                break;
            case '/':
                if (!match('/')) throw error("Unexpected character '/'.");
                skipToEndOfLine();
                break;
            case '\'', '"':
                string(c);
                addToken(TokenType.STRING, source.substring(start + 1, current - 1));
                break;
            case '.', '^':
                variable(c);
                break;
            case '#':
                directive();
                break;
            // Ignore whitespace
            case ' ', '\r', '\t':
                break;
            case '\n':
                line++;
                column = 0;
                break;
            default:
                if (isDigit(c)) {
                    number();
                } else if (isAlpha(c)) {
                    identifier();
                } else {
                    throw error("Unexpected character '" + c + "'.");
                }
                break;
        }
    }

    private void variable(char sigil) throws ParseException {
        if (peek() == '\'' || peek() == '"') {
            char quote = advance();
            int contentStart = current;
            string(quote);
            addToken(TokenType.DYNAMIC_VARIABLE, source.substring(contentStart, current - 1));
            return;
        }
        if (!isAlphaNumeric(peek())) {
            throw error("Expected a variable name after '" + sigil + "'.");
        }
        while (isAlphaNumeric(peek())) advance();
        addToken(TokenType.VARIABLE, source.substring(start + 1, current));
    }

    private void directive() throws ParseException {
        while (peek() == ' ' || peek() == '\t') advance();
        int nameStart = current;
        while (isAlpha(peek())) advance();
        if (nameStart == current) {
            throw error("Expected a directive name after '#'.");
        }
        addToken(TokenType.DIRECTIVE, source.substring(nameStart, current).toLowerCase());
    }

    /**
     * Consumes the rest of a string whose opening quote was already consumed. A '^' escapes the next
     * character, so "^'" does not end a single-quoted string.
     */
    private void string(char quote) throws ParseException {
        while (peek() != quote) {
            if (isAtEnd() || peek() == '\n') {
                throw error("Unterminated string.");
            }
            if (advance() == '^' && !isAtEnd() && peek() != '\n') {
                advance();
            }
        }
        advance(); // closing quote
    }

    private void number() throws ParseException {
        while (isDigit(peek())) advance();
        String text = source.substring(start, current);
        try {
            addToken(TokenType.INTEGER, Integer.parseInt(text));
        } catch (NumberFormatException e) {
            throw error("Integer literal '" + text + "' is out of range.");
        }
    }

    private void identifier() {
        while (isAlphaNumeric(peek())) advance();
        addToken(TokenType.IDENTIFIER);
    }

    private void skipToEndOfLine() {
        while (peek() != '\n' && !isAtEnd()) advance();
    }

    private ParseException error(String message) {
        return new ParseException(message, SourceRange.of(uri, line, startColumn, line, column));
    }

    private boolean isAtEnd() {
        return current >= source.length();
    }

    private char advance() {
        column++;
        return source.charAt(current++);
    }

    private boolean match(char expected) {
        if (isAtEnd() || source.charAt(current) != expected) return false;
        advance();
        return true;
    }

    private char peek() {
        if (isAtEnd()) return '\0';
        return source.charAt(current);
    }

    private boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private boolean isAlpha(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_';
    }

    private boolean isAlphaNumeric(char c) {
        return isAlpha(c) || isDigit(c);
    }

    private void addToken(TokenType type) {
        addToken(type, null);
    }

    private void addToken(TokenType type, Object value) {
        String text = source.substring(start, current);
        tokens.add(new Token(type, text, value, line, startColumn, uri));
    }
}
