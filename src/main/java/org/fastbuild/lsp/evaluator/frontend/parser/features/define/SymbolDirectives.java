package org.fastbuild.lsp.evaluator.frontend.parser.features.define;

import org.fastbuild.lsp.evaluator.api.ParseException;
import org.fastbuild.lsp.evaluator.api.SourceRange;
import org.fastbuild.lsp.evaluator.frontend.lexer.Token;
import org.fastbuild.lsp.evaluator.frontend.lexer.TokenType;
import org.fastbuild.lsp.evaluator.frontend.parser.ParsingContext;

/**
 * Shared parsing for directives of the form {@code #name SYMBOL}.
 */
final class SymbolDirectives {

    /**
     * A parsed directive.
     * @param directive The directive token.
     * @param symbol The symbol token.
     */
    record Parsed(Token directive, Token symbol) {
        SourceRange range() {
            return SourceRange.between(directive.range(), symbol.range());
        }
    }

    private SymbolDirectives() {}

    /**
     * Consumes the directive and its symbol.
     * @param context The parsing context, positioned at the directive.
     * @return The directive and symbol tokens.
     * @throws ParseException if the symbol is missing or followed by more tokens on the line.
     */
    static Parsed parseSymbol(ParsingContext context) throws ParseException {
        Token directive = context.advance();
        String name = "#" + directive.value();
        if (!context.isOnLine(directive.line()) || !context.check(TokenType.IDENTIFIER)) {
            throw context.error(context.peek(), "Expected a symbol after '" + name + "'.");
        }
        Token symbol = context.advance();
        if (context.isOnLine(directive.line())) {
            throw context.error(context.peek(), "Unexpected '" + context.peek().text() + "' after '" + name + "' symbol.");
        }
        return new Parsed(directive, symbol);
    }
}
