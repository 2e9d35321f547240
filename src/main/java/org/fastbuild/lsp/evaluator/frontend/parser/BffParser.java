package org.fastbuild.lsp.evaluator.frontend.parser;

import org.fastbuild.lsp.evaluator.api.ParseException;
import org.fastbuild.lsp.evaluator.frontend.lexer.Lexer;
import org.fastbuild.lsp.evaluator.frontend.lexer.Token;
import org.fastbuild.lsp.evaluator.frontend.parser.ast.AstNode;

import java.util.List;

/**
 * Entry point that runs the lexer and parser over one file.
 */
public final class BffParser {

    private BffParser() {}

    /**
     * Parses BFF source text.
     * @param source The file contents.
     * @param uri The file uri, used in every range.
     * @return The top-level statements.
     * @throws ParseException at the first lexical or syntax error.
     */
    public static List<AstNode> parse(String source, String uri) throws ParseException {
        List<Token> tokens = new Lexer(source, uri).scanTokens();
        return new Parser(tokens, uri).parse();
    }
}
