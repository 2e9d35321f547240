package org.fastbuild.lsp.evaluator.frontend.parser.features.define;

import org.fastbuild.lsp.evaluator.api.ParseException;
import org.fastbuild.lsp.evaluator.frontend.directive.IDirectiveHandler;
import org.fastbuild.lsp.evaluator.frontend.lexer.Token;
import org.fastbuild.lsp.evaluator.frontend.parser.ParsingContext;
import org.fastbuild.lsp.evaluator.frontend.parser.ast.AstNode;

/**
 * Handler for the <code>#import</code> directive.
 */
public class ImportDirectiveHandler implements IDirectiveHandler {

    @Override
    public AstNode parse(ParsingContext context) throws ParseException {
        SymbolDirectives.Parsed parsed = SymbolDirectives.parseSymbol(context);
        Token symbol = parsed.symbol();
        return new ImportNode(symbol.text(), symbol.range(), parsed.range());
    }
}
