package org.fastbuild.lsp.evaluator.frontend.parser.features.include;

import org.fastbuild.lsp.evaluator.api.ParseException;
import org.fastbuild.lsp.evaluator.frontend.directive.IDirectiveHandler;
import org.fastbuild.lsp.evaluator.frontend.lexer.Token;
import org.fastbuild.lsp.evaluator.frontend.parser.ParsingContext;
import org.fastbuild.lsp.evaluator.frontend.parser.ast.AstNode;

/**
 * Handler for the {@code #once} directive.
 */
public class OnceDirectiveHandler implements IDirectiveHandler {

    @Override
    public AstNode parse(ParsingContext context) throws ParseException {
        Token directive = context.advance();
        if (context.isOnLine(directive.line())) {
            throw context.error(context.peek(), "Unexpected '" + context.peek().text() + "' after '#once'.");
        }
        return new OnceNode(directive.range());
    }
}
