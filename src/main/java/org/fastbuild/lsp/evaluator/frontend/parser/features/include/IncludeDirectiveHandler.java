package org.fastbuild.lsp.evaluator.frontend.parser.features.include;

import org.fastbuild.lsp.evaluator.api.ParseException;
import org.fastbuild.lsp.evaluator.api.SourceRange;
import org.fastbuild.lsp.evaluator.frontend.directive.IDirectiveHandler;
import org.fastbuild.lsp.evaluator.frontend.lexer.Token;
import org.fastbuild.lsp.evaluator.frontend.lexer.TokenType;
import org.fastbuild.lsp.evaluator.frontend.parser.ParsingContext;
import org.fastbuild.lsp.evaluator.frontend.parser.StringContents;
import org.fastbuild.lsp.evaluator.frontend.parser.ast.AstNode;
import org.fastbuild.lsp.evaluator.frontend.parser.ast.StringLiteralNode;

/**
 * Handler for the {@code #include} directive. The file itself is read during evaluation, because
 * {@code #once} and {@code #if} decide whether it is included at all.
 */
public class IncludeDirectiveHandler implements IDirectiveHandler {

    @Override
    public AstNode parse(ParsingContext context) throws ParseException {
        Token directive = context.advance();
        if (!context.isOnLine(directive.line()) || !context.check(TokenType.STRING)) {
            throw context.error(context.peek(), "Expected a quoted path after '#include'.");
        }
        Token path = context.advance();
        if (context.isOnLine(directive.line())) {
            throw context.error(context.peek(), "Unexpected '" + context.peek().text() + "' after '#include' path.");
        }
        StringLiteralNode pathNode = new StringLiteralNode(StringContents.unescape((String) path.value()), path.range());
        return new IncludeNode(pathNode, SourceRange.between(directive.range(), path.range()));
    }
}
