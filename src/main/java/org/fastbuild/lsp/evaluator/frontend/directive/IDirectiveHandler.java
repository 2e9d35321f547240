package org.fastbuild.lsp.evaluator.frontend.directive;

import org.fastbuild.lsp.evaluator.api.ParseException;
import org.fastbuild.lsp.evaluator.frontend.parser.ParsingContext;
import org.fastbuild.lsp.evaluator.frontend.parser.ast.AstNode;

/**
 * The base interface for all preprocessor directive handlers.
 * Each handler is responsible for parsing a specific directive (e.g., "#include").
 */
@FunctionalInterface
public interface IDirectiveHandler {

    /**
     * Parses the directive and its arguments. The current token is the directive token itself.
     *
     * @param context The context that provides access to the token stream.
     * @return The AST node for this directive.
     * @throws ParseException if the directive is malformed.
     */
    AstNode parse(ParsingContext context) throws ParseException;
}
