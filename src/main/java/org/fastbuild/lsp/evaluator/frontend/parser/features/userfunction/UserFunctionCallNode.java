package org.fastbuild.lsp.evaluator.frontend.parser.features.userfunction;

import org.fastbuild.lsp.evaluator.api.SourceRange;
import org.fastbuild.lsp.evaluator.frontend.parser.ast.AstNode;

import java.util.List;

/**
 * {@code Name(arg1, arg2)}.
 *
 * @param name The function name.
 * @param nameRange The range of the name.
 * @param arguments The argument expressions.
 * @param range The source range of the call.
 */
public record UserFunctionCallNode(String name, SourceRange nameRange, List<AstNode> arguments, SourceRange range)
        implements AstNode {
}
