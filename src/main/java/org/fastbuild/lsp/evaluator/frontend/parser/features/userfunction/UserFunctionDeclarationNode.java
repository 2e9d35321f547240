package org.fastbuild.lsp.evaluator.frontend.parser.features.userfunction;

import org.fastbuild.lsp.evaluator.api.SourceRange;
import org.fastbuild.lsp.evaluator.frontend.parser.ast.AstNode;

import java.util.List;

/**
 * {@code function Name(.A, .B) { ... }}.
 *
 * @param name The function name.
 * @param nameRange The range of the name.
 * @param parameters The parameters in order.
 * @param statements The unevaluated body.
 * @param range The source range of the declaration.
 */
public record UserFunctionDeclarationNode(
        String name,
        SourceRange nameRange,
        List<ParameterNode> parameters,
        List<AstNode> statements,
        SourceRange range
) implements AstNode {
}
