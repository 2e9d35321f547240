package org.fastbuild.lsp.evaluator.frontend.parser.features.function;

import org.fastbuild.lsp.evaluator.api.SourceRange;
import org.fastbuild.lsp.evaluator.frontend.parser.ast.AstNode;

import java.util.List;

/**
 * @param statements The body of the {@code Settings} block.
 * @param range The source range of the statement.
 */
public record SettingsNode(List<AstNode> statements, SourceRange range) implements AstNode {
}
