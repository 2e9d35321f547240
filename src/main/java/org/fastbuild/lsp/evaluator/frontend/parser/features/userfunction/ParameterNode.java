package org.fastbuild.lsp.evaluator.frontend.parser.features.userfunction;

import org.fastbuild.lsp.evaluator.api.SourceRange;

/**
 * @param name The parameter name, without the leading '.'.
 * @param range The range of the parameter in the declaration.
 */
public record ParameterNode(String name, SourceRange range) {
}
