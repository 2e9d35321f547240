package org.fastbuild.lsp.evaluator.api;

/**
 * The place where a variable was first bound in a scope.
 *
 * @param id A session-unique id. Built-in variables use {@code -1}.
 * @param range The range of the defining occurrence.
 * @param name The variable name, without the leading '.' or '^'.
 */
public record VariableDefinition(int id, SourceRange range, String name) {
}
