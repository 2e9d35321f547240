package org.fastbuild.lsp.evaluator.api;

/**
 * A build target declared by one of the generic build-declaration functions.
 *
 * @param id A session-unique id, drawn from the same counter as variable definitions.
 * @param range The range of the target name expression.
 * @param name The evaluated target name.
 */
public record TargetDefinition(int id, SourceRange range, String name) {
}
