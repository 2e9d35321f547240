package org.fastbuild.lsp.evaluator.api;

/**
 * An occurrence of a target name.
 *
 * @param definition The target the occurrence refers to.
 * @param range The range of the occurrence.
 */
public record TargetReference(TargetDefinition definition, SourceRange range) {
}
