package org.fastbuild.lsp.evaluator.api;

/**
 * A target name used in a target-list property (for example {@code .Targets} of an {@code Alias})
 * for which no build-declaration function declared a target during the session.
 *
 * @param targetName The referenced name.
 * @param range The range of the property that lists the name.
 */
public record UnresolvedTargetReference(String targetName, SourceRange range) {
}
