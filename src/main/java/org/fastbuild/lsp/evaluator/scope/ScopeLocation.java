package org.fastbuild.lsp.evaluator.scope;

/**
 * Where a variable lookup starts: {@code .Name} starts in the current scope, {@code ^Name} in the
 * parent scope.
 */
public enum ScopeLocation {
    CURRENT,
    PARENT
}
