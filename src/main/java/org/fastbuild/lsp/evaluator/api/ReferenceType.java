package org.fastbuild.lsp.evaluator.api;

/**
 * How a variable occurrence accesses its variable.
 */
public enum ReferenceType {
    READ,
    WRITE,
    READ_WRITE
}
