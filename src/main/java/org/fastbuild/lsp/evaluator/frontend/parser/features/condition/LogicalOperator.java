package org.fastbuild.lsp.evaluator.frontend.parser.features.condition;

/**
 * {@code &&} and {@code ||}, shared by {@code If} and {@code #if} conditions.
 */
public enum LogicalOperator {
    AND,
    OR
}
