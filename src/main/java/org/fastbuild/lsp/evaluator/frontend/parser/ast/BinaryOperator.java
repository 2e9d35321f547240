package org.fastbuild.lsp.evaluator.frontend.parser.ast;

/**
 * The two value operators.
 */
public enum BinaryOperator {
    ADD("+"),
    SUBTRACT("-");

    private final String symbol;

    BinaryOperator(String symbol) {
        this.symbol = symbol;
    }

    public String symbol() {
        return symbol;
    }
}
