package org.fastbuild.lsp.evaluator.frontend.parser.features.condition;

/**
 * The comparison operators of an {@code If} condition.
 */
public enum ComparisonOperator {
    EQUAL("=="),
    NOT_EQUAL("!="),
    LESS("<"),
    LESS_OR_EQUAL("<="),
    GREATER(">"),
    GREATER_OR_EQUAL(">=");

    private final String symbol;

    ComparisonOperator(String symbol) {
        this.symbol = symbol;
    }

    public String symbol() {
        return symbol;
    }

    /**
     * @return true for {@code ==} and {@code !=}, which also accept Booleans.
     */
    public boolean isEquality() {
        return this == EQUAL || this == NOT_EQUAL;
    }
}
