package org.fastbuild.lsp.evaluator.frontend.parser.ast;

import org.fastbuild.lsp.evaluator.api.SourceRange;

import java.util.List;

/**
 * A chain of {@code +}/{@code -} operations on one line, evaluated left to right.
 *
 * @param first The first operand.
 * @param summands The following operations.
 * @param range The source range from the first to the last operand.
 */
public record SumNode(AstNode first, List<Summand> summands, SourceRange range) implements AstNode {

    /**
     * One operation of a sum.
     * @param operator The operator.
     * @param value The right operand.
     */
    public record Summand(BinaryOperator operator, AstNode value) {
    }
}
