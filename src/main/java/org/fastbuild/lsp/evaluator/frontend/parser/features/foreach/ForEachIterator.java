package org.fastbuild.lsp.evaluator.frontend.parser.features.foreach;

import org.fastbuild.lsp.evaluator.frontend.parser.ast.EvaluatedVariableNode;
import org.fastbuild.lsp.evaluator.frontend.parser.ast.VariableLhs;

/**
 * One {@code .Item in .Array} clause of a {@code ForEach}.
 *
 * @param loopVariable The variable bound to each item.
 * @param arrayToLoopOver The array variable.
 */
public record ForEachIterator(VariableLhs loopVariable, EvaluatedVariableNode arrayToLoopOver) {
}
