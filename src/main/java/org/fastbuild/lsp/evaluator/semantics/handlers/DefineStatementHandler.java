package org.fastbuild.lsp.evaluator.semantics.handlers;

import org.fastbuild.lsp.evaluator.api.EvaluationException;
import org.fastbuild.lsp.evaluator.frontend.parser.ast.AstNode;
import org.fastbuild.lsp.evaluator.frontend.parser.features.define.DefineNode;
import org.fastbuild.lsp.evaluator.semantics.EvaluationContext;
import org.fastbuild.lsp.evaluator.semantics.IStatementHandler;
import org.fastbuild.lsp.evaluator.semantics.LhsBinding;

import java.util.Optional;

/**
 * Handles {@code #define SYMBOL}.
 */
public class DefineStatementHandler implements IStatementHandler {

    @Override
    public Optional<LhsBinding> evaluate(AstNode statement, EvaluationContext context) throws EvaluationException {
        DefineNode node = (DefineNode) statement;
        context.getDefines().define(node.symbol(), node.symbolRange());
        return Optional.empty();
    }
}
