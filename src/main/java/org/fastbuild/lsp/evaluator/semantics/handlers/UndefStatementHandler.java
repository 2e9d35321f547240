package org.fastbuild.lsp.evaluator.semantics.handlers;

import org.fastbuild.lsp.evaluator.api.EvaluationException;
import org.fastbuild.lsp.evaluator.frontend.parser.ast.AstNode;
import org.fastbuild.lsp.evaluator.frontend.parser.features.define.UndefNode;
import org.fastbuild.lsp.evaluator.semantics.EvaluationContext;
import org.fastbuild.lsp.evaluator.semantics.IStatementHandler;
import org.fastbuild.lsp.evaluator.semantics.LhsBinding;

import java.util.Optional;

/**
 * Handles {@code #undef SYMBOL}.
 */
public class UndefStatementHandler implements IStatementHandler {

    @Override
    public Optional<LhsBinding> evaluate(AstNode statement, EvaluationContext context) throws EvaluationException {
        UndefNode node = (UndefNode) statement;
        context.getDefines().undefine(node.symbol(), node.symbolRange());
        return Optional.empty();
    }
}
