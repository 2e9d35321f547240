package org.fastbuild.lsp.evaluator.semantics.handlers;

import org.fastbuild.lsp.evaluator.api.SourceException;
import org.fastbuild.lsp.evaluator.frontend.parser.ast.AstNode;
import org.fastbuild.lsp.evaluator.frontend.parser.features.directiveif.DirectiveIfNode;
import org.fastbuild.lsp.evaluator.preprocessor.DirectiveConditionEvaluator;
import org.fastbuild.lsp.evaluator.semantics.EvaluationContext;
import org.fastbuild.lsp.evaluator.semantics.IStatementHandler;
import org.fastbuild.lsp.evaluator.semantics.LhsBinding;
import org.fastbuild.lsp.evaluator.semantics.StatementEvaluator;

import java.util.List;
import java.util.Optional;

/**
 * Handles {@code #if ... #else ... #endif}. The taken branch runs in the current scope; the other
 * branch is not evaluated at all.
 */
public class DirectiveIfStatementHandler implements IStatementHandler {

    private final StatementEvaluator statements;
    private final DirectiveConditionEvaluator conditions = new DirectiveConditionEvaluator();

    public DirectiveIfStatementHandler(StatementEvaluator statements) {
        this.statements = statements;
    }

    /**
     * {@inheritDoc}
     * <p>
     * The binding of the statement before the {@code #if} stays current afterwards, so an assignment can
     * be continued by unnamed modifications inside and after the directive.
     */
    @Override
    public Optional<LhsBinding> evaluate(AstNode statement, EvaluationContext context) throws SourceException {
        DirectiveIfNode node = (DirectiveIfNode) statement;
        List<AstNode> branch = conditions.evaluate(node.condition(), context) ? node.ifBranch() : node.elseBranch();
        statements.evaluateStatements(branch, context);
        return Optional.ofNullable(context.getPreviousStatementLhs());
    }
}
