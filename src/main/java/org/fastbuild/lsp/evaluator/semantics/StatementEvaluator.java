package org.fastbuild.lsp.evaluator.semantics;

import org.fastbuild.lsp.evaluator.api.InternalEvaluationException;
import org.fastbuild.lsp.evaluator.api.SourceException;
import org.fastbuild.lsp.evaluator.frontend.parser.ast.AstNode;
import org.fastbuild.lsp.evaluator.frontend.parser.features.assignment.BinaryOperatorNode;
import org.fastbuild.lsp.evaluator.frontend.parser.features.assignment.UnnamedBinaryOperatorNode;
import org.fastbuild.lsp.evaluator.frontend.parser.features.assignment.VariableDefinitionNode;
import org.fastbuild.lsp.evaluator.frontend.parser.features.condition.IfNode;
import org.fastbuild.lsp.evaluator.frontend.parser.features.define.DefineNode;
import org.fastbuild.lsp.evaluator.frontend.parser.features.define.ImportNode;
import org.fastbuild.lsp.evaluator.frontend.parser.features.define.UndefNode;
import org.fastbuild.lsp.evaluator.frontend.parser.features.directiveif.DirectiveIfNode;
import org.fastbuild.lsp.evaluator.frontend.parser.features.foreach.ForEachNode;
import org.fastbuild.lsp.evaluator.frontend.parser.features.function.ErrorNode;
import org.fastbuild.lsp.evaluator.frontend.parser.features.function.GenericFunctionNode;
import org.fastbuild.lsp.evaluator.frontend.parser.features.function.PrintNode;
import org.fastbuild.lsp.evaluator.frontend.parser.features.function.SettingsNode;
import org.fastbuild.lsp.evaluator.frontend.parser.features.include.IncludeNode;
import org.fastbuild.lsp.evaluator.frontend.parser.features.include.OnceNode;
import org.fastbuild.lsp.evaluator.frontend.parser.features.scope.ScopedStatementsNode;
import org.fastbuild.lsp.evaluator.frontend.parser.features.userfunction.UserFunctionCallNode;
import org.fastbuild.lsp.evaluator.frontend.parser.features.userfunction.UserFunctionDeclarationNode;
import org.fastbuild.lsp.evaluator.frontend.parser.features.using.UsingNode;
import org.fastbuild.lsp.evaluator.scope.ScopeStack;
import org.fastbuild.lsp.evaluator.semantics.handlers.BinaryOperatorStatementHandler;
import org.fastbuild.lsp.evaluator.semantics.handlers.DefineStatementHandler;
import org.fastbuild.lsp.evaluator.semantics.handlers.DirectiveIfStatementHandler;
import org.fastbuild.lsp.evaluator.semantics.handlers.ErrorStatementHandler;
import org.fastbuild.lsp.evaluator.semantics.handlers.ForEachStatementHandler;
import org.fastbuild.lsp.evaluator.semantics.handlers.GenericFunctionStatementHandler;
import org.fastbuild.lsp.evaluator.semantics.handlers.IfStatementHandler;
import org.fastbuild.lsp.evaluator.semantics.handlers.ImportStatementHandler;
import org.fastbuild.lsp.evaluator.semantics.handlers.IncludeStatementHandler;
import org.fastbuild.lsp.evaluator.semantics.handlers.OnceStatementHandler;
import org.fastbuild.lsp.evaluator.semantics.handlers.PrintStatementHandler;
import org.fastbuild.lsp.evaluator.semantics.handlers.ScopedStatementsHandler;
import org.fastbuild.lsp.evaluator.semantics.handlers.SettingsStatementHandler;
import org.fastbuild.lsp.evaluator.semantics.handlers.UndefStatementHandler;
import org.fastbuild.lsp.evaluator.semantics.handlers.UnnamedBinaryOperatorStatementHandler;
import org.fastbuild.lsp.evaluator.semantics.handlers.UserFunctionCallStatementHandler;
import org.fastbuild.lsp.evaluator.semantics.handlers.UserFunctionDeclarationStatementHandler;
import org.fastbuild.lsp.evaluator.semantics.handlers.UsingStatementHandler;
import org.fastbuild.lsp.evaluator.semantics.handlers.VariableDefinitionStatementHandler;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Evaluates statement lists in source order by dispatching each statement to the handler registered
 * for its node type.
 */
public class StatementEvaluator {

    private final Map<Class<? extends AstNode>, IStatementHandler> handlers = new HashMap<>();
    private final ExpressionEvaluator expressions;
    private final ConditionEvaluator conditions;

    public StatementEvaluator() {
        this.expressions = new ExpressionEvaluator(this);
        this.conditions = new ConditionEvaluator(expressions);
        registerDefaultHandlers();
    }

    private void registerDefaultHandlers() {
        handlers.put(VariableDefinitionNode.class, new VariableDefinitionStatementHandler(expressions));
        handlers.put(BinaryOperatorNode.class, new BinaryOperatorStatementHandler(expressions));
        handlers.put(UnnamedBinaryOperatorNode.class, new UnnamedBinaryOperatorStatementHandler(expressions));
        handlers.put(ScopedStatementsNode.class, new ScopedStatementsHandler(this));
        handlers.put(UsingNode.class, new UsingStatementHandler(expressions));
        handlers.put(ForEachNode.class, new ForEachStatementHandler(this, expressions));
        handlers.put(IfNode.class, new IfStatementHandler(this, conditions));
        handlers.put(GenericFunctionNode.class, new GenericFunctionStatementHandler(this, expressions));
        handlers.put(PrintNode.class, new PrintStatementHandler(expressions));
        handlers.put(ErrorNode.class, new ErrorStatementHandler(expressions));
        handlers.put(SettingsNode.class, new SettingsStatementHandler(this));
        handlers.put(UserFunctionDeclarationNode.class, new UserFunctionDeclarationStatementHandler());
        handlers.put(UserFunctionCallNode.class, new UserFunctionCallStatementHandler(this, expressions));
        handlers.put(IncludeNode.class, new IncludeStatementHandler(this));
        handlers.put(OnceNode.class, new OnceStatementHandler());
        handlers.put(DirectiveIfNode.class, new DirectiveIfStatementHandler(this));
        handlers.put(DefineNode.class, new DefineStatementHandler());
        handlers.put(UndefNode.class, new UndefStatementHandler());
        handlers.put(ImportNode.class, new ImportStatementHandler());
    }

    /**
     * Evaluates statements in the current scope of the context.
     * @param statements The statements in source order.
     * @param context The evaluation context.
     * @throws SourceException on the first statement that fails.
     */
    public void evaluateStatements(List<AstNode> statements, EvaluationContext context) throws SourceException {
        for (AstNode statement : statements) {
            IStatementHandler handler = handlers.get(statement.getClass());
            if (handler == null) {
                throw new InternalEvaluationException("Unsupported statement: " + statement.getClass().getSimpleName(),
                        statement.range());
            }
            Optional<LhsBinding> lhs = handler.evaluate(statement, context);
            context.setPreviousStatementLhs(lhs.orElse(null));
        }
    }

    /**
     * Evaluates statements in a new child scope. An unnamed modification at the start of the block
     * cannot continue a statement outside of it.
     * @param statements The statements in source order.
     * @param context The evaluation context.
     * @throws SourceException on the first statement that fails.
     */
    public void evaluateInChildScope(List<AstNode> statements, EvaluationContext context) throws SourceException {
        ScopeStack scopes = context.getScopes();
        scopes.enterScope();
        try {
            context.setPreviousStatementLhs(null);
            evaluateStatements(statements, context);
        } finally {
            scopes.leaveScope();
        }
    }

    public ExpressionEvaluator getExpressions() {
        return expressions;
    }
}
