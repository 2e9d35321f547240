package org.fastbuild.lsp.evaluator.semantics.handlers;

import org.fastbuild.lsp.evaluator.api.EvaluationException;
import org.fastbuild.lsp.evaluator.api.SourceException;
import org.fastbuild.lsp.evaluator.diagnostics.EvaluatorLogger;
import org.fastbuild.lsp.evaluator.frontend.parser.ast.AstNode;
import org.fastbuild.lsp.evaluator.frontend.parser.features.include.IncludeNode;
import org.fastbuild.lsp.evaluator.io.ParseData;
import org.fastbuild.lsp.evaluator.scope.ScopeVariable;
import org.fastbuild.lsp.evaluator.semantics.EvaluationContext;
import org.fastbuild.lsp.evaluator.semantics.EvaluationSession;
import org.fastbuild.lsp.evaluator.semantics.IStatementHandler;
import org.fastbuild.lsp.evaluator.semantics.LhsBinding;
import org.fastbuild.lsp.evaluator.semantics.StatementEvaluator;
import org.fastbuild.lsp.evaluator.value.Value;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Handles {@code #include "path"}: the included file's statements are evaluated in the current scope.
 * While they run, {@code _CURRENT_BFF_DIR_} holds the included file's directory relative to the root
 * file's directory.
 */
public class IncludeStatementHandler implements IStatementHandler {

    private final StatementEvaluator statements;

    public IncludeStatementHandler(StatementEvaluator statements) {
        this.statements = statements;
    }

    /**
     * {@inheritDoc}
     */
    @Override
    public Optional<LhsBinding> evaluate(AstNode statement, EvaluationContext context) throws SourceException {
        IncludeNode node = (IncludeNode) statement;
        EvaluationSession session = context.getSession();
        Path includePath = context.resolveRelativeToCurrentFile(node.path().value());

        if (session.isIncludedOnce(includePath)) {
            EvaluatorLogger.debug("Skipping #once file {}", includePath);
            return Optional.empty();
        }

        if (!session.enterFile(includePath)) {
            throw new EvaluationException("Cyclic #include of \"" + node.path().value()
                    + "\". The file is already being evaluated further up the include chain.", node.path().range());
        }
        try {
            include(node, includePath, context);
        } finally {
            session.exitFile();
        }
        return Optional.empty();
    }

    private void include(IncludeNode node, Path includePath, EvaluationContext context) throws SourceException {
        EvaluationSession session = context.getSession();
        ParseData parseData;
        try {
            parseData = session.getParseDataProvider().getParseData(includePath);
        } catch (IOException e) {
            throw new EvaluationException("Unable to open include: " + e.getMessage(), node.path().range(), e);
        }
        EvaluatorLogger.debug("Including {}", includePath);

        ScopeVariable currentBffDir = session.getCurrentBffDirVariable();
        Value currentBffDirBeforeInclude = currentBffDir.getValue();
        currentBffDir.setValue(new Value.Str(relativeDirectory(session.getRootDirectory(), includePath)));
        try {
            statements.evaluateStatements(parseData.statements(), context.forInclude(parseData));
        } finally {
            currentBffDir.setValue(currentBffDirBeforeInclude);
        }
    }

    private static String relativeDirectory(Path rootDirectory, Path file) {
        Path directory = file.getParent();
        return rootDirectory.relativize(directory).toString().replace('\\', '/');
    }
}
