package org.fastbuild.lsp.evaluator.semantics;

import org.fastbuild.lsp.evaluator.api.EvaluatedData;
import org.fastbuild.lsp.evaluator.io.ParseData;
import org.fastbuild.lsp.evaluator.preprocessor.PreprocessorSymbols;
import org.fastbuild.lsp.evaluator.scope.ScopeStack;

import java.nio.file.Path;

/**
 * The state of the statement list being evaluated: the file it belongs to, the defined preprocessor
 * symbols and the binding an unnamed {@code +}/{@code -} continues.
 * <p>
 * An included file shares the includer's symbols. A user-function body gets fresh symbols.
 */
public class EvaluationContext {

    private final EvaluationSession session;
    private final Path currentFile;
    private final PreprocessorSymbols defines;
    private LhsBinding previousStatementLhs;

    private EvaluationContext(EvaluationSession session, Path currentFile, PreprocessorSymbols defines) {
        this.session = session;
        this.currentFile = currentFile;
        this.defines = defines;
    }

    /**
     * Creates the context for the root file of a session.
     * @param session The session.
     * @param rootFile The root file.
     * @return The context.
     */
    public static EvaluationContext forRootFile(EvaluationSession session, Path rootFile) {
        return new EvaluationContext(session, rootFile, new PreprocessorSymbols(session.getSettings().getPlatform()));
    }

    /**
     * Creates the context for an included file.
     * @param included The parsed included file.
     * @return The context.
     */
    public EvaluationContext forInclude(ParseData included) {
        EvaluationContext context = new EvaluationContext(session, included.path(), defines);
        context.previousStatementLhs = previousStatementLhs;
        return context;
    }

    /**
     * Creates the context for the body of a user-function call.
     * @return The context.
     */
    public EvaluationContext forFunctionCall() {
        return new EvaluationContext(session, currentFile, new PreprocessorSymbols(session.getSettings().getPlatform()));
    }

    /**
     * Resolves a path written in the current file.
     * @param path A relative or absolute path.
     * @return The normalized absolute path.
     */
    public Path resolveRelativeToCurrentFile(String path) {
        return currentFile.toAbsolutePath().getParent().resolve(path).normalize();
    }

    public EvaluationSession getSession() {
        return session;
    }

    public ScopeStack getScopes() {
        return session.getScopeStack();
    }

    public EvaluatedData getData() {
        return session.getData();
    }

    public Path getCurrentFile() {
        return currentFile;
    }

    public PreprocessorSymbols getDefines() {
        return defines;
    }

    /**
     * @return The binding of the preceding statement, or null if it did not assign anything.
     */
    public LhsBinding getPreviousStatementLhs() {
        return previousStatementLhs;
    }

    public void setPreviousStatementLhs(LhsBinding previousStatementLhs) {
        this.previousStatementLhs = previousStatementLhs;
    }
}
