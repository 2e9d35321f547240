package org.fastbuild.lsp.evaluator;

import org.fastbuild.lsp.evaluator.api.EvaluatedData;
import org.fastbuild.lsp.evaluator.api.EvaluationException;
import org.fastbuild.lsp.evaluator.api.EvaluationResult;
import org.fastbuild.lsp.evaluator.api.IEvaluator;
import org.fastbuild.lsp.evaluator.api.InternalEvaluationException;
import org.fastbuild.lsp.evaluator.api.SourceException;
import org.fastbuild.lsp.evaluator.api.SourceRange;
import org.fastbuild.lsp.evaluator.diagnostics.EvaluatorLogger;
import org.fastbuild.lsp.evaluator.io.FileUris;
import org.fastbuild.lsp.evaluator.io.ParseData;
import org.fastbuild.lsp.evaluator.io.ParseDataProvider;
import org.fastbuild.lsp.evaluator.semantics.EvaluationContext;
import org.fastbuild.lsp.evaluator.semantics.EvaluationSession;
import org.fastbuild.lsp.evaluator.semantics.StatementEvaluator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Map;

/**
 * The main evaluator implementation. Each call to {@link #evaluate(Path)} runs a fresh session, so
 * evaluating unchanged input twice yields equal data. It is not thread-safe: the parse cache is shared
 * between calls.
 */
public class Evaluator implements IEvaluator {

    private static final Logger LOG = LoggerFactory.getLogger(Evaluator.class);

    private final EvaluatorSettings settings;
    private final ParseDataProvider parseDataProvider;
    private final Map<String, String> environment;
    private int verbosity = -1;

    /**
     * Creates an evaluator.
     * @param settings The evaluator settings.
     * @param parseDataProvider The source of parsed files.
     * @param environment The environment variables visible to {@code exists()} and {@code #import}.
     */
    public Evaluator(EvaluatorSettings settings, ParseDataProvider parseDataProvider, Map<String, String> environment) {
        this.settings = settings;
        this.parseDataProvider = parseDataProvider;
        this.environment = Map.copyOf(environment);
    }

    /**
     * {@inheritDoc}
     * <p>
     * When the settings name a root file, that file is evaluated instead of the given one, so that an
     * edit in an included file is evaluated in the context of the whole configuration.
     */
    @Override
    public EvaluationResult evaluate(Path file) {
        if (verbosity >= 0) {
            EvaluatorLogger.setLevel(verbosity);
        }
        Path rootFile = settings.getRootFile().orElse(file).toAbsolutePath().normalize();
        long startNanos = System.nanoTime();

        EvaluationSession session = new EvaluationSession(settings, parseDataProvider, environment, rootFile);
        EvaluationContext context = EvaluationContext.forRootFile(session, rootFile);
        EvaluatedData data = session.getData();
        EvaluationResult result;
        try {
            ParseData parseData = readRootFile(rootFile);
            new StatementEvaluator().evaluateStatements(parseData.statements(), context);
            result = EvaluationResult.success(data);
        } catch (SourceException e) {
            LOG.debug("Evaluation of {} stopped: {} at {}", rootFile, e.getMessage(), e.getRange());
            result = EvaluationResult.failure(data, e);
        } catch (RuntimeException | StackOverflowError e) {
            LOG.error("Evaluation of {} failed unexpectedly", rootFile, e);
            SourceRange range = SourceRange.of(FileUris.toUri(rootFile), 0, 0, 0, 0);
            result = EvaluationResult.failure(data, new InternalEvaluationException("Internal error during evaluation: " + e, range, e));
        } finally {
            session.getTargets().resolveReferences(data);
        }

        LOG.info("Evaluated {}: {} definitions, {} references, {} targets{}", rootFile,
                data.getVariableDefinitions().size(), data.getVariableReferences().size(),
                data.getTargetDefinitions().size(), result.hasError() ? " (with error)" : "");
        if (settings.isLogPerformanceMetrics()) {
            LOG.info("Evaluation of {} took {} ms", rootFile, (System.nanoTime() - startNanos) / 1_000_000);
        }
        return result;
    }

    private ParseData readRootFile(Path rootFile) throws SourceException {
        try {
            return parseDataProvider.getParseData(rootFile);
        } catch (IOException e) {
            String uri = FileUris.toUri(rootFile);
            throw new EvaluationException("Unable to open file: " + e.getMessage(), SourceRange.of(uri, 0, 0, 0, 0), e);
        }
    }

    /**
     * {@inheritDoc}
     */
    @Override
    public void setVerbosity(int level) {
        this.verbosity = level;
    }

    public ParseDataProvider getParseDataProvider() {
        return parseDataProvider;
    }
}
