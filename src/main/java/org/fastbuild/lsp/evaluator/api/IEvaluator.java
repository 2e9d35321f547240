package org.fastbuild.lsp.evaluator.api;

import java.nio.file.Path;

/**
 * Defines the public interface of the BFF evaluator.
 */
public interface IEvaluator {

    /**
     * Evaluates a root BFF file and everything it includes.
     * <p>
     * Errors do not escape: the result carries the first error together with the data recorded up to
     * that point.
     *
     * @param rootFile The root file.
     * @return The recorded data and, if evaluation stopped early, the error.
     */
    EvaluationResult evaluate(Path rootFile);

    /**
     * Sets the verbosity level for log output.
     * @param level The verbosity level (0=errors only up to 4=trace).
     */
    void setVerbosity(int level);
}
