package org.fastbuild.lsp.evaluator.api;

/**
 * Thrown when the statement tree handed to the evaluator has a shape the parser never produces, and
 * used to report unexpected runtime failures of an evaluation pass.
 * This indicates a bug rather than a problem in the user's BFF file.
 */
public class InternalEvaluationException extends EvaluationException {

    public InternalEvaluationException(String message, SourceRange range) {
        super(message, range);
    }

    public InternalEvaluationException(String message, SourceRange range, Throwable cause) {
        super(message, range, cause);
    }

    @Override
    public String getKind() {
        return "InternalEvaluationError";
    }
}
