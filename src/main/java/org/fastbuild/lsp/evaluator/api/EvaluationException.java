package org.fastbuild.lsp.evaluator.api;

/**
 * Thrown when a well-formed statement cannot be evaluated, e.g. because of a type mismatch or an
 * undefined variable.
 */
public class EvaluationException extends SourceException {

    public EvaluationException(String message, SourceRange range) {
        super(message, range);
    }

    public EvaluationException(String message, SourceRange range, Throwable cause) {
        super(message, range, cause);
    }

    @Override
    public String getKind() {
        return "EvaluationError";
    }
}
