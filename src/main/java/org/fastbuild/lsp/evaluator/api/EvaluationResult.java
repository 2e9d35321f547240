package org.fastbuild.lsp.evaluator.api;

import java.util.Optional;

/**
 * The outcome of an evaluation pass: the recorded data, which is kept even when the pass stops at an
 * error, and the error if there was one.
 */
public final class EvaluationResult {

    private final EvaluatedData data;
    private final SourceException error;

    private EvaluationResult(EvaluatedData data, SourceException error) {
        this.data = data;
        this.error = error;
    }

    public static EvaluationResult success(EvaluatedData data) {
        return new EvaluationResult(data, null);
    }

    public static EvaluationResult failure(EvaluatedData data, SourceException error) {
        return new EvaluationResult(data, error);
    }

    public EvaluatedData getData() {
        return data;
    }

    public Optional<SourceException> getError() {
        return Optional.ofNullable(error);
    }

    public boolean hasError() {
        return error != null;
    }
}
