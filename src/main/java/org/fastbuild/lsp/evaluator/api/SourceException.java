package org.fastbuild.lsp.evaluator.api;

/**
 * Base class for all errors that can be attributed to a location in a BFF file.
 */
public abstract class SourceException extends Exception {

    private final SourceRange range;

    protected SourceException(String message, SourceRange range) {
        super(message);
        this.range = range;
    }

    protected SourceException(String message, SourceRange range, Throwable cause) {
        super(message, cause);
        this.range = range;
    }

    /**
     * @return The source range the error refers to.
     */
    public SourceRange getRange() {
        return range;
    }

    /**
     * @return A short, stable name of the error kind, used in reports.
     */
    public abstract String getKind();
}
