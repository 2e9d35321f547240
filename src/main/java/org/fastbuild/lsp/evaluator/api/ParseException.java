package org.fastbuild.lsp.evaluator.api;

/**
 * Thrown when BFF source text is malformed.
 */
public class ParseException extends SourceException {

    public ParseException(String message, SourceRange range) {
        super(message, range);
    }

    @Override
    public String getKind() {
        return "ParseError";
    }
}
