package org.fastbuild.lsp.evaluator;

/**
 * Thrown when the evaluator configuration holds an invalid value.
 */
public class SettingsException extends RuntimeException {

    public SettingsException(String message) {
        super(message);
    }

    public SettingsException(String message, Throwable cause) {
        super(message, cause);
    }
}
