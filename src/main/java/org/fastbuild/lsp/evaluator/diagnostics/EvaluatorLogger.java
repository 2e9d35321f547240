package org.fastbuild.lsp.evaluator.diagnostics;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Tracing for the statement handlers, gated by an integer verbosity level that is checked before
 * SLF4J is reached.
 * Levels: 0=ERROR, 1=WARN, 2=INFO, 3=DEBUG, 4=TRACE. Only DEBUG and TRACE messages are written here;
 * the lower levels exist so that the verbosity can follow the configured Logback level.
 */
public final class EvaluatorLogger {

    public static final int ERROR = 0;
    public static final int WARN  = 1;
    public static final int INFO  = 2;
    public static final int DEBUG = 3;
    public static final int TRACE = 4;
    private static volatile int level = DEBUG;

    private static final Logger logger = LoggerFactory.getLogger(EvaluatorLogger.class);

    private EvaluatorLogger() {}

    /**
     * Sets the verbosity. Values outside {@link #ERROR}..{@link #TRACE} are clamped.
     * @param newLevel The new level.
     */
    public static void setLevel(int newLevel) { level = Math.max(ERROR, Math.min(TRACE, newLevel)); }

    public static int getLevel() { return level; }

    /**
     * Logs include, {@code #once}, target and call events.
     * @param format An SLF4J message format.
     * @param args The format arguments.
     */
    public static void debug(String format, Object... args) {
        if (level >= DEBUG) logger.debug(format, args);
    }

    /**
     * Logs per-statement detail such as the output of {@code Print}.
     * @param format An SLF4J message format.
     * @param args The format arguments.
     */
    public static void trace(String format, Object... args) {
        if (level >= TRACE) logger.trace(format, args);
    }
}
