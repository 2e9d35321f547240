package org.fastbuild.lsp.junit.extensions.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.turbo.TurboFilter;
import ch.qos.logback.core.spi.FilterReply;
import org.junit.jupiter.api.extension.AfterEachCallback;
import org.junit.jupiter.api.extension.BeforeEachCallback;
import org.junit.jupiter.api.extension.ExtensionContext;
import org.slf4j.LoggerFactory;
import org.slf4j.Marker;
import org.slf4j.helpers.MessageFormatter;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.regex.Pattern;

/**
 * Fails a test that logs at WARN or above unless the event is allowed with {@link AllowLog}.
 * Allowed events are suppressed so they do not clutter the test output.
 */
public class LogWatchExtension implements BeforeEachCallback, AfterEachCallback {

    private static final ExtensionContext.Namespace NAMESPACE = ExtensionContext.Namespace.create(LogWatchExtension.class);

    @Override
    public void beforeEach(ExtensionContext context) {
        WatchFilter filter = new WatchFilter(resolveRules(context));
        filter.start();
        loggerContext().addTurboFilter(filter);
        context.getStore(NAMESPACE).put("filter", filter);
    }

    @Override
    public void afterEach(ExtensionContext context) {
        WatchFilter filter = context.getStore(NAMESPACE).remove("filter", WatchFilter.class);
        if (filter == null) {
            return;
        }
        loggerContext().getTurboFilterList().remove(filter);
        filter.stop();

        List<String> unexpected = filter.getUnexpected();
        if (!unexpected.isEmpty()) {
            StringBuilder sb = new StringBuilder("Unexpected logs:\n");
            unexpected.forEach(line -> sb.append("  ").append(line).append('\n'));
            throw new AssertionError(sb.toString());
        }
    }

    private static LoggerContext loggerContext() {
        return (LoggerContext) LoggerFactory.getILoggerFactory();
    }

    private static Rules resolveRules(ExtensionContext context) {
        FailOnLog fail = context.getRequiredTestMethod().getAnnotation(FailOnLog.class);
        if (fail == null) {
            fail = context.getRequiredTestClass().getAnnotation(FailOnLog.class);
        }
        List<AllowLog> allows = new ArrayList<>();
        allows.addAll(List.of(context.getRequiredTestClass().getAnnotationsByType(AllowLog.class)));
        allows.addAll(List.of(context.getRequiredTestMethod().getAnnotationsByType(AllowLog.class)));

        LogLevel minLevel = fail != null ? fail.level() : LogLevel.WARN;
        boolean disabled = fail != null && fail.disabled();
        return new Rules(toLogback(minLevel), disabled, allows);
    }

    private static Level toLogback(LogLevel level) {
        return switch (level) {
            case INFO -> Level.INFO;
            case WARN -> Level.WARN;
            case ERROR -> Level.ERROR;
        };
    }

    private record Rules(Level minLevel, boolean disabled, List<AllowLog> allows) {

        boolean isAllowed(String loggerName, Level level, String message) {
            for (AllowLog allow : allows) {
                if (level.isGreaterOrEqual(toLogback(allow.level()))
                        && Pattern.matches(allow.loggerPattern(), loggerName)
                        && Pattern.matches(allow.messagePattern(), message)) {
                    return true;
                }
            }
            return false;
        }
    }

    private static final class WatchFilter extends TurboFilter {
        private final Rules rules;
        private final List<String> unexpected = new CopyOnWriteArrayList<>();

        WatchFilter(Rules rules) {
            this.rules = rules;
        }

        @Override
        public FilterReply decide(Marker marker, ch.qos.logback.classic.Logger logger, Level level,
                                  String format, Object[] params, Throwable t) {
            if (rules.disabled() || !level.isGreaterOrEqual(rules.minLevel())) {
                return FilterReply.NEUTRAL;
            }
            String message = format == null ? "" : MessageFormatter.arrayFormat(format, params).getMessage();
            if (rules.isAllowed(logger.getName(), level, message)) {
                return FilterReply.DENY;
            }
            unexpected.add(String.format("[%s] %s - %s", level, logger.getName(), message));
            return FilterReply.NEUTRAL;
        }

        List<String> getUnexpected() {
            return new ArrayList<>(unexpected);
        }
    }
}
