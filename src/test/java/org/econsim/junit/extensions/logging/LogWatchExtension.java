package org.econsim.junit.extensions.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.turbo.TurboFilter;
import ch.qos.logback.core.spi.FilterReply;
import org.junit.jupiter.api.extension.AfterAllCallback;
import org.junit.jupiter.api.extension.AfterEachCallback;
import org.junit.jupiter.api.extension.BeforeAllCallback;
import org.junit.jupiter.api.extension.BeforeEachCallback;
import org.junit.jupiter.api.extension.ExtensionContext;
import org.slf4j.LoggerFactory;
import org.slf4j.Marker;
import org.slf4j.helpers.MessageFormatter;

import java.lang.annotation.Annotation;
import java.lang.reflect.AnnotatedElement;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.regex.Pattern;

/**
 * Fails a test when it logs at WARN or above without an {@link AllowLog} or {@link ExpectLog} covering the event,
 * and when an {@link ExpectLog} is not satisfied.
 * <p>
 * A Logback turbo filter is installed once per test class and re-armed with method-level rules before each test.
 */
public class LogWatchExtension implements BeforeAllCallback, BeforeEachCallback, AfterAllCallback, AfterEachCallback {

    private static final ExtensionContext.Namespace NAMESPACE = ExtensionContext.Namespace.create(LogWatchExtension.class);

    @Override
    public void beforeAll(ExtensionContext context) {
        WatchingFilter filter = new WatchingFilter(resolveRules(context));
        filter.start();
        loggerContext().addTurboFilter(filter);
        context.getStore(NAMESPACE).put("filter", filter);
    }

    @Override
    public void beforeEach(ExtensionContext context) {
        WatchingFilter filter = context.getStore(NAMESPACE).get("filter", WatchingFilter.class);
        if (filter != null) {
            filter.clearEvents();
            filter.updateRules(resolveRules(context));
        }
    }

    @Override
    public void afterEach(ExtensionContext context) {
        WatchingFilter filter = context.getStore(NAMESPACE).get("filter", WatchingFilter.class);
        if (filter == null) {
            return;
        }
        Rules rules = resolveRules(context);
        List<CapturedEvent> events = filter.getCapturedEvents();
        filter.clearEvents();

        List<String> unexpected = new ArrayList<>();
        if (!rules.disabled()) {
            for (CapturedEvent e : events) {
                if (e.level().isGreaterOrEqual(toLogback(rules.minLevel())) && !rules.covers(e)) {
                    unexpected.add(String.format("[%s] %s - %s", e.level(), e.loggerName(), e.message()));
                }
            }
        }
        List<String> missing = new ArrayList<>();
        for (ExpectLog exp : rules.expects()) {
            long count = events.stream()
                    .filter(e -> matches(e, exp.level(), exp.loggerPattern(), exp.messagePattern()))
                    .count();
            if (count < exp.occurrences()) {
                missing.add(String.format("Expected %d x [%s] logger=\"%s\" message=\"%s\", but found %d.",
                        exp.occurrences(), exp.level(), exp.loggerPattern(), exp.messagePattern(), count));
            }
        }

        if (!unexpected.isEmpty() || !missing.isEmpty()) {
            StringBuilder sb = new StringBuilder();
            if (!unexpected.isEmpty()) {
                sb.append("Unexpected logs:\n");
                unexpected.forEach(msg -> sb.append("  ").append(msg).append('\n'));
            }
            if (!missing.isEmpty()) {
                sb.append("Missing expected logs:\n");
                missing.forEach(msg -> sb.append("  ").append(msg).append('\n'));
            }
            throw new AssertionError(sb.toString());
        }
    }

    @Override
    public void afterAll(ExtensionContext context) {
        WatchingFilter filter = context.getStore(NAMESPACE).remove("filter", WatchingFilter.class);
        if (filter != null) {
            loggerContext().getTurboFilterList().remove(filter);
            filter.stop();
        }
    }

    private static LoggerContext loggerContext() {
        return (LoggerContext) LoggerFactory.getILoggerFactory();
    }

    private static Rules resolveRules(ExtensionContext context) {
        FailOnLog fail = context.getElement().map(el -> el.getAnnotation(FailOnLog.class))
                .orElse(context.getTestClass().map(c -> c.getAnnotation(FailOnLog.class)).orElse(null));
        LogLevel minLevel = fail != null ? fail.level() : LogLevel.WARN;
        boolean disabled = fail != null && fail.disabled();
        return new Rules(minLevel, disabled,
                collect(context, AllowLog.class, new AllowLog[0]),
                collect(context, ExpectLog.class, new ExpectLog[0]));
    }

    // Class-level annotations first, then method-level.
    private static <A extends Annotation> A[] collect(ExtensionContext context, Class<A> type, A[] empty) {
        List<A> merged = new ArrayList<>();
        context.getTestClass().ifPresent(c -> merged.addAll(List.of(c.getAnnotationsByType(type))));
        context.getElement()
                .filter(el -> !(el instanceof Class<?>))
                .map((AnnotatedElement el) -> el.getAnnotationsByType(type))
                .ifPresent(found -> merged.addAll(List.of(found)));
        return merged.toArray(empty);
    }

    private static boolean matches(CapturedEvent e, LogLevel level, String loggerPattern, String messagePattern) {
        return e.level().isGreaterOrEqual(toLogback(level))
                && Pattern.matches(loggerPattern, e.loggerName())
                && Pattern.matches(messagePattern, e.message());
    }

    private static Level toLogback(LogLevel level) {
        return switch (level) {
            case INFO -> Level.INFO;
            case WARN -> Level.WARN;
            case ERROR -> Level.ERROR;
        };
    }

    private record CapturedEvent(String loggerName, Level level, String message) {}

    private record Rules(LogLevel minLevel, boolean disabled, AllowLog[] allows, ExpectLog[] expects) {
        boolean covers(CapturedEvent e) {
            for (AllowLog a : allows) {
                if (matches(e, a.level(), a.loggerPattern(), a.messagePattern())) return true;
            }
            for (ExpectLog exp : expects) {
                if (matches(e, exp.level(), exp.loggerPattern(), exp.messagePattern())) return true;
            }
            return false;
        }
    }

    private static class WatchingFilter extends TurboFilter {
        private final List<CapturedEvent> events = new CopyOnWriteArrayList<>();
        private volatile Rules rules;

        WatchingFilter(Rules rules) {
            this.rules = rules;
        }

        void updateRules(Rules newRules) {
            this.rules = newRules;
        }

        @Override
        public FilterReply decide(Marker marker, ch.qos.logback.classic.Logger logger, Level level, String format, Object[] params, Throwable t) {
            Rules current = rules;
            if (level.isGreaterOrEqual(toLogback(current.minLevel()))) {
                String message = format == null ? "" : MessageFormatter.arrayFormat(format, params).getMessage();
                CapturedEvent event = new CapturedEvent(logger.getName(), level, message != null ? message : "");
                events.add(event);
                // covered events are kept out of the console output
                if (current.covers(event)) {
                    return FilterReply.DENY;
                }
            }
            return FilterReply.NEUTRAL;
        }

        List<CapturedEvent> getCapturedEvents() {
            return new ArrayList<>(events);
        }

        void clearEvents() {
            events.clear();
        }
    }
}
