package org.feralsim.junit.extensions.logging;

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

import java.lang.reflect.AnnotatedElement;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * Fails a test on unexpected WARN or ERROR log events and on missing expected ones.
 * <p>
 * A Logback turbo filter captures every INFO and higher event, including events logged on
 * worker threads. Only events at or above the {@link FailOnLog} level fail a test. Events
 * matching {@link AllowLog} or {@link ExpectLog} are swallowed so they do not clutter the
 * test output.
 * </p>
 */
public class LogWatchExtension implements BeforeAllCallback, BeforeEachCallback, AfterEachCallback, AfterAllCallback {

    private static final ExtensionContext.Namespace NAMESPACE = ExtensionContext.Namespace.create(LogWatchExtension.class);

    @Override
    public void beforeAll(ExtensionContext context) {
        CapturingFilter filter = new CapturingFilter(rulesFor(context));
        filter.start();
        loggerContext().addTurboFilter(filter);
        context.getStore(NAMESPACE).put("filter", filter);
    }

    @Override
    public void beforeEach(ExtensionContext context) {
        CapturingFilter filter = context.getStore(NAMESPACE).get("filter", CapturingFilter.class);
        if (filter != null) {
            filter.rules = rulesFor(context);
            filter.events.clear();
        }
    }

    @Override
    public void afterEach(ExtensionContext context) {
        CapturingFilter filter = context.getStore(NAMESPACE).get("filter", CapturingFilter.class);
        if (filter == null) {
            return;
        }
        Rules rules = filter.rules;
        List<Captured> events = new ArrayList<>(filter.events);
        filter.events.clear();

        List<String> problems = new ArrayList<>();
        if (!rules.disabled) {
            for (Captured event : events) {
                if (event.level.isGreaterOrEqual(rules.minLevel) && !rules.permits(event)) {
                    problems.add("Unexpected log: " + event);
                }
            }
        }
        for (ExpectLog expect : rules.expects) {
            long count = events.stream().filter(e -> matches(e, expect.level(), expect.loggerPattern(),
                    expect.messagePattern())).count();
            if (count < expect.occurrences()) {
                problems.add(String.format("Missing log: expected %d x [%s] logger=\"%s\" message=\"%s\", found %d",
                        expect.occurrences(), expect.level(), expect.loggerPattern(), expect.messagePattern(), count));
            }
        }
        if (!problems.isEmpty()) {
            throw new AssertionError(String.join("\n", problems));
        }
    }

    @Override
    public void afterAll(ExtensionContext context) {
        CapturingFilter filter = context.getStore(NAMESPACE).remove("filter", CapturingFilter.class);
        if (filter != null) {
            loggerContext().getTurboFilterList().remove(filter);
            filter.stop();
        }
    }

    private static LoggerContext loggerContext() {
        return (LoggerContext) LoggerFactory.getILoggerFactory();
    }

    private static Rules rulesFor(ExtensionContext context) {
        AnnotatedElement testClass = context.getTestClass().orElse(null);
        AnnotatedElement element = context.getElement().orElse(null);
        FailOnLog fail = element != null && element.getAnnotation(FailOnLog.class) != null
                ? element.getAnnotation(FailOnLog.class)
                : testClass != null ? testClass.getAnnotation(FailOnLog.class) : null;

        AllowLog[] allows = collect(testClass, element, AllowLog.class).toArray(AllowLog[]::new);
        ExpectLog[] expects = collect(testClass, element, ExpectLog.class).toArray(ExpectLog[]::new);
        Level minLevel = toLogback(fail != null ? fail.level() : LogLevel.WARN);
        return new Rules(minLevel, fail != null && fail.disabled(), allows, expects);
    }

    private static <A extends java.lang.annotation.Annotation> Stream<A> collect(AnnotatedElement testClass,
                                                                                 AnnotatedElement element,
                                                                                 Class<A> type) {
        Stream<A> fromClass = testClass == null ? Stream.empty() : Arrays.stream(testClass.getAnnotationsByType(type));
        Stream<A> fromElement = element == null || element == testClass ? Stream.empty()
                : Arrays.stream(element.getAnnotationsByType(type));
        return Stream.concat(fromClass, fromElement);
    }

    private static boolean matches(Captured event, LogLevel level, String loggerPattern, String messagePattern) {
        return event.level.isGreaterOrEqual(toLogback(level))
                && Pattern.matches(loggerPattern, event.loggerName)
                && Pattern.matches(messagePattern, event.message);
    }

    private static Level toLogback(LogLevel level) {
        return switch (level) {
            case INFO -> Level.INFO;
            case WARN -> Level.WARN;
            case ERROR -> Level.ERROR;
        };
    }

    private static final class Rules {
        final Level minLevel;
        final boolean disabled;
        final AllowLog[] allows;
        final ExpectLog[] expects;

        Rules(Level minLevel, boolean disabled, AllowLog[] allows, ExpectLog[] expects) {
            this.minLevel = minLevel;
            this.disabled = disabled;
            this.allows = allows;
            this.expects = expects;
        }

        boolean permits(Captured event) {
            for (AllowLog allow : allows) {
                if (matches(event, allow.level(), allow.loggerPattern(), allow.messagePattern())) {
                    return true;
                }
            }
            for (ExpectLog expect : expects) {
                if (matches(event, expect.level(), expect.loggerPattern(), expect.messagePattern())) {
                    return true;
                }
            }
            return false;
        }
    }

    private static final class CapturingFilter extends TurboFilter {
        final List<Captured> events = new CopyOnWriteArrayList<>();
        volatile Rules rules;

        CapturingFilter(Rules rules) {
            this.rules = rules;
        }

        @Override
        public FilterReply decide(Marker marker, ch.qos.logback.classic.Logger logger, Level level, String format,
                                  Object[] params, Throwable t) {
            Rules current = rules;
            if (format == null || !level.isGreaterOrEqual(Level.INFO)) {
                return FilterReply.NEUTRAL;
            }
            Captured event = new Captured(logger.getName(), level,
                    MessageFormatter.arrayFormat(format, params).getMessage());
            events.add(event);
            return current.permits(event) ? FilterReply.DENY : FilterReply.NEUTRAL;
        }
    }

    private static final class Captured {
        final String loggerName;
        final Level level;
        final String message;

        Captured(String loggerName, Level level, String message) {
            this.loggerName = loggerName;
            this.level = level;
            this.message = message == null ? "" : message;
        }

        @Override
        public String toString() {
            return "[" + level + "] " + loggerName + " - " + message;
        }
    }
}
