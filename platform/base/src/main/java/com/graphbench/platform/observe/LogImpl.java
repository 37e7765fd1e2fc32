package com.graphbench.platform.observe;

import io.opentelemetry.api.GlobalOpenTelemetry;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.Supplier;

/**
 * Implementation of logging with SLF4J and OpenTelemetry.
 *
 * ALL third-party types (SLF4J, OpenTelemetry) are confined to this class.
 */
final class LogImpl {

    private static final StackWalker WALKER = StackWalker.getInstance(StackWalker.Option.RETAIN_CLASS_REFERENCE);
    private static final ConcurrentMap<Class<?>, Logger> LOGGERS = new ConcurrentHashMap<>();

    private static final String LOG_CLASS = Log.class.getName();
    private static final String IMPL_CLASS = LogImpl.class.getName();

    private final Tracer tracer;

    LogImpl() {
        this.tracer = GlobalOpenTelemetry.get().getTracer("graph-bench-telemetry");
    }

    void info(String message) {
        getCallerLogger().info(message);
    }

    void info(String format, Object... args) {
        getCallerLogger().info(format, args);
    }

    void warn(String message) {
        getCallerLogger().warn(message);
    }

    void warn(String format, Object... args) {
        getCallerLogger().warn(format, args);
    }

    void error(String message, Throwable t) {
        getCallerLogger().error(message, t);
    }

    void error(String format, Object... args) {
        getCallerLogger().error(format, args);
    }

    void debug(String format, Object... args) {
        Logger logger = getCallerLogger();
        if (logger.isDebugEnabled()) {
            logger.debug(format, args);
        }
    }

    // ========================================================================
    // Traced (only when investigation active)
    // ========================================================================

    <T> T traced(String operation, Supplier<T> work) {
        if (!InvestigationContext.isActive()) {
            return work.get();
        }

        Logger logger = getCallerLogger();
        logger.debug("→ {}", operation);

        long startTime = System.currentTimeMillis();

        Span span = tracer.spanBuilder(operation)
                .setSpanKind(SpanKind.INTERNAL)
                .startSpan();

        try (Scope scope = span.makeCurrent()) {
            T result = work.get();
            logger.debug("← {} ({}ms)", operation, System.currentTimeMillis() - startTime);
            return result;
        } catch (RuntimeException e) {
            span.recordException(e);
            logger.debug("✗ {} ({}ms) - {}", operation, System.currentTimeMillis() - startTime, e.getMessage());
            throw e;
        } finally {
            span.end();
        }
    }

    void attr(String key, String value) {
        Span.current().setAttribute(key, value);
    }

    private Logger getCallerLogger() {
        Class<?> callerClass = WALKER.walk(frames -> frames
                .map(StackWalker.StackFrame::getDeclaringClass)
                .filter(c -> !c.getName().equals(LOG_CLASS) && !c.getName().equals(IMPL_CLASS))
                .findFirst()
                .orElse(LogImpl.class));

        return LOGGERS.computeIfAbsent(callerClass, LoggerFactory::getLogger);
    }
}
