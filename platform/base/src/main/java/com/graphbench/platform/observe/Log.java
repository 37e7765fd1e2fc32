package com.graphbench.platform.observe;

import java.util.function.Supplier;

/**
 * Unified logging API for the telemetry modules.
 *
 * NO third-party types in this interface.
 * SLF4J and OpenTelemetry details hidden in implementation.
 *
 * Usage:
 *   import static com.graphbench.platform.observe.Log.*;
 *
 *   info("Wrote {}", path);
 *   warn("Cannot read {}: {}", file, e.getMessage());
 *   debug("Skipping malformed row {}", lineNo);
 *
 *   // Debug + Span (only when investigation mode active)
 *   traced("aggregate-triple", () -> readRecord(key));
 */
public final class Log {

    private static final LogImpl impl = new LogImpl();

    private Log() {}

    // ========================================================================
    // Always-On Logging
    // ========================================================================

    public static void info(String message) {
        impl.info(message);
    }

    public static void info(String format, Object... args) {
        impl.info(format, args);
    }

    public static void warn(String message) {
        impl.warn(message);
    }

    public static void warn(String format, Object... args) {
        impl.warn(format, args);
    }

    public static void error(String message, Throwable t) {
        impl.error(message, t);
    }

    public static void error(String format, Object... args) {
        impl.error(format, args);
    }

    /**
     * Debug output for skipped rows and cells. Cheap when DEBUG is off.
     */
    public static void debug(String format, Object... args) {
        impl.debug(format, args);
    }

    // ========================================================================
    // Investigation Mode (Debug + Tracing)
    // ========================================================================

    /**
     * Execute work with debug logging and a tracing span.
     * Only active when investigation mode is enabled for the current thread.
     *
     * When active:
     *   [DEBUG] → operation-name
     *   [DEBUG] ← operation-name (45ms)
     *
     * When inactive: just executes work.
     */
    public static <T> T traced(String operation, Supplier<T> work) {
        return impl.traced(operation, work);
    }

    public static void enableInvestigation() {
        InvestigationContext.enable();
    }

    public static void disableInvestigation() {
        InvestigationContext.disable();
    }

    public static boolean isInvestigating() {
        return InvestigationContext.isActive();
    }

    /**
     * Add attribute to the current span. No-op without an active span.
     */
    public static void attr(String key, String value) {
        impl.attr(key, value);
    }
}
