package com.trace.lifecycle.logging;

import org.slf4j.MDC;

import java.util.ArrayList;
import java.util.List;

/**
 * AutoCloseable MDC (Mapped Diagnostic Context) wrapper for structured logging.
 * Adds key-value pairs to SLF4J MDC and removes them on close.
 *
 * <p>Usage with try-with-resources:</p>
 * <pre>
 * try (LogContext ctx = LogContext.forExport(traceId)) {
 *     log.info("trace.exported backend={}", backend.getName());
 * } // MDC entries are cleared
 * </pre>
 */
public class LogContext implements AutoCloseable {

    private final List<String> keys = new ArrayList<>();

    private LogContext() {
    }

    /**
     * Creates a log context for exporting one trace.
     */
    public static LogContext forExport(String traceId) {
        LogContext ctx = new LogContext();
        ctx.put("traceId", traceId);
        ctx.put("operation", "export");
        return ctx;
    }

    /**
     * Creates a log context for a forced timeout closure.
     */
    public static LogContext forTimeout(String traceId) {
        LogContext ctx = new LogContext();
        ctx.put("traceId", traceId);
        ctx.put("operation", "timeout");
        return ctx;
    }

    /**
     * Creates a log context for work on a single span.
     */
    public static LogContext forSpan(String traceId, String spanId) {
        LogContext ctx = new LogContext();
        ctx.put("traceId", traceId);
        ctx.put("spanId", spanId);
        ctx.put("operation", "span");
        return ctx;
    }

    /**
     * Adds an additional key-value pair to this log context.
     */
    public LogContext with(String key, String value) {
        put(key, value);
        return this;
    }

    private void put(String key, String value) {
        keys.add(key);
        MDC.put(key, value);
    }

    @Override
    public void close() {
        for (String key : keys) {
            MDC.remove(key);
        }
        keys.clear();
    }
}
