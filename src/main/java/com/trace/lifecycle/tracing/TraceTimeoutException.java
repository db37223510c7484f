package com.trace.lifecycle.tracing;

import java.time.Duration;

/**
 * Signal recorded on spans that the timeout supervisor force-closed.
 * It is attached to the trace record only and never thrown into application code.
 */
public class TraceTimeoutException extends RuntimeException {

    private final String traceId;
    private final Duration timeout;

    public TraceTimeoutException(String traceId, Duration timeout) {
        super("Trace " + traceId + " exceeded timeout of " + timeout.toMillis() + "ms");
        this.traceId = traceId;
        this.timeout = timeout;
    }

    public String getTraceId() {
        return traceId;
    }

    public Duration getTimeout() {
        return timeout;
    }
}
