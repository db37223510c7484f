package com.trace.lifecycle.tracing;

/**
 * Thrown when a span is ended that is not open in the calling context,
 * either because it is unknown or because it was already closed.
 * Other traces are not affected.
 */
public class SpanStateException extends RuntimeException {

    private final String spanId;

    public SpanStateException(String spanId, String message) {
        super(message);
        this.spanId = spanId;
    }

    public String getSpanId() {
        return spanId;
    }
}
