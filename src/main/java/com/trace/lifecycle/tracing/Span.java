package com.trace.lifecycle.tracing;

import com.trace.lifecycle.core.model.SpanStatus;

/**
 * Represents a timed unit of work within a trace.
 * Implements {@link AutoCloseable} so spans can be used in try-with-resources blocks,
 * which ends the span when the block exits.
 *
 * <p>Example usage:</p>
 * <pre>
 * try (Span span = tracer.startSpan("retrieve")) {
 *     span.setInputs(query);
 *     span.setAttribute("k", 5);
 *     // ... do work ...
 *     span.setOutputs(documents);
 * }
 * </pre>
 *
 * <p>A span that ends with status {@link SpanStatus#UNSET} is recorded as {@link SpanStatus#OK}.</p>
 */
public interface Span extends AutoCloseable {

    String getSpanId();

    String getTraceId();

    /**
     * Returns the parent span identifier, or {@code null} for a root span.
     */
    String getParentId();

    String getName();

    void setAttribute(String key, Object value);

    void setInputs(Object inputs);

    void setOutputs(Object outputs);

    void setStatus(SpanStatus status);

    SpanStatus getStatus();

    /**
     * Marks the span as failed and records the exception type and message as attributes.
     */
    void recordException(Throwable t);

    /**
     * Returns false for spans that are not part of any trace (tracing disabled,
     * or the owning trace already finished).
     */
    boolean isRecording();

    @Override
    void close();
}
