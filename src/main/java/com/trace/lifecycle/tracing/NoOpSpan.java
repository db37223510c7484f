package com.trace.lifecycle.tracing;

import com.trace.lifecycle.core.model.SpanStatus;

/**
 * Span returned when nothing should be recorded. All methods do nothing.
 */
public final class NoOpSpan implements Span {

    public static final String SPAN_ID = "0000000000000000";

    public static final NoOpSpan INSTANCE = new NoOpSpan();

    private NoOpSpan() {
    }

    @Override
    public String getSpanId() {
        return SPAN_ID;
    }

    @Override
    public String getTraceId() {
        return null;
    }

    @Override
    public String getParentId() {
        return null;
    }

    @Override
    public String getName() {
        return "";
    }

    @Override
    public void setAttribute(String key, Object value) {
    }

    @Override
    public void setInputs(Object inputs) {
    }

    @Override
    public void setOutputs(Object outputs) {
    }

    @Override
    public void setStatus(SpanStatus status) {
    }

    @Override
    public SpanStatus getStatus() {
        return SpanStatus.UNSET;
    }

    @Override
    public void recordException(Throwable t) {
    }

    @Override
    public boolean isRecording() {
        return false;
    }

    @Override
    public void close() {
    }
}
