package com.trace.lifecycle.metrics;

import com.trace.lifecycle.core.model.TraceState;

import java.time.Duration;

/**
 * No-op implementation of {@link TracingMetrics}.
 */
public class NoOpTracingMetrics implements TracingMetrics {

    @Override
    public void incrementTraceStarted() {
    }

    @Override
    public void recordTraceCompleted(TraceState state, Duration duration) {
    }

    @Override
    public void incrementTraceTimedOut() {
    }

    @Override
    public void incrementExportDropped() {
    }

    @Override
    public void recordExportSucceeded(Duration duration) {
    }

    @Override
    public void incrementExportRetried() {
    }

    @Override
    public void incrementExportFailed(String reason) {
    }
}
