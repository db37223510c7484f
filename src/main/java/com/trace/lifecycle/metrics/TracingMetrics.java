package com.trace.lifecycle.metrics;

import com.trace.lifecycle.core.model.TraceState;

import java.time.Duration;

/**
 * Interface for recording trace lifecycle and export metrics.
 * Implementations can integrate with Micrometer, Prometheus, or other metrics systems.
 * The default {@link NoOpTracingMetrics} does nothing, ensuring the library works
 * without any metrics dependencies on the classpath.
 */
public interface TracingMetrics {

    void incrementTraceStarted();

    void recordTraceCompleted(TraceState state, Duration duration);

    void incrementTraceTimedOut();

    void incrementExportDropped();

    void recordExportSucceeded(Duration duration);

    void incrementExportRetried();

    /**
     * @param reason short failure category, e.g. {@code non_retryable} or {@code retry_timeout}
     */
    void incrementExportFailed(String reason);
}
