package com.trace.lifecycle.metrics;

import com.trace.lifecycle.core.model.TraceState;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Micrometer-based implementation of {@link TracingMetrics}.
 * Requires {@code micrometer-core} on the classpath (optional dependency).
 *
 * <p>Recorded metrics:</p>
 * <ul>
 *   <li>{@code trace.started} - Counter</li>
 *   <li>{@code trace.completed} - Timer (tag: state)</li>
 *   <li>{@code trace.timeout} - Counter</li>
 *   <li>{@code trace.export.dropped} - Counter</li>
 *   <li>{@code trace.export.succeeded} - Timer</li>
 *   <li>{@code trace.export.retried} - Counter</li>
 *   <li>{@code trace.export.failed} - Counter (tag: reason)</li>
 * </ul>
 */
public class MicrometerTracingMetrics implements TracingMetrics {

    private final MeterRegistry registry;
    private final Map<TraceState, Timer> completedTimers = new ConcurrentHashMap<>();
    private final Map<String, Counter> failedCounters = new ConcurrentHashMap<>();
    private final Counter startedCounter;
    private final Counter timeoutCounter;
    private final Counter droppedCounter;
    private final Counter retriedCounter;
    private final Timer exportTimer;

    public MicrometerTracingMetrics(MeterRegistry registry) {
        this.registry = registry;
        this.startedCounter = Counter.builder("trace.started")
                .description("Number of traces started")
                .register(registry);
        this.timeoutCounter = Counter.builder("trace.timeout")
                .description("Number of traces force-closed by the timeout supervisor")
                .register(registry);
        this.droppedCounter = Counter.builder("trace.export.dropped")
                .description("Number of export tasks dropped because the queue was full")
                .register(registry);
        this.retriedCounter = Counter.builder("trace.export.retried")
                .description("Number of export retry attempts")
                .register(registry);
        this.exportTimer = Timer.builder("trace.export.succeeded")
                .description("Time from enqueue to successful export")
                .register(registry);
    }

    @Override
    public void incrementTraceStarted() {
        startedCounter.increment();
    }

    @Override
    public void recordTraceCompleted(TraceState state, Duration duration) {
        Timer timer = completedTimers.computeIfAbsent(state, s ->
                Timer.builder("trace.completed")
                        .description("Duration of completed traces")
                        .tag("state", s.name())
                        .register(registry));
        timer.record(duration);
    }

    @Override
    public void incrementTraceTimedOut() {
        timeoutCounter.increment();
    }

    @Override
    public void incrementExportDropped() {
        droppedCounter.increment();
    }

    @Override
    public void recordExportSucceeded(Duration duration) {
        exportTimer.record(duration);
    }

    @Override
    public void incrementExportRetried() {
        retriedCounter.increment();
    }

    @Override
    public void incrementExportFailed(String reason) {
        Counter counter = failedCounters.computeIfAbsent(reason, r ->
                Counter.builder("trace.export.failed")
                        .description("Number of export tasks discarded")
                        .tag("reason", r)
                        .register(registry));
        counter.increment();
    }
}
