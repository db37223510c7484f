package com.trace.lifecycle.api;

import com.trace.lifecycle.assessment.AssessmentService;
import com.trace.lifecycle.assessment.AssessmentStore;
import com.trace.lifecycle.assessment.InMemoryAssessmentStore;
import com.trace.lifecycle.backend.InMemoryTraceBackend;
import com.trace.lifecycle.backend.TraceBackend;
import com.trace.lifecycle.cache.CaffeineTraceBuffer;
import com.trace.lifecycle.cache.NoOpTraceBuffer;
import com.trace.lifecycle.cache.TraceBuffer;
import com.trace.lifecycle.context.ContextScope;
import com.trace.lifecycle.context.ContextStorage;
import com.trace.lifecycle.context.TraceContext;
import com.trace.lifecycle.core.model.SpanStatus;
import com.trace.lifecycle.core.model.TraceSnapshot;
import com.trace.lifecycle.export.ExportStats;
import com.trace.lifecycle.export.TraceExportService;
import com.trace.lifecycle.health.ExportQueueHealthCheck;
import com.trace.lifecycle.health.TimeoutSupervisorHealthCheck;
import com.trace.lifecycle.health.TracerHealth;
import com.trace.lifecycle.logging.LogContext;
import com.trace.lifecycle.metrics.NoOpTracingMetrics;
import com.trace.lifecycle.metrics.TracingMetrics;
import com.trace.lifecycle.retry.RetryController;
import com.trace.lifecycle.timeout.TimeoutSupervisor;
import com.trace.lifecycle.tracing.Ids;
import com.trace.lifecycle.tracing.LiveSpan;
import com.trace.lifecycle.tracing.LiveTrace;
import com.trace.lifecycle.tracing.NoOpSpan;
import com.trace.lifecycle.tracing.Span;
import com.trace.lifecycle.tracing.SpanStateException;
import com.trace.lifecycle.tracing.TraceRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;

/**
 * Main entry point of the tracing library.
 * Records spans into traces, force-closes traces that exceed their timeout and
 * exports finished traces asynchronously to a {@link TraceBackend}.
 *
 * <p>Usage example:</p>
 * <pre>
 * try (Tracer tracer = Tracer.builder()
 *         .options(TracingOptions.fromEnvironment())
 *         .backend(HttpTraceBackend.builder().baseUrl("http://localhost:5000").build())
 *         .build()) {
 *
 *     String answer = tracer.trace("answer", () -&gt; {
 *         try (Span span = tracer.startSpan("retrieve")) {
 *             span.setInputs(question);
 *             span.setOutputs(documents);
 *         }
 *         return generate(documents);
 *     });
 *
 *     tracer.flush(Duration.ofSeconds(5));
 * }
 * </pre>
 *
 * <p>Each thread has its own {@link TraceContext}; threads never inherit a context.
 * Use {@link #propagate(Runnable)} or {@link #captureContext()} with {@link #attach(TraceContext)}
 * to continue a trace on another thread.</p>
 *
 * <p>Closing the tracer stops the timeout supervisor, flushes pending exports for at most
 * the configured shutdown deadline and stops the export workers.</p>
 */
public class Tracer implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(Tracer.class);

    private final TracingOptions options;
    private final TraceBackend backend;
    private final TracingMetrics metrics;
    private final Clock clock;
    private final String runId;
    private final TraceRegistry registry = new TraceRegistry();
    private final ContextStorage contexts = new ContextStorage();
    private final TraceExportService exportService;
    private final TimeoutSupervisor supervisor;
    private final TraceBuffer buffer;
    private final AssessmentService assessmentService;
    private final ExportQueueHealthCheck queueHealthCheck;
    private final TimeoutSupervisorHealthCheck supervisorHealthCheck;
    private final AtomicBoolean enabled;
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private final Thread shutdownHook;

    private Tracer(Builder builder) {
        this.options = builder.options;
        this.backend = builder.backend != null ? builder.backend : new InMemoryTraceBackend();
        this.metrics = builder.metrics != null ? builder.metrics : new NoOpTracingMetrics();
        this.clock = builder.clock;
        this.runId = builder.runId;
        this.enabled = new AtomicBoolean(options.isEnabled());

        RetryController retryController = new RetryController(
                options.getBackoffPolicy(), options.getExportRetryTimeout(), metrics);
        this.exportService = new TraceExportService(backend, retryController, metrics,
                options.getMaxQueueSize(), options.getMaxExportWorkers(), clock,
                options.getShutdownFlushTimeout());

        this.supervisor = options.getTraceTimeout()
                .map(timeout -> new TimeoutSupervisor(registry, timeout, options.getTimeoutCheckInterval(),
                        options.getSupervisorIdleGracePeriod(),
                        (trace, snapshot) -> {
                            metrics.incrementTraceTimedOut();
                            onTraceFinished(trace, snapshot);
                        },
                        clock))
                .orElse(null);

        this.buffer = options.isBufferEnabled()
                ? new CaffeineTraceBuffer(options.getBufferMaxSize(), options.getBufferTtl())
                : new NoOpTraceBuffer();

        AssessmentStore store = builder.assessmentStore != null
                ? builder.assessmentStore
                : new InMemoryAssessmentStore();
        this.assessmentService = new AssessmentService(store, clock);

        this.queueHealthCheck = new ExportQueueHealthCheck(exportService);
        this.supervisorHealthCheck = new TimeoutSupervisorHealthCheck(supervisor, registry);

        if (builder.registerShutdownHook) {
            this.shutdownHook = new Thread(this::close, "trace-lifecycle-shutdown");
            Runtime.getRuntime().addShutdownHook(shutdownHook);
        } else {
            this.shutdownHook = null;
        }

        log.info("Tracer initialized: backend={}, {}", backend.getName(), options);
    }

    // ── Spans ─────────────────────────────────────────────────

    /**
     * Starts a span under the calling context's current span, or a new trace if there is none.
     */
    public Span startSpan(String name) {
        return startSpan(name, null, Map.of());
    }

    public Span startSpan(String name, Map<String, ?> attributes) {
        return startSpan(name, null, attributes);
    }

    /**
     * Starts a span under {@code parent}, or under the current span when {@code parent} is null.
     *
     * <p>Returns {@link NoOpSpan#INSTANCE} when tracing is disabled, when the tracer is closed,
     * or when an explicit {@code parent}'s trace already finished. Spans of a trace that finished
     * while still open in the calling context (for example after a timeout) are dropped from
     * the context first, so the new span starts a new trace.</p>
     */
    public Span startSpan(String name, Span parent, Map<String, ?> attributes) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Span name must not be blank");
        }
        if (!enabled.get() || closed.get()) {
            return NoOpSpan.INSTANCE;
        }
        if (parent != null && !(parent instanceof LiveSpan)) {
            return NoOpSpan.INSTANCE;
        }

        TraceContext context = contexts.current();
        if (parent == null) {
            int pruned = context.pruneFinished();
            if (pruned > 0) {
                log.debug("Dropped {} spans of finished traces from the current context", pruned);
            }
        }
        LiveSpan parentSpan = parent != null ? (LiveSpan) parent : context.currentSpan().orElse(null);
        Instant now = clock.instant();

        if (parentSpan == null) {
            return startTrace(context, name, attributes, now);
        }

        LiveTrace trace = parentSpan.getTrace();
        LiveSpan span = new LiveSpan(Ids.newSpanId(), parentSpan.getSpanId(), trace, name, now, this::closeSpan);
        span.setAttributes(attributes);
        if (!trace.addSpan(span)) {
            log.debug("Trace {} is no longer in progress, span '{}' is not recorded", trace.getTraceId(), name);
            return NoOpSpan.INSTANCE;
        }
        context.push(span);
        return span;
    }

    /**
     * Ends an open span of the calling context with status OK.
     *
     * @throws SpanStateException if the span is not open in the calling context
     */
    public void endSpan(String spanId) {
        endSpan(spanId, null, null);
    }

    /**
     * Ends an open span of the calling context. Spans opened above it are closed first.
     * Ending a root span finalizes its trace and queues it for export.
     *
     * @param status  final status, or {@code null} to keep the recorded one (UNSET becomes OK)
     * @param outputs outputs to record, or {@code null}
     * @throws SpanStateException if the span is not open in the calling context
     */
    public void endSpan(String spanId, SpanStatus status, Object outputs) {
        if (spanId == null) {
            throw new IllegalArgumentException("spanId must not be null");
        }
        if (NoOpSpan.SPAN_ID.equals(spanId)) {
            return;
        }
        TraceContext context = contexts.current();
        Optional<LiveSpan> span = context.find(spanId);
        if (span.isEmpty()) {
            if (!enabled.get()) {
                log.debug("Tracing disabled, ignoring end of unknown span {}", spanId);
                return;
            }
            throw new SpanStateException(spanId, "Span " + spanId + " is not open in the current context");
        }
        finish(context, span.get(), status, outputs);
    }

    /**
     * Runs {@code body} inside a new span. A thrown exception marks the span ERROR and is rethrown.
     */
    public <T> T trace(String name, Supplier<T> body) {
        Span span = startSpan(name);
        try {
            T result = body.get();
            span.setOutputs(result);
            return result;
        } catch (RuntimeException | Error e) {
            span.recordException(e);
            throw e;
        } finally {
            span.close();
        }
    }

    public void trace(String name, Runnable body) {
        trace(name, () -> {
            body.run();
            return null;
        });
    }

    /**
     * Returns the innermost open span of the calling context while its trace is in progress.
     */
    public Optional<Span> currentSpan() {
        return contexts.current().currentSpan()
                .filter(span -> span.getTrace().isInProgress())
                .map(Span.class::cast);
    }

    /**
     * Snapshot of the calling context's in-progress trace.
     */
    public Optional<TraceSnapshot> currentTrace() {
        return contexts.current().currentSpan()
                .map(LiveSpan::getTrace)
                .filter(LiveTrace::isInProgress)
                .map(LiveTrace::snapshot);
    }

    // ── Tags ──────────────────────────────────────────────────

    /**
     * Adds tags to the calling context's trace. If that trace already finished,
     * the tags are applied post-hoc through {@link #setTraceTag}.
     */
    public void updateCurrentTrace(Map<String, String> tags) {
        if (tags == null || tags.isEmpty()) {
            return;
        }
        Optional<LiveSpan> current = contexts.current().currentSpan();
        if (current.isEmpty()) {
            log.warn("No active trace in the current context, tags {} ignored", tags.keySet());
            return;
        }
        LiveTrace trace = current.get().getTrace();
        if (!trace.setTags(tags)) {
            tags.forEach((key, value) -> setTraceTag(trace.getTraceId(), key, value));
        }
    }

    /**
     * Sets a tag on a trace. In-progress traces are tagged in place; finished traces
     * are tagged directly on the backend, bypassing the export pipeline.
     *
     * @throws IllegalStateException if the backend cannot tag an already persisted trace
     */
    public void setTraceTag(String traceId, String key, String value) {
        requireTagKey(key);
        if (value == null) {
            throw new IllegalArgumentException("Tag value must not be null");
        }
        Optional<LiveTrace> live = registry.get(traceId);
        if (live.isPresent() && live.get().setTag(key, value)) {
            return;
        }
        backend.setTraceTag(traceId, key, value);
        buffer.updateTag(traceId, key, value);
    }

    public void deleteTraceTag(String traceId, String key) {
        requireTagKey(key);
        Optional<LiveTrace> live = registry.get(traceId);
        if (live.isPresent() && live.get().removeTag(key)) {
            return;
        }
        backend.deleteTraceTag(traceId, key);
        buffer.updateTag(traceId, key, null);
    }

    // ── Switch, flush, context ────────────────────────────────

    public void enable() {
        enabled.set(true);
        log.info("Tracing enabled");
    }

    /**
     * Disables span creation. Spans already open can still be ended.
     */
    public void disable() {
        enabled.set(false);
        log.info("Tracing disabled");
    }

    public boolean isEnabled() {
        return enabled.get();
    }

    /**
     * Blocks until every finished trace was exported or {@code deadline} elapsed.
     *
     * @return true if the export pipeline drained completely
     */
    public boolean flush(Duration deadline) {
        return exportService.flush(deadline);
    }

    /**
     * Captures the calling context for use on another thread.
     */
    public TraceContext captureContext() {
        return contexts.capture();
    }

    /**
     * Attaches a captured context to the calling thread until the scope is closed.
     */
    public ContextScope attach(TraceContext context) {
        return contexts.attach(context);
    }

    public Runnable propagate(Runnable task) {
        return contexts.propagate(task);
    }

    public <T> Callable<T> propagate(Callable<T> task) {
        return contexts.propagate(task);
    }

    // ── Read back ─────────────────────────────────────────────

    /**
     * Returns an in-progress trace, or a recently finished one from the buffer.
     */
    public Optional<TraceSnapshot> getTrace(String traceId) {
        Optional<LiveTrace> live = registry.get(traceId);
        if (live.isPresent()) {
            return Optional.of(live.get().snapshot());
        }
        return buffer.get(traceId);
    }

    public Optional<String> getLastActiveTraceId() {
        return buffer.lastActiveTraceId();
    }

    public AssessmentService assessments() {
        return assessmentService;
    }

    public ExportStats exportStats() {
        return exportService.stats();
    }

    public TracerHealth health() {
        return new TracerHealth(queueHealthCheck.check(), supervisorHealthCheck.check());
    }

    public TracingOptions getOptions() {
        return options;
    }

    public TraceBackend getBackend() {
        return backend;
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        if (supervisor != null) {
            supervisor.stop();
        }
        int unfinished = registry.size();
        if (unfinished > 0) {
            log.warn("Closing tracer with {} traces still in progress; they will not be exported", unfinished);
        }
        boolean drained = exportService.close(options.getShutdownFlushTimeout());
        removeShutdownHook();
        log.info("Tracer closed (drained={})", drained);
    }

    // ── Internal ──────────────────────────────────────────────

    private Span startTrace(TraceContext context, String name, Map<String, ?> attributes, Instant now) {
        LiveTrace trace = new LiveTrace(Ids.newTraceId(), now, runId);
        LiveSpan root = new LiveSpan(Ids.newSpanId(), null, trace, name, now, this::closeSpan);
        root.setAttributes(attributes);
        trace.addSpan(root);
        registry.register(trace);
        metrics.incrementTraceStarted();
        if (supervisor != null) {
            supervisor.ensureStarted();
        }
        context.push(root);
        log.debug("Trace {} started with root span '{}'", trace.getTraceId(), name);
        return root;
    }

    /**
     * {@link Span#close()} path. Closing an already ended span again does nothing.
     */
    private void closeSpan(LiveSpan span) {
        TraceContext context = contexts.current();
        if (context.find(span.getSpanId()).isEmpty()) {
            if (!span.isOpen()) {
                return;
            }
            throw new SpanStateException(span.getSpanId(),
                    "Span " + span.getSpanId() + " is not open in the current context");
        }
        finish(context, span, null, null);
    }

    private void finish(TraceContext context, LiveSpan span, SpanStatus status, Object outputs) {
        try (LogContext ctx = LogContext.forSpan(span.getTraceId(), span.getSpanId())) {
            Instant now = clock.instant();
            List<LiveSpan> above = context.popThrough(span);
            for (LiveSpan child : above) {
                if (child.abandon(now)) {
                    log.debug("Span {} closed because enclosing span {} ended", child.getSpanId(), span.getSpanId());
                }
            }
            if (!span.end(now, status, outputs)) {
                log.debug("Span {} was already closed (trace state={})", span.getSpanId(), span.getTrace().getState());
                return;
            }
            if (span.isRoot()) {
                LiveTrace trace = span.getTrace();
                trace.complete(now).ifPresent(snapshot -> onTraceFinished(trace, snapshot));
            }
        }
    }

    /**
     * The snapshot is buffered before the trace leaves the registry. Late tag updates
     * recorded on the trace in between are replayed onto the buffered copy.
     */
    private void onTraceFinished(LiveTrace trace, TraceSnapshot snapshot) {
        buffer.put(snapshot);
        trace.lateTagUpdates().forEach((key, value) -> buffer.updateTag(trace.getTraceId(), key, value));
        registry.remove(trace.getTraceId());
        metrics.recordTraceCompleted(snapshot.state(), snapshot.duration());
        exportService.submit(snapshot);
        log.debug("Trace {} finished with state {} ({} spans)",
                snapshot.traceId(), snapshot.state(), snapshot.spans().size());
    }

    private void removeShutdownHook() {
        if (shutdownHook == null || Thread.currentThread() == shutdownHook) {
            return;
        }
        try {
            Runtime.getRuntime().removeShutdownHook(shutdownHook);
        } catch (IllegalStateException e) {
            log.debug("JVM shutdown in progress, shutdown hook stays registered");
        }
    }

    private static void requireTagKey(String key) {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("Tag key must not be blank");
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private TracingOptions options = TracingOptions.defaults();
        private TraceBackend backend;
        private TracingMetrics metrics;
        private Clock clock = Clock.systemUTC();
        private AssessmentStore assessmentStore;
        private String runId;
        private boolean registerShutdownHook = false;

        public Builder options(TracingOptions options) {
            if (options == null) {
                throw new IllegalArgumentException("options must not be null");
            }
            this.options = options;
            return this;
        }

        public Builder backend(TraceBackend backend) {
            this.backend = backend;
            return this;
        }

        public Builder metrics(TracingMetrics metrics) {
            this.metrics = metrics;
            return this;
        }

        public Builder clock(Clock clock) {
            if (clock == null) {
                throw new IllegalArgumentException("clock must not be null");
            }
            this.clock = clock;
            return this;
        }

        public Builder assessmentStore(AssessmentStore assessmentStore) {
            this.assessmentStore = assessmentStore;
            return this;
        }

        /**
         * Run identifier recorded on every trace this tracer creates.
         */
        public Builder runId(String runId) {
            this.runId = runId;
            return this;
        }

        /**
         * Registers a JVM shutdown hook that closes the tracer, flushing pending exports
         * for at most the configured shutdown deadline.
         */
        public Builder registerShutdownHook(boolean registerShutdownHook) {
            this.registerShutdownHook = registerShutdownHook;
            return this;
        }

        public Tracer build() {
            return new Tracer(this);
        }
    }
}
