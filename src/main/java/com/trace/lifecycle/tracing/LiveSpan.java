package com.trace.lifecycle.tracing;

import com.trace.lifecycle.core.model.SpanSnapshot;
import com.trace.lifecycle.core.model.SpanStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Recording span owned by a {@link LiveTrace}.
 *
 * <p>State is guarded by the span's monitor. A span ends at most once: the first of
 * {@link #end}, {@link #abandon} or {@link #forceEnd} wins and later calls return false.
 * The end timestamp is never earlier than the start timestamp.</p>
 */
public class LiveSpan implements Span {
    private static final Logger log = LoggerFactory.getLogger(LiveSpan.class);

    static final String EXCEPTION_TYPE = "exception.type";
    static final String EXCEPTION_MESSAGE = "exception.message";

    private final String spanId;
    private final String parentId;
    private final LiveTrace trace;
    private final String name;
    private final Instant startTime;
    private final SpanLifecycle lifecycle;

    private final Map<String, Object> attributes = new LinkedHashMap<>();
    private Object inputs;
    private Object outputs;
    private SpanStatus status = SpanStatus.UNSET;
    private Instant endTime;
    private boolean forceClosed;

    public LiveSpan(String spanId, String parentId, LiveTrace trace, String name,
                    Instant startTime, SpanLifecycle lifecycle) {
        this.spanId = spanId;
        this.parentId = parentId;
        this.trace = trace;
        this.name = name;
        this.startTime = startTime;
        this.lifecycle = lifecycle;
    }

    @Override
    public String getSpanId() {
        return spanId;
    }

    @Override
    public String getTraceId() {
        return trace.getTraceId();
    }

    @Override
    public String getParentId() {
        return parentId;
    }

    @Override
    public String getName() {
        return name;
    }

    public LiveTrace getTrace() {
        return trace;
    }

    public Instant getStartTime() {
        return startTime;
    }

    public boolean isRoot() {
        return parentId == null;
    }

    @Override
    public synchronized void setAttribute(String key, Object value) {
        if (endTime != null) {
            log.debug("Ignoring attribute '{}' on closed span {}", key, spanId);
            return;
        }
        attributes.put(key, value);
    }

    public synchronized void setAttributes(Map<String, ?> values) {
        if (values != null && endTime == null) {
            attributes.putAll(values);
        }
    }

    @Override
    public synchronized void setInputs(Object inputs) {
        if (endTime == null) {
            this.inputs = inputs;
        }
    }

    @Override
    public synchronized void setOutputs(Object outputs) {
        if (endTime == null) {
            this.outputs = outputs;
        }
    }

    @Override
    public synchronized void setStatus(SpanStatus status) {
        if (endTime == null && status != null) {
            this.status = status;
        }
    }

    @Override
    public synchronized SpanStatus getStatus() {
        return status;
    }

    @Override
    public synchronized void recordException(Throwable t) {
        if (endTime != null || t == null) {
            return;
        }
        status = SpanStatus.ERROR;
        attributes.put(EXCEPTION_TYPE, t.getClass().getName());
        attributes.put(EXCEPTION_MESSAGE, String.valueOf(t.getMessage()));
    }

    @Override
    public boolean isRecording() {
        return true;
    }

    public synchronized boolean isOpen() {
        return endTime == null;
    }

    public synchronized boolean isForceClosed() {
        return forceClosed;
    }

    /**
     * Ends the span normally. A {@code null} status keeps the current one;
     * {@link SpanStatus#UNSET} is promoted to {@link SpanStatus#OK}.
     *
     * @return true if this call closed the span
     */
    public synchronized boolean end(Instant at, SpanStatus endStatus, Object endOutputs) {
        if (endTime != null) {
            return false;
        }
        if (endStatus != null) {
            status = endStatus;
        }
        if (status == SpanStatus.UNSET) {
            status = SpanStatus.OK;
        }
        if (endOutputs != null) {
            outputs = endOutputs;
        }
        endTime = clamp(at);
        return true;
    }

    /**
     * Closes a span left open when an enclosing span ended. The status is left as recorded.
     */
    public synchronized boolean abandon(Instant at) {
        if (endTime != null) {
            return false;
        }
        endTime = clamp(at);
        return true;
    }

    /**
     * Closes the span with {@link SpanStatus#ERROR} on behalf of the timeout supervisor.
     */
    public synchronized boolean forceEnd(Instant at, TraceTimeoutException cause) {
        if (endTime != null) {
            return false;
        }
        status = SpanStatus.ERROR;
        attributes.put(EXCEPTION_TYPE, cause.getClass().getName());
        attributes.put(EXCEPTION_MESSAGE, cause.getMessage());
        endTime = clamp(at);
        forceClosed = true;
        return true;
    }

    public synchronized SpanSnapshot snapshot() {
        return new SpanSnapshot(spanId, parentId, trace.getTraceId(), name, startTime, endTime,
                status, attributes, inputs, outputs);
    }

    /**
     * Ends the span through the owning tracer.
     */
    @Override
    public void close() {
        lifecycle.onClose(this);
    }

    private Instant clamp(Instant at) {
        return at.isBefore(startTime) ? startTime : at;
    }

    @Override
    public String toString() {
        return "LiveSpan{" +
                "spanId='" + spanId + '\'' +
                ", traceId='" + trace.getTraceId() + '\'' +
                ", name='" + name + '\'' +
                '}';
    }
}
