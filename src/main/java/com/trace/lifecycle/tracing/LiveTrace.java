package com.trace.lifecycle.tracing;

import com.trace.lifecycle.core.model.SpanStatus;
import com.trace.lifecycle.core.model.TraceSnapshot;
import com.trace.lifecycle.core.model.TraceState;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicReference;

/**
 * A trace that is being recorded.
 *
 * <p>The state leaves {@link TraceState#IN_PROGRESS} through a single compare-and-set,
 * performed either by {@link #complete} (root span closed by the application) or by
 * {@link #expire} (timeout supervisor). Exactly one of them obtains a snapshot; the
 * other gets {@link Optional#empty()}.</p>
 *
 * <p>Tag writes and the terminal transition share the trace monitor, so a tag written
 * before the transition is always part of the snapshot, and a tag written after it is
 * rejected here and has to go through the post-hoc path. Rejected writes are kept as
 * {@linkplain #lateTagUpdates() late tag updates} until the trace leaves the registry.</p>
 */
public class LiveTrace {

    private final String traceId;
    private final Instant createdAt;
    private final String runId;
    private final AtomicReference<TraceState> state = new AtomicReference<>(TraceState.IN_PROGRESS);
    private final ConcurrentLinkedQueue<LiveSpan> spans = new ConcurrentLinkedQueue<>();
    private final Map<String, String> tags = new LinkedHashMap<>();
    private final Map<String, String> lateTagUpdates = new LinkedHashMap<>();

    public LiveTrace(String traceId, Instant createdAt, String runId) {
        this.traceId = traceId;
        this.createdAt = createdAt;
        this.runId = runId;
    }

    public String getTraceId() {
        return traceId;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public String getRunId() {
        return runId;
    }

    public TraceState getState() {
        return state.get();
    }

    public boolean isInProgress() {
        return state.get() == TraceState.IN_PROGRESS;
    }

    /**
     * Adds a span to the tree.
     *
     * @return false if the trace already left IN_PROGRESS
     */
    public synchronized boolean addSpan(LiveSpan span) {
        if (!isInProgress()) {
            return false;
        }
        spans.add(span);
        return true;
    }

    public int spanCount() {
        return spans.size();
    }

    public boolean hasExceeded(Duration timeout, Instant now) {
        return Duration.between(createdAt, now).compareTo(timeout) > 0;
    }

    /**
     * Finalizes the trace after its root span closed: ERROR if any span recorded ERROR, OK otherwise.
     * Spans still open on other contexts are closed with the root's end time.
     *
     * @return the snapshot to export, or empty if the trace was already finalized
     */
    public synchronized Optional<TraceSnapshot> complete(Instant endedAt) {
        TraceState terminal = anySpanFailed() ? TraceState.ERROR : TraceState.OK;
        if (!state.compareAndSet(TraceState.IN_PROGRESS, terminal)) {
            return Optional.empty();
        }
        for (LiveSpan span : spans) {
            span.abandon(endedAt);
        }
        return Optional.of(capture(endedAt));
    }

    /**
     * Marks the trace ERROR and force-closes every open span with the detection time.
     *
     * @return the snapshot to export, or empty if the trace was already finalized
     */
    public synchronized Optional<TraceSnapshot> expire(Instant detectedAt, Duration timeout) {
        if (!state.compareAndSet(TraceState.IN_PROGRESS, TraceState.ERROR)) {
            return Optional.empty();
        }
        TraceTimeoutException cause = new TraceTimeoutException(traceId, timeout);
        for (LiveSpan span : spans) {
            span.forceEnd(detectedAt, cause);
        }
        return Optional.of(capture(detectedAt));
    }

    /**
     * @return false if the trace is no longer in progress and the tag was not applied
     */
    public synchronized boolean setTag(String key, String value) {
        if (!isInProgress()) {
            lateTagUpdates.put(key, value);
            return false;
        }
        tags.put(key, value);
        return true;
    }

    public synchronized boolean setTags(Map<String, String> values) {
        if (!isInProgress()) {
            lateTagUpdates.putAll(values);
            return false;
        }
        tags.putAll(values);
        return true;
    }

    public synchronized boolean removeTag(String key) {
        if (!isInProgress()) {
            lateTagUpdates.put(key, null);
            return false;
        }
        tags.remove(key);
        return true;
    }

    /**
     * Tag writes rejected after the terminal transition, in write order. A {@code null} value is a deletion.
     */
    public synchronized Map<String, String> lateTagUpdates() {
        return new LinkedHashMap<>(lateTagUpdates);
    }

    /**
     * Number of spans closed by {@link #expire}.
     */
    public synchronized int forceClosedSpanCount() {
        int count = 0;
        for (LiveSpan span : spans) {
            if (span.isForceClosed()) {
                count++;
            }
        }
        return count;
    }

    /**
     * Snapshot of the trace as it is now, open spans included.
     */
    public synchronized TraceSnapshot snapshot() {
        return capture(null);
    }

    private boolean anySpanFailed() {
        for (LiveSpan span : spans) {
            if (span.getStatus() == SpanStatus.ERROR) {
                return true;
            }
        }
        return false;
    }

    private TraceSnapshot capture(Instant endedAt) {
        return new TraceSnapshot(
                traceId,
                state.get(),
                createdAt,
                endedAt,
                runId,
                tags,
                spans.stream().map(LiveSpan::snapshot).toList()
        );
    }
}
