package com.trace.lifecycle.core.model;

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable copy of a trace and its full span tree.
 *
 * <p>Children are looked up by parent identifier through {@link #childrenOf(String)};
 * spans never hold references to each other.</p>
 *
 * @param traceId   trace identifier
 * @param state     lifecycle state at capture time
 * @param createdAt creation timestamp (root span start)
 * @param endedAt   completion timestamp, {@code null} while in progress
 * @param runId     optional associated run identifier
 * @param tags      trace tags at capture time
 * @param spans     spans in start order
 */
public record TraceSnapshot(
        String traceId,
        TraceState state,
        Instant createdAt,
        Instant endedAt,
        String runId,
        Map<String, String> tags,
        List<SpanSnapshot> spans
) {

    public TraceSnapshot {
        tags = tags != null ? Collections.unmodifiableMap(new LinkedHashMap<>(tags)) : Map.of();
        spans = spans != null ? List.copyOf(spans) : List.of();
    }

    public Optional<SpanSnapshot> rootSpan() {
        return spans.stream().filter(SpanSnapshot::isRoot).findFirst();
    }

    public Optional<SpanSnapshot> findSpan(String spanId) {
        return spans.stream().filter(s -> s.spanId().equals(spanId)).findFirst();
    }

    public List<SpanSnapshot> childrenOf(String parentId) {
        return spans.stream()
                .filter(s -> parentId.equals(s.parentId()))
                .toList();
    }

    public Optional<String> tag(String key) {
        return Optional.ofNullable(tags.get(key));
    }

    public Duration duration() {
        if (endedAt == null) {
            return Duration.ZERO;
        }
        return Duration.between(createdAt, endedAt);
    }

    /**
     * Returns a copy with {@code key} set to {@code value}.
     */
    public TraceSnapshot withTag(String key, String value) {
        Map<String, String> updated = new LinkedHashMap<>(tags);
        updated.put(key, value);
        return new TraceSnapshot(traceId, state, createdAt, endedAt, runId, updated, spans);
    }

    /**
     * Returns a copy without {@code key}.
     */
    public TraceSnapshot withoutTag(String key) {
        Map<String, String> updated = new LinkedHashMap<>(tags);
        updated.remove(key);
        return new TraceSnapshot(traceId, state, createdAt, endedAt, runId, updated, spans);
    }
}
