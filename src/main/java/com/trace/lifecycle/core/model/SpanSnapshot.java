package com.trace.lifecycle.core.model;

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Immutable view of a span at the moment its trace was captured.
 *
 * @param spanId     span identifier
 * @param parentId   parent span identifier, {@code null} for the root span
 * @param traceId    owning trace identifier
 * @param name       operation name
 * @param startTime  start timestamp
 * @param endTime    end timestamp, {@code null} if the span was still open
 * @param status     recorded status
 * @param attributes attributes in insertion order
 * @param inputs     free-form inputs payload, may be {@code null}
 * @param outputs    free-form outputs payload, may be {@code null}
 */
public record SpanSnapshot(
        String spanId,
        String parentId,
        String traceId,
        String name,
        Instant startTime,
        Instant endTime,
        SpanStatus status,
        Map<String, Object> attributes,
        Object inputs,
        Object outputs
) {

    public SpanSnapshot {
        attributes = attributes != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(attributes))
                : Map.of();
        status = status != null ? status : SpanStatus.UNSET;
    }

    public boolean isRoot() {
        return parentId == null;
    }

    public boolean isOpen() {
        return endTime == null;
    }

    /**
     * Duration of the span, or {@link Duration#ZERO} if it never ended.
     */
    public Duration duration() {
        if (endTime == null) {
            return Duration.ZERO;
        }
        return Duration.between(startTime, endTime);
    }
}
