package com.trace.lifecycle.cache;

import com.trace.lifecycle.core.model.TraceSnapshot;

import java.util.Optional;

/**
 * Bounded buffer of recently finished traces, readable by the application after export.
 * Entries are immutable snapshots; tag edits replace the entry with a new snapshot.
 */
public interface TraceBuffer {

    void put(TraceSnapshot trace);

    Optional<TraceSnapshot> get(String traceId);

    /**
     * Sets ({@code value != null}) or removes ({@code value == null}) a tag on the buffered copy.
     */
    void updateTag(String traceId, String key, String value);

    /**
     * Identifier of the trace most recently put into the buffer.
     */
    Optional<String> lastActiveTraceId();

    long size();

    void clear();
}
