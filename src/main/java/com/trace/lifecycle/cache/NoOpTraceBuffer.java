package com.trace.lifecycle.cache;

import com.trace.lifecycle.core.model.TraceSnapshot;

import java.util.Optional;

/**
 * Buffer that keeps nothing. Used when buffering is disabled.
 */
public class NoOpTraceBuffer implements TraceBuffer {

    @Override
    public void put(TraceSnapshot trace) {
    }

    @Override
    public Optional<TraceSnapshot> get(String traceId) {
        return Optional.empty();
    }

    @Override
    public void updateTag(String traceId, String key, String value) {
    }

    @Override
    public Optional<String> lastActiveTraceId() {
        return Optional.empty();
    }

    @Override
    public long size() {
        return 0;
    }

    @Override
    public void clear() {
    }
}
