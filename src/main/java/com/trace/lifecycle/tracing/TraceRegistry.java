package com.trace.lifecycle.tracing;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Registry of in-progress traces, shared by application threads and the timeout supervisor.
 * Backed by a {@link ConcurrentHashMap}, so registering one trace never blocks work on another.
 */
public class TraceRegistry {

    private final ConcurrentMap<String, LiveTrace> traces = new ConcurrentHashMap<>();

    public void register(LiveTrace trace) {
        traces.put(trace.getTraceId(), trace);
    }

    public void remove(String traceId) {
        traces.remove(traceId);
    }

    public Optional<LiveTrace> get(String traceId) {
        return Optional.ofNullable(traces.get(traceId));
    }

    /**
     * Point-in-time copy of the registered traces.
     */
    public Collection<LiveTrace> inProgress() {
        return List.copyOf(traces.values());
    }

    public int size() {
        return traces.size();
    }

    public boolean isEmpty() {
        return traces.isEmpty();
    }
}
