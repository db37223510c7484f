package com.trace.lifecycle.backend;

import com.trace.lifecycle.core.model.TraceSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-memory {@link TraceBackend}. Suitable for tests and single-process use.
 * Tags written post-hoc are kept separately and merged into the stored trace on read.
 */
public class InMemoryTraceBackend implements TraceBackend {
    private static final Logger log = LoggerFactory.getLogger(InMemoryTraceBackend.class);

    private final ConcurrentMap<String, TraceSnapshot> traces = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, Map<String, String>> tagUpdates = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, AtomicInteger> persistCounts = new ConcurrentHashMap<>();

    @Override
    public void persistTrace(TraceSnapshot trace) {
        traces.put(trace.traceId(), trace);
        persistCounts.computeIfAbsent(trace.traceId(), k -> new AtomicInteger()).incrementAndGet();
        log.debug("Persisted trace {} ({} spans, state={})",
                trace.traceId(), trace.spans().size(), trace.state());
    }

    @Override
    public void setTraceTag(String traceId, String key, String value) {
        tagUpdates.compute(traceId, (id, tags) -> {
            Map<String, String> updated = tags != null ? new LinkedHashMap<>(tags) : new LinkedHashMap<>();
            updated.put(key, value);
            return updated;
        });
    }

    @Override
    public void deleteTraceTag(String traceId, String key) {
        tagUpdates.compute(traceId, (id, tags) -> {
            Map<String, String> updated = tags != null ? new LinkedHashMap<>(tags) : new LinkedHashMap<>();
            updated.put(key, null);
            return updated;
        });
    }

    /**
     * Returns the stored trace with post-hoc tag updates applied.
     */
    public Optional<TraceSnapshot> getTrace(String traceId) {
        TraceSnapshot stored = traces.get(traceId);
        if (stored == null) {
            return Optional.empty();
        }
        Map<String, String> updates = tagUpdates.getOrDefault(traceId, Map.of());
        for (Map.Entry<String, String> entry : updates.entrySet()) {
            stored = entry.getValue() != null
                    ? stored.withTag(entry.getKey(), entry.getValue())
                    : stored.withoutTag(entry.getKey());
        }
        return Optional.of(stored);
    }

    public List<TraceSnapshot> getTraces() {
        return new ArrayList<>(traces.values());
    }

    /**
     * Number of times {@code traceId} was persisted.
     */
    public int persistCount(String traceId) {
        AtomicInteger count = persistCounts.get(traceId);
        return count != null ? count.get() : 0;
    }

    public int size() {
        return traces.size();
    }

    public void clear() {
        traces.clear();
        tagUpdates.clear();
        persistCounts.clear();
    }

    @Override
    public String getName() {
        return "in-memory";
    }
}
