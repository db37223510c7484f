package com.trace.lifecycle.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.trace.lifecycle.core.model.TraceSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Caffeine-backed {@link TraceBuffer} with size bound and write expiry.
 */
public class CaffeineTraceBuffer implements TraceBuffer {
    private static final Logger log = LoggerFactory.getLogger(CaffeineTraceBuffer.class);

    private final Cache<String, TraceSnapshot> cache;
    private final AtomicReference<String> lastActive = new AtomicReference<>();

    /**
     * @param maxSize maximum number of finished traces kept
     * @param ttl     how long a trace is kept after it was buffered
     */
    public CaffeineTraceBuffer(int maxSize, Duration ttl) {
        if (maxSize <= 0) {
            throw new IllegalArgumentException("maxSize must be > 0");
        }
        if (ttl == null || ttl.isNegative() || ttl.isZero()) {
            throw new IllegalArgumentException("ttl must be positive");
        }
        this.cache = Caffeine.newBuilder()
                .maximumSize(maxSize)
                .expireAfterWrite(ttl)
                .build();
        log.info("CaffeineTraceBuffer initialized: maxSize={}, ttl={}s", maxSize, ttl.toSeconds());
    }

    @Override
    public void put(TraceSnapshot trace) {
        cache.put(trace.traceId(), trace);
        lastActive.set(trace.traceId());
    }

    @Override
    public Optional<TraceSnapshot> get(String traceId) {
        return Optional.ofNullable(cache.getIfPresent(traceId));
    }

    @Override
    public void updateTag(String traceId, String key, String value) {
        cache.asMap().computeIfPresent(traceId, (id, trace) ->
                value != null ? trace.withTag(key, value) : trace.withoutTag(key));
    }

    @Override
    public Optional<String> lastActiveTraceId() {
        return Optional.ofNullable(lastActive.get());
    }

    @Override
    public long size() {
        cache.cleanUp();
        return cache.estimatedSize();
    }

    @Override
    public void clear() {
        cache.invalidateAll();
        lastActive.set(null);
    }
}
