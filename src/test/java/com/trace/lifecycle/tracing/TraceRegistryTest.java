package com.trace.lifecycle.tracing;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Collection;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("TraceRegistry Tests")
class TraceRegistryTest {

    @Test
    @DisplayName("Should register, look up and remove traces")
    void registerAndRemove() {
        TraceRegistry registry = new TraceRegistry();
        LiveTrace trace = new LiveTrace("tr-1", Instant.now(), null);

        assertTrue(registry.isEmpty());
        registry.register(trace);

        assertEquals(1, registry.size());
        assertSame(trace, registry.get("tr-1").orElseThrow());

        registry.remove("tr-1");
        assertTrue(registry.get("tr-1").isEmpty());
        assertTrue(registry.isEmpty());
    }

    @Test
    @DisplayName("inProgress() should return a copy unaffected by later changes")
    void inProgressIsCopy() {
        TraceRegistry registry = new TraceRegistry();
        registry.register(new LiveTrace("tr-1", Instant.now(), null));

        Collection<LiveTrace> view = registry.inProgress();
        registry.register(new LiveTrace("tr-2", Instant.now(), null));

        assertEquals(1, view.size());
        assertEquals(2, registry.size());
    }
}
