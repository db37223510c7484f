package com.trace.lifecycle.backend;

import com.trace.lifecycle.core.model.TraceSnapshot;
import com.trace.lifecycle.util.TestTraces;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("InMemoryTraceBackend Tests")
class InMemoryTraceBackendTest {

    private final InMemoryTraceBackend backend = new InMemoryTraceBackend();

    @Test
    @DisplayName("Should store traces and count persists")
    void persist() {
        backend.persistTrace(TestTraces.finished("tr-1"));

        assertEquals(1, backend.size());
        assertEquals(1, backend.persistCount("tr-1"));
        assertEquals(0, backend.persistCount("tr-2"));
        assertEquals(1, backend.getTraces().size());
    }

    @Test
    @DisplayName("Post-hoc tags should be merged into the stored trace on read")
    void tagsMergedOnRead() {
        backend.persistTrace(TestTraces.finished("tr-1"));
        backend.setTraceTag("tr-1", "label", "good");
        backend.deleteTraceTag("tr-1", "env");

        TraceSnapshot stored = backend.getTrace("tr-1").orElseThrow();

        assertEquals(Optional.of("good"), stored.tag("label"));
        assertTrue(stored.tag("env").isEmpty());
    }

    @Test
    @DisplayName("Tags written before the trace arrives should still apply")
    void tagsBeforeTrace() {
        backend.setTraceTag("tr-1", "label", "early");
        backend.persistTrace(TestTraces.finished("tr-1"));

        assertEquals(Optional.of("early"), backend.getTrace("tr-1").orElseThrow().tag("label"));
    }

    @Test
    @DisplayName("clear() should remove everything")
    void clear() {
        backend.persistTrace(TestTraces.finished("tr-1"));
        backend.clear();

        assertEquals(0, backend.size());
        assertTrue(backend.getTrace("tr-1").isEmpty());
    }
}
