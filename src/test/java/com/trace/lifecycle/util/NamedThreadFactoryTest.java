package com.trace.lifecycle.util;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("NamedThreadFactory Tests")
class NamedThreadFactoryTest {

    @Test
    @DisplayName("Threads should be numbered daemons with the given prefix")
    void namedDaemonThreads() {
        NamedThreadFactory factory = new NamedThreadFactory("trace-test");

        Thread first = factory.newThread(() -> { });
        Thread second = factory.newThread(() -> { });

        assertEquals("trace-test-1", first.getName());
        assertEquals("trace-test-2", second.getName());
        assertTrue(first.isDaemon());
        assertNotNull(first.getUncaughtExceptionHandler());
    }
}
