package com.trace.lifecycle.tracing;

import java.util.UUID;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Identifier generation for traces and spans.
 */
public final class Ids {

    private static final String TRACE_ID_PREFIX = "tr-";

    private Ids() {
        // Utility class
    }

    public static String newTraceId() {
        return TRACE_ID_PREFIX + UUID.randomUUID().toString().replace("-", "");
    }

    public static String newSpanId() {
        long id;
        do {
            id = ThreadLocalRandom.current().nextLong();
        } while (id == 0);
        return String.format("%016x", id);
    }
}
