package com.trace.lifecycle.export;

import com.trace.lifecycle.core.model.TraceSnapshot;

import java.time.Instant;

/**
 * Finished trace queued for delivery. Never mutated once created.
 *
 * @param trace      snapshot of the trace and its span tree
 * @param enqueuedAt time the task was created
 */
public record ExportTask(TraceSnapshot trace, Instant enqueuedAt) {

    public ExportTask {
        if (trace == null) {
            throw new IllegalArgumentException("trace must not be null");
        }
    }

    public String traceId() {
        return trace.traceId();
    }
}
