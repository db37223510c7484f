package com.trace.lifecycle.timeout;

import com.trace.lifecycle.core.model.TraceSnapshot;
import com.trace.lifecycle.tracing.LiveTrace;

/**
 * Receives the snapshot of a trace the supervisor force-closed.
 * Called at most once per trace, on the supervisor thread.
 */
@FunctionalInterface
public interface ExpiredTraceHandler {

    void onExpired(LiveTrace trace, TraceSnapshot snapshot);
}
