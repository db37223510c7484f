package com.trace.lifecycle.backend;

import com.trace.lifecycle.core.model.TraceSnapshot;

/**
 * Remote store that finished traces are exported to.
 *
 * <p>{@link #persistTrace} is called only by export workers. Tag operations are called
 * synchronously by the application for traces that already left the export pipeline,
 * and may reach the backend before the trace itself does, so implementations should
 * accept tags for traces they have not seen yet.</p>
 */
public interface TraceBackend {

    /**
     * Persists a finished trace with its full span tree.
     *
     * @throws ExportException if the trace could not be stored
     */
    void persistTrace(TraceSnapshot trace) throws ExportException;

    void setTraceTag(String traceId, String key, String value);

    void deleteTraceTag(String traceId, String key);

    /**
     * Returns a short name used in logs.
     */
    String getName();
}
