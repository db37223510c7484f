package com.trace.lifecycle.context;

/**
 * Restores the previously attached context when closed.
 *
 * <pre>
 * TraceContext captured = tracer.captureContext();
 * executor.submit(() -&gt; {
 *     try (ContextScope scope = tracer.attach(captured)) {
 *         tracer.trace("child", this::work);
 *     }
 * });
 * </pre>
 */
@FunctionalInterface
public interface ContextScope extends AutoCloseable {

    @Override
    void close();
}
