package com.trace.lifecycle.tracing;

/**
 * Callback used by {@link LiveSpan#close()} to route the close through the owning tracer,
 * so the context stack and trace completion are handled in one place.
 */
@FunctionalInterface
public interface SpanLifecycle {

    void onClose(LiveSpan span);
}
