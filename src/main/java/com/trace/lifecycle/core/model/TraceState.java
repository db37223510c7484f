package com.trace.lifecycle.core.model;

/**
 * Lifecycle state of a trace. Transitions are monotonic:
 * {@code IN_PROGRESS -> OK} or {@code IN_PROGRESS -> ERROR}, never reversed.
 */
public enum TraceState {
    IN_PROGRESS,
    OK,
    ERROR;

    public boolean isTerminal() {
        return this != IN_PROGRESS;
    }
}
