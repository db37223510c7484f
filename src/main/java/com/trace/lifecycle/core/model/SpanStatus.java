package com.trace.lifecycle.core.model;

/**
 * Completion status of a single span.
 */
public enum SpanStatus {
    /**
     * No status recorded yet.
     */
    UNSET,

    /**
     * The operation completed successfully.
     */
    OK,

    /**
     * The operation failed, or was force-closed.
     */
    ERROR
}
