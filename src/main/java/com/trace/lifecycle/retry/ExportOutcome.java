package com.trace.lifecycle.retry;

/**
 * Final result of exporting one task.
 */
public enum ExportOutcome {
    SUCCEEDED,
    DISCARDED_NON_RETRYABLE,
    DISCARDED_RETRY_TIMEOUT,
    ABANDONED
}
