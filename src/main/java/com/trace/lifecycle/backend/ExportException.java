package com.trace.lifecycle.backend;

/**
 * Failure reported by a {@link TraceBackend} while persisting a trace.
 *
 * <p>Retryable failures (backend unreachable, 5xx, throttling) are retried with backoff.
 * Non-retryable failures (malformed payload, authentication) discard the task immediately.</p>
 */
public class ExportException extends Exception {

    private final boolean retryable;

    public ExportException(String message, boolean retryable) {
        super(message);
        this.retryable = retryable;
    }

    public ExportException(String message, boolean retryable, Throwable cause) {
        super(message, cause);
        this.retryable = retryable;
    }

    public static ExportException retryable(String message, Throwable cause) {
        return new ExportException(message, true, cause);
    }

    public static ExportException nonRetryable(String message, Throwable cause) {
        return new ExportException(message, false, cause);
    }

    public boolean isRetryable() {
        return retryable;
    }
}
