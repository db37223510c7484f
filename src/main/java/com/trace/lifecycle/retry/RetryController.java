package com.trace.lifecycle.retry;

import com.trace.lifecycle.backend.ExportException;
import com.trace.lifecycle.metrics.TracingMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.function.LongSupplier;

/**
 * Runs one export attempt loop for a single task.
 *
 * <ul>
 *   <li>Success ends the loop.</li>
 *   <li>A non-retryable {@link ExportException}, or any unexpected runtime exception,
 *       discards the task at once without consuming the retry budget.</li>
 *   <li>A retryable failure waits the next backoff delay and tries again, until the time
 *       elapsed since the first attempt reaches the retry timeout; the task is then discarded.</li>
 *   <li>Interruption while waiting (shutdown) abandons the task and restores the interrupt flag.</li>
 * </ul>
 *
 * <p>Failures are logged and counted; nothing is rethrown.</p>
 */
public class RetryController {
    private static final Logger log = LoggerFactory.getLogger(RetryController.class);

    /**
     * One export attempt.
     */
    @FunctionalInterface
    public interface Attempt {
        void run() throws ExportException;
    }

    /**
     * Waits between attempts.
     */
    @FunctionalInterface
    public interface Sleeper {
        void sleep(Duration duration) throws InterruptedException;
    }

    private final BackoffPolicy backoff;
    private final Duration retryTimeout;
    private final TracingMetrics metrics;
    private final Sleeper sleeper;
    private final LongSupplier nanoTime;

    public RetryController(BackoffPolicy backoff, Duration retryTimeout, TracingMetrics metrics) {
        this(backoff, retryTimeout, metrics, d -> Thread.sleep(d.toMillis(), d.toNanosPart() % 1_000_000),
                System::nanoTime);
    }

    RetryController(BackoffPolicy backoff, Duration retryTimeout, TracingMetrics metrics,
                    Sleeper sleeper, LongSupplier nanoTime) {
        if (retryTimeout == null || retryTimeout.isNegative()) {
            throw new IllegalArgumentException("retryTimeout must be >= 0");
        }
        this.backoff = backoff;
        this.retryTimeout = retryTimeout;
        this.metrics = metrics;
        this.sleeper = sleeper;
        this.nanoTime = nanoTime;
    }

    /**
     * @param traceId trace being exported, for logging
     * @param attempt the export call
     */
    public ExportOutcome execute(String traceId, Attempt attempt) {
        long start = nanoTime.getAsLong();
        int attempts = 0;

        while (true) {
            attempts++;
            try {
                attempt.run();
                if (attempts > 1) {
                    log.info("Trace {} exported after {} attempts", traceId, attempts);
                }
                return ExportOutcome.SUCCEEDED;
            } catch (ExportException e) {
                if (!e.isRetryable()) {
                    log.warn("Discarding trace {}: non-retryable export failure: {}", traceId, e.getMessage());
                    metrics.incrementExportFailed("non_retryable");
                    return ExportOutcome.DISCARDED_NON_RETRYABLE;
                }
                log.debug("Retryable export failure for trace {} (attempt {}): {}",
                        traceId, attempts, e.getMessage());
            } catch (RuntimeException e) {
                log.error("Discarding trace {}: unexpected export error", traceId, e);
                metrics.incrementExportFailed("non_retryable");
                return ExportOutcome.DISCARDED_NON_RETRYABLE;
            }

            Duration elapsed = Duration.ofNanos(nanoTime.getAsLong() - start);
            if (elapsed.compareTo(retryTimeout) >= 0) {
                log.warn("Discarding trace {}: retry timeout of {}s exceeded after {} attempts",
                        traceId, retryTimeout.toSeconds(), attempts);
                metrics.incrementExportFailed("retry_timeout");
                return ExportOutcome.DISCARDED_RETRY_TIMEOUT;
            }

            Duration delay = backoff.delayFor(attempts - 1);
            metrics.incrementExportRetried();
            try {
                sleeper.sleep(delay);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Abandoning export of trace {} after {} attempts: interrupted", traceId, attempts);
                metrics.incrementExportFailed("abandoned");
                return ExportOutcome.ABANDONED;
            }
        }
    }

    public Duration getRetryTimeout() {
        return retryTimeout;
    }
}
