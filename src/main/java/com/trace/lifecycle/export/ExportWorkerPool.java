package com.trace.lifecycle.export;

import com.trace.lifecycle.backend.TraceBackend;
import com.trace.lifecycle.logging.LogContext;
import com.trace.lifecycle.metrics.TracingMetrics;
import com.trace.lifecycle.retry.ExportOutcome;
import com.trace.lifecycle.retry.RetryController;
import com.trace.lifecycle.util.NamedThreadFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Fixed pool of workers draining an {@link ExportQueue} into a {@link TraceBackend}.
 *
 * <p>Each worker takes one task, runs it to completion through the {@link RetryController}
 * (retries included) and only then polls for the next one. Order is FIFO per worker;
 * there is no ordering across workers.</p>
 *
 * <p>Stopping the pool does not interrupt a task in flight: workers finish their
 * current task in the background and then exit.</p>
 */
public class ExportWorkerPool {
    private static final Logger log = LoggerFactory.getLogger(ExportWorkerPool.class);

    private static final long POLL_INTERVAL_MS = 100;

    private final ExportQueue queue;
    private final TraceBackend backend;
    private final RetryController retryController;
    private final FlushCoordinator flushCoordinator;
    private final TracingMetrics metrics;
    private final int workerCount;
    private final Clock clock;

    private final AtomicInteger activeWorkers = new AtomicInteger(0);
    private final AtomicLong exported = new AtomicLong(0);
    private final AtomicLong failed = new AtomicLong(0);
    private volatile boolean running;
    private ExecutorService executor;

    public ExportWorkerPool(ExportQueue queue, TraceBackend backend, RetryController retryController,
                            FlushCoordinator flushCoordinator, TracingMetrics metrics,
                            int workerCount, Clock clock) {
        if (workerCount <= 0) {
            throw new IllegalArgumentException("workerCount must be > 0");
        }
        this.queue = queue;
        this.backend = backend;
        this.retryController = retryController;
        this.flushCoordinator = flushCoordinator;
        this.metrics = metrics;
        this.workerCount = workerCount;
        this.clock = clock;
    }

    public synchronized void start() {
        if (executor != null) {
            return;
        }
        running = true;
        executor = Executors.newFixedThreadPool(workerCount, new NamedThreadFactory("trace-export-worker"));
        for (int i = 0; i < workerCount; i++) {
            executor.execute(this::workLoop);
        }
        log.info("Export worker pool started: workers={}, backend={}", workerCount, backend.getName());
    }

    /**
     * Stops polling for new tasks and waits up to {@code timeout} for workers to exit.
     *
     * @return true if every worker exited in time
     */
    public synchronized boolean stop(Duration timeout) {
        if (executor == null) {
            return true;
        }
        running = false;
        executor.shutdown();
        try {
            boolean terminated = executor.awaitTermination(timeout.toMillis(), TimeUnit.MILLISECONDS);
            if (!terminated) {
                log.warn("Export workers still busy after {}ms; in-flight exports continue in the background",
                        timeout.toMillis());
            }
            return terminated;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    public boolean isRunning() {
        return running;
    }

    public int activeWorkers() {
        return activeWorkers.get();
    }

    public int workerCount() {
        return workerCount;
    }

    public long exportedCount() {
        return exported.get();
    }

    public long failedCount() {
        return failed.get();
    }

    private void workLoop() {
        while (running) {
            ExportTask task;
            try {
                task = queue.poll(POLL_INTERVAL_MS, TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
            if (task != null) {
                process(task);
            }
        }
        log.debug("Export worker {} exited", Thread.currentThread().getName());
    }

    void process(ExportTask task) {
        activeWorkers.incrementAndGet();
        try (LogContext ctx = LogContext.forExport(task.traceId()).with("backend", backend.getName())) {
            ExportOutcome outcome = retryController.execute(task.traceId(),
                    () -> backend.persistTrace(task.trace()));
            if (outcome == ExportOutcome.SUCCEEDED) {
                exported.incrementAndGet();
                metrics.recordExportSucceeded(Duration.between(task.enqueuedAt(), clock.instant()));
                log.debug("Trace {} exported to {}", task.traceId(), backend.getName());
            } else {
                failed.incrementAndGet();
            }
        } finally {
            activeWorkers.decrementAndGet();
            flushCoordinator.taskFinished();
        }
    }
}
