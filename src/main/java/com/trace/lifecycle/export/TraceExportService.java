package com.trace.lifecycle.export;

import com.trace.lifecycle.backend.TraceBackend;
import com.trace.lifecycle.core.model.TraceSnapshot;
import com.trace.lifecycle.metrics.TracingMetrics;
import com.trace.lifecycle.retry.RetryController;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Asynchronous export pipeline: bounded queue, worker pool and flush coordinator.
 *
 * <p>Workers are started lazily on the first submission. {@link #submit} never blocks
 * and never throws; a task that does not fit is dropped and counted.</p>
 *
 * <pre>
 * TraceExportService exports = new TraceExportService(backend, retryController, metrics, 1000, 10, clock);
 * exports.submit(snapshot);
 * boolean drained = exports.flush(Duration.ofSeconds(5));
 * exports.close(Duration.ofSeconds(10));
 * </pre>
 */
public class TraceExportService implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(TraceExportService.class);

    private static final Duration WORKER_STOP_TIMEOUT = Duration.ofSeconds(1);

    private final FlushCoordinator flushCoordinator;
    private final ExportQueue queue;
    private final ExportWorkerPool workerPool;
    private final Clock clock;
    private final Duration defaultShutdownTimeout;
    private final AtomicBoolean started = new AtomicBoolean(false);
    private final AtomicBoolean closed = new AtomicBoolean(false);

    public TraceExportService(TraceBackend backend, RetryController retryController, TracingMetrics metrics,
                              int queueCapacity, int workerCount, Clock clock) {
        this(backend, retryController, metrics, queueCapacity, workerCount, clock, Duration.ofSeconds(10));
    }

    public TraceExportService(TraceBackend backend, RetryController retryController, TracingMetrics metrics,
                              int queueCapacity, int workerCount, Clock clock, Duration defaultShutdownTimeout) {
        this.flushCoordinator = new FlushCoordinator();
        this.queue = new ExportQueue(queueCapacity, flushCoordinator, metrics);
        this.workerPool = new ExportWorkerPool(queue, backend, retryController, flushCoordinator,
                metrics, workerCount, clock);
        this.clock = clock;
        this.defaultShutdownTimeout = defaultShutdownTimeout;
    }

    /**
     * Queues a finished trace for export.
     *
     * @return false if the trace was dropped
     */
    public boolean submit(TraceSnapshot trace) {
        ExportTask task = new ExportTask(trace, clock.instant());
        if (closed.get()) {
            log.warn("Export service closed, dropping trace {}", task.traceId());
            queue.recordDrop(task);
            return false;
        }
        boolean accepted = queue.offer(task);
        ensureStarted();
        return accepted;
    }

    /**
     * Blocks until every queued and in-flight task finished, or {@code deadline} elapsed.
     *
     * @return true if the pipeline drained completely
     */
    public boolean flush(Duration deadline) {
        if (flushCoordinator.outstanding() > 0 && !closed.get()) {
            ensureStarted();
        }
        boolean drained = flushCoordinator.awaitDrain(deadline);
        if (!drained) {
            log.warn("Flush deadline of {}ms elapsed with {} export tasks outstanding",
                    deadline.toMillis(), flushCoordinator.outstanding());
        }
        return drained;
    }

    /**
     * Stops accepting tasks, drains for at most {@code deadline}, then stops the workers.
     * Exports still in flight afterwards keep running in the background.
     *
     * @return true if the pipeline drained before the deadline
     */
    public boolean close(Duration deadline) {
        if (!closed.compareAndSet(false, true)) {
            return flushCoordinator.outstanding() == 0;
        }
        boolean drained = true;
        if (started.get()) {
            drained = flushCoordinator.awaitDrain(deadline);
            if (!drained) {
                log.warn("Export service closing with {} tasks outstanding after {}ms",
                        flushCoordinator.outstanding(), deadline.toMillis());
            }
            workerPool.stop(WORKER_STOP_TIMEOUT);
        }
        log.info("Export service closed: exported={}, failed={}, dropped={}",
                workerPool.exportedCount(), workerPool.failedCount(), queue.droppedCount());
        return drained;
    }

    @Override
    public void close() {
        close(defaultShutdownTimeout);
    }

    public boolean isClosed() {
        return closed.get();
    }

    public boolean isStarted() {
        return started.get();
    }

    public ExportStats stats() {
        return new ExportStats(
                queue.size(),
                queue.capacity(),
                workerPool.activeWorkers(),
                workerPool.workerCount(),
                queue.acceptedCount(),
                queue.droppedCount(),
                workerPool.exportedCount(),
                workerPool.failedCount(),
                flushCoordinator.outstanding()
        );
    }

    private void ensureStarted() {
        if (started.compareAndSet(false, true)) {
            workerPool.start();
        }
    }
}
