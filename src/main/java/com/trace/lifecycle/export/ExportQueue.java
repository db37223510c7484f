package com.trace.lifecycle.export;

import com.trace.lifecycle.metrics.TracingMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Bounded multi-producer/multi-consumer queue of {@link ExportTask}s.
 *
 * <p>Publishing never blocks the calling thread: when the queue is full the new task
 * is dropped, the drop counter is incremented and a warning is logged at most once
 * per {@link #WARNING_INTERVAL}.</p>
 */
public class ExportQueue {
    private static final Logger log = LoggerFactory.getLogger(ExportQueue.class);

    static final Duration WARNING_INTERVAL = Duration.ofSeconds(60);

    private final int capacity;
    private final BlockingQueue<ExportTask> queue;
    private final FlushCoordinator flushCoordinator;
    private final TracingMetrics metrics;
    private final AtomicLong dropped = new AtomicLong(0);
    private final AtomicLong accepted = new AtomicLong(0);
    private final AtomicLong lastWarningNanos = new AtomicLong(Long.MIN_VALUE);

    public ExportQueue(int capacity, FlushCoordinator flushCoordinator, TracingMetrics metrics) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be > 0");
        }
        this.capacity = capacity;
        this.queue = new ArrayBlockingQueue<>(capacity);
        this.flushCoordinator = flushCoordinator;
        this.metrics = metrics;
    }

    /**
     * Offers a task without blocking.
     *
     * @return false if the task was dropped because the queue is full
     */
    public boolean offer(ExportTask task) {
        flushCoordinator.taskAccepted();
        if (queue.offer(task)) {
            accepted.incrementAndGet();
            return true;
        }
        flushCoordinator.taskFinished();
        recordDrop(task);
        return false;
    }

    /**
     * Records a task that could not be queued at all.
     */
    void recordDrop(ExportTask task) {
        long total = dropped.incrementAndGet();
        metrics.incrementExportDropped();
        warnRateLimited(task, total);
    }

    /**
     * Waits up to {@code timeout} for the next task.
     */
    public ExportTask poll(long timeout, TimeUnit unit) throws InterruptedException {
        return queue.poll(timeout, unit);
    }

    public int size() {
        return queue.size();
    }

    public int capacity() {
        return capacity;
    }

    public int remainingCapacity() {
        return queue.remainingCapacity();
    }

    public long droppedCount() {
        return dropped.get();
    }

    public long acceptedCount() {
        return accepted.get();
    }

    private void warnRateLimited(ExportTask task, long total) {
        long now = System.nanoTime();
        long last = lastWarningNanos.get();
        boolean due = last == Long.MIN_VALUE || now - last >= WARNING_INTERVAL.toNanos();
        if (due && lastWarningNanos.compareAndSet(last, now)) {
            log.warn("Export queue full (capacity={}), dropping trace {}. {} traces dropped so far",
                    capacity, task.traceId(), total);
        } else {
            log.debug("Export queue full, dropping trace {}", task.traceId());
        }
    }
}
