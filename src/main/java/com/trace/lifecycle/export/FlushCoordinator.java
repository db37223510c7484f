package com.trace.lifecycle.export;

import java.time.Duration;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Counts outstanding export tasks (queued or in flight) and lets callers wait for drain.
 *
 * <p>A task is counted before it is offered to the queue and released after a worker
 * finished it, retries included, so a zero count means the queue is empty and no
 * worker is mid-task.</p>
 */
public class FlushCoordinator {

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition drained = lock.newCondition();
    private long outstanding;

    public void taskAccepted() {
        lock.lock();
        try {
            outstanding++;
        } finally {
            lock.unlock();
        }
    }

    public void taskFinished() {
        lock.lock();
        try {
            if (outstanding > 0) {
                outstanding--;
            }
            if (outstanding == 0) {
                drained.signalAll();
            }
        } finally {
            lock.unlock();
        }
    }

    public long outstanding() {
        lock.lock();
        try {
            return outstanding;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Blocks until no task is outstanding or the deadline elapses.
     *
     * @return true if everything drained before the deadline
     */
    public boolean awaitDrain(Duration deadline) {
        long remaining = deadline.toNanos();
        lock.lock();
        try {
            while (outstanding > 0) {
                if (remaining <= 0) {
                    return false;
                }
                remaining = drained.awaitNanos(remaining);
            }
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return outstanding == 0;
        } finally {
            lock.unlock();
        }
    }

}
