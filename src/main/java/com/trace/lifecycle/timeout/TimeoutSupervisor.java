package com.trace.lifecycle.timeout;

import com.trace.lifecycle.core.model.TraceSnapshot;
import com.trace.lifecycle.logging.LogContext;
import com.trace.lifecycle.tracing.LiveTrace;
import com.trace.lifecycle.tracing.TraceRegistry;
import com.trace.lifecycle.util.NamedThreadFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Single background loop that force-closes traces exceeding the configured timeout.
 *
 * <p>The loop is started lazily by {@link #ensureStarted()} when a trace is created.
 * Every check interval it scans the {@link TraceRegistry}; each trace older than the
 * timeout is expired through {@link LiveTrace#expire}, which wins or loses the race
 * against the application closing the root span. Only the winner hands a snapshot to
 * the {@link ExpiredTraceHandler}.</p>
 *
 * <p>The loop exits after the registry stayed empty for the idle grace period and is
 * started again by the next {@link #ensureStarted()}. The instrumented application is
 * never interrupted; only the trace record is marked failed.</p>
 */
public class TimeoutSupervisor {
    private static final Logger log = LoggerFactory.getLogger(TimeoutSupervisor.class);

    private final TraceRegistry registry;
    private final Duration timeout;
    private final Duration checkInterval;
    private final Duration idleGracePeriod;
    private final ExpiredTraceHandler handler;
    private final Clock clock;
    private final NamedThreadFactory threadFactory = new NamedThreadFactory("trace-timeout-supervisor");

    private boolean running;
    private boolean stopped;
    private Thread thread;

    public TimeoutSupervisor(TraceRegistry registry, Duration timeout, Duration checkInterval,
                             Duration idleGracePeriod, ExpiredTraceHandler handler, Clock clock) {
        if (timeout == null || timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("timeout must be > 0");
        }
        if (checkInterval == null || checkInterval.isNegative() || checkInterval.isZero()) {
            throw new IllegalArgumentException("checkInterval must be > 0");
        }
        if (idleGracePeriod == null || idleGracePeriod.isNegative()) {
            throw new IllegalArgumentException("idleGracePeriod must be >= 0");
        }
        this.registry = registry;
        this.timeout = timeout;
        this.checkInterval = checkInterval;
        this.idleGracePeriod = idleGracePeriod;
        this.handler = handler;
        this.clock = clock;
    }

    /**
     * Starts the loop if it is not running. Does nothing after {@link #stop()}.
     */
    public synchronized void ensureStarted() {
        if (running || stopped) {
            return;
        }
        running = true;
        thread = threadFactory.newThread(this::loop);
        thread.start();
        log.debug("Timeout supervisor started: timeout={}ms, checkInterval={}ms",
                timeout.toMillis(), checkInterval.toMillis());
    }

    /**
     * Stops the loop for good.
     */
    public void stop() {
        Thread current;
        synchronized (this) {
            stopped = true;
            running = false;
            current = thread;
            thread = null;
        }
        if (current != null) {
            current.interrupt();
            try {
                current.join(checkInterval.toMillis() + 1000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
    }

    public synchronized boolean isRunning() {
        return running;
    }

    public Duration getTimeout() {
        return timeout;
    }

    /**
     * Expires every registered trace older than the timeout.
     *
     * @return the number of traces this scan force-closed
     */
    public int scanOnce() {
        Instant now = clock.instant();
        int expired = 0;
        for (LiveTrace trace : registry.inProgress()) {
            if (!trace.isInProgress() || !trace.hasExceeded(timeout, now)) {
                continue;
            }
            try (LogContext ctx = LogContext.forTimeout(trace.getTraceId())) {
                Optional<TraceSnapshot> snapshot = trace.expire(now, timeout);
                if (snapshot.isPresent()) {
                    expired++;
                    log.warn("Trace {} exceeded timeout of {}ms; force-closed {} of {} spans",
                            trace.getTraceId(), timeout.toMillis(), trace.forceClosedSpanCount(), trace.spanCount());
                    handler.onExpired(trace, snapshot.get());
                }
            } catch (RuntimeException e) {
                log.error("Failed to expire trace {}", trace.getTraceId(), e);
            }
        }
        return expired;
    }

    private void loop() {
        Instant idleSince = null;
        while (isRunning()) {
            try {
                Thread.sleep(checkInterval.toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
            scanOnce();

            if (!registry.isEmpty()) {
                idleSince = null;
                continue;
            }
            Instant now = clock.instant();
            if (idleSince == null) {
                idleSince = now;
            }
            if (Duration.between(idleSince, now).compareTo(idleGracePeriod) >= 0 && exitIfIdle()) {
                log.debug("Timeout supervisor idle for {}ms, stopping", idleGracePeriod.toMillis());
                return;
            }
        }
    }

    private synchronized boolean exitIfIdle() {
        if (!registry.isEmpty()) {
            return false;
        }
        running = false;
        thread = null;
        return true;
    }
}
