package com.trace.lifecycle.retry;

import com.trace.lifecycle.backend.ExportException;
import com.trace.lifecycle.metrics.TracingMetrics;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@DisplayName("RetryController Tests")
class RetryControllerTest {

    private TracingMetrics metrics;
    private AtomicLong fakeNanos;
    private List<Duration> sleeps;
    private RetryController controller;

    @BeforeEach
    void setUp() {
        metrics = mock(TracingMetrics.class);
        fakeNanos = new AtomicLong(0);
        sleeps = new ArrayList<>();
        BackoffPolicy backoff = new BackoffPolicy(Duration.ofSeconds(1), 2.0, 0.0, () -> 0.0);
        controller = new RetryController(backoff, Duration.ofSeconds(10), metrics,
                delay -> {
                    sleeps.add(delay);
                    fakeNanos.addAndGet(delay.toNanos());
                },
                fakeNanos::get);
    }

    @Test
    @DisplayName("Success on first attempt should not retry")
    void successFirstAttempt() {
        AtomicInteger calls = new AtomicInteger();

        ExportOutcome outcome = controller.execute("tr-1", calls::incrementAndGet);

        assertEquals(ExportOutcome.SUCCEEDED, outcome);
        assertEquals(1, calls.get());
        assertTrue(sleeps.isEmpty());
        verifyNoInteractions(metrics);
    }

    @Test
    @DisplayName("Retryable failures should back off until a later success")
    void retryThenSucceed() {
        AtomicInteger calls = new AtomicInteger();

        ExportOutcome outcome = controller.execute("tr-1", () -> {
            if (calls.incrementAndGet() < 3) {
                throw ExportException.retryable("503", null);
            }
        });

        assertEquals(ExportOutcome.SUCCEEDED, outcome);
        assertEquals(3, calls.get());
        assertEquals(List.of(Duration.ofSeconds(1), Duration.ofSeconds(2)), sleeps);
        verify(metrics, times(2)).incrementExportRetried();
        verify(metrics, never()).incrementExportFailed(anyString());
    }

    @Test
    @DisplayName("Retryable failures should be discarded exactly once when the budget is spent")
    void discardAfterRetryTimeout() {
        AtomicInteger calls = new AtomicInteger();

        ExportOutcome outcome = controller.execute("tr-1", () -> {
            calls.incrementAndGet();
            throw ExportException.retryable("connection refused", null);
        });

        assertEquals(ExportOutcome.DISCARDED_RETRY_TIMEOUT, outcome);
        // 1 + 2 + 4 + 8 = 15s >= 10s budget after the fifth attempt
        assertEquals(5, calls.get());
        assertEquals(List.of(Duration.ofSeconds(1), Duration.ofSeconds(2),
                Duration.ofSeconds(4), Duration.ofSeconds(8)), sleeps);
        for (int i = 1; i < sleeps.size(); i++) {
            assertTrue(sleeps.get(i).compareTo(sleeps.get(i - 1)) > 0);
        }
        verify(metrics, times(1)).incrementExportFailed("retry_timeout");
    }

    @Test
    @DisplayName("Non-retryable failure should discard immediately without backoff")
    void nonRetryableDiscardsImmediately() {
        AtomicInteger calls = new AtomicInteger();

        ExportOutcome outcome = controller.execute("tr-1", () -> {
            calls.incrementAndGet();
            throw ExportException.nonRetryable("401 unauthorized", null);
        });

        assertEquals(ExportOutcome.DISCARDED_NON_RETRYABLE, outcome);
        assertEquals(1, calls.get());
        assertTrue(sleeps.isEmpty());
        verify(metrics).incrementExportFailed("non_retryable");
    }

    @Test
    @DisplayName("Unexpected runtime exceptions should be treated as non-retryable")
    void runtimeExceptionIsNonRetryable() {
        ExportOutcome outcome = controller.execute("tr-1", () -> {
            throw new IllegalStateException("bug in backend");
        });

        assertEquals(ExportOutcome.DISCARDED_NON_RETRYABLE, outcome);
        assertTrue(sleeps.isEmpty());
    }

    @Test
    @DisplayName("Interrupted backoff should abandon the task and keep the interrupt flag")
    void interruptAbandons() {
        RetryController interrupting = new RetryController(BackoffPolicy.defaults(), Duration.ofSeconds(10),
                metrics,
                delay -> {
                    throw new InterruptedException("shutdown");
                },
                System::nanoTime);
        try {
            ExportOutcome outcome = interrupting.execute("tr-1", () -> {
                throw ExportException.retryable("503", null);
            });

            assertEquals(ExportOutcome.ABANDONED, outcome);
            assertTrue(Thread.currentThread().isInterrupted());
            verify(metrics).incrementExportFailed("abandoned");
        } finally {
            Thread.interrupted();
        }
    }

    @Test
    @DisplayName("Negative retry timeout should be rejected")
    void negativeTimeout() {
        assertThrows(IllegalArgumentException.class,
                () -> new RetryController(BackoffPolicy.defaults(), Duration.ofSeconds(-1), metrics));
    }
}
