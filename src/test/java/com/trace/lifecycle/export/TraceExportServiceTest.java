package com.trace.lifecycle.export;

import com.trace.lifecycle.backend.ExportException;
import com.trace.lifecycle.backend.InMemoryTraceBackend;
import com.trace.lifecycle.backend.TraceBackend;
import com.trace.lifecycle.core.model.TraceSnapshot;
import com.trace.lifecycle.metrics.NoOpTracingMetrics;
import com.trace.lifecycle.metrics.TracingMetrics;
import com.trace.lifecycle.retry.BackoffPolicy;
import com.trace.lifecycle.retry.RetryController;
import com.trace.lifecycle.util.TestTraces;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@DisplayName("Export pipeline Tests")
class TraceExportServiceTest {

    private final TracingMetrics metrics = new NoOpTracingMetrics();
    private TraceExportService service;

    @AfterEach
    void tearDown() {
        if (service != null) {
            service.close(Duration.ofSeconds(1));
        }
    }

    private RetryController fastRetries(Duration budget) {
        return new RetryController(BackoffPolicy.exponential(Duration.ofMillis(10), 2.0, 0.0), budget, metrics);
    }

    @Nested
    @DisplayName("Worker pool")
    class WorkerPoolTests {

        @Test
        @DisplayName("Capacity 2 with stalled workers: 3 submissions give 2 deliveries and 1 drop")
        void stalledWorkersScenario() throws Exception {
            FlushCoordinator flush = new FlushCoordinator();
            ExportQueue queue = new ExportQueue(2, flush, metrics);
            InMemoryTraceBackend backend = new InMemoryTraceBackend();
            ExportWorkerPool pool = new ExportWorkerPool(queue, backend, fastRetries(Duration.ofSeconds(1)),
                    flush, metrics, 2, Clock.systemUTC());

            assertTrue(queue.offer(new ExportTask(TestTraces.finished("tr-1"), Instant.now())));
            assertTrue(queue.offer(new ExportTask(TestTraces.finished("tr-2"), Instant.now())));
            assertFalse(queue.offer(new ExportTask(TestTraces.finished("tr-3"), Instant.now())));

            pool.start();
            try {
                assertTrue(flush.awaitDrain(Duration.ofSeconds(5)));
                assertEquals(2, backend.size());
                assertEquals(1, queue.droppedCount());
                assertTrue(backend.getTrace("tr-3").isEmpty());
                assertEquals(2, pool.exportedCount());
            } finally {
                pool.stop(Duration.ofSeconds(1));
            }
        }

        @Test
        @DisplayName("Workers should finish their task and exit after stop")
        void stopEndsWorkers() {
            FlushCoordinator flush = new FlushCoordinator();
            ExportQueue queue = new ExportQueue(10, flush, metrics);
            ExportWorkerPool pool = new ExportWorkerPool(queue, new InMemoryTraceBackend(),
                    fastRetries(Duration.ofSeconds(1)), flush, metrics, 3, Clock.systemUTC());

            pool.start();
            assertTrue(pool.isRunning());
            assertTrue(pool.stop(Duration.ofSeconds(2)));
            assertFalse(pool.isRunning());
        }

        @Test
        @DisplayName("Worker count must be positive")
        void invalidWorkerCount() {
            FlushCoordinator flush = new FlushCoordinator();
            assertThrows(IllegalArgumentException.class, () -> new ExportWorkerPool(
                    new ExportQueue(1, flush, metrics), new InMemoryTraceBackend(),
                    fastRetries(Duration.ZERO), flush, metrics, 0, Clock.systemUTC()));
        }

        @Test
        @DisplayName("Backend calls should run with the trace and backend in the MDC")
        void exportLogContext() {
            Map<String, String> seen = new ConcurrentHashMap<>();
            InMemoryTraceBackend backend = new InMemoryTraceBackend() {
                @Override
                public void persistTrace(TraceSnapshot trace) {
                    seen.putAll(MDC.getCopyOfContextMap());
                    super.persistTrace(trace);
                }
            };
            FlushCoordinator flush = new FlushCoordinator();
            ExportQueue queue = new ExportQueue(1, flush, metrics);
            ExportWorkerPool pool = new ExportWorkerPool(queue, backend, fastRetries(Duration.ofSeconds(1)),
                    flush, metrics, 1, Clock.systemUTC());

            pool.process(new ExportTask(TestTraces.finished("tr-1"), Instant.now()));

            assertEquals("tr-1", seen.get("traceId"));
            assertEquals("export", seen.get("operation"));
            assertEquals("in-memory", seen.get("backend"));
            assertNull(MDC.get("backend"));
            assertEquals(1, pool.exportedCount());
        }
    }

    @Nested
    @DisplayName("TraceExportService")
    class ServiceTests {

        @Test
        @DisplayName("Submitted traces should reach the backend and flush should report drain")
        void submitAndFlush() {
            InMemoryTraceBackend backend = new InMemoryTraceBackend();
            service = new TraceExportService(backend, fastRetries(Duration.ofSeconds(1)), metrics,
                    100, 4, Clock.systemUTC());

            for (int i = 0; i < 20; i++) {
                assertTrue(service.submit(TestTraces.finished("tr-" + i)));
            }

            assertTrue(service.flush(Duration.ofSeconds(5)));
            assertEquals(20, backend.size());
            ExportStats stats = service.stats();
            assertEquals(20, stats.accepted());
            assertEquals(20, stats.exported());
            assertEquals(0, stats.outstanding());
            assertEquals(0, stats.queueSize());
        }

        @Test
        @DisplayName("Flush should return false while a worker is mid-task, true once it finishes")
        void flushWithBusyWorker() throws Exception {
            BlockingBackend backend = new BlockingBackend();
            service = new TraceExportService(backend, fastRetries(Duration.ofSeconds(1)), metrics,
                    2, 1, Clock.systemUTC());

            service.submit(TestTraces.finished("tr-1"));
            assertTrue(backend.awaitFirstWrite());
            assertTrue(service.submit(TestTraces.finished("tr-2")));
            assertTrue(service.submit(TestTraces.finished("tr-3")));
            assertFalse(service.submit(TestTraces.finished("tr-4")));

            assertFalse(service.flush(Duration.ofMillis(200)));
            assertEquals(1, service.stats().activeWorkers());
            assertEquals(3, service.stats().outstanding());

            backend.release();
            assertTrue(service.flush(Duration.ofSeconds(5)));
            assertEquals(3, backend.size());
            assertEquals(1, service.stats().dropped());
        }

        @Test
        @DisplayName("Non-retryable failure should be persisted zero times and counted as failed")
        void nonRetryableFailure() throws Exception {
            TraceBackend backend = mock(TraceBackend.class);
            when(backend.getName()).thenReturn("mock");
            doThrow(ExportException.nonRetryable("400 bad payload", null)).when(backend).persistTrace(any());
            service = new TraceExportService(backend, fastRetries(Duration.ofSeconds(1)), metrics,
                    10, 1, Clock.systemUTC());

            service.submit(TestTraces.finished("tr-1"));

            assertTrue(service.flush(Duration.ofSeconds(5)));
            verify(backend, times(1)).persistTrace(any());
            assertEquals(1, service.stats().failed());
        }

        @Test
        @DisplayName("Retryable failures should be retried until the backend recovers, persisting once")
        void retryableRecovers() throws Exception {
            AtomicInteger attempts = new AtomicInteger();
            InMemoryTraceBackend delegate = new InMemoryTraceBackend();
            TraceBackend flaky = new TraceBackend() {
                @Override
                public void persistTrace(TraceSnapshot trace) throws ExportException {
                    if (attempts.incrementAndGet() < 3) {
                        throw ExportException.retryable("503", null);
                    }
                    delegate.persistTrace(trace);
                }

                @Override
                public void setTraceTag(String traceId, String key, String value) {
                }

                @Override
                public void deleteTraceTag(String traceId, String key) {
                }

                @Override
                public String getName() {
                    return "flaky";
                }
            };
            service = new TraceExportService(flaky, fastRetries(Duration.ofSeconds(5)), metrics,
                    10, 1, Clock.systemUTC());

            service.submit(TestTraces.finished("tr-1"));

            assertTrue(service.flush(Duration.ofSeconds(5)));
            assertEquals(3, attempts.get());
            assertEquals(1, delegate.persistCount("tr-1"));
        }

        @Test
        @DisplayName("Submissions after close should be dropped")
        void submitAfterClose() {
            InMemoryTraceBackend backend = new InMemoryTraceBackend();
            service = new TraceExportService(backend, fastRetries(Duration.ofSeconds(1)), metrics,
                    10, 1, Clock.systemUTC());

            assertTrue(service.close(Duration.ofSeconds(1)));
            assertTrue(service.isClosed());
            assertFalse(service.submit(TestTraces.finished("tr-1")));
            assertEquals(1, service.stats().dropped());
            assertEquals(0, backend.size());
        }

        @Test
        @DisplayName("Workers should start lazily on the first submission")
        void lazyStart() {
            service = new TraceExportService(new InMemoryTraceBackend(), fastRetries(Duration.ofSeconds(1)),
                    metrics, 10, 1, Clock.systemUTC());

            assertFalse(service.isStarted());
            service.submit(TestTraces.finished("tr-1"));
            assertTrue(service.isStarted());
        }
    }
}
