package com.trace.lifecycle.tracing;

import com.trace.lifecycle.core.model.SpanSnapshot;
import com.trace.lifecycle.core.model.SpanStatus;
import com.trace.lifecycle.core.model.TraceSnapshot;
import com.trace.lifecycle.core.model.TraceState;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("LiveTrace Tests")
class LiveTraceTest {

    private static final Instant T0 = Instant.parse("2024-05-01T10:00:00Z");
    private static final SpanLifecycle NO_LIFECYCLE = span -> { };

    private LiveTrace trace;
    private LiveSpan root;

    @BeforeEach
    void setUp() {
        trace = new LiveTrace("tr-1", T0, "run-7");
        root = new LiveSpan("root", null, trace, "root", T0, NO_LIFECYCLE);
        trace.addSpan(root);
    }

    private LiveSpan child(String id, Instant start) {
        LiveSpan span = new LiveSpan(id, root.getSpanId(), trace, id, start, NO_LIFECYCLE);
        assertTrue(trace.addSpan(span));
        return span;
    }

    @Nested
    @DisplayName("Completion")
    class CompletionTests {

        @Test
        @DisplayName("Trace without ERROR spans should complete OK")
        void completesOk() {
            LiveSpan c = child("c1", T0.plusSeconds(1));
            c.end(T0.plusSeconds(2), null, "out");
            root.end(T0.plusSeconds(3), null, null);

            TraceSnapshot snapshot = trace.complete(T0.plusSeconds(3)).orElseThrow();

            assertEquals(TraceState.OK, snapshot.state());
            assertEquals(TraceState.OK, trace.getState());
            assertEquals("run-7", snapshot.runId());
            assertEquals(Duration.ofSeconds(3), snapshot.duration());
            assertEquals(SpanStatus.OK, snapshot.findSpan("c1").orElseThrow().status());
            assertEquals("out", snapshot.findSpan("c1").orElseThrow().outputs());
        }

        @Test
        @DisplayName("Any ERROR span should make the trace ERROR")
        void anyErrorSpanFailsTrace() {
            LiveSpan c = child("c1", T0);
            c.recordException(new IllegalStateException("boom"));
            c.end(T0.plusSeconds(1), null, null);
            root.end(T0.plusSeconds(2), null, null);

            TraceSnapshot snapshot = trace.complete(T0.plusSeconds(2)).orElseThrow();

            assertEquals(TraceState.ERROR, snapshot.state());
            SpanSnapshot failed = snapshot.findSpan("c1").orElseThrow();
            assertEquals(IllegalStateException.class.getName(), failed.attributes().get("exception.type"));
            assertEquals("boom", failed.attributes().get("exception.message"));
        }

        @Test
        @DisplayName("Second completion should be a no-op")
        void completeOnlyOnce() {
            root.end(T0.plusSeconds(1), null, null);
            assertTrue(trace.complete(T0.plusSeconds(1)).isPresent());
            assertTrue(trace.complete(T0.plusSeconds(2)).isEmpty());
        }

        @Test
        @DisplayName("Spans still open elsewhere should be closed with the root end time")
        void completeClosesStragglers() {
            LiveSpan straggler = child("c1", T0.plusSeconds(1));
            root.end(T0.plusSeconds(5), null, null);

            TraceSnapshot snapshot = trace.complete(T0.plusSeconds(5)).orElseThrow();

            assertFalse(straggler.isOpen());
            assertFalse(straggler.isForceClosed());
            assertEquals(0, trace.forceClosedSpanCount());
            assertEquals(T0.plusSeconds(5), snapshot.findSpan("c1").orElseThrow().endTime());
        }

        @Test
        @DisplayName("Spans cannot be added once the trace finished")
        void noSpansAfterFinish() {
            root.end(T0.plusSeconds(1), null, null);
            trace.complete(T0.plusSeconds(1));

            LiveSpan late = new LiveSpan("late", "root", trace, "late", T0.plusSeconds(2), NO_LIFECYCLE);
            assertFalse(trace.addSpan(late));
            assertEquals(1, trace.spanCount());
        }
    }

    @Nested
    @DisplayName("Expiry")
    class ExpiryTests {

        @Test
        @DisplayName("Expiry should force-close open spans with ERROR at detection time")
        void expireForceClosesOpenSpans() {
            LiveSpan done = child("done", T0.plusSeconds(1));
            done.end(T0.plusSeconds(2), null, null);
            LiveSpan running = child("running", T0.plusSeconds(3));

            Instant detectedAt = T0.plusSeconds(6);
            TraceSnapshot snapshot = trace.expire(detectedAt, Duration.ofSeconds(5)).orElseThrow();

            assertEquals(TraceState.ERROR, snapshot.state());
            assertEquals(detectedAt, snapshot.endedAt());
            assertTrue(running.isForceClosed());
            assertTrue(root.isForceClosed());
            assertFalse(done.isForceClosed());
            assertEquals(2, trace.forceClosedSpanCount());
            assertEquals(3, trace.spanCount());

            SpanSnapshot runningSnapshot = snapshot.findSpan("running").orElseThrow();
            assertEquals(SpanStatus.ERROR, runningSnapshot.status());
            assertEquals(detectedAt, runningSnapshot.endTime());
            assertEquals(TraceTimeoutException.class.getName(), runningSnapshot.attributes().get("exception.type"));
            assertEquals(SpanStatus.OK, snapshot.findSpan("done").orElseThrow().status());
        }

        @Test
        @DisplayName("hasExceeded should compare elapsed time strictly")
        void hasExceeded() {
            assertFalse(trace.hasExceeded(Duration.ofSeconds(5), T0.plusSeconds(5)));
            assertTrue(trace.hasExceeded(Duration.ofSeconds(5), T0.plusSeconds(5).plusMillis(1)));
        }

        @Test
        @DisplayName("Concurrent completion and expiry should produce exactly one snapshot")
        void completeAndExpireRace() throws Exception {
            ExecutorService executor = Executors.newFixedThreadPool(2);
            try {
                for (int i = 0; i < 200; i++) {
                    LiveTrace racing = new LiveTrace("tr-race-" + i, T0, null);
                    LiveSpan racingRoot = new LiveSpan("r" + i, null, racing, "root", T0, NO_LIFECYCLE);
                    racing.addSpan(racingRoot);
                    CountDownLatch start = new CountDownLatch(1);

                    Future<Optional<TraceSnapshot>> app = executor.submit(() -> {
                        start.await();
                        racingRoot.end(T0.plusSeconds(5), null, null);
                        return racing.complete(T0.plusSeconds(5));
                    });
                    Future<Optional<TraceSnapshot>> supervisor = executor.submit(() -> {
                        start.await();
                        return racing.expire(T0.plusSeconds(5), Duration.ofSeconds(4));
                    });
                    start.countDown();

                    List<TraceSnapshot> winners = new ArrayList<>();
                    app.get(5, TimeUnit.SECONDS).ifPresent(winners::add);
                    supervisor.get(5, TimeUnit.SECONDS).ifPresent(winners::add);

                    assertEquals(1, winners.size(), "exactly one of application and supervisor must win");
                    assertTrue(racing.getState().isTerminal());
                }
            } finally {
                executor.shutdownNow();
            }
        }
    }

    @Nested
    @DisplayName("Tags")
    class TagTests {

        @Test
        @DisplayName("Tag written before the snapshot should be exported")
        void tagBeforeSnapshotIncluded() {
            assertTrue(trace.setTag("env", "prod"));
            assertTrue(trace.setTags(Map.of("team", "search")));
            root.end(T0.plusSeconds(1), null, null);

            TraceSnapshot snapshot = trace.complete(T0.plusSeconds(1)).orElseThrow();

            assertEquals(Optional.of("prod"), snapshot.tag("env"));
            assertEquals(Optional.of("search"), snapshot.tag("team"));
        }

        @Test
        @DisplayName("Tag written after the snapshot should be rejected")
        void tagAfterSnapshotRejected() {
            root.end(T0.plusSeconds(1), null, null);
            TraceSnapshot snapshot = trace.complete(T0.plusSeconds(1)).orElseThrow();

            assertFalse(trace.setTag("late", "x"));
            assertFalse(trace.removeTag("late"));
            assertTrue(snapshot.tag("late").isEmpty());
        }

        @Test
        @DisplayName("Rejected tag writes should be kept as late updates in write order")
        void rejectedWritesKeptAsLateUpdates() {
            trace.setTag("early", "x");
            root.end(T0.plusSeconds(1), null, null);
            trace.complete(T0.plusSeconds(1)).orElseThrow();

            trace.setTag("label", "good");
            trace.setTags(Map.of("owner", "alice"));
            trace.removeTag("early");

            Map<String, String> late = trace.lateTagUpdates();
            assertEquals(List.of("label", "owner", "early"), new ArrayList<>(late.keySet()));
            assertEquals("good", late.get("label"));
            assertNull(late.get("early"));
        }

        @Test
        @DisplayName("Accepted tag writes should not be recorded as late updates")
        void acceptedWritesNotLate() {
            trace.setTag("env", "prod");
            trace.removeTag("env");

            assertTrue(trace.lateTagUpdates().isEmpty());
        }

        @Test
        @DisplayName("Exported snapshot should not change when tags change later")
        void snapshotIsImmutable() {
            trace.setTag("k", "v1");
            TraceSnapshot before = trace.snapshot();
            trace.setTag("k", "v2");

            assertEquals(Optional.of("v1"), before.tag("k"));
            assertThrows(UnsupportedOperationException.class, () -> before.tags().put("x", "y"));
        }
    }

    @Nested
    @DisplayName("LiveSpan")
    class LiveSpanTests {

        @Test
        @DisplayName("End timestamp should never precede start timestamp")
        void endClampedToStart() {
            LiveSpan c = child("c1", T0.plusSeconds(10));
            c.end(T0.plusSeconds(5), null, null);

            assertEquals(T0.plusSeconds(10), c.snapshot().endTime());
        }

        @Test
        @DisplayName("A span should end only once")
        void endOnce() {
            LiveSpan c = child("c1", T0);
            assertTrue(c.end(T0.plusSeconds(1), SpanStatus.ERROR, null));
            assertFalse(c.end(T0.plusSeconds(2), SpanStatus.OK, null));
            assertFalse(c.abandon(T0.plusSeconds(3)));

            assertEquals(SpanStatus.ERROR, c.getStatus());
            assertEquals(T0.plusSeconds(1), c.snapshot().endTime());
        }

        @Test
        @DisplayName("Abandoned span should keep its recorded status")
        void abandonKeepsStatus() {
            LiveSpan c = child("c1", T0);
            c.abandon(T0.plusSeconds(1));

            assertEquals(SpanStatus.UNSET, c.getStatus());
            assertFalse(c.isOpen());
        }

        @Test
        @DisplayName("Closed span should ignore attribute writes")
        void attributesIgnoredAfterEnd() {
            LiveSpan c = child("c1", T0);
            c.setAttribute("k", 1);
            c.end(T0.plusSeconds(1), null, null);
            c.setAttribute("late", 2);

            Map<String, Object> attributes = c.snapshot().attributes();
            assertEquals(1, attributes.get("k"));
            assertFalse(attributes.containsKey("late"));
        }

        @Test
        @DisplayName("close() should delegate to the lifecycle")
        void closeDelegates() {
            List<LiveSpan> closed = new ArrayList<>();
            LiveSpan span = new LiveSpan("s", null, trace, "s", T0, closed::add);

            span.close();

            assertEquals(List.of(span), closed);
        }
    }

    @Test
    @DisplayName("Ids should have the documented shapes")
    void idShapes() {
        assertTrue(Ids.newTraceId().matches("tr-[0-9a-f]{32}"));
        assertTrue(Ids.newSpanId().matches("[0-9a-f]{16}"));
        assertNotEquals(Ids.newSpanId(), Ids.newSpanId());
    }

    @Test
    @DisplayName("NoOpSpan should not record anything")
    void noOpSpan() {
        Span span = NoOpSpan.INSTANCE;
        span.setAttribute("k", "v");
        span.setStatus(SpanStatus.ERROR);
        span.close();

        assertFalse(span.isRecording());
        assertEquals(SpanStatus.UNSET, span.getStatus());
        assertEquals(NoOpSpan.SPAN_ID, span.getSpanId());
    }
}
