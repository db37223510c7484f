package com.trace.lifecycle.backend;

import com.trace.lifecycle.core.model.SpanSnapshot;
import com.trace.lifecycle.core.model.SpanStatus;
import com.trace.lifecycle.core.model.TraceSnapshot;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanBuilder;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Context;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Map;

/**
 * {@link TraceBackend} that replays finished traces into an OpenTelemetry {@link Tracer}.
 * Requires {@code opentelemetry-api} on the classpath (optional dependency).
 *
 * <p>The span tree is walked from the root, children resolved by parent identifier,
 * and each span is emitted with its recorded start and end timestamps. Trace tags are
 * copied onto the root span as {@code trace.tag.*} attributes. Spans cannot change once
 * emitted, so post-hoc tag changes are rejected with {@link IllegalStateException}.</p>
 */
public class OpenTelemetryTraceBackend implements TraceBackend {
    private static final Logger log = LoggerFactory.getLogger(OpenTelemetryTraceBackend.class);

    static final String TRACE_ID_ATTRIBUTE = "trace.id";
    static final String TAG_ATTRIBUTE_PREFIX = "trace.tag.";

    private final Tracer tracer;

    public OpenTelemetryTraceBackend(Tracer tracer) {
        this.tracer = tracer;
    }

    @Override
    public void persistTrace(TraceSnapshot trace) throws ExportException {
        SpanSnapshot root = trace.rootSpan().orElseThrow(() ->
                ExportException.nonRetryable("Trace " + trace.traceId() + " has no root span", null));

        Instant fallbackEnd = trace.endedAt() != null ? trace.endedAt() : Instant.now();
        Deque<Emission> pending = new ArrayDeque<>();
        pending.push(new Emission(root, null));

        while (!pending.isEmpty()) {
            Emission next = pending.pop();
            Span emitted = emit(trace, next.span(), next.parent(), fallbackEnd);
            for (SpanSnapshot child : trace.childrenOf(next.span().spanId())) {
                pending.push(new Emission(child, emitted));
            }
        }
        log.debug("Replayed trace {} into OpenTelemetry ({} spans)", trace.traceId(), trace.spans().size());
    }

    private Span emit(TraceSnapshot trace, SpanSnapshot snapshot, Span parent, Instant fallbackEnd) {
        SpanBuilder builder = tracer.spanBuilder(snapshot.name())
                .setStartTimestamp(snapshot.startTime());
        if (parent != null) {
            builder.setParent(Context.root().with(parent));
        } else {
            builder.setNoParent();
            builder.setAttribute(TRACE_ID_ATTRIBUTE, trace.traceId());
            for (Map.Entry<String, String> tag : trace.tags().entrySet()) {
                builder.setAttribute(TAG_ATTRIBUTE_PREFIX + tag.getKey(), tag.getValue());
            }
        }
        for (Map.Entry<String, Object> attribute : snapshot.attributes().entrySet()) {
            builder.setAttribute(attribute.getKey(), String.valueOf(attribute.getValue()));
        }

        Span span = builder.startSpan();
        if (snapshot.status() == SpanStatus.ERROR) {
            span.setStatus(StatusCode.ERROR);
        } else if (snapshot.status() == SpanStatus.OK) {
            span.setStatus(StatusCode.OK);
        }
        span.end(snapshot.endTime() != null ? snapshot.endTime() : fallbackEnd);
        return span;
    }

    @Override
    public void setTraceTag(String traceId, String key, String value) {
        throw new IllegalStateException("Cannot set tag '" + key + "' on trace " + traceId
                + ": spans already emitted, post-hoc tags unsupported");
    }

    @Override
    public void deleteTraceTag(String traceId, String key) {
        throw new IllegalStateException("Cannot delete tag '" + key + "' on trace " + traceId
                + ": spans already emitted, post-hoc tags unsupported");
    }

    @Override
    public String getName() {
        return "opentelemetry";
    }

    private record Emission(SpanSnapshot span, Span parent) {}
}
