package com.trace.lifecycle.backend;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.trace.lifecycle.core.model.SpanSnapshot;
import com.trace.lifecycle.core.model.TraceSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * {@link TraceBackend} that stores traces through a JSON HTTP API.
 *
 * <p>Endpoints, relative to the base URL:</p>
 * <ul>
 *   <li>{@code POST /api/traces} - persist a finished trace</li>
 *   <li>{@code PUT /api/traces/{traceId}/tags} - set one tag</li>
 *   <li>{@code DELETE /api/traces/{traceId}/tags/{key}} - delete one tag</li>
 * </ul>
 *
 * <p>Status mapping for {@link #persistTrace}: 2xx succeeds; 408, 429 and 5xx are retryable;
 * any other status (bad payload, authentication) is not. Connection failures are retryable.</p>
 *
 * Usage:
 * <pre>
 * HttpTraceBackend backend = HttpTraceBackend.builder()
 *     .baseUrl("http://localhost:5000")
 *     .bearerToken(token)
 *     .build();
 * </pre>
 */
public class HttpTraceBackend implements TraceBackend {
    private static final Logger log = LoggerFactory.getLogger(HttpTraceBackend.class);

    private static final String DEFAULT_BASE_URL = "http://localhost:5000";
    private static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);

    private final String baseUrl;
    private final Duration timeout;
    private final String bearerToken;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;

    private HttpTraceBackend(Builder builder) {
        String url = builder.baseUrl != null ? builder.baseUrl : DEFAULT_BASE_URL;
        this.baseUrl = url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
        this.timeout = builder.timeout != null ? builder.timeout : DEFAULT_TIMEOUT;
        this.bearerToken = builder.bearerToken;
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(timeout)
                .build();
        this.objectMapper = new ObjectMapper();
    }

    @Override
    public void persistTrace(TraceSnapshot trace) throws ExportException {
        String body;
        try {
            body = objectMapper.writeValueAsString(TracePayload.from(trace));
        } catch (JsonProcessingException e) {
            throw ExportException.nonRetryable("Trace " + trace.traceId() + " could not be serialized", e);
        }

        HttpRequest request = newRequest("/api/traces")
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(body))
                .build();

        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw ExportException.retryable("Backend unreachable: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw ExportException.retryable("Interrupted while exporting trace " + trace.traceId(), e);
        }

        int status = response.statusCode();
        if (status >= 200 && status < 300) {
            log.debug("Trace {} stored (status {})", trace.traceId(), status);
            return;
        }
        throw new ExportException("Backend returned status " + status + ": " + response.body(),
                isRetryableStatus(status));
    }

    @Override
    public void setTraceTag(String traceId, String key, String value) {
        String body;
        try {
            body = objectMapper.writeValueAsString(new TagPayload(key, value));
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Tag could not be serialized", e);
        }
        send(newRequest("/api/traces/" + encode(traceId) + "/tags")
                .header("Content-Type", "application/json")
                .PUT(HttpRequest.BodyPublishers.ofString(body))
                .build());
    }

    @Override
    public void deleteTraceTag(String traceId, String key) {
        send(newRequest("/api/traces/" + encode(traceId) + "/tags/" + encode(key))
                .DELETE()
                .build());
    }

    @Override
    public String getName() {
        return "http:" + baseUrl;
    }

    static boolean isRetryableStatus(int status) {
        return status == 408 || status == 429 || status >= 500;
    }

    private HttpRequest.Builder newRequest(String path) {
        HttpRequest.Builder builder = HttpRequest.newBuilder()
                .uri(URI.create(baseUrl + path))
                .timeout(timeout);
        if (bearerToken != null) {
            builder.header("Authorization", "Bearer " + bearerToken);
        }
        return builder;
    }

    private void send(HttpRequest request) {
        try {
            HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
            if (response.statusCode() < 200 || response.statusCode() >= 300) {
                throw new IllegalStateException(request.method() + " " + request.uri()
                        + " returned status " + response.statusCode() + ": " + response.body());
            }
        } catch (IOException e) {
            throw new IllegalStateException("Backend unreachable: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while calling " + request.uri(), e);
        }
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8).replace("+", "%20");
    }

    private static Long toEpochMillis(Instant instant) {
        return instant != null ? instant.toEpochMilli() : null;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String baseUrl;
        private Duration timeout;
        private String bearerToken;

        public Builder baseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
            return this;
        }

        public Builder timeout(Duration timeout) {
            this.timeout = timeout;
            return this;
        }

        public Builder bearerToken(String bearerToken) {
            this.bearerToken = bearerToken;
            return this;
        }

        public HttpTraceBackend build() {
            return new HttpTraceBackend(this);
        }
    }

    // Request DTOs
    @JsonIgnoreProperties(ignoreUnknown = true)
    record TracePayload(
            @JsonProperty("trace_id") String traceId,
            String state,
            @JsonProperty("timestamp_ms") Long timestampMs,
            @JsonProperty("execution_time_ms") Long executionTimeMs,
            @JsonProperty("run_id") String runId,
            Map<String, String> tags,
            List<SpanPayload> spans
    ) {
        static TracePayload from(TraceSnapshot trace) {
            return new TracePayload(
                    trace.traceId(),
                    trace.state().name(),
                    toEpochMillis(trace.createdAt()),
                    trace.endedAt() != null ? trace.duration().toMillis() : null,
                    trace.runId(),
                    trace.tags(),
                    trace.spans().stream().map(SpanPayload::from).toList()
            );
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record SpanPayload(
            @JsonProperty("span_id") String spanId,
            @JsonProperty("parent_id") String parentId,
            String name,
            @JsonProperty("start_time_ms") Long startTimeMs,
            @JsonProperty("end_time_ms") Long endTimeMs,
            String status,
            Map<String, Object> attributes,
            Object inputs,
            Object outputs
    ) {
        static SpanPayload from(SpanSnapshot span) {
            return new SpanPayload(
                    span.spanId(),
                    span.parentId(),
                    span.name(),
                    toEpochMillis(span.startTime()),
                    toEpochMillis(span.endTime()),
                    span.status().name(),
                    new LinkedHashMap<>(span.attributes()),
                    span.inputs(),
                    span.outputs()
            );
        }
    }

    record TagPayload(String key, String value) {}
}
