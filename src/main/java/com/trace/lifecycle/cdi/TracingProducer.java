package com.trace.lifecycle.cdi;

import com.trace.lifecycle.api.Tracer;
import com.trace.lifecycle.api.TracingOptions;
import com.trace.lifecycle.backend.HttpTraceBackend;
import com.trace.lifecycle.backend.InMemoryTraceBackend;
import com.trace.lifecycle.backend.TraceBackend;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Disposes;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Optional;

/**
 * CDI producer that wires a {@link Tracer} from MicroProfile Config properties.
 *
 * <h2>Example configuration</h2>
 * <pre>
 * trace-lifecycle:
 *   timeout-seconds: 300
 *   export:
 *     max-workers: 10
 *     max-queue-size: 1000
 *   backend:
 *     type: http
 *     http:
 *       base-url: http://localhost:5000
 * </pre>
 *
 * <p>Inject the tracer directly:</p>
 * <pre>
 * &#64;Inject Tracer tracer;
 * </pre>
 */
@ApplicationScoped
public class TracingProducer {

    private static final Logger log = LoggerFactory.getLogger(TracingProducer.class);

    // ── Lifecycle ─────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "trace-lifecycle.enabled", defaultValue = "true")
    boolean enabled;

    @Inject
    @ConfigProperty(name = "trace-lifecycle.timeout-seconds")
    Optional<Long> timeoutSeconds;

    @Inject
    @ConfigProperty(name = "trace-lifecycle.timeout-check-interval-seconds", defaultValue = "1")
    long timeoutCheckIntervalSeconds;

    @Inject
    @ConfigProperty(name = "trace-lifecycle.shutdown-flush-timeout-seconds", defaultValue = "10")
    long shutdownFlushTimeoutSeconds;

    // ── Export ────────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "trace-lifecycle.export.max-workers", defaultValue = "10")
    int maxWorkers;

    @Inject
    @ConfigProperty(name = "trace-lifecycle.export.max-queue-size", defaultValue = "1000")
    int maxQueueSize;

    @Inject
    @ConfigProperty(name = "trace-lifecycle.export.retry-timeout-seconds", defaultValue = "500")
    long retryTimeoutSeconds;

    // ── Buffer ────────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "trace-lifecycle.buffer.enabled", defaultValue = "true")
    boolean bufferEnabled;

    @Inject
    @ConfigProperty(name = "trace-lifecycle.buffer.max-size", defaultValue = "100")
    int bufferMaxSize;

    @Inject
    @ConfigProperty(name = "trace-lifecycle.buffer.ttl-seconds", defaultValue = "3600")
    int bufferTtlSeconds;

    // ── Backend ───────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "trace-lifecycle.backend.type", defaultValue = "memory")
    String backendType;

    @Inject
    @ConfigProperty(name = "trace-lifecycle.backend.http.base-url", defaultValue = "http://localhost:5000")
    String httpBaseUrl;

    @Inject
    @ConfigProperty(name = "trace-lifecycle.backend.http.timeout-seconds", defaultValue = "30")
    int httpTimeoutSeconds;

    @Inject
    @ConfigProperty(name = "trace-lifecycle.backend.http.token")
    Optional<String> httpToken;

    @Produces
    @Singleton
    public Tracer tracer() {
        TracingOptions options = tracingOptions();
        log.info("Producing Tracer: backend={} {}", backendType, options);
        return Tracer.builder()
                .options(options)
                .backend(createBackend())
                .build();
    }

    public void closeTracer(@Disposes Tracer tracer) {
        log.info("Closing Tracer");
        tracer.close();
    }

    TracingOptions tracingOptions() {
        return TracingOptions.builder()
                .enabled(enabled)
                .traceTimeout(timeoutSeconds.map(Duration::ofSeconds).orElse(null))
                .timeoutCheckInterval(Duration.ofSeconds(timeoutCheckIntervalSeconds))
                .shutdownFlushTimeout(Duration.ofSeconds(shutdownFlushTimeoutSeconds))
                .maxExportWorkers(maxWorkers)
                .maxQueueSize(maxQueueSize)
                .exportRetryTimeout(Duration.ofSeconds(retryTimeoutSeconds))
                .bufferEnabled(bufferEnabled)
                .bufferMaxSize(bufferMaxSize)
                .bufferTtl(Duration.ofSeconds(bufferTtlSeconds))
                .build();
    }

    TraceBackend createBackend() {
        if ("http".equalsIgnoreCase(backendType)) {
            HttpTraceBackend.Builder builder = HttpTraceBackend.builder()
                    .baseUrl(httpBaseUrl)
                    .timeout(Duration.ofSeconds(httpTimeoutSeconds));
            httpToken.ifPresent(builder::bearerToken);
            return builder.build();
        }
        if (!"memory".equalsIgnoreCase(backendType)) {
            log.warn("Unknown trace backend '{}', falling back to in-memory", backendType);
        }
        return new InMemoryTraceBackend();
    }
}
