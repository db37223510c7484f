package com.trace.lifecycle.api;

import com.trace.lifecycle.retry.BackoffPolicy;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;

/**
 * Options for the tracing subsystem: timeout supervision, export pipeline sizing,
 * retry budget, shutdown deadline and the recent-trace buffer.
 */
public class TracingOptions {

    static final String ENV_TIMEOUT = "TRACE_TIMEOUT_SECONDS";
    static final String ENV_CHECK_INTERVAL = "TRACE_TIMEOUT_CHECK_INTERVAL_SECONDS";
    static final String ENV_MAX_WORKERS = "TRACE_EXPORT_MAX_WORKERS";
    static final String ENV_MAX_QUEUE_SIZE = "TRACE_EXPORT_MAX_QUEUE_SIZE";
    static final String ENV_RETRY_TIMEOUT = "TRACE_EXPORT_RETRY_TIMEOUT_SECONDS";
    static final String ENV_SHUTDOWN_FLUSH_TIMEOUT = "TRACE_SHUTDOWN_FLUSH_TIMEOUT_SECONDS";
    static final String ENV_ENABLED = "TRACE_ENABLED";
    static final String ENV_BUFFER_MAX_SIZE = "TRACE_BUFFER_MAX_SIZE";
    static final String ENV_BUFFER_TTL = "TRACE_BUFFER_TTL_SECONDS";

    private static final Duration DEFAULT_CHECK_INTERVAL = Duration.ofSeconds(1);
    private static final Duration DEFAULT_IDLE_GRACE_PERIOD = Duration.ofSeconds(30);
    private static final int DEFAULT_MAX_WORKERS = 10;
    private static final int DEFAULT_MAX_QUEUE_SIZE = 1000;
    private static final Duration DEFAULT_RETRY_TIMEOUT = Duration.ofSeconds(500);
    private static final Duration DEFAULT_SHUTDOWN_FLUSH_TIMEOUT = Duration.ofSeconds(10);
    private static final int DEFAULT_BUFFER_MAX_SIZE = 100;
    private static final Duration DEFAULT_BUFFER_TTL = Duration.ofHours(1);

    private final Duration traceTimeout;
    private final Duration timeoutCheckInterval;
    private final Duration supervisorIdleGracePeriod;
    private final int maxExportWorkers;
    private final int maxQueueSize;
    private final Duration exportRetryTimeout;
    private final Duration shutdownFlushTimeout;
    private final boolean enabled;
    private final BackoffPolicy backoffPolicy;
    private final boolean bufferEnabled;
    private final int bufferMaxSize;
    private final Duration bufferTtl;

    private TracingOptions(Builder builder) {
        this.traceTimeout = builder.traceTimeout;
        this.timeoutCheckInterval = builder.timeoutCheckInterval;
        this.supervisorIdleGracePeriod = builder.supervisorIdleGracePeriod;
        this.maxExportWorkers = builder.maxExportWorkers;
        this.maxQueueSize = builder.maxQueueSize;
        this.exportRetryTimeout = builder.exportRetryTimeout;
        this.shutdownFlushTimeout = builder.shutdownFlushTimeout;
        this.enabled = builder.enabled;
        this.backoffPolicy = builder.backoffPolicy;
        this.bufferEnabled = builder.bufferEnabled;
        this.bufferMaxSize = builder.bufferMaxSize;
        this.bufferTtl = builder.bufferTtl;
    }

    /**
     * Per-trace maximum lifetime, or empty when timeouts are disabled.
     */
    public Optional<Duration> getTraceTimeout() {
        return Optional.ofNullable(traceTimeout);
    }

    public Duration getTimeoutCheckInterval() {
        return timeoutCheckInterval;
    }

    public Duration getSupervisorIdleGracePeriod() {
        return supervisorIdleGracePeriod;
    }

    public int getMaxExportWorkers() {
        return maxExportWorkers;
    }

    public int getMaxQueueSize() {
        return maxQueueSize;
    }

    public Duration getExportRetryTimeout() {
        return exportRetryTimeout;
    }

    public Duration getShutdownFlushTimeout() {
        return shutdownFlushTimeout;
    }

    public boolean isEnabled() {
        return enabled;
    }

    public BackoffPolicy getBackoffPolicy() {
        return backoffPolicy;
    }

    /**
     * Whether finished traces are kept for {@code getTrace} and {@code getLastActiveTraceId}.
     */
    public boolean isBufferEnabled() {
        return bufferEnabled;
    }

    public int getBufferMaxSize() {
        return bufferMaxSize;
    }

    public Duration getBufferTtl() {
        return bufferTtl;
    }

    public static TracingOptions defaults() {
        return builder().build();
    }

    /**
     * Reads options from the process environment.
     */
    public static TracingOptions fromEnvironment() {
        return fromEnvironment(System.getenv());
    }

    /**
     * Reads options from {@code env}. Unset or blank variables keep their defaults.
     *
     * @throws IllegalArgumentException if a variable is set to an invalid value
     */
    public static TracingOptions fromEnvironment(Map<String, String> env) {
        Builder builder = builder();
        seconds(env, ENV_TIMEOUT).ifPresent(builder::traceTimeout);
        seconds(env, ENV_CHECK_INTERVAL).ifPresent(builder::timeoutCheckInterval);
        integer(env, ENV_MAX_WORKERS).ifPresent(builder::maxExportWorkers);
        integer(env, ENV_MAX_QUEUE_SIZE).ifPresent(builder::maxQueueSize);
        seconds(env, ENV_RETRY_TIMEOUT).ifPresent(builder::exportRetryTimeout);
        seconds(env, ENV_SHUTDOWN_FLUSH_TIMEOUT).ifPresent(builder::shutdownFlushTimeout);
        value(env, ENV_ENABLED).ifPresent(v -> builder.enabled(parseBoolean(ENV_ENABLED, v)));

        integer(env, ENV_BUFFER_MAX_SIZE).ifPresent(builder::bufferMaxSize);
        seconds(env, ENV_BUFFER_TTL).ifPresent(builder::bufferTtl);
        return builder.build();
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public String toString() {
        return "TracingOptions{" +
                "traceTimeout=" + traceTimeout +
                ", timeoutCheckInterval=" + timeoutCheckInterval +
                ", maxExportWorkers=" + maxExportWorkers +
                ", maxQueueSize=" + maxQueueSize +
                ", exportRetryTimeout=" + exportRetryTimeout +
                ", shutdownFlushTimeout=" + shutdownFlushTimeout +
                ", enabled=" + enabled +
                ", buffer=" + (bufferEnabled ? bufferMaxSize + "/" + bufferTtl : "off") +
                '}';
    }

    private static Optional<String> value(Map<String, String> env, String name) {
        String raw = env.get(name);
        return raw == null || raw.isBlank() ? Optional.empty() : Optional.of(raw.trim());
    }

    private static Optional<Duration> seconds(Map<String, String> env, String name) {
        return value(env, name).map(raw -> {
            try {
                return Duration.ofMillis(Math.round(Double.parseDouble(raw) * 1000));
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException(name + " must be a number of seconds, got '" + raw + "'", e);
            }
        });
    }

    private static Optional<Integer> integer(Map<String, String> env, String name) {
        return value(env, name).map(raw -> {
            try {
                return Integer.parseInt(raw);
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException(name + " must be an integer, got '" + raw + "'", e);
            }
        });
    }

    private static boolean parseBoolean(String name, String raw) {
        if ("true".equalsIgnoreCase(raw) || "1".equals(raw)) {
            return true;
        }
        if ("false".equalsIgnoreCase(raw) || "0".equals(raw)) {
            return false;
        }
        throw new IllegalArgumentException(name + " must be true or false, got '" + raw + "'");
    }

    public static class Builder {
        private Duration traceTimeout;
        private Duration timeoutCheckInterval = DEFAULT_CHECK_INTERVAL;
        private Duration supervisorIdleGracePeriod = DEFAULT_IDLE_GRACE_PERIOD;
        private int maxExportWorkers = DEFAULT_MAX_WORKERS;
        private int maxQueueSize = DEFAULT_MAX_QUEUE_SIZE;
        private Duration exportRetryTimeout = DEFAULT_RETRY_TIMEOUT;
        private Duration shutdownFlushTimeout = DEFAULT_SHUTDOWN_FLUSH_TIMEOUT;
        private boolean enabled = true;
        private BackoffPolicy backoffPolicy = BackoffPolicy.defaults();
        private boolean bufferEnabled = true;
        private int bufferMaxSize = DEFAULT_BUFFER_MAX_SIZE;
        private Duration bufferTtl = DEFAULT_BUFFER_TTL;

        /**
         * Sets the per-trace timeout; {@code null} disables timeout supervision.
         */
        public Builder traceTimeout(Duration traceTimeout) {
            if (traceTimeout != null) {
                requirePositive(traceTimeout, "traceTimeout");
            }
            this.traceTimeout = traceTimeout;
            return this;
        }

        public Builder timeoutCheckInterval(Duration timeoutCheckInterval) {
            requirePositive(timeoutCheckInterval, "timeoutCheckInterval");
            this.timeoutCheckInterval = timeoutCheckInterval;
            return this;
        }

        public Builder supervisorIdleGracePeriod(Duration supervisorIdleGracePeriod) {
            if (supervisorIdleGracePeriod == null || supervisorIdleGracePeriod.isNegative()) {
                throw new IllegalArgumentException("supervisorIdleGracePeriod must be >= 0");
            }
            this.supervisorIdleGracePeriod = supervisorIdleGracePeriod;
            return this;
        }

        public Builder maxExportWorkers(int maxExportWorkers) {
            if (maxExportWorkers <= 0) {
                throw new IllegalArgumentException("maxExportWorkers must be positive");
            }
            this.maxExportWorkers = maxExportWorkers;
            return this;
        }

        public Builder maxQueueSize(int maxQueueSize) {
            if (maxQueueSize <= 0) {
                throw new IllegalArgumentException("maxQueueSize must be positive");
            }
            this.maxQueueSize = maxQueueSize;
            return this;
        }

        public Builder exportRetryTimeout(Duration exportRetryTimeout) {
            if (exportRetryTimeout == null || exportRetryTimeout.isNegative()) {
                throw new IllegalArgumentException("exportRetryTimeout must be >= 0");
            }
            this.exportRetryTimeout = exportRetryTimeout;
            return this;
        }

        public Builder shutdownFlushTimeout(Duration shutdownFlushTimeout) {
            if (shutdownFlushTimeout == null || shutdownFlushTimeout.isNegative()) {
                throw new IllegalArgumentException("shutdownFlushTimeout must be >= 0");
            }
            this.shutdownFlushTimeout = shutdownFlushTimeout;
            return this;
        }

        public Builder enabled(boolean enabled) {
            this.enabled = enabled;
            return this;
        }

        public Builder backoffPolicy(BackoffPolicy backoffPolicy) {
            if (backoffPolicy == null) {
                throw new IllegalArgumentException("backoffPolicy must not be null");
            }
            this.backoffPolicy = backoffPolicy;
            return this;
        }

        public Builder bufferEnabled(boolean bufferEnabled) {
            this.bufferEnabled = bufferEnabled;
            return this;
        }

        public Builder bufferMaxSize(int bufferMaxSize) {
            if (bufferMaxSize <= 0) {
                throw new IllegalArgumentException("bufferMaxSize must be positive");
            }
            this.bufferMaxSize = bufferMaxSize;
            return this;
        }

        public Builder bufferTtl(Duration bufferTtl) {
            requirePositive(bufferTtl, "bufferTtl");
            this.bufferTtl = bufferTtl;
            return this;
        }

        public TracingOptions build() {
            return new TracingOptions(this);
        }

        private static void requirePositive(Duration value, String name) {
            if (value == null || value.isNegative() || value.isZero()) {
                throw new IllegalArgumentException(name + " must be positive");
            }
        }
    }
}
