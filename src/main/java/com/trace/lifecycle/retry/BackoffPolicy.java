package com.trace.lifecycle.retry;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * Exponential backoff with multiplicative jitter.
 *
 * <p>The delay before retry {@code n} (0-based) lies in
 * {@code [initial * multiplier^n, initial * multiplier^n * (1 + jitter))}.
 * With {@code jitter <= multiplier - 1} consecutive ranges do not overlap,
 * so delays are strictly increasing whatever the random draws are.</p>
 */
public final class BackoffPolicy {

    private static final Duration MAX_DELAY = Duration.ofDays(1);

    private final Duration initialDelay;
    private final double multiplier;
    private final double jitter;
    private final DoubleSupplier random;

    BackoffPolicy(Duration initialDelay, double multiplier, double jitter, DoubleSupplier random) {
        if (initialDelay == null || initialDelay.isNegative() || initialDelay.isZero()) {
            throw new IllegalArgumentException("initialDelay must be > 0");
        }
        if (multiplier <= 1.0) {
            throw new IllegalArgumentException("multiplier must be > 1");
        }
        if (jitter < 0.0 || jitter > multiplier - 1.0) {
            throw new IllegalArgumentException("jitter must be between 0 and multiplier - 1");
        }
        this.initialDelay = initialDelay;
        this.multiplier = multiplier;
        this.jitter = jitter;
        this.random = random;
    }

    public static BackoffPolicy exponential(Duration initialDelay, double multiplier, double jitter) {
        return new BackoffPolicy(initialDelay, multiplier, jitter, () -> ThreadLocalRandom.current().nextDouble());
    }

    /**
     * Default policy: 500ms initial delay, doubling, up to 50% jitter.
     */
    public static BackoffPolicy defaults() {
        return exponential(Duration.ofMillis(500), 2.0, 0.5);
    }

    /**
     * Returns the delay to wait before retry {@code retryIndex} (0 for the first retry).
     */
    public Duration delayFor(int retryIndex) {
        if (retryIndex < 0) {
            throw new IllegalArgumentException("retryIndex must be >= 0");
        }
        double base = initialDelay.toNanos() * Math.pow(multiplier, retryIndex);
        double draw = random.getAsDouble();
        // keep the draw in [0, 1) so the upper bound stays exclusive
        double factor = 1.0 + jitter * Math.min(Math.max(draw, 0.0), Math.nextDown(1.0));
        double nanos = base * factor;
        if (nanos >= MAX_DELAY.toNanos()) {
            return MAX_DELAY;
        }
        return Duration.ofNanos((long) nanos);
    }

    public Duration getInitialDelay() {
        return initialDelay;
    }

    public double getMultiplier() {
        return multiplier;
    }

    public double getJitter() {
        return jitter;
    }
}
