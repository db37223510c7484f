package com.trace.lifecycle.health;

/**
 * Health report of one background component of the tracer.
 */
public interface ComponentHealth {

    /**
     * Stable component name, e.g. {@code exportQueue}.
     */
    String component();

    HealthState state();

    String message();

    default boolean isUp() {
        return state() == HealthState.UP;
    }
}
