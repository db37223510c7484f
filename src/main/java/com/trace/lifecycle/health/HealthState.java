package com.trace.lifecycle.health;

/**
 * Health of a tracing component, ordered from best to worst.
 */
public enum HealthState {
    UP,
    DEGRADED,
    DOWN;

    public HealthState worst(HealthState other) {
        return other.ordinal() > ordinal() ? other : this;
    }
}
