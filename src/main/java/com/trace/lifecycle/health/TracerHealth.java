package com.trace.lifecycle.health;

import java.util.List;

/**
 * Combined health of a tracer. The worst component state wins.
 */
public record TracerHealth(QueueHealth exportQueue, SupervisorHealth timeoutSupervisor) {

    public List<ComponentHealth> components() {
        return List.of(exportQueue, timeoutSupervisor);
    }

    public HealthState state() {
        HealthState worst = HealthState.UP;
        for (ComponentHealth component : components()) {
            worst = worst.worst(component.state());
        }
        return worst;
    }

    /**
     * Message of the first component in the worst state, prefixed with its name, or {@code OK}.
     */
    public String message() {
        HealthState worst = state();
        if (worst == HealthState.UP) {
            return "OK";
        }
        for (ComponentHealth component : components()) {
            if (component.state() == worst) {
                return component.component() + ": " + component.message();
            }
        }
        return worst.name();
    }

    public boolean isUp() {
        return state() == HealthState.UP;
    }

    public boolean isDegraded() {
        return state() == HealthState.DEGRADED;
    }

    public boolean isDown() {
        return state() == HealthState.DOWN;
    }
}
