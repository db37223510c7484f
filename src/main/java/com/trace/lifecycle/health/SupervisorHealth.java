package com.trace.lifecycle.health;

import java.time.Duration;
import java.util.Optional;

/**
 * Timeout supervisor health.
 *
 * @param state      derived state
 * @param message    human-readable reason
 * @param timeout    configured trace timeout, {@code null} when timeouts are disabled
 * @param running    whether the supervisor loop is running
 * @param inProgress number of traces in progress
 */
public record SupervisorHealth(HealthState state, String message, Duration timeout, boolean running, int inProgress)
        implements ComponentHealth {

    @Override
    public String component() {
        return "timeoutSupervisor";
    }

    public Optional<Duration> getTimeout() {
        return Optional.ofNullable(timeout);
    }

    public boolean timeoutEnabled() {
        return timeout != null;
    }
}
