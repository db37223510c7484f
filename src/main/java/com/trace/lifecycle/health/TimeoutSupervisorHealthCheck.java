package com.trace.lifecycle.health;

import com.trace.lifecycle.timeout.TimeoutSupervisor;
import com.trace.lifecycle.tracing.TraceRegistry;

/**
 * Reports DOWN when traces are in progress under a timeout but the supervisor loop is not running.
 */
public class TimeoutSupervisorHealthCheck implements ComponentHealthCheck<SupervisorHealth> {

    private final TimeoutSupervisor supervisor;
    private final TraceRegistry registry;

    /**
     * @param supervisor the supervisor, or {@code null} when timeouts are disabled
     */
    public TimeoutSupervisorHealthCheck(TimeoutSupervisor supervisor, TraceRegistry registry) {
        this.supervisor = supervisor;
        this.registry = registry;
    }

    @Override
    public SupervisorHealth check() {
        int inProgress = registry.size();
        if (supervisor == null) {
            return new SupervisorHealth(HealthState.UP, "Trace timeout disabled", null, false, inProgress);
        }
        boolean running = supervisor.isRunning();
        if (inProgress > 0 && !running) {
            return new SupervisorHealth(HealthState.DOWN,
                    "Supervisor not running with " + inProgress + " traces in progress",
                    supervisor.getTimeout(), false, inProgress);
        }
        return new SupervisorHealth(HealthState.UP, running ? "Running" : "Idle",
                supervisor.getTimeout(), running, inProgress);
    }
}
