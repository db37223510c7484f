package com.trace.lifecycle.health;

import com.trace.lifecycle.export.ExportStats;

/**
 * Export pipeline health with the statistics it was derived from.
 *
 * @param state   derived state
 * @param message human-readable reason
 * @param closed  whether the export service stopped accepting traces
 * @param stats   pipeline statistics at check time
 */
public record QueueHealth(HealthState state, String message, boolean closed, ExportStats stats)
        implements ComponentHealth {

    @Override
    public String component() {
        return "exportQueue";
    }

    public double queueUsage() {
        return stats.queueUsage();
    }
}
