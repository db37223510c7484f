package com.trace.lifecycle.health;

import com.trace.lifecycle.export.ExportStats;
import com.trace.lifecycle.export.TraceExportService;

/**
 * Reports export queue usage: DEGRADED from 80% full, DOWN when full or closed.
 */
public class ExportQueueHealthCheck implements ComponentHealthCheck<QueueHealth> {

    private static final double DOWN_THRESHOLD = 1.0;
    private static final double DEGRADED_THRESHOLD = 0.80;

    private final TraceExportService exportService;

    public ExportQueueHealthCheck(TraceExportService exportService) {
        this.exportService = exportService;
    }

    @Override
    public QueueHealth check() {
        ExportStats stats = exportService.stats();
        boolean closed = exportService.isClosed();
        double usage = stats.queueUsage();

        if (closed) {
            return new QueueHealth(HealthState.DOWN, "Export service closed", true, stats);
        }
        if (usage >= DOWN_THRESHOLD) {
            return new QueueHealth(HealthState.DOWN, "Export queue full: new traces are dropped", false, stats);
        }
        if (usage >= DEGRADED_THRESHOLD) {
            return new QueueHealth(HealthState.DEGRADED,
                    String.format("Export queue usage high: %.0f%%", usage * 100), false, stats);
        }
        return new QueueHealth(HealthState.UP, "OK", false, stats);
    }
}
