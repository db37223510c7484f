package com.trace.lifecycle.export;

/**
 * Point-in-time statistics of the export pipeline.
 *
 * @param queueSize     tasks waiting in the queue
 * @param queueCapacity queue capacity
 * @param activeWorkers workers currently exporting a task
 * @param workerCount   configured pool size
 * @param accepted      cumulative tasks accepted into the queue
 * @param dropped       cumulative tasks dropped because the queue was full or closed
 * @param exported      cumulative tasks persisted successfully
 * @param failed        cumulative tasks discarded after failure
 * @param outstanding   tasks queued or in flight
 */
public record ExportStats(
        int queueSize,
        int queueCapacity,
        int activeWorkers,
        int workerCount,
        long accepted,
        long dropped,
        long exported,
        long failed,
        long outstanding
) {

    /**
     * Fraction of the queue in use, between 0 and 1.
     */
    public double queueUsage() {
        return queueCapacity > 0 ? (double) queueSize / queueCapacity : 0.0;
    }
}
