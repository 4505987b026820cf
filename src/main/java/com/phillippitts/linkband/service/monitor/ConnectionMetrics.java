package com.phillippitts.linkband.service.monitor;

import java.time.Instant;

/**
 * Derived link metrics. Produced by {@link ConnectionMonitor}; never mutated by callers.
 *
 * @param uptimeMs accumulated time between records while the link was not OFFLINE
 * @param totalChecks statuses recorded
 * @param successfulChecks recorded statuses that were not OFFLINE
 * @param failedChecks recorded statuses that were OFFLINE
 * @param errorCount errors reported through {@link ConnectionMonitor#recordError()}
 * @param averageLatencyMs exponential moving average of health-check latency
 * @param errorRate fraction of OFFLINE statuses over the recent check window, in [0, 1]
 * @param lastSuccessfulCheck time of the latest non-OFFLINE record, null if none
 */
public record ConnectionMetrics(
        long uptimeMs,
        long totalChecks,
        long successfulChecks,
        long failedChecks,
        long errorCount,
        double averageLatencyMs,
        double errorRate,
        Instant lastSuccessfulCheck
) {
    static final ConnectionMetrics EMPTY = new ConnectionMetrics(0, 0, 0, 0, 0, 0.0, 0.0, null);
}
