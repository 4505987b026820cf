package com.phillippitts.linkband.service.monitor;

/**
 * Point-in-time view of {@link ConnectionMonitor} internals.
 *
 * @param currentStatus latest raw observation (an OFFLINE placeholder before the first record)
 * @param reportedStatus status voted over the recent window
 * @param metrics derived metrics
 * @param historySize entries currently retained
 * @param alertCount alerts raised since start
 */
public record MonitorDebugInfo(
        ConnectionStatus currentStatus,
        OverallStatus reportedStatus,
        ConnectionMetrics metrics,
        int historySize,
        long alertCount
) {
}
