package com.phillippitts.linkband.service.supervisor.event;

import com.phillippitts.linkband.service.monitor.ConnectionStatus;
import com.phillippitts.linkband.service.monitor.OverallStatus;

import java.time.Instant;

/**
 * Published when the derived overall status of the bridge link changes.
 */
public record OverallStatusChangedEvent(
        OverallStatus previous,
        OverallStatus current,
        ConnectionStatus status,
        Instant at
) {
}
