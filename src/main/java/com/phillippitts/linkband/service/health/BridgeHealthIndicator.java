package com.phillippitts.linkband.service.health;

import com.phillippitts.linkband.service.gate.RecordingDecision;
import com.phillippitts.linkband.service.monitor.ConnectionMetrics;
import com.phillippitts.linkband.service.monitor.ConnectionStatus;
import com.phillippitts.linkband.service.monitor.OverallStatus;
import com.phillippitts.linkband.service.supervisor.BridgeSupervisor;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Health indicator for the bridge link.
 *
 * <p>Maps the voted overall status:
 * <ul>
 *   <li>UP: HEALTHY or READY</li>
 *   <li>DEGRADED: only part of the bridge answers</li>
 *   <li>DOWN: OFFLINE</li>
 * </ul>
 *
 * <p>Exposed via /actuator/health endpoint.
 */
@Component
public class BridgeHealthIndicator implements HealthIndicator {

    private final BridgeSupervisor supervisor;

    public BridgeHealthIndicator(BridgeSupervisor supervisor) {
        this.supervisor = supervisor;
    }

    @Override
    public Health health() {
        OverallStatus overall = supervisor.getOverallStatus();
        ConnectionStatus current = supervisor.currentStatus();
        ConnectionMetrics metrics = supervisor.getMetrics();
        RecordingDecision decision = supervisor.canRecord();

        Health.Builder builder = new Health.Builder();
        switch (overall) {
            case HEALTHY, READY -> builder.up();
            case DEGRADED -> builder.status("DEGRADED");
            case OFFLINE -> builder.down();
        }

        return builder
                .withDetail("status", overall.wireName())
                .withDetail("websocket", current.websocket())
                .withDetail("api", current.api())
                .withDetail("streaming", current.streaming())
                .withDetail("transport", supervisor.transportState().name())
                .withDetail("canRecord", decision.allowed())
                .withDetail("reason", decision.reason())
                .withDetail("averageLatencyMs", Math.round(metrics.averageLatencyMs()))
                .withDetail("errorRate", metrics.errorRate())
                .build();
    }
}
