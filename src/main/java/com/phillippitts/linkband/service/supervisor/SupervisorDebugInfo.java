package com.phillippitts.linkband.service.supervisor;

import com.phillippitts.linkband.protocol.SensorType;
import com.phillippitts.linkband.service.gate.RecordingDecision;
import com.phillippitts.linkband.service.monitor.MonitorDebugInfo;
import com.phillippitts.linkband.service.streaming.SensorRate;
import com.phillippitts.linkband.service.streaming.StreamingState;
import com.phillippitts.linkband.service.transport.TransportState;

import java.util.Map;
import java.util.Set;

/**
 * Point-in-time view of everything the supervisor tracks.
 */
public record SupervisorDebugInfo(
        boolean running,
        long checkIntervalMs,
        TransportState transportState,
        int failedConnectAttempts,
        boolean reconnectExhausted,
        boolean engineInitialized,
        boolean deviceConnected,
        boolean apiReachable,
        boolean requestedStreaming,
        StreamingState.Phase streamingPhase,
        Map<SensorType, SensorRate> rates,
        Set<SensorType> requiredSensors,
        RecordingDecision recordingDecision,
        MonitorDebugInfo monitor
) {
}
