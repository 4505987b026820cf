package com.phillippitts.linkband.service.gate;

import com.phillippitts.linkband.service.monitor.OverallStatus;
import com.phillippitts.linkband.service.streaming.StreamingState;

import java.util.Objects;

/**
 * Decides whether recording may start.
 *
 * <p>A pure function of its four inputs. Recording is allowed only when the bridge engine is
 * initialized, the bridge is not OFFLINE, a device is connected and the observed streaming
 * phase is ACTIVE. Inputs are checked in that order and the first failing one names the
 * reason. A user-requested start never opens the gate on its own.
 */
public final class RecordingGate {

    static final String ENGINE_NOT_INITIALIZED = "Bridge engine is not initialized";
    static final String BRIDGE_OFFLINE = "Bridge is offline";
    static final String DEVICE_NOT_CONNECTED = "No device connected";
    static final String NOT_STREAMING = "No sensor data is flowing; start streaming first";
    static final String STREAMING_DEGRADED = "Sensor data rate is below threshold; waiting for the stream to recover";

    private RecordingGate() {
        // Utility class - prevent instantiation
    }

    public static RecordingDecision canRecord(boolean engineInitialized,
                                              boolean deviceConnected,
                                              OverallStatus overall,
                                              StreamingState streamingState) {
        Objects.requireNonNull(overall, "overall");
        Objects.requireNonNull(streamingState, "streamingState");
        if (!engineInitialized) {
            return RecordingDecision.deny(ENGINE_NOT_INITIALIZED);
        }
        if (overall == OverallStatus.OFFLINE) {
            return RecordingDecision.deny(BRIDGE_OFFLINE);
        }
        if (!deviceConnected) {
            return RecordingDecision.deny(DEVICE_NOT_CONNECTED);
        }
        return switch (streamingState.phase()) {
            case ACTIVE -> RecordingDecision.allow();
            case DEGRADING -> RecordingDecision.deny(STREAMING_DEGRADED);
            case IDLE -> RecordingDecision.deny(NOT_STREAMING);
        };
    }
}
