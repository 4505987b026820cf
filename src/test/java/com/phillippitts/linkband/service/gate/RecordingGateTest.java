package com.phillippitts.linkband.service.gate;

import com.phillippitts.linkband.protocol.SensorType;
import com.phillippitts.linkband.service.monitor.OverallStatus;
import com.phillippitts.linkband.service.streaming.StreamingState;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RecordingGateTest {

    private static final StreamingState ACTIVE = StreamingState.active(Map.of(SensorType.EEG, 250.0));
    private static final StreamingState DEGRADING = StreamingState.degrading(Map.of(SensorType.EEG, 40.0));

    @ParameterizedTest
    @EnumSource(value = OverallStatus.class, names = {"HEALTHY", "READY", "DEGRADED"})
    void allowsWhenEveryConditionHolds(OverallStatus overall) {
        RecordingDecision decision = RecordingGate.canRecord(true, true, overall, ACTIVE);

        assertThat(decision.allowed()).isTrue();
        assertThat(decision.reason()).isEqualTo("Ready to record");
    }

    @Test
    void engineNotInitializedIsCheckedFirst() {
        RecordingDecision decision = RecordingGate.canRecord(false, false, OverallStatus.OFFLINE, StreamingState.idle());

        assertThat(decision.allowed()).isFalse();
        assertThat(decision.reason()).isEqualTo(RecordingGate.ENGINE_NOT_INITIALIZED);
    }

    @Test
    void offlineBridgeDenies() {
        RecordingDecision decision = RecordingGate.canRecord(true, false, OverallStatus.OFFLINE, ACTIVE);

        assertThat(decision.allowed()).isFalse();
        assertThat(decision.reason()).isEqualTo(RecordingGate.BRIDGE_OFFLINE);
    }

    @Test
    void missingDeviceDenies() {
        RecordingDecision decision = RecordingGate.canRecord(true, false, OverallStatus.HEALTHY, ACTIVE);

        assertThat(decision.reason()).isEqualTo(RecordingGate.DEVICE_NOT_CONNECTED);
    }

    @Test
    void idleStreamDenies() {
        RecordingDecision decision = RecordingGate.canRecord(true, true, OverallStatus.READY, StreamingState.idle());

        assertThat(decision.allowed()).isFalse();
        assertThat(decision.reason()).isEqualTo(RecordingGate.NOT_STREAMING);
    }

    @Test
    void degradingStreamDenies() {
        RecordingDecision decision = RecordingGate.canRecord(true, true, OverallStatus.HEALTHY, DEGRADING);

        assertThat(decision.allowed()).isFalse();
        assertThat(decision.reason()).isEqualTo(RecordingGate.STREAMING_DEGRADED);
    }

    @Test
    void rejectsNullInputs() {
        assertThatThrownBy(() -> RecordingGate.canRecord(true, true, null, ACTIVE))
                .isInstanceOf(NullPointerException.class);
        assertThatThrownBy(() -> RecordingGate.canRecord(true, true, OverallStatus.READY, null))
                .isInstanceOf(NullPointerException.class);
    }

    @Test
    void decisionRequiresReason() {
        assertThatThrownBy(() -> new RecordingDecision(true, null)).isInstanceOf(NullPointerException.class);
    }
}
