package com.phillippitts.linkband.protocol;

import com.phillippitts.linkband.exception.ProtocolException;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BridgeMessageParserTest {

    @Test
    void parsesRawDataFrameWithPerSampleTimestamps() {
        String json = """
                {"type":"raw_data","sensor_type":"eeg","device_id":"LXB-1","timestamp":1700000000.5,
                 "data":[{"timestamp":1700000000.004,"ch1":1.0},{"timestamp":1700000000.008,"ch1":2.0}]}
                """;

        BridgeMessage message = BridgeMessageParser.parse(json);

        assertThat(message).isInstanceOf(SensorFrame.class);
        SensorFrame frame = (SensorFrame) message;
        assertThat(frame.frameType()).isEqualTo(FrameType.RAW_DATA);
        assertThat(frame.sensorType()).isEqualTo(SensorType.EEG);
        assertThat(frame.deviceId()).isEqualTo("LXB-1");
        assertThat(frame.timestampMillis()).isEqualTo(1_700_000_000_500L);
        assertThat(frame.sampleTimesMillis()).containsExactly(1_700_000_000_004L, 1_700_000_000_008L);
    }

    @Test
    void samplesWithoutOwnTimestampUseFrameTimestamp() {
        String json = "{\"type\":\"sensor_data\",\"sensor_type\":\"ppg\",\"timestamp\":10.25,"
                + "\"data\":[{\"red\":1},{\"red\":2},3]}";

        SensorFrame frame = (SensorFrame) BridgeMessageParser.parse(json);

        assertThat(frame.frameType()).isEqualTo(FrameType.SENSOR_DATA);
        assertThat(frame.sampleCount()).isEqualTo(3);
        assertThat(frame.sampleTimesMillis()).containsOnly(10_250L);
    }

    @Test
    void acceptsLegacyBatteryWireName() {
        String json = "{\"type\":\"processed_data\",\"sensor_type\":\"battery\",\"timestamp\":1,\"data\":[{}]}";

        SensorFrame frame = (SensorFrame) BridgeMessageParser.parse(json);

        assertThat(frame.sensorType()).isEqualTo(SensorType.BATTERY);
        assertThat(frame.frameType()).isEqualTo(FrameType.PROCESSED_DATA);
    }

    @Test
    void parsesHealthCheckResponse() {
        String json = "{\"type\":\"health_check_response\",\"status\":\"ok\",\"clients_connected\":2,"
                + "\"is_streaming\":true,\"device_connected\":true}";

        HealthCheckResponse response = (HealthCheckResponse) BridgeMessageParser.parse(json);

        assertThat(response.isOk()).isTrue();
        assertThat(response.clientsConnected()).isEqualTo(2);
        assertThat(response.streaming()).isTrue();
        assertThat(response.deviceConnected()).isTrue();
    }

    @Test
    void parsesDeviceInfoEvent() {
        String json = "{\"type\":\"event\",\"event_type\":\"device_info\","
                + "\"data\":{\"connected\":true,\"device_info\":null,\"is_streaming\":false}}";

        BridgeEvent event = (BridgeEvent) BridgeMessageParser.parse(json);

        assertThat(event.type()).isEqualTo(BridgeEventType.DEVICE_INFO);
        assertThat(event.flag("connected", false)).isTrue();
        assertThat(event.flag("is_streaming", true)).isFalse();
        assertThat(event.data()).doesNotContainKey("device_info");
    }

    @Test
    void eventWithoutDataHasEmptyPayload() {
        BridgeEvent event = (BridgeEvent) BridgeMessageParser.parse(
                "{\"type\":\"event\",\"event_type\":\"device_disconnected\"}");

        assertThat(event.type()).isEqualTo(BridgeEventType.DEVICE_DISCONNECTED);
        assertThat(event.data()).isEmpty();
        assertThat(event.flag("connected", true)).isTrue();
    }

    @Test
    void unknownTypesAreUnhandledNotErrors() {
        assertThat(BridgeMessageParser.parse("{\"type\":\"pong\"}"))
                .isEqualTo(new UnhandledMessage("pong"));
        assertThat(BridgeMessageParser.parse("{\"type\":\"event\",\"event_type\":\"firmware_update\"}"))
                .isEqualTo(new UnhandledMessage("event:firmware_update"));
    }

    @Test
    void rejectsMalformedFrames() {
        assertThatThrownBy(() -> BridgeMessageParser.parse("not json"))
                .isInstanceOf(ProtocolException.class)
                .hasMessageContaining("not a JSON object");
        assertThatThrownBy(() -> BridgeMessageParser.parse(""))
                .isInstanceOf(ProtocolException.class);
        assertThatThrownBy(() -> BridgeMessageParser.parse("{\"data\":[]}"))
                .isInstanceOf(ProtocolException.class)
                .hasMessageContaining("missing type");
    }

    @Test
    void rejectsUnknownSensorAndMissingData() {
        assertThatThrownBy(() -> BridgeMessageParser.parse(
                "{\"type\":\"raw_data\",\"sensor_type\":\"emg\",\"timestamp\":1,\"data\":[]}"))
                .isInstanceOf(ProtocolException.class)
                .hasMessageContaining("unknown sensor_type");
        assertThatThrownBy(() -> BridgeMessageParser.parse(
                "{\"type\":\"raw_data\",\"sensor_type\":\"eeg\",\"timestamp\":1}"))
                .isInstanceOf(ProtocolException.class)
                .hasMessageContaining("without data array");
    }

    @Test
    void rejectsSampleWithoutAnyTimestamp() {
        assertThatThrownBy(() -> BridgeMessageParser.parse(
                "{\"type\":\"raw_data\",\"sensor_type\":\"acc\",\"data\":[{\"x\":1}]}"))
                .isInstanceOf(ProtocolException.class)
                .hasMessageContaining("has no timestamp");
    }

    @Test
    void rejectsOversizedFrame() {
        String huge = "{\"type\":\"pong\",\"pad\":\"" + "x".repeat(BridgeMessageParser.MAX_FRAME_CHARS) + "\"}";

        assertThatThrownBy(() -> BridgeMessageParser.parse(huge))
                .isInstanceOf(ProtocolException.class)
                .hasMessageContaining("exceeds");
    }

    @Test
    void rejectsEventWhoseDataIsNotAnObject() {
        assertThatThrownBy(() -> BridgeMessageParser.parse(
                "{\"type\":\"event\",\"event_type\":\"error\",\"data\":\"boom\"}"))
                .isInstanceOf(ProtocolException.class)
                .hasMessageContaining("not an object");
    }
}
