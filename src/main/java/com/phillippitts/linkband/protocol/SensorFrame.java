package com.phillippitts.linkband.protocol;

import java.util.List;
import java.util.Objects;

/**
 * A batch of samples for one sensor channel.
 *
 * @param frameType raw, processed or generic sensor frame
 * @param sensorType channel the samples belong to
 * @param deviceId bridge-reported device id (may be empty)
 * @param timestampMillis frame timestamp in epoch millis (0 when the bridge omitted it)
 * @param sampleTimesMillis per-sample timestamps in epoch millis, in arrival order
 */
public record SensorFrame(
        FrameType frameType,
        SensorType sensorType,
        String deviceId,
        long timestampMillis,
        List<Long> sampleTimesMillis
) implements BridgeMessage {

    public SensorFrame {
        Objects.requireNonNull(frameType, "frameType");
        Objects.requireNonNull(sensorType, "sensorType");
        deviceId = deviceId == null ? "" : deviceId;
        sampleTimesMillis = List.copyOf(sampleTimesMillis);
    }

    public int sampleCount() {
        return sampleTimesMillis.size();
    }
}
