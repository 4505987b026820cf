package com.phillippitts.linkband.service.streaming;

import com.phillippitts.linkband.protocol.SensorType;

import java.time.Instant;
import java.util.Objects;

/**
 * Throughput snapshot for one sensor channel.
 *
 * @param sensorType channel
 * @param samplesPerSecond windowed rate; 0 when nothing arrived within the window
 * @param threshold rate at or above which the channel counts as flowing
 * @param totalSamples samples counted since the estimator was created
 * @param lastArrival local time of the newest counted batch, null when none arrived yet
 */
public record SensorRate(
        SensorType sensorType,
        double samplesPerSecond,
        double threshold,
        long totalSamples,
        Instant lastArrival
) {
    public SensorRate {
        Objects.requireNonNull(sensorType, "sensorType");
    }

    public boolean meetsThreshold() {
        return samplesPerSecond >= threshold;
    }
}
