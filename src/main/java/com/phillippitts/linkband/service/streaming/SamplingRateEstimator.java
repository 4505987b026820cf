package com.phillippitts.linkband.service.streaming;

import com.phillippitts.linkband.protocol.FrameType;
import com.phillippitts.linkband.protocol.SensorFrame;
import com.phillippitts.linkband.protocol.SensorType;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Windowed per-sensor throughput.
 *
 * <p>For each sensor the estimator keeps the sample timestamps that fall within the last
 * {@code windowMs} relative to an anchor, and reports the count normalized to samples per
 * second. The anchor is the newest sample timestamp, advanced by {@link #tick()} by the local
 * time elapsed since that sample arrived. A stalled stream therefore decays to zero within one
 * window instead of freezing at its last value.
 *
 * <p>Only frame types in {@code countedFrameTypes} contribute; the bridge sends processed data
 * for the same samples as raw data, so counting both would double the rate.
 *
 * <p>Not thread-safe; confined to the supervisor reactor.
 */
public class SamplingRateEstimator {

    private final long windowMs;
    private final Set<FrameType> countedFrameTypes;
    private final Map<SensorType, Double> thresholds;
    private final Clock clock;
    private final Map<SensorType, Channel> channels = new EnumMap<>(SensorType.class);

    public SamplingRateEstimator(long windowMs,
                                 Set<FrameType> countedFrameTypes,
                                 Map<SensorType, Double> thresholds,
                                 Clock clock) {
        if (windowMs <= 0) {
            throw new IllegalArgumentException("windowMs must be positive, got: " + windowMs);
        }
        this.windowMs = windowMs;
        this.countedFrameTypes = countedFrameTypes.isEmpty()
                ? EnumSet.noneOf(FrameType.class) : EnumSet.copyOf(countedFrameTypes);
        this.thresholds = thresholds.isEmpty()
                ? new EnumMap<>(SensorType.class) : new EnumMap<>(thresholds);
        this.clock = Objects.requireNonNull(clock, "clock");
        for (SensorType type : SensorType.values()) {
            channels.put(type, new Channel());
        }
    }

    /**
     * Adds one batch of samples and recomputes that sensor's rate.
     *
     * @return true when the frame counted towards throughput
     */
    public boolean recordBatch(SensorFrame frame) {
        Objects.requireNonNull(frame, "frame");
        if (!countedFrameTypes.contains(frame.frameType()) || frame.sampleCount() == 0) {
            return false;
        }
        channels.get(frame.sensorType()).add(frame.sampleTimesMillis(), clock.millis());
        return true;
    }

    /** Recomputes every rate against local elapsed time so idle channels decay. */
    public void tick() {
        long nowMs = clock.millis();
        for (Channel channel : channels.values()) {
            channel.advance(nowMs);
        }
    }

    /** Current samples per second for one sensor. */
    public double currentRate(SensorType sensorType) {
        return channels.get(sensorType).rate;
    }

    /** Snapshot of every sensor's rate, in {@link SensorType} order. */
    public Map<SensorType, SensorRate> rates() {
        Map<SensorType, SensorRate> snapshot = new EnumMap<>(SensorType.class);
        channels.forEach((type, channel) -> snapshot.put(type, new SensorRate(
                type,
                channel.rate,
                thresholds.getOrDefault(type, 0.0),
                channel.totalSamples,
                channel.lastArrivalMs < 0 ? null : Instant.ofEpochMilli(channel.lastArrivalMs))));
        return Collections.unmodifiableMap(snapshot);
    }

    /** Forgets every buffered sample and total. */
    public void reset() {
        for (SensorType type : SensorType.values()) {
            channels.put(type, new Channel());
        }
    }

    int bufferedSamples(SensorType sensorType) {
        return channels.get(sensorType).window.size();
    }

    private final class Channel {
        private final Deque<Long> window = new ArrayDeque<>();
        private long newestSampleMs = Long.MIN_VALUE;
        private long lastArrivalMs = -1L;
        private long totalSamples;
        private double rate;

        void add(Iterable<Long> sampleTimes, long arrivalMs) {
            for (Long t : sampleTimes) {
                window.addLast(t);
                newestSampleMs = Math.max(newestSampleMs, t);
                totalSamples++;
            }
            lastArrivalMs = arrivalMs;
            recompute(newestSampleMs);
        }

        void advance(long nowMs) {
            if (lastArrivalMs < 0) {
                return;
            }
            long elapsed = Math.max(0L, nowMs - lastArrivalMs);
            recompute(newestSampleMs + elapsed);
        }

        // Keeps samples in (anchor - windowMs, anchor]; later samples from a skewed clock are kept too.
        private void recompute(long anchorMs) {
            long cutoff = anchorMs - windowMs;
            window.removeIf(t -> t <= cutoff);
            rate = window.size() * 1000.0 / windowMs;
        }
    }
}
