package com.phillippitts.linkband.service.streaming;

import com.phillippitts.linkband.protocol.SensorType;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * Observed, data-driven streaming state.
 *
 * <p>{@link Phase#DEGRADING} is the hysteresis hold-over between ACTIVE and IDLE: data was
 * flowing and has fallen short on more than one consecutive evaluation, but not for long enough
 * to declare the stream idle. A single short evaluation leaves the state ACTIVE. Only ACTIVE
 * permits recording.
 */
public final class StreamingState {

    public enum Phase { IDLE, ACTIVE, DEGRADING }

    private static final StreamingState IDLE = new StreamingState(Phase.IDLE, Map.of());

    private final Phase phase;
    private final Map<SensorType, Double> rates;

    private StreamingState(Phase phase, Map<SensorType, Double> rates) {
        this.phase = phase;
        this.rates = rates;
    }

    public static StreamingState idle() {
        return IDLE;
    }

    public static StreamingState active(Map<SensorType, Double> rates) {
        return new StreamingState(Phase.ACTIVE, copy(rates));
    }

    public static StreamingState degrading(Map<SensorType, Double> rates) {
        return new StreamingState(Phase.DEGRADING, copy(rates));
    }

    public Phase phase() {
        return phase;
    }

    /** Rates of the evaluation that produced this state; empty when idle. */
    public Map<SensorType, Double> rates() {
        return rates;
    }

    public boolean isActive() {
        return phase == Phase.ACTIVE;
    }

    /** True while data is, or was until very recently, flowing (ACTIVE or DEGRADING). */
    public boolean isStreaming() {
        return phase != Phase.IDLE;
    }

    private static Map<SensorType, Double> copy(Map<SensorType, Double> rates) {
        Objects.requireNonNull(rates, "rates");
        return rates.isEmpty() ? Map.of() : Collections.unmodifiableMap(new EnumMap<>(rates));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof StreamingState other)) {
            return false;
        }
        return phase == other.phase && rates.equals(other.rates);
    }

    @Override
    public int hashCode() {
        return Objects.hash(phase, rates);
    }

    @Override
    public String toString() {
        return phase == Phase.IDLE ? "IDLE" : phase.name() + rates;
    }
}
