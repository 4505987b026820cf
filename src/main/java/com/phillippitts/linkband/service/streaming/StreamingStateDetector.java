package com.phillippitts.linkband.service.streaming;

import com.phillippitts.linkband.protocol.SensorType;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Turns per-sensor throughput into a debounced {@link StreamingState}.
 *
 * <p>An evaluation is "flowing" when every required sensor is at or above its threshold.
 * IDLE becomes ACTIVE after {@code activationTicks} consecutive flowing evaluations. Once
 * ACTIVE, the stream falls to IDLE only after {@code deactivationTicks} consecutive short
 * evaluations. The first short evaluation of a run is absorbed: the state stays ACTIVE with the
 * dipped rates. Any further short evaluations before the run reaches {@code deactivationTicks}
 * report DEGRADING. One flowing evaluation restores ACTIVE and clears the run. Commands never
 * set the state; only observed rates do.
 *
 * <p>Not thread-safe; confined to the supervisor reactor.
 */
public class StreamingStateDetector {

    private static final Logger LOG = LogManager.getLogger(StreamingStateDetector.class);

    private final Map<SensorType, Double> thresholds;
    private final int activationTicks;
    private final int deactivationTicks;

    private Set<SensorType> requiredSensors;
    private StreamingState state = StreamingState.idle();
    private int flowingStreak;
    private int shortStreak;

    public StreamingStateDetector(Map<SensorType, Double> thresholds,
                                  Set<SensorType> requiredSensors,
                                  int activationTicks,
                                  int deactivationTicks) {
        if (activationTicks < 1 || deactivationTicks < 1) {
            throw new IllegalArgumentException("activationTicks and deactivationTicks must be >= 1");
        }
        this.thresholds = new EnumMap<>(thresholds);
        this.activationTicks = activationTicks;
        this.deactivationTicks = deactivationTicks;
        setRequiredSensors(requiredSensors);
    }

    /**
     * Replaces the sensors required for the current session. Takes effect on the next
     * {@link #update(Map)}.
     *
     * @throws IllegalArgumentException if empty
     */
    public void setRequiredSensors(Set<SensorType> sensors) {
        if (sensors == null || sensors.isEmpty()) {
            throw new IllegalArgumentException("At least one sensor must be required");
        }
        this.requiredSensors = EnumSet.copyOf(sensors);
    }

    public Set<SensorType> requiredSensors() {
        return EnumSet.copyOf(requiredSensors);
    }

    public double threshold(SensorType sensorType) {
        return thresholds.getOrDefault(sensorType, 0.0);
    }

    public StreamingState current() {
        return state;
    }

    /**
     * Evaluates one tick of rates.
     *
     * @param rates latest rates per sensor; missing sensors count as 0/s
     * @return the state after this evaluation
     */
    public StreamingState update(Map<SensorType, SensorRate> rates) {
        Map<SensorType, Double> observed = new EnumMap<>(SensorType.class);
        boolean flowing = true;
        for (SensorType sensor : requiredSensors) {
            SensorRate rate = rates.get(sensor);
            double value = rate == null ? 0.0 : rate.samplesPerSecond();
            observed.put(sensor, value);
            if (value < threshold(sensor)) {
                flowing = false;
            }
        }

        StreamingState previous = state;
        state = flowing ? onFlowing(observed) : onShort(observed);
        if (previous.phase() != state.phase()) {
            LOG.info("Streaming state {} -> {} (rates={})", previous.phase(), state.phase(), observed);
        }
        return state;
    }

    /** Returns to IDLE and clears streaks, e.g. when a session ends. */
    public void reset() {
        state = StreamingState.idle();
        flowingStreak = 0;
        shortStreak = 0;
    }

    private StreamingState onFlowing(Map<SensorType, Double> observed) {
        shortStreak = 0;
        if (state.phase() == StreamingState.Phase.IDLE) {
            flowingStreak++;
            if (flowingStreak < activationTicks) {
                return StreamingState.idle();
            }
        }
        flowingStreak = 0;
        return StreamingState.active(observed);
    }

    private StreamingState onShort(Map<SensorType, Double> observed) {
        flowingStreak = 0;
        if (state.phase() == StreamingState.Phase.IDLE) {
            return StreamingState.idle();
        }
        shortStreak++;
        if (shortStreak >= deactivationTicks) {
            shortStreak = 0;
            return StreamingState.idle();
        }
        if (shortStreak == 1) {
            return StreamingState.active(observed);
        }
        return StreamingState.degrading(observed);
    }
}
