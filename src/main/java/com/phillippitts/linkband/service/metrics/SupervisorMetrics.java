package com.phillippitts.linkband.service.metrics;

import com.phillippitts.linkband.protocol.SensorType;
import com.phillippitts.linkband.service.monitor.AlertLevel;
import com.phillippitts.linkband.service.monitor.AlertType;
import com.phillippitts.linkband.service.monitor.OverallStatus;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.concurrent.TimeUnit;
import java.util.function.DoubleSupplier;
import java.util.function.Supplier;

/**
 * Centralized metrics for the bridge supervisor.
 *
 * <p>Provides instrumentation for:
 * <ul>
 *   <li>Connect attempts, scheduled reconnects and exhausted reconnect budgets</li>
 *   <li>Transport failures by exception type and malformed inbound frames</li>
 *   <li>Health-check round-trip latency and missed acknowledgements</li>
 *   <li>Alerts by level and type</li>
 *   <li>Gauges for the overall status and per-sensor sample rates</li>
 * </ul>
 *
 * <p>All metrics are exposed via Micrometer under the {@code linkband.supervisor} prefix.
 *
 * @see io.micrometer.core.instrument.MeterRegistry
 */
@Component
public class SupervisorMetrics {

    private static final String METRIC_PREFIX = "linkband.supervisor";

    private final MeterRegistry registry;

    public SupervisorMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void incrementConnectAttempt() {
        Counter.builder(METRIC_PREFIX + ".connect.attempts")
                .description("Number of WebSocket connect attempts")
                .register(registry)
                .increment();
    }

    public void incrementReconnectScheduled() {
        Counter.builder(METRIC_PREFIX + ".reconnect.scheduled")
                .description("Number of reconnects scheduled after a lost or failed connection")
                .register(registry)
                .increment();
    }

    public void incrementReconnectExhausted() {
        Counter.builder(METRIC_PREFIX + ".reconnect.exhausted")
                .description("Number of times the reconnect budget was spent")
                .register(registry)
                .increment();
    }

    /**
     * Increments the transport failure counter.
     *
     * @param type simple name of the exception that ended the link
     */
    public void incrementTransportFailure(String type) {
        Counter.builder(METRIC_PREFIX + ".transport.failures")
                .description("Number of failed connects and lost links")
                .tag("type", type)
                .register(registry)
                .increment();
    }

    public void incrementMalformedFrame() {
        Counter.builder(METRIC_PREFIX + ".frames.malformed")
                .description("Number of inbound frames dropped as malformed")
                .register(registry)
                .increment();
    }

    /**
     * Records health-check round-trip latency.
     *
     * @param latencyMs time between request and acknowledgement
     */
    public void recordHealthLatency(long latencyMs) {
        Timer.builder(METRIC_PREFIX + ".health.latency")
                .description("Health-check round-trip latency")
                .register(registry)
                .record(latencyMs, TimeUnit.MILLISECONDS);
    }

    public void incrementHealthMiss() {
        Counter.builder(METRIC_PREFIX + ".health.missed")
                .description("Number of health checks not acknowledged in time")
                .register(registry)
                .increment();
    }

    public void incrementAlert(AlertLevel level, AlertType type) {
        Counter.builder(METRIC_PREFIX + ".alerts")
                .description("Number of connection alerts raised")
                .tag("level", level.name().toLowerCase(Locale.ROOT))
                .tag("type", type.name().toLowerCase(Locale.ROOT))
                .register(registry)
                .increment();
    }

    /**
     * Registers a gauge reporting the overall status as its ordinal (0 healthy .. 3 offline).
     */
    public void registerOverallStatusGauge(Supplier<OverallStatus> status) {
        Gauge.builder(METRIC_PREFIX + ".status", () -> status.get().ordinal())
                .description("Overall bridge status (0=healthy, 1=ready, 2=degraded, 3=offline)")
                .register(registry);
    }

    public void registerSensorRateGauge(SensorType sensorType, DoubleSupplier rate) {
        Gauge.builder(METRIC_PREFIX + ".sensor.rate", rate::getAsDouble)
                .description("Observed samples per second")
                .tag("sensor", sensorType.wireName())
                .baseUnit("samples/s")
                .register(registry);
    }
}
