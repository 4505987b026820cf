package com.phillippitts.linkband.config.properties;

import com.phillippitts.linkband.protocol.FrameType;
import com.phillippitts.linkband.protocol.SensorType;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Configuration properties for the bridge supervisor (prefix {@code linkband.supervisor}).
 *
 * <p>Defaults match the bridge's shipped behaviour: WebSocket on port 18765, REST on 8121,
 * one-second health ticks, and the design thresholds for EEG/PPG/ACC throughput.
 * Cross-field rules are checked at startup by {@code SupervisorConfigurationValidator}.
 */
@ConfigurationProperties(prefix = "linkband.supervisor")
@Validated
public class SupervisorProperties {

    /** Start the supervisor with the application context. */
    private boolean autoStart = true;

    @Valid
    private Bridge bridge = new Bridge();

    @Valid
    private Reconnect reconnect = new Reconnect();

    @Valid
    private Health health = new Health();

    @Valid
    private Rate rate = new Rate();

    @Valid
    private Streaming streaming = new Streaming();

    @Valid
    private Monitor monitor = new Monitor();

    public boolean isAutoStart() {
        return autoStart;
    }

    public void setAutoStart(boolean autoStart) {
        this.autoStart = autoStart;
    }

    public Bridge getBridge() {
        return bridge;
    }

    public void setBridge(Bridge bridge) {
        this.bridge = bridge;
    }

    public Reconnect getReconnect() {
        return reconnect;
    }

    public void setReconnect(Reconnect reconnect) {
        this.reconnect = reconnect;
    }

    public Health getHealth() {
        return health;
    }

    public void setHealth(Health health) {
        this.health = health;
    }

    public Rate getRate() {
        return rate;
    }

    public void setRate(Rate rate) {
        this.rate = rate;
    }

    public Streaming getStreaming() {
        return streaming;
    }

    public void setStreaming(Streaming streaming) {
        this.streaming = streaming;
    }

    public Monitor getMonitor() {
        return monitor;
    }

    public void setMonitor(Monitor monitor) {
        this.monitor = monitor;
    }

    /**
     * Bridge endpoints.
     */
    public static class Bridge {
        @NotBlank(message = "Bridge WebSocket URL must be set")
        private String url = "ws://localhost:18765";

        @NotBlank(message = "Bridge API health URL must be set")
        private String apiHealthUrl = "http://localhost:8121/stream/health";

        @Positive(message = "Connect timeout must be positive")
        private long connectTimeoutMs = 10_000;

        /** Time the peer has to answer a local close before the socket is aborted. */
        @Positive(message = "Close timeout must be positive")
        private long closeTimeoutMs = 2_000;

        /** Interval of the safety-net check that restarts connects when idle-disconnected. */
        @Positive(message = "Connection check interval must be positive")
        private long connectionCheckIntervalMs = 1_000;

        public String getUrl() {
            return url;
        }

        public void setUrl(String url) {
            this.url = url;
        }

        public String getApiHealthUrl() {
            return apiHealthUrl;
        }

        public void setApiHealthUrl(String apiHealthUrl) {
            this.apiHealthUrl = apiHealthUrl;
        }

        public long getConnectTimeoutMs() {
            return connectTimeoutMs;
        }

        public void setConnectTimeoutMs(long connectTimeoutMs) {
            this.connectTimeoutMs = connectTimeoutMs;
        }

        public long getCloseTimeoutMs() {
            return closeTimeoutMs;
        }

        public void setCloseTimeoutMs(long closeTimeoutMs) {
            this.closeTimeoutMs = closeTimeoutMs;
        }

        public long getConnectionCheckIntervalMs() {
            return connectionCheckIntervalMs;
        }

        public void setConnectionCheckIntervalMs(long connectionCheckIntervalMs) {
            this.connectionCheckIntervalMs = connectionCheckIntervalMs;
        }
    }

    /**
     * Bounded exponential backoff with jitter.
     */
    public static class Reconnect {
        @Positive(message = "Base delay must be positive")
        private long baseDelayMs = 1_000;

        @DecimalMin(value = "1.0", message = "Multiplier must be at least 1.0")
        private double multiplier = 2.0;

        @Positive(message = "Max delay must be positive")
        private long maxDelayMs = 30_000;

        @DecimalMin(value = "0.0", message = "Jitter must be between 0 and 1")
        @DecimalMax(value = "1.0", message = "Jitter must be between 0 and 1")
        private double jitter = 0.2;

        /** 0 retries forever; a positive value gives up after that many failed attempts. */
        @Min(value = 0, message = "Max attempts must be zero (unbounded) or positive")
        private int maxAttempts = 0;

        public long getBaseDelayMs() {
            return baseDelayMs;
        }

        public void setBaseDelayMs(long baseDelayMs) {
            this.baseDelayMs = baseDelayMs;
        }

        public double getMultiplier() {
            return multiplier;
        }

        public void setMultiplier(double multiplier) {
            this.multiplier = multiplier;
        }

        public long getMaxDelayMs() {
            return maxDelayMs;
        }

        public void setMaxDelayMs(long maxDelayMs) {
            this.maxDelayMs = maxDelayMs;
        }

        public double getJitter() {
            return jitter;
        }

        public void setJitter(double jitter) {
            this.jitter = jitter;
        }

        public int getMaxAttempts() {
            return maxAttempts;
        }

        public void setMaxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
        }
    }

    /**
     * Liveness probing of the bridge.
     */
    public static class Health {
        @Positive(message = "Health interval must be positive")
        private long intervalMs = 1_000;

        @Positive(message = "Health timeout must be positive")
        private long timeoutMs = 2_000;

        @Positive(message = "Max missed acknowledgements must be positive")
        private int maxMissed = 2;

        public long getIntervalMs() {
            return intervalMs;
        }

        public void setIntervalMs(long intervalMs) {
            this.intervalMs = intervalMs;
        }

        public long getTimeoutMs() {
            return timeoutMs;
        }

        public void setTimeoutMs(long timeoutMs) {
            this.timeoutMs = timeoutMs;
        }

        public int getMaxMissed() {
            return maxMissed;
        }

        public void setMaxMissed(int maxMissed) {
            this.maxMissed = maxMissed;
        }
    }

    /**
     * Throughput estimation.
     */
    public static class Rate {
        @Positive(message = "Rate window must be positive")
        private long windowMs = 1_000;

        /** Supervisor tick; drives rate decay, streaming detection and status recording. */
        @Positive(message = "Tick interval must be positive")
        private long tickMs = 1_000;

        /** processed_data repeats the raw samples, so it is excluded by default. */
        @NotEmpty(message = "At least one frame type must count towards throughput")
        private Set<FrameType> countedFrameTypes = EnumSet.of(FrameType.RAW_DATA, FrameType.SENSOR_DATA);

        public long getWindowMs() {
            return windowMs;
        }

        public void setWindowMs(long windowMs) {
            this.windowMs = windowMs;
        }

        public long getTickMs() {
            return tickMs;
        }

        public void setTickMs(long tickMs) {
            this.tickMs = tickMs;
        }

        public Set<FrameType> getCountedFrameTypes() {
            return countedFrameTypes;
        }

        public void setCountedFrameTypes(Set<FrameType> countedFrameTypes) {
            this.countedFrameTypes = countedFrameTypes;
        }
    }

    /**
     * Streaming detection thresholds and hysteresis.
     */
    public static class Streaming {
        /** Samples per second at or above which a sensor counts as flowing. */
        @NotNull
        private Map<SensorType, Double> thresholds = defaultThresholds();

        @NotEmpty(message = "At least one sensor must be required for streaming")
        private Set<SensorType> requiredSensors = EnumSet.of(SensorType.EEG, SensorType.PPG, SensorType.ACC);

        @Positive(message = "Activation ticks must be positive")
        private int activationTicks = 1;

        @Positive(message = "Deactivation ticks must be positive")
        private int deactivationTicks = 2;

        /** How long a start request may go without observed data before a warning is logged. */
        @Positive(message = "Request grace period must be positive")
        private long requestGraceMs = 15_000;

        private static Map<SensorType, Double> defaultThresholds() {
            Map<SensorType, Double> m = new EnumMap<>(SensorType.class);
            m.put(SensorType.EEG, 200.0);
            m.put(SensorType.PPG, 40.0);
            m.put(SensorType.ACC, 25.0);
            m.put(SensorType.BATTERY, 0.0);
            return m;
        }

        public Map<SensorType, Double> getThresholds() {
            return thresholds;
        }

        public void setThresholds(Map<SensorType, Double> thresholds) {
            this.thresholds = thresholds;
        }

        public Set<SensorType> getRequiredSensors() {
            return requiredSensors;
        }

        public void setRequiredSensors(Set<SensorType> requiredSensors) {
            this.requiredSensors = requiredSensors;
        }

        public int getActivationTicks() {
            return activationTicks;
        }

        public void setActivationTicks(int activationTicks) {
            this.activationTicks = activationTicks;
        }

        public int getDeactivationTicks() {
            return deactivationTicks;
        }

        public void setDeactivationTicks(int deactivationTicks) {
            this.deactivationTicks = deactivationTicks;
        }

        public long getRequestGraceMs() {
            return requestGraceMs;
        }

        public void setRequestGraceMs(long requestGraceMs) {
            this.requestGraceMs = requestGraceMs;
        }
    }

    /**
     * Status history, voting, metrics and alerting.
     */
    public static class Monitor {
        @Positive(message = "History capacity must be positive")
        private int historyCapacity = 100;

        @Positive(message = "History max age must be positive")
        private long historyMaxAgeHours = 24;

        @Positive(message = "Vote window must be positive")
        private int voteWindow = 5;

        @Positive(message = "Error rate window must be positive")
        private int errorRateWindow = 100;

        @DecimalMin(value = "0.0", message = "Error rate threshold must be between 0 and 1")
        @DecimalMax(value = "1.0", message = "Error rate threshold must be between 0 and 1")
        private double errorRateThreshold = 0.3;

        @DecimalMin(value = "0.0", inclusive = false, message = "Latency weight must be in (0, 1]")
        @DecimalMax(value = "1.0", message = "Latency weight must be in (0, 1]")
        private double latencyWeight = 0.1;

        /** Degraded samples among the vote window that count as an unstable link. */
        @Positive(message = "Instability threshold must be positive")
        private int instabilityThreshold = 3;

        public int getHistoryCapacity() {
            return historyCapacity;
        }

        public void setHistoryCapacity(int historyCapacity) {
            this.historyCapacity = historyCapacity;
        }

        public long getHistoryMaxAgeHours() {
            return historyMaxAgeHours;
        }

        public void setHistoryMaxAgeHours(long historyMaxAgeHours) {
            this.historyMaxAgeHours = historyMaxAgeHours;
        }

        public int getVoteWindow() {
            return voteWindow;
        }

        public void setVoteWindow(int voteWindow) {
            this.voteWindow = voteWindow;
        }

        public int getErrorRateWindow() {
            return errorRateWindow;
        }

        public void setErrorRateWindow(int errorRateWindow) {
            this.errorRateWindow = errorRateWindow;
        }

        public double getErrorRateThreshold() {
            return errorRateThreshold;
        }

        public void setErrorRateThreshold(double errorRateThreshold) {
            this.errorRateThreshold = errorRateThreshold;
        }

        public double getLatencyWeight() {
            return latencyWeight;
        }

        public void setLatencyWeight(double latencyWeight) {
            this.latencyWeight = latencyWeight;
        }

        public int getInstabilityThreshold() {
            return instabilityThreshold;
        }

        public void setInstabilityThreshold(int instabilityThreshold) {
            this.instabilityThreshold = instabilityThreshold;
        }
    }
}
