package com.phillippitts.linkband.service.supervisor;

import com.phillippitts.linkband.config.properties.SupervisorProperties;
import com.phillippitts.linkband.exception.ProtocolException;
import com.phillippitts.linkband.exception.TransportException;
import com.phillippitts.linkband.protocol.BridgeEvent;
import com.phillippitts.linkband.protocol.BridgeMessage;
import com.phillippitts.linkband.protocol.HealthCheckResponse;
import com.phillippitts.linkband.protocol.SensorFrame;
import com.phillippitts.linkband.protocol.SensorType;
import com.phillippitts.linkband.protocol.UnhandledMessage;
import com.phillippitts.linkband.service.api.ApiHealthCheck;
import com.phillippitts.linkband.service.gate.RecordingDecision;
import com.phillippitts.linkband.service.gate.RecordingGate;
import com.phillippitts.linkband.service.metrics.SupervisorMetrics;
import com.phillippitts.linkband.service.monitor.Alert;
import com.phillippitts.linkband.service.monitor.ConnectionMetrics;
import com.phillippitts.linkband.service.monitor.ConnectionMonitor;
import com.phillippitts.linkband.service.monitor.ConnectionStatus;
import com.phillippitts.linkband.service.monitor.MonitorDebugInfo;
import com.phillippitts.linkband.service.monitor.OverallStatus;
import com.phillippitts.linkband.service.reactor.Reactor;
import com.phillippitts.linkband.service.streaming.SamplingRateEstimator;
import com.phillippitts.linkband.service.streaming.SensorRate;
import com.phillippitts.linkband.service.streaming.StreamingState;
import com.phillippitts.linkband.service.streaming.StreamingStateDetector;
import com.phillippitts.linkband.service.supervisor.event.ConnectionAlertEvent;
import com.phillippitts.linkband.service.supervisor.event.OverallStatusChangedEvent;
import com.phillippitts.linkband.service.supervisor.event.ReconnectExhaustedEvent;
import com.phillippitts.linkband.service.supervisor.event.RecordingGateChangedEvent;
import com.phillippitts.linkband.service.supervisor.event.StreamingStateChangedEvent;
import com.phillippitts.linkband.service.transport.BridgeConnector;
import com.phillippitts.linkband.service.transport.ConnectionTransport;
import com.phillippitts.linkband.service.transport.HealthProbe;
import com.phillippitts.linkband.service.transport.ReconnectPolicy;
import com.phillippitts.linkband.service.transport.TransportState;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Service;

import java.net.URI;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Owns the bridge link and everything derived from it.
 *
 * <p>On {@link #start()} the supervisor creates one transport, rate estimator, streaming
 * detector and connection monitor, connects, and runs a fixed-rate tick:
 * <ol>
 *   <li>recompute sensor rates (so a stalled stream decays)</li>
 *   <li>evaluate the observed streaming state</li>
 *   <li>start a REST reachability check (its result feeds the next tick)</li>
 *   <li>record the link status with the connection monitor</li>
 *   <li>prune history and recompute the recording gate</li>
 * </ol>
 * All state lives on the {@link Reactor}. Public methods may be called from any thread: commands
 * are dispatched onto the reactor, and read accessors return immutable snapshots.
 *
 * <p>Changes are published as Spring application events ({@link OverallStatusChangedEvent},
 * {@link StreamingStateChangedEvent}, {@link RecordingGateChangedEvent},
 * {@link ConnectionAlertEvent}, {@link ReconnectExhaustedEvent}).
 */
@Service
public class BridgeSupervisor implements SmartLifecycle {

    private static final Logger LOG = LogManager.getLogger(BridgeSupervisor.class);

    private static final Duration LIFECYCLE_TIMEOUT = Duration.ofSeconds(10);

    private final SupervisorProperties props;
    private final Reactor reactor;
    private final Clock clock;
    private final BridgeConnector connector;
    private final ApiHealthCheck apiHealthCheck;
    private final StreamingControl streamingControl;
    private final ApplicationEventPublisher publisher;
    private final SupervisorMetrics metrics;

    private final List<Consumer<ConnectionStatus>> statusListeners = new CopyOnWriteArrayList<>();

    private volatile Session session;
    private volatile boolean running;
    private volatile Set<SensorType> requiredSensors;

    public BridgeSupervisor(SupervisorProperties props,
                            Reactor reactor,
                            Clock clock,
                            BridgeConnector connector,
                            ApiHealthCheck apiHealthCheck,
                            StreamingControl streamingControl,
                            ApplicationEventPublisher publisher,
                            SupervisorMetrics metrics) {
        this.props = Objects.requireNonNull(props, "props");
        this.reactor = Objects.requireNonNull(reactor, "reactor");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.connector = Objects.requireNonNull(connector, "connector");
        this.apiHealthCheck = Objects.requireNonNull(apiHealthCheck, "apiHealthCheck");
        this.streamingControl = Objects.requireNonNull(streamingControl, "streamingControl");
        this.publisher = Objects.requireNonNull(publisher, "publisher");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.requiredSensors = EnumSet.copyOf(props.getStreaming().getRequiredSensors());

        metrics.registerOverallStatusGauge(this::getOverallStatus);
        for (SensorType type : SensorType.values()) {
            metrics.registerSensorRateGauge(type, () -> currentRate(type));
        }
    }

    // ---------------------------------------------------------------- lifecycle

    @Override
    public void start() {
        if (running) {
            return;
        }
        reactor.executeAndWait(this::startOnReactor, LIFECYCLE_TIMEOUT);
        running = true;
        LOG.info("Bridge supervisor started (bridge={}, tick={}ms)",
                props.getBridge().getUrl(), props.getRate().getTickMs());
    }

    @Override
    public void stop() {
        if (!running) {
            return;
        }
        reactor.executeAndWait(this::stopOnReactor, LIFECYCLE_TIMEOUT);
        running = false;
        LOG.info("Bridge supervisor stopped");
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    @Override
    public boolean isAutoStartup() {
        return props.isAutoStart();
    }

    // ---------------------------------------------------------------- commands

    /** Connects (or retries after exhaustion). No-op while connecting or connected. */
    public void connect() {
        withSession(s -> s.transport.connect());
    }

    /** Drops the link and stops reconnecting until {@link #connect()} is called. */
    public void disconnect() {
        withSession(s -> s.transport.disconnect());
    }

    /**
     * Records the user's requested streaming state and forwards it to the bridge. Never changes
     * the observed streaming state.
     */
    public void requestStreaming(boolean streaming) {
        withSession(s -> {
            s.requestedStreaming = streaming;
            s.requestedAt = reactor.now();
            s.mismatchWarned = false;
            LOG.info("Streaming {} requested", streaming ? "start" : "stop");
            streamingControl.requestStreaming(streaming, s.transport)
                    .whenComplete((ignored, error) -> {
                        if (error != null) {
                            LOG.warn("Streaming {} command not delivered: {}",
                                    streaming ? "start" : "stop", error.getMessage());
                        }
                    });
        });
    }

    /**
     * Replaces the sensors that must be flowing for the session to count as streaming.
     *
     * @throws IllegalArgumentException if empty
     */
    public void setRequiredSensors(Set<SensorType> sensors) {
        if (sensors == null || sensors.isEmpty()) {
            throw new IllegalArgumentException("At least one sensor must be required");
        }
        Set<SensorType> copy = EnumSet.copyOf(sensors);
        requiredSensors = copy;
        withSession(s -> s.detector.setRequiredSensors(copy));
    }

    /**
     * Subscribes to link status changes.
     *
     * @return handle that unsubscribes when run
     */
    public Runnable onStatusChange(Consumer<ConnectionStatus> listener) {
        Objects.requireNonNull(listener, "listener");
        statusListeners.add(listener);
        return () -> statusListeners.remove(listener);
    }

    // ---------------------------------------------------------------- snapshots

    /** Status voted over recent checks; OFFLINE while stopped. */
    public OverallStatus getOverallStatus() {
        Session s = session;
        return s == null ? OverallStatus.OFFLINE : s.monitor.getOverallStatus();
    }

    /** Latest raw link observation. */
    public ConnectionStatus currentStatus() {
        Session s = session;
        return s == null ? ConnectionStatus.offline(clock.instant()) : s.monitor.currentStatus();
    }

    public ConnectionMetrics getMetrics() {
        Session s = session;
        return s == null ? new ConnectionMetrics(0, 0, 0, 0, 0, 0.0, 0.0, null) : s.monitor.getMetrics();
    }

    public List<ConnectionStatus> getStatusHistory(int limit) {
        Session s = session;
        return s == null ? List.of() : s.monitor.getStatusHistory(limit);
    }

    public List<Alert> getAlerts() {
        Session s = session;
        return s == null ? List.of() : s.monitor.getAlerts();
    }

    /** Whether recording may start now, with the reason. */
    public RecordingDecision canRecord() {
        Session s = session;
        return s == null
                ? RecordingGate.canRecord(false, false, OverallStatus.OFFLINE, StreamingState.idle())
                : s.decision;
    }

    public StreamingState streamingState() {
        Session s = session;
        return s == null ? StreamingState.idle() : s.streamingState;
    }

    public Map<SensorType, SensorRate> rates() {
        Session s = session;
        return s == null ? Map.of() : s.rates;
    }

    public double currentRate(SensorType sensorType) {
        SensorRate rate = rates().get(sensorType);
        return rate == null ? 0.0 : rate.samplesPerSecond();
    }

    public TransportState transportState() {
        Session s = session;
        return s == null ? TransportState.DISCONNECTED : s.transport.state();
    }

    public boolean isRequestedStreaming() {
        Session s = session;
        return s != null && s.requestedStreaming;
    }

    public SupervisorDebugInfo getDebugInfo() {
        Session s = session;
        if (s == null) {
            return new SupervisorDebugInfo(false, props.getRate().getTickMs(), TransportState.DISCONNECTED, 0, false,
                    false, false, false, false, StreamingState.Phase.IDLE, Map.of(), requiredSensors,
                    canRecord(), null);
        }
        MonitorDebugInfo monitorInfo = s.monitor.getDebugInfo();
        return new SupervisorDebugInfo(running, props.getRate().getTickMs(), s.transport.state(),
                s.failedConnectAttempts, s.reconnectExhausted, s.engineInitialized, s.deviceConnected,
                s.apiReachable, s.requestedStreaming, s.streamingState.phase(), s.rates, requiredSensors,
                s.decision, monitorInfo);
    }

    // ---------------------------------------------------------------- reactor side

    private void withSession(Consumer<Session> action) {
        reactor.execute(() -> {
            Session s = session;
            if (s == null) {
                LOG.warn("Bridge supervisor is not running; command ignored");
                return;
            }
            action.accept(s);
        });
    }

    private void startOnReactor() {
        Session s = new Session(newTransport(), newEstimator(), newDetector(), newMonitor());
        s.transport.onMessage(message -> onMessage(s, message));
        s.transport.onConnectionChange(connected -> onConnectionChange(s, connected));
        s.transport.addObserver(new TransportMetricsObserver(s));
        s.monitor.onStatusChange(status -> statusListeners.forEach(l -> l.accept(status)));
        s.monitor.onAlert(alert -> {
            metrics.incrementAlert(alert.level(), alert.type());
            publisher.publishEvent(new ConnectionAlertEvent(alert));
        });
        s.rates = s.estimator.rates();
        s.decision = RecordingGate.canRecord(false, false, OverallStatus.OFFLINE, StreamingState.idle());
        session = s;

        s.transport.connect();
        s.tickTask = reactor.scheduleAtFixedRate(() -> tick(s), Duration.ofMillis(props.getRate().getTickMs()));
    }

    private void stopOnReactor() {
        Session s = session;
        if (s == null) {
            return;
        }
        if (s.tickTask != null) {
            s.tickTask.cancel();
        }
        s.transport.disconnect();
        session = null;
    }

    private void tick(Session s) {
        if (session != s) {
            return;
        }
        Instant now = reactor.now();

        s.estimator.tick();
        s.rates = s.estimator.rates();

        StreamingState previousState = s.streamingState;
        s.streamingState = s.detector.update(s.rates);
        if (previousState.phase() != s.streamingState.phase()) {
            publisher.publishEvent(new StreamingStateChangedEvent(previousState, s.streamingState, now));
        }
        checkRequestedVersusObserved(s, now);

        requestApiCheck(s);

        OverallStatus previousOverall = s.monitor.currentStatus().overall();
        boolean hadRecord = s.monitor.getMetrics().totalChecks() > 0;
        ConnectionStatus status = s.monitor.recordStatus(
                s.transport.isConnected(), s.apiReachable, s.streamingState.isStreaming());
        if (!hadRecord || previousOverall != status.overall()) {
            publisher.publishEvent(new OverallStatusChangedEvent(previousOverall, status.overall(), status, now));
        }

        s.monitor.performMaintenance();
        recomputeGate(s);
    }

    private void requestApiCheck(Session s) {
        if (s.apiCheckInFlight) {
            return;
        }
        s.apiCheckInFlight = true;
        apiHealthCheck.check().whenComplete((reachable, error) -> reactor.execute(() -> {
            s.apiCheckInFlight = false;
            if (session != s) {
                return;
            }
            s.apiReachable = error == null && Boolean.TRUE.equals(reachable);
        }));
    }

    private void checkRequestedVersusObserved(Session s, Instant now) {
        if (!s.requestedStreaming || s.streamingState.isActive()) {
            return;
        }
        long grace = props.getStreaming().getRequestGraceMs();
        if (!s.mismatchWarned && s.requestedAt != null
                && Duration.between(s.requestedAt, now).toMillis() >= grace
                && s.streamingState.phase() == StreamingState.Phase.IDLE) {
            s.mismatchWarned = true;
            LOG.warn("Streaming was requested {}ms ago but no sensor data is flowing (required={}, rates={})",
                    Duration.between(s.requestedAt, now).toMillis(), requiredSensors, s.streamingState.rates());
        }
    }

    private void onMessage(Session s, BridgeMessage message) {
        if (session != s) {
            return;
        }
        if (message instanceof SensorFrame frame) {
            s.estimator.recordBatch(frame);
        } else if (message instanceof HealthCheckResponse response) {
            boolean changed = s.engineInitialized != response.isOk() || s.deviceConnected != response.deviceConnected();
            s.engineInitialized = response.isOk();
            s.deviceConnected = response.deviceConnected();
            if (changed) {
                recomputeGate(s);
            }
        } else if (message instanceof BridgeEvent event) {
            onBridgeEvent(s, event);
        } else if (message instanceof UnhandledMessage unhandled) {
            LOG.debug("Ignoring bridge message type {}", unhandled.type());
        }
    }

    private void onBridgeEvent(Session s, BridgeEvent event) {
        boolean device = s.deviceConnected;
        switch (event.type()) {
            case DEVICE_INFO -> device = event.flag("connected", device);
            case DEVICE_CONNECTED -> device = true;
            case DEVICE_DISCONNECTED -> device = false;
            case DEVICE_CONNECTION_FAILED -> LOG.warn("Bridge reports device connection failed: {}", event.data());
            case ERROR -> LOG.warn("Bridge reported an error: {}", event.data());
            default -> LOG.debug("Bridge event {}", event.type());
        }
        if (device != s.deviceConnected) {
            s.deviceConnected = device;
            LOG.info("Device {}", device ? "connected" : "disconnected");
            recomputeGate(s);
        }
    }

    private void onConnectionChange(Session s, boolean connected) {
        if (session != s || connected) {
            return;
        }
        // Engine and device state are only known for the current connection.
        s.engineInitialized = false;
        s.deviceConnected = false;
        recomputeGate(s);
    }

    private void recomputeGate(Session s) {
        RecordingDecision next = RecordingGate.canRecord(
                s.engineInitialized, s.deviceConnected, s.monitor.currentStatus().overall(), s.streamingState);
        if (!next.equals(s.decision)) {
            s.decision = next;
            LOG.info("Recording gate: allowed={}, reason={}", next.allowed(), next.reason());
            publisher.publishEvent(new RecordingGateChangedEvent(next, reactor.now()));
        }
    }

    private ConnectionTransport newTransport() {
        SupervisorProperties.Reconnect r = props.getReconnect();
        SupervisorProperties.Health h = props.getHealth();
        return new ConnectionTransport(
                reactor,
                connector,
                URI.create(props.getBridge().getUrl()),
                new ReconnectPolicy(r.getBaseDelayMs(), r.getMultiplier(), r.getMaxDelayMs(), r.getJitter(),
                        r.getMaxAttempts()),
                Duration.ofMillis(props.getBridge().getConnectionCheckIntervalMs()),
                new HealthProbe.Settings(Duration.ofMillis(h.getIntervalMs()), Duration.ofMillis(h.getTimeoutMs()),
                        h.getMaxMissed()));
    }

    private SamplingRateEstimator newEstimator() {
        return new SamplingRateEstimator(props.getRate().getWindowMs(), props.getRate().getCountedFrameTypes(),
                props.getStreaming().getThresholds(), clock);
    }

    private StreamingStateDetector newDetector() {
        SupervisorProperties.Streaming st = props.getStreaming();
        return new StreamingStateDetector(new EnumMap<>(st.getThresholds()), requiredSensors,
                st.getActivationTicks(), st.getDeactivationTicks());
    }

    private ConnectionMonitor newMonitor() {
        SupervisorProperties.Monitor m = props.getMonitor();
        return new ConnectionMonitor(clock, new ConnectionMonitor.Settings(
                m.getHistoryCapacity(),
                Duration.ofHours(m.getHistoryMaxAgeHours()),
                m.getVoteWindow(),
                m.getErrorRateWindow(),
                m.getErrorRateThreshold(),
                m.getLatencyWeight(),
                m.getInstabilityThreshold()));
    }

    /** Everything owned by one start/stop cycle. Fields are written on the reactor only. */
    private static final class Session {
        final ConnectionTransport transport;
        final SamplingRateEstimator estimator;
        final StreamingStateDetector detector;
        final ConnectionMonitor monitor;

        Reactor.ScheduledTask tickTask;
        volatile Map<SensorType, SensorRate> rates = Map.of();
        volatile StreamingState streamingState = StreamingState.idle();
        volatile RecordingDecision decision;
        volatile boolean engineInitialized;
        volatile boolean deviceConnected;
        volatile boolean apiReachable;
        volatile boolean requestedStreaming;
        volatile int failedConnectAttempts;
        volatile boolean reconnectExhausted;
        Instant requestedAt;
        boolean mismatchWarned;
        boolean apiCheckInFlight;

        Session(ConnectionTransport transport,
                SamplingRateEstimator estimator,
                StreamingStateDetector detector,
                ConnectionMonitor monitor) {
            this.transport = transport;
            this.estimator = estimator;
            this.detector = detector;
            this.monitor = monitor;
        }
    }

    private final class TransportMetricsObserver implements ConnectionTransport.Observer {
        private final Session s;

        TransportMetricsObserver(Session s) {
            this.s = s;
        }

        @Override
        public void onConnectAttempt(long generation) {
            s.reconnectExhausted = false;
            metrics.incrementConnectAttempt();
        }

        @Override
        public void onReconnectScheduled(int attempt, long delayMs) {
            s.failedConnectAttempts = attempt;
            metrics.incrementReconnectScheduled();
        }

        @Override
        public void onReconnectExhausted(TransportException exception) {
            s.reconnectExhausted = true;
            metrics.incrementReconnectExhausted();
            publisher.publishEvent(new ReconnectExhaustedEvent(exception.getEndpoint(),
                    s.transport.failedAttempts(), exception, reactor.now()));
        }

        @Override
        public void onFailure(TransportException exception) {
            s.monitor.recordError();
            metrics.incrementTransportFailure(exception.getClass().getSimpleName());
        }

        @Override
        public void onProtocolError(ProtocolException exception) {
            s.monitor.recordError();
            metrics.incrementMalformedFrame();
        }

        @Override
        public void onHealthAcknowledged(long latencyMs, HealthCheckResponse response) {
            s.monitor.recordResponseTime(latencyMs);
            metrics.recordHealthLatency(latencyMs);
        }

        @Override
        public void onHealthMissed(int consecutiveMisses) {
            metrics.incrementHealthMiss();
        }
    }
}
