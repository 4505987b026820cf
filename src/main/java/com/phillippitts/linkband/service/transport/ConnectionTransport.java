package com.phillippitts.linkband.service.transport;

import com.phillippitts.linkband.exception.HealthTimeoutException;
import com.phillippitts.linkband.exception.ProtocolException;
import com.phillippitts.linkband.exception.TransportException;
import com.phillippitts.linkband.protocol.BridgeCommand;
import com.phillippitts.linkband.protocol.BridgeMessage;
import com.phillippitts.linkband.protocol.BridgeMessageParser;
import com.phillippitts.linkband.protocol.HealthCheckResponse;
import com.phillippitts.linkband.service.reactor.Reactor;
import org.apache.logging.log4j.CloseableThreadContext;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.net.URI;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.OptionalLong;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Owns the single WebSocket link to the bridge and keeps it alive.
 *
 * <p>At most one socket is ever live: {@link #connect()} is a no-op while connecting or
 * connected, and every callback of a superseded socket is discarded by comparing its
 * connection generation with the current one. After a close or failure the transport
 * reconnects according to its {@link ReconnectPolicy} for as long as it is wanted, and
 * re-issues {@code check_device_connection} on every successful open so bridge state is
 * resynchronized.
 *
 * <p>Confined to the reactor thread: every method must be called from a reactor task, and all
 * socket callbacks are re-dispatched onto the reactor before they touch state. Only
 * {@link #state()} and {@link #isConnected()} may be read from other threads.
 */
public class ConnectionTransport {

    private static final Logger LOG = LogManager.getLogger(ConnectionTransport.class);

    private static final String MDC_GENERATION = "connectionGeneration";

    /** Optional hooks for metrics and error accounting. All methods default to no-ops. */
    public interface Observer {

        default void onConnectAttempt(long generation) {
        }

        default void onReconnectScheduled(int attempt, long delayMs) {
        }

        default void onReconnectExhausted(TransportException exception) {
        }

        default void onFailure(TransportException exception) {
        }

        default void onProtocolError(ProtocolException exception) {
        }

        default void onHealthAcknowledged(long latencyMs, HealthCheckResponse response) {
        }

        default void onHealthMissed(int consecutiveMisses) {
        }
    }

    private final Reactor reactor;
    private final BridgeConnector connector;
    private final URI endpoint;
    private final ReconnectPolicy reconnectPolicy;
    private final Duration connectionCheckInterval;
    private final HealthProbe healthProbe;

    private final List<Consumer<BridgeMessage>> messageHandlers = new CopyOnWriteArrayList<>();
    private final List<Consumer<Boolean>> connectionHandlers = new CopyOnWriteArrayList<>();
    private final List<Observer> observers = new CopyOnWriteArrayList<>();

    private volatile TransportState state = TransportState.DISCONNECTED;
    private BridgeConnection connection;
    private long generation;
    private boolean wanted;
    private boolean exhausted;
    private int failedAttempts;
    private Reactor.ScheduledTask reconnectTask;
    private Reactor.ScheduledTask connectionCheckTask;

    public ConnectionTransport(Reactor reactor,
                               BridgeConnector connector,
                               URI endpoint,
                               ReconnectPolicy reconnectPolicy,
                               Duration connectionCheckInterval,
                               HealthProbe.Settings probeSettings) {
        this.reactor = Objects.requireNonNull(reactor, "reactor");
        this.connector = Objects.requireNonNull(connector, "connector");
        this.endpoint = Objects.requireNonNull(endpoint, "endpoint");
        this.reconnectPolicy = Objects.requireNonNull(reconnectPolicy, "reconnectPolicy");
        this.connectionCheckInterval = Objects.requireNonNull(connectionCheckInterval, "connectionCheckInterval");
        this.healthProbe = new HealthProbe(reactor, probeSettings, this::sendProbe, new ProbeListener());
    }

    /** Registers a handler for every decoded inbound message. */
    public void onMessage(Consumer<BridgeMessage> handler) {
        messageHandlers.add(Objects.requireNonNull(handler, "handler"));
    }

    /** Registers a handler notified with {@code true} on open and {@code false} on loss. */
    public void onConnectionChange(Consumer<Boolean> handler) {
        connectionHandlers.add(Objects.requireNonNull(handler, "handler"));
    }

    public void addObserver(Observer observer) {
        observers.add(Objects.requireNonNull(observer, "observer"));
    }

    public TransportState state() {
        return state;
    }

    public boolean isConnected() {
        return state == TransportState.CONNECTED;
    }

    /** True when reconnecting was abandoned after the attempt budget was spent. */
    public boolean isExhausted() {
        return exhausted;
    }

    public boolean isReconnectPending() {
        return reconnectTask != null;
    }

    public int failedAttempts() {
        return failedAttempts;
    }

    long generation() {
        return generation;
    }

    /**
     * Marks the link as wanted and opens it unless already connecting or connected. A manual
     * connect after exhaustion resets the attempt budget.
     */
    public void connect() {
        wanted = true;
        if (exhausted) {
            LOG.info("Manual connect after exhausted reconnects; resetting attempt budget");
            exhausted = false;
            failedAttempts = 0;
        }
        if (connectionCheckTask == null) {
            connectionCheckTask = reactor.scheduleAtFixedRate(this::checkConnection, connectionCheckInterval);
        }
        beginConnect();
    }

    /**
     * Tears the link down and stops every timer. No callback of the released socket has any
     * effect afterwards. Idempotent.
     */
    public void disconnect() {
        wanted = false;
        cancelReconnect();
        if (connectionCheckTask != null) {
            connectionCheckTask.cancel();
            connectionCheckTask = null;
        }
        healthProbe.disarm();
        boolean wasConnected = state == TransportState.CONNECTED;
        BridgeConnection released = connection;
        connection = null;
        generation++;
        failedAttempts = 0;
        exhausted = false;
        if (state != TransportState.DISCONNECTED) {
            transition(TransportState.DISCONNECTED, "disconnect");
        }
        if (released != null) {
            released.close();
        }
        if (wasConnected) {
            notifyConnectionChange(false);
        }
    }

    /**
     * Sends a text frame on the live socket.
     *
     * @return future that fails with {@link TransportException} immediately when not connected
     */
    public CompletableFuture<Void> send(String text) {
        BridgeConnection current = connection;
        if (state != TransportState.CONNECTED || current == null) {
            TransportException e = new TransportException("Cannot send while " + state, endpoint.toString());
            LOG.warn("Dropping outbound frame: {}", e.getMessage());
            return CompletableFuture.failedFuture(e);
        }
        CompletableFuture<Void> sent = current.send(text);
        sent.whenComplete((ignored, error) -> {
            if (error != null) {
                LOG.warn("Outbound frame failed: {}", error.getMessage());
            }
        });
        return sent;
    }

    private void beginConnect() {
        if (!wanted || state != TransportState.DISCONNECTED) {
            return;
        }
        cancelReconnect();
        transition(TransportState.CONNECTING, "beginConnect");
        long gen = ++generation;
        observers.forEach(o -> o.onConnectAttempt(gen));
        try (CloseableThreadContext.Instance ctx = CloseableThreadContext.put(MDC_GENERATION, String.valueOf(gen))) {
            LOG.info("Connecting to bridge at {}", endpoint);
        }
        CompletableFuture<BridgeConnection> opening;
        try {
            opening = connector.open(endpoint, new SocketListener(gen));
        } catch (RuntimeException e) {
            opening = CompletableFuture.failedFuture(e);
        }
        opening.whenComplete((conn, error) -> reactor.execute(() -> {
            if (error != null) {
                openFailed(gen, error);
            } else {
                opened(gen, conn);
            }
        }));
    }

    private void opened(long gen, BridgeConnection conn) {
        if (gen != generation || state != TransportState.CONNECTING) {
            LOG.debug("Closing superseded socket of generation {}", gen);
            conn.close();
            return;
        }
        connection = conn;
        failedAttempts = 0;
        exhausted = false;
        transition(TransportState.CONNECTED, "opened");
        try (CloseableThreadContext.Instance ctx = CloseableThreadContext.put(MDC_GENERATION, String.valueOf(gen))) {
            LOG.info("Bridge connected at {}", endpoint);
        }
        notifyConnectionChange(true);
        healthProbe.arm();
        send(BridgeCommand.CHECK_DEVICE_CONNECTION.encode());
    }

    private void openFailed(long gen, Throwable error) {
        if (gen != generation || state != TransportState.CONNECTING) {
            return;
        }
        transition(TransportState.DISCONNECTED, "openFailed");
        generation++;
        TransportException e = asTransportException("Connect failed", error);
        try (CloseableThreadContext.Instance ctx = CloseableThreadContext.put(MDC_GENERATION, String.valueOf(gen))) {
            LOG.warn("Bridge connect failed: {}", e.getMessage());
        }
        observers.forEach(o -> o.onFailure(e));
        scheduleReconnect();
    }

    private void closed(long gen, int statusCode, String reason) {
        if (gen != generation) {
            return;
        }
        try (CloseableThreadContext.Instance ctx = CloseableThreadContext.put(MDC_GENERATION, String.valueOf(gen))) {
            LOG.info("Bridge closed the link (code={}, reason={})", statusCode, reason);
        }
        lose("closed");
        scheduleReconnect();
    }

    private void failed(long gen, Throwable error) {
        if (gen != generation) {
            return;
        }
        TransportException e = asTransportException("Link failed", error);
        try (CloseableThreadContext.Instance ctx = CloseableThreadContext.put(MDC_GENERATION, String.valueOf(gen))) {
            LOG.warn("Bridge link failed: {}", e.getMessage());
        }
        lose("failed");
        observers.forEach(o -> o.onFailure(e));
        scheduleReconnect();
    }

    // Shared teardown of an unexpected loss; invalidates the old socket's callbacks. The peer may
    // be hung, so the socket is aborted rather than closed with a handshake.
    private void lose(String transitionName) {
        boolean wasConnected = state == TransportState.CONNECTED;
        healthProbe.disarm();
        BridgeConnection released = connection;
        connection = null;
        generation++;
        if (state != TransportState.DISCONNECTED) {
            transition(TransportState.DISCONNECTED, transitionName);
        }
        if (released != null) {
            released.abort();
        }
        if (wasConnected) {
            notifyConnectionChange(false);
        }
    }

    private void scheduleReconnect() {
        if (!wanted || reconnectTask != null) {
            return;
        }
        failedAttempts++;
        OptionalLong delay = reconnectPolicy.delayMillis(failedAttempts);
        if (delay.isEmpty()) {
            exhausted = true;
            TransportException e = new TransportException(
                    "Gave up reconnecting after " + reconnectPolicy.maxAttempts() + " attempts", endpoint.toString());
            LOG.error(e.getMessage());
            observers.forEach(o -> o.onReconnectExhausted(e));
            return;
        }
        long delayMs = delay.getAsLong();
        LOG.info("Reconnecting in {}ms (attempt {})", delayMs, failedAttempts);
        observers.forEach(o -> o.onReconnectScheduled(failedAttempts, delayMs));
        reconnectTask = reactor.schedule(() -> {
            reconnectTask = null;
            beginConnect();
        }, Duration.ofMillis(delayMs));
    }

    private void cancelReconnect() {
        if (reconnectTask != null) {
            reconnectTask.cancel();
            reconnectTask = null;
        }
    }

    // Safety net: restarts connecting when the link is wanted but nothing is in flight.
    private void checkConnection() {
        if (wanted && state == TransportState.DISCONNECTED && reconnectTask == null && !exhausted) {
            LOG.debug("Connection check found an idle transport; connecting");
            beginConnect();
        }
    }

    private void onText(long gen, String text) {
        if (gen != generation) {
            return;
        }
        BridgeMessage message;
        try {
            message = BridgeMessageParser.parse(text);
        } catch (ProtocolException e) {
            rejected(gen, e);
            return;
        }
        if (message instanceof HealthCheckResponse response) {
            healthProbe.onResponse(response);
        }
        for (Consumer<BridgeMessage> handler : messageHandlers) {
            handler.accept(message);
        }
    }

    private void rejected(long gen, ProtocolException e) {
        if (gen != generation) {
            return;
        }
        LOG.warn("Dropping malformed bridge frame: {}", e.getReason());
        observers.forEach(o -> o.onProtocolError(e));
    }

    private void sendProbe(String text) {
        send(text);
    }

    private void transition(TransportState next, String name) {
        TransportState current = state;
        if (!current.canTransitionTo(next)) {
            throw new IllegalStateException("Illegal transport transition " + name + ": " + current + " -> " + next);
        }
        LOG.debug("Transport {}: {} -> {}", name, current, next);
        state = next;
    }

    private void notifyConnectionChange(boolean connected) {
        for (Consumer<Boolean> handler : connectionHandlers) {
            handler.accept(connected);
        }
    }

    private TransportException asTransportException(String message, Throwable error) {
        Throwable cause = error instanceof java.util.concurrent.CompletionException && error.getCause() != null
                ? error.getCause() : error;
        if (cause instanceof TransportException te) {
            return te;
        }
        return new TransportException(message + ": " + cause.getMessage(), endpoint.toString(), cause);
    }

    private final class SocketListener implements BridgeConnection.Listener {
        private final long gen;

        SocketListener(long gen) {
            this.gen = gen;
        }

        @Override
        public void onText(String text) {
            reactor.execute(() -> ConnectionTransport.this.onText(gen, text));
        }

        @Override
        public void onClosed(int statusCode, String reason) {
            reactor.execute(() -> closed(gen, statusCode, reason));
        }

        @Override
        public void onError(Throwable error) {
            reactor.execute(() -> failed(gen, error));
        }

        @Override
        public void onRejected(ProtocolException error) {
            reactor.execute(() -> rejected(gen, error));
        }
    }

    private final class ProbeListener implements HealthProbe.Listener {
        @Override
        public void onAcknowledged(long latencyMs, HealthCheckResponse response) {
            observers.forEach(o -> o.onHealthAcknowledged(latencyMs, response));
        }

        @Override
        public void onMissed(int consecutiveMisses) {
            observers.forEach(o -> o.onHealthMissed(consecutiveMisses));
        }

        @Override
        public void onTimedOut(HealthTimeoutException exception) {
            failed(generation, exception);
        }
    }
}
