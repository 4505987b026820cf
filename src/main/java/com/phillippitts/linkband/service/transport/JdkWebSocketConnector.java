package com.phillippitts.linkband.service.transport;

import com.phillippitts.linkband.exception.ProtocolException;
import com.phillippitts.linkband.exception.TransportException;
import com.phillippitts.linkband.protocol.BridgeMessageParser;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.WebSocket;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * {@link BridgeConnector} on top of {@link java.net.http.WebSocket}.
 *
 * <p>Fragmented text messages are reassembled before delivery, up to
 * {@link BridgeMessageParser#MAX_FRAME_CHARS}; a longer message is discarded and reported as
 * rejected. Outbound frames are chained so that at most one {@code sendText} is outstanding,
 * as the JDK client requires. A local close that the peer does not answer within the close
 * timeout aborts the socket.
 */
public class JdkWebSocketConnector implements BridgeConnector {

    private static final Logger LOG = LogManager.getLogger(JdkWebSocketConnector.class);

    private final HttpClient httpClient;
    private final Duration connectTimeout;
    private final Duration closeTimeout;
    private final int maxMessageChars;

    public JdkWebSocketConnector(HttpClient httpClient, Duration connectTimeout, Duration closeTimeout) {
        this(httpClient, connectTimeout, closeTimeout, BridgeMessageParser.MAX_FRAME_CHARS);
    }

    JdkWebSocketConnector(HttpClient httpClient, Duration connectTimeout, Duration closeTimeout, int maxMessageChars) {
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient");
        this.connectTimeout = Objects.requireNonNull(connectTimeout, "connectTimeout");
        this.closeTimeout = Objects.requireNonNull(closeTimeout, "closeTimeout");
        if (maxMessageChars < 1) {
            throw new IllegalArgumentException("maxMessageChars must be >= 1, got: " + maxMessageChars);
        }
        this.maxMessageChars = maxMessageChars;
    }

    @Override
    public CompletableFuture<BridgeConnection> open(URI endpoint, BridgeConnection.Listener listener) {
        Objects.requireNonNull(listener, "listener");
        FrameAssembler assembler = new FrameAssembler(listener, maxMessageChars);
        return httpClient.newWebSocketBuilder()
                .connectTimeout(connectTimeout)
                .buildAsync(endpoint, assembler)
                .<BridgeConnection>thenApply(ws -> new JdkConnection(ws, endpoint.toString(), closeTimeout))
                .exceptionallyCompose(e -> CompletableFuture.failedFuture(
                        new TransportException("WebSocket handshake failed", endpoint.toString(), unwrap(e))));
    }

    private static Throwable unwrap(Throwable e) {
        return e instanceof java.util.concurrent.CompletionException && e.getCause() != null ? e.getCause() : e;
    }

    private static final class JdkConnection implements BridgeConnection {
        private final WebSocket webSocket;
        private final String endpoint;
        private final Duration closeTimeout;
        private final AtomicBoolean closed = new AtomicBoolean(false);
        private CompletableFuture<?> tail = CompletableFuture.completedFuture(null);

        JdkConnection(WebSocket webSocket, String endpoint, Duration closeTimeout) {
            this.webSocket = webSocket;
            this.endpoint = endpoint;
            this.closeTimeout = closeTimeout;
        }

        @Override
        public synchronized CompletableFuture<Void> send(String text) {
            if (closed.get() || webSocket.isOutputClosed()) {
                return CompletableFuture.failedFuture(new TransportException("Socket output is closed", endpoint));
            }
            CompletableFuture<Void> result = tail
                    .handle((ignored, previousFailure) -> null)
                    .thenCompose(ignored -> webSocket.sendText(text, true))
                    .<Void>thenApply(ws -> null)
                    .exceptionallyCompose(e -> CompletableFuture.failedFuture(
                            new TransportException("Send failed", endpoint, unwrap(e))));
            tail = result;
            return result;
        }

        @Override
        public void close() {
            if (!closed.compareAndSet(false, true)) {
                return;
            }
            if (webSocket.isOutputClosed()) {
                webSocket.abort();
                return;
            }
            webSocket.sendClose(WebSocket.NORMAL_CLOSURE, "client disconnect")
                    .whenComplete((ws, e) -> {
                        if (e != null) {
                            LOG.debug("Close handshake failed for {}; aborting: {}", endpoint, e.getMessage());
                            webSocket.abort();
                        }
                    });
            CompletableFuture.delayedExecutor(closeTimeout.toMillis(), TimeUnit.MILLISECONDS).execute(() -> {
                if (!webSocket.isInputClosed()) {
                    LOG.debug("Peer at {} did not answer the close within {}ms; aborting",
                            endpoint, closeTimeout.toMillis());
                    webSocket.abort();
                }
            });
        }

        @Override
        public void abort() {
            closed.set(true);
            webSocket.abort();
        }
    }

    private static final class FrameAssembler implements WebSocket.Listener {
        private final BridgeConnection.Listener delegate;
        private final int maxChars;
        private final StringBuilder partial = new StringBuilder();
        private boolean discarding;

        FrameAssembler(BridgeConnection.Listener delegate, int maxChars) {
            this.delegate = delegate;
            this.maxChars = maxChars;
        }

        @Override
        public void onOpen(WebSocket webSocket) {
            webSocket.request(1);
        }

        @Override
        public CompletionStage<?> onText(WebSocket webSocket, CharSequence data, boolean last) {
            if (!discarding && partial.length() + data.length() > maxChars) {
                int seen = partial.length() + data.length();
                partial.setLength(0);
                partial.trimToSize();
                discarding = true;
                delegate.onRejected(new ProtocolException(
                        "message exceeds " + maxChars + " chars (at least " + seen + " received)"));
            }
            if (discarding) {
                if (last) {
                    discarding = false;
                }
            } else {
                partial.append(data);
                if (last) {
                    String text = partial.toString();
                    partial.setLength(0);
                    delegate.onText(text);
                }
            }
            webSocket.request(1);
            return null;
        }

        @Override
        public CompletionStage<?> onClose(WebSocket webSocket, int statusCode, String reason) {
            delegate.onClosed(statusCode, reason);
            return null;
        }

        @Override
        public void onError(WebSocket webSocket, Throwable error) {
            delegate.onError(error);
        }
    }
}
