package com.phillippitts.linkband.testutil;

import com.phillippitts.linkband.exception.TransportException;
import com.phillippitts.linkband.service.transport.BridgeConnection;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * In-memory {@link BridgeConnection}. Records outbound frames and lets the test play the bridge.
 */
public class FakeBridgeConnection implements BridgeConnection {

    private final Listener listener;
    private final List<String> sent = new CopyOnWriteArrayList<>();
    private boolean closed;
    private boolean aborted;

    FakeBridgeConnection(Listener listener) {
        this.listener = listener;
    }

    @Override
    public CompletableFuture<Void> send(String text) {
        if (closed) {
            return CompletableFuture.failedFuture(new TransportException("Connection closed"));
        }
        sent.add(text);
        return CompletableFuture.completedFuture(null);
    }

    @Override
    public void close() {
        closed = true;
    }

    @Override
    public void abort() {
        closed = true;
        aborted = true;
    }

    public boolean isClosed() {
        return closed;
    }

    /** True when the client dropped the socket without a close handshake. */
    public boolean isAborted() {
        return aborted;
    }

    public List<String> sent() {
        return sent;
    }

    /** Number of sent frames containing the given command name. */
    public long sentCount(String commandName) {
        return sent.stream().filter(s -> s.contains("\"" + commandName + "\"")).count();
    }

    /** Delivers an inbound frame from the bridge. */
    public void receive(String text) {
        listener.onText(text);
    }

    /** The bridge closes the socket. */
    public void peerClose(int statusCode, String reason) {
        listener.onClosed(statusCode, reason);
    }

    /** The socket errors. */
    public void fail(Throwable error) {
        listener.onError(error);
    }
}
