package com.phillippitts.linkband.service.transport;

import com.phillippitts.linkband.exception.ProtocolException;

import java.util.concurrent.CompletableFuture;

/**
 * One open socket to the bridge.
 *
 * <p>Instances are single-use: once closed (by either side) they never reopen.
 */
public interface BridgeConnection {

    /**
     * Sends one complete text frame. Sends are queued so callers never block.
     *
     * @return future completed when the frame was handed to the socket, or failed with
     *         {@link com.phillippitts.linkband.exception.TransportException}
     */
    CompletableFuture<Void> send(String text);

    /**
     * Closes the socket with a normal-closure code. If the peer does not complete the close
     * handshake in time the socket is aborted. Idempotent.
     */
    void close();

    /** Drops the socket at once, without a close handshake. Idempotent. */
    void abort();

    /**
     * Callbacks for one connection. Invoked on I/O threads; implementations must hand off to
     * the reactor.
     */
    interface Listener {

        /** A complete text frame arrived. */
        void onText(String text);

        /** The peer closed the socket, or the socket was closed locally. */
        void onClosed(int statusCode, String reason);

        /** The socket failed; no further callbacks follow. */
        void onError(Throwable error);

        /** An inbound message was rejected before delivery. The socket stays open. */
        void onRejected(ProtocolException error);
    }
}
