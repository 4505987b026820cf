package com.phillippitts.linkband.service.transport;

import java.net.URI;
import java.util.concurrent.CompletableFuture;

/**
 * Opens sockets to the bridge. The seam between {@link ConnectionTransport} and the actual
 * WebSocket client.
 */
public interface BridgeConnector {

    /**
     * Starts an asynchronous open.
     *
     * @param endpoint bridge WebSocket URI
     * @param listener receives frames and close/error callbacks once open
     * @return future completed with the open connection, or failed when the handshake fails
     */
    CompletableFuture<BridgeConnection> open(URI endpoint, BridgeConnection.Listener listener);
}
