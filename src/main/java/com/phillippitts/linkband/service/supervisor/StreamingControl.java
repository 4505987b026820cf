package com.phillippitts.linkband.service.supervisor;

import com.phillippitts.linkband.service.transport.ConnectionTransport;

import java.util.concurrent.CompletableFuture;

/**
 * Forwards the user's requested streaming state to the bridge.
 *
 * <p>Only the request is forwarded; whether data actually flows is decided by observed
 * throughput.
 */
public interface StreamingControl {

    /**
     * @param streaming true to ask the bridge to start streaming, false to stop
     * @param transport live transport, called on the reactor
     * @return future completed when the command was sent
     */
    CompletableFuture<Void> requestStreaming(boolean streaming, ConnectionTransport transport);
}
