package com.phillippitts.linkband.service.monitor;

import java.time.Instant;
import java.util.Objects;

/**
 * One recorded observation of the link.
 *
 * @param websocket bridge WebSocket open
 * @param api REST API reachable
 * @param streaming data observed flowing (streaming phase ACTIVE or DEGRADING)
 * @param lastCheck when the observation was recorded
 */
public record ConnectionStatus(boolean websocket, boolean api, boolean streaming, Instant lastCheck) {

    public ConnectionStatus {
        Objects.requireNonNull(lastCheck, "lastCheck");
    }

    /** Placeholder used before anything was recorded. */
    public static ConnectionStatus offline(Instant at) {
        return new ConnectionStatus(false, false, false, at);
    }

    public OverallStatus overall() {
        return OverallStatus.of(websocket, api, streaming);
    }

    boolean differsFrom(ConnectionStatus other) {
        return websocket != other.websocket
                || api != other.api
                || streaming != other.streaming
                || overall() != other.overall();
    }
}
