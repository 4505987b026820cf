package com.phillippitts.linkband.protocol;

/**
 * Acknowledgement of a {@code health_check} command.
 *
 * @param status bridge status string, {@code "ok"} when the bridge engine is running
 * @param clientsConnected number of WebSocket clients attached to the bridge
 * @param streaming bridge's own streaming flag (informational; never drives streaming state)
 * @param deviceConnected whether the bridge holds a device connection
 */
public record HealthCheckResponse(
        String status,
        int clientsConnected,
        boolean streaming,
        boolean deviceConnected
) implements BridgeMessage {

    public boolean isOk() {
        return "ok".equals(status);
    }
}
