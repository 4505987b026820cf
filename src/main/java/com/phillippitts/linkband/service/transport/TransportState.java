package com.phillippitts.linkband.service.transport;

/**
 * Lifecycle of the bridge link.
 *
 * <p><b>State Transitions:</b>
 * <pre>
 * DISCONNECTED → CONNECTING  (beginConnect)
 * CONNECTING   → CONNECTED   (opened)
 * CONNECTING   → DISCONNECTED (openFailed, disconnect)
 * CONNECTED    → DISCONNECTED (closed, failed, disconnect)
 * </pre>
 * A reconnect is scheduled from DISCONNECTED and re-enters through {@code beginConnect}.
 */
public enum TransportState {
    DISCONNECTED,
    CONNECTING,
    CONNECTED;

    /** True when {@code next} is a legal successor of this state. */
    public boolean canTransitionTo(TransportState next) {
        return switch (this) {
            case DISCONNECTED -> next == CONNECTING;
            case CONNECTING -> next == CONNECTED || next == DISCONNECTED;
            case CONNECTED -> next == DISCONNECTED;
        };
    }
}
