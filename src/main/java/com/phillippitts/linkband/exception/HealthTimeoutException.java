package com.phillippitts.linkband.exception;

/**
 * Raised when the bridge stops acknowledging liveness probes while the socket still looks open.
 * Handled exactly like any other {@link TransportException}.
 */
public class HealthTimeoutException extends TransportException {

    private final int missedAcknowledgements;

    public HealthTimeoutException(int missedAcknowledgements, long timeoutMs) {
        super("Bridge missed " + missedAcknowledgements + " consecutive health-check acknowledgements (timeout "
                + timeoutMs + "ms)");
        this.missedAcknowledgements = missedAcknowledgements;
    }

    public int getMissedAcknowledgements() {
        return missedAcknowledgements;
    }
}
