package com.phillippitts.linkband.exception;

/**
 * Thrown (or delivered through a failed future) when the bridge link is closed, errored,
 * or a send is attempted on a dead transport.
 *
 * <p>Never fatal: the transport reports it upward as a connection change and retries
 * according to its reconnect policy.
 */
public class TransportException extends LinkBandException {

    private final String endpoint;

    public TransportException(String message) {
        super(message);
        this.endpoint = "unknown";
    }

    public TransportException(String message, String endpoint) {
        super(message + " (endpoint: " + endpoint + ")");
        this.endpoint = endpoint;
    }

    public TransportException(String message, Throwable cause) {
        super(message, cause);
        this.endpoint = "unknown";
    }

    public TransportException(String message, String endpoint, Throwable cause) {
        super(message + " (endpoint: " + endpoint + ")", cause);
        this.endpoint = endpoint;
    }

    public String getEndpoint() {
        return endpoint;
    }
}
