package com.phillippitts.linkband.exception;

/**
 * Thrown when an inbound bridge frame cannot be decoded.
 * The frame is dropped; the connection is preserved.
 */
public class ProtocolException extends LinkBandException {

    private final String reason;

    public ProtocolException(String reason) {
        super("Malformed bridge frame: " + reason);
        this.reason = reason;
    }

    public ProtocolException(String reason, Throwable cause) {
        super("Malformed bridge frame: " + reason, cause);
        this.reason = reason;
    }

    public String getReason() {
        return reason;
    }
}
