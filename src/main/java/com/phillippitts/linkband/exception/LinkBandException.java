package com.phillippitts.linkband.exception;

/**
 * Base exception for all LinkBand supervisor errors.
 * All domain exceptions should extend this class to enable centralized error handling.
 */
public class LinkBandException extends RuntimeException {

    public LinkBandException(String message) {
        super(message);
    }

    public LinkBandException(String message, Throwable cause) {
        super(message, cause);
    }

    public LinkBandException(Throwable cause) {
        super(cause);
    }
}
