package com.phillippitts.linkband.exception;

/**
 * Thrown at startup when supervisor thresholds or intervals are inconsistent.
 * The application context refuses to start.
 */
public class SupervisorConfigurationException extends LinkBandException {

    private final String property;

    public SupervisorConfigurationException(String property, String message) {
        super("Invalid " + property + ": " + message);
        this.property = property;
    }

    public String getProperty() {
        return property;
    }
}
