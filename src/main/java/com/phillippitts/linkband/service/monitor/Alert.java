package com.phillippitts.linkband.service.monitor;

import java.time.Instant;
import java.util.Objects;

/**
 * A raised connection alert.
 *
 * @param id monotonic from 1 within a process
 */
public record Alert(long id, AlertLevel level, AlertType type, String message, Instant timestamp) {

    public Alert {
        Objects.requireNonNull(level, "level");
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(message, "message");
        Objects.requireNonNull(timestamp, "timestamp");
    }
}
