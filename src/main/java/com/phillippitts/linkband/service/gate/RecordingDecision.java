package com.phillippitts.linkband.service.gate;

import java.util.Objects;

/**
 * Outcome of a recording check.
 *
 * @param allowed whether recording may start now
 * @param reason human-readable explanation, suitable for the UI
 */
public record RecordingDecision(boolean allowed, String reason) {

    public RecordingDecision {
        Objects.requireNonNull(reason, "reason");
    }

    static RecordingDecision allow() {
        return new RecordingDecision(true, "Ready to record");
    }

    static RecordingDecision deny(String reason) {
        return new RecordingDecision(false, reason);
    }
}
