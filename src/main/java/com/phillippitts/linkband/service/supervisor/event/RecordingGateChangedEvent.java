package com.phillippitts.linkband.service.supervisor.event;

import com.phillippitts.linkband.service.gate.RecordingDecision;

import java.time.Instant;

/**
 * Published whenever the recording decision or its reason changes.
 */
public record RecordingGateChangedEvent(RecordingDecision decision, Instant at) {
}
