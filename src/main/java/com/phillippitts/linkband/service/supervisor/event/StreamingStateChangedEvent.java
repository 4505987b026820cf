package com.phillippitts.linkband.service.supervisor.event;

import com.phillippitts.linkband.service.streaming.StreamingState;

import java.time.Instant;

/**
 * Published when the observed streaming phase changes.
 */
public record StreamingStateChangedEvent(StreamingState previous, StreamingState current, Instant at) {
}
