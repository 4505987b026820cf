package com.phillippitts.linkband.service.supervisor.event;

import com.phillippitts.linkband.exception.TransportException;

import java.time.Instant;

/**
 * Published when the transport gives up reconnecting. A manual connect resets the budget.
 */
public record ReconnectExhaustedEvent(String endpoint, int attempts, TransportException cause, Instant at) {
}
