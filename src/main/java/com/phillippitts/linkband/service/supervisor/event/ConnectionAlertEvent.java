package com.phillippitts.linkband.service.supervisor.event;

import com.phillippitts.linkband.service.monitor.Alert;

/**
 * Published for every alert raised by the connection monitor.
 */
public record ConnectionAlertEvent(Alert alert) {
}
