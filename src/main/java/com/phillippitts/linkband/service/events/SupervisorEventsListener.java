package com.phillippitts.linkband.service.events;

import com.phillippitts.linkband.service.monitor.Alert;
import com.phillippitts.linkband.service.monitor.AlertLevel;
import com.phillippitts.linkband.service.supervisor.event.ConnectionAlertEvent;
import com.phillippitts.linkband.service.supervisor.event.OverallStatusChangedEvent;
import com.phillippitts.linkband.service.supervisor.event.ReconnectExhaustedEvent;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Operator-facing log lines for supervisor events. Throttled per key to avoid log spam while
 * the link flaps.
 */
@Component
class SupervisorEventsListener {
    private static final Logger LOG = LogManager.getLogger(SupervisorEventsListener.class);

    private final Map<String, Instant> lastLog = new ConcurrentHashMap<>();
    private static final Duration THROTTLE = Duration.ofMinutes(1);

    @EventListener
    void onAlert(ConnectionAlertEvent e) {
        Alert alert = e.alert();
        String key = "alert-" + alert.type();
        if (shouldLog(key)) {
            if (alert.level() == AlertLevel.CRITICAL) {
                LOG.error("Bridge alert: {}. Check that the LinkBand bridge is running.", alert.message());
            } else {
                LOG.warn("Bridge alert: {}", alert.message());
            }
        }
    }

    @EventListener
    void onReconnectExhausted(ReconnectExhaustedEvent e) {
        if (shouldLog("reconnect-exhausted")) {
            LOG.error("Stopped reconnecting to the bridge at {} after {} attempts. "
                    + "Start the bridge, then reconnect manually.", e.endpoint(), e.attempts());
        }
    }

    @EventListener
    void onOverallStatusChanged(OverallStatusChangedEvent e) {
        String key = "status-" + e.current();
        if (shouldLog(key)) {
            LOG.info("Bridge status {} -> {}", e.previous(), e.current());
        }
    }

    // Package-private for tests
    boolean shouldLog(String key) {
        Instant now = Instant.now();
        Instant prev = lastLog.get(key);
        if (prev == null || Duration.between(prev, now).compareTo(THROTTLE) > 0) {
            lastLog.put(key, now);
            return true;
        }
        return false;
    }
}
