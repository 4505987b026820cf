package com.phillippitts.linkband.config.supervisor;

import com.phillippitts.linkband.config.properties.SupervisorProperties;
import com.phillippitts.linkband.exception.SupervisorConfigurationException;
import com.phillippitts.linkband.protocol.SensorType;
import jakarta.annotation.PostConstruct;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Map;

/**
 * Validates cross-field rules of {@link SupervisorProperties} at startup so that the
 * context refuses to start with actionable messages.
 */
@Component
class SupervisorConfigurationValidator {

    private final SupervisorProperties props;

    SupervisorConfigurationValidator(SupervisorProperties props) {
        this.props = props;
    }

    @PostConstruct
    void validate() {
        SupervisorProperties.Bridge bridge = props.getBridge();
        requireScheme("linkband.supervisor.bridge.url", bridge.getUrl(), "ws", "wss");
        requireScheme("linkband.supervisor.bridge.api-health-url", bridge.getApiHealthUrl(), "http", "https");

        SupervisorProperties.Reconnect reconnect = props.getReconnect();
        if (reconnect.getMaxDelayMs() < reconnect.getBaseDelayMs()) {
            throw new SupervisorConfigurationException("linkband.supervisor.reconnect.max-delay-ms",
                    "must be >= base-delay-ms (" + reconnect.getBaseDelayMs() + "), got: "
                            + reconnect.getMaxDelayMs());
        }

        SupervisorProperties.Health health = props.getHealth();
        if (health.getTimeoutMs() < health.getIntervalMs()) {
            throw new SupervisorConfigurationException("linkband.supervisor.health.timeout-ms",
                    "must be >= interval-ms (" + health.getIntervalMs() + "), got: " + health.getTimeoutMs());
        }

        SupervisorProperties.Rate rate = props.getRate();
        if (rate.getTickMs() > rate.getWindowMs()) {
            throw new SupervisorConfigurationException("linkband.supervisor.rate.tick-ms",
                    "must be <= window-ms (" + rate.getWindowMs() + ") so a stalled stream decays within one window");
        }

        SupervisorProperties.Streaming streaming = props.getStreaming();
        for (Map.Entry<SensorType, Double> e : streaming.getThresholds().entrySet()) {
            Double threshold = e.getValue();
            if (threshold == null || threshold.isNaN() || threshold < 0.0) {
                throw new SupervisorConfigurationException(
                        "linkband.supervisor.streaming.thresholds." + e.getKey().wireName(),
                        "must be a non-negative number, got: " + threshold);
            }
        }
        for (SensorType required : streaming.getRequiredSensors()) {
            if (!streaming.getThresholds().containsKey(required)) {
                throw new SupervisorConfigurationException("linkband.supervisor.streaming.required-sensors",
                        "sensor '" + required.wireName() + "' has no threshold configured");
            }
        }

        SupervisorProperties.Monitor monitor = props.getMonitor();
        if (monitor.getVoteWindow() > monitor.getHistoryCapacity()) {
            throw new SupervisorConfigurationException("linkband.supervisor.monitor.vote-window",
                    "must be <= history-capacity (" + monitor.getHistoryCapacity() + "), got: "
                            + monitor.getVoteWindow());
        }
        if (monitor.getInstabilityThreshold() > monitor.getVoteWindow()) {
            throw new SupervisorConfigurationException("linkband.supervisor.monitor.instability-threshold",
                    "must be <= vote-window (" + monitor.getVoteWindow() + "), got: "
                            + monitor.getInstabilityThreshold());
        }
    }

    private static void requireScheme(String property, String value, String... schemes) {
        URI uri;
        try {
            uri = new URI(value);
        } catch (URISyntaxException e) {
            throw new SupervisorConfigurationException(property, "not a valid URI: '" + value + "'");
        }
        String scheme = uri.getScheme();
        for (String allowed : schemes) {
            if (allowed.equalsIgnoreCase(scheme)) {
                if (uri.getHost() == null) {
                    throw new SupervisorConfigurationException(property, "missing host in '" + value + "'");
                }
                return;
            }
        }
        throw new SupervisorConfigurationException(property,
                "scheme must be one of " + String.join("/", schemes) + ", got: '" + value + "'");
    }
}
