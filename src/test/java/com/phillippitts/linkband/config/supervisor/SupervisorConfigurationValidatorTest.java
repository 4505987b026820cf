package com.phillippitts.linkband.config.supervisor;

import com.phillippitts.linkband.config.properties.SupervisorProperties;
import com.phillippitts.linkband.exception.SupervisorConfigurationException;
import com.phillippitts.linkband.protocol.SensorType;
import org.junit.jupiter.api.Test;

import java.util.EnumMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SupervisorConfigurationValidatorTest {

    @Test
    void acceptsDefaults() {
        SupervisorConfigurationValidator validator = new SupervisorConfigurationValidator(new SupervisorProperties());

        assertThatCode(validator::validate).doesNotThrowAnyException();
    }

    @Test
    void rejectsHttpBridgeUrl() {
        SupervisorProperties props = new SupervisorProperties();
        props.getBridge().setUrl("http://localhost:18765");

        assertRejected(props, "linkband.supervisor.bridge.url");
    }

    @Test
    void rejectsApiUrlWithoutHost() {
        SupervisorProperties props = new SupervisorProperties();
        props.getBridge().setApiHealthUrl("http:///stream/health");

        assertRejected(props, "linkband.supervisor.bridge.api-health-url");
    }

    @Test
    void rejectsMalformedUri() {
        SupervisorProperties props = new SupervisorProperties();
        props.getBridge().setUrl("ws://local host:18765");

        assertRejected(props, "linkband.supervisor.bridge.url");
    }

    @Test
    void rejectsMaxDelayBelowBaseDelay() {
        SupervisorProperties props = new SupervisorProperties();
        props.getReconnect().setBaseDelayMs(5_000);
        props.getReconnect().setMaxDelayMs(1_000);

        assertRejected(props, "linkband.supervisor.reconnect.max-delay-ms");
    }

    @Test
    void rejectsHealthTimeoutShorterThanInterval() {
        SupervisorProperties props = new SupervisorProperties();
        props.getHealth().setTimeoutMs(500);

        assertRejected(props, "linkband.supervisor.health.timeout-ms");
    }

    @Test
    void rejectsTickLongerThanRateWindow() {
        SupervisorProperties props = new SupervisorProperties();
        props.getRate().setTickMs(2_000);

        assertRejected(props, "linkband.supervisor.rate.tick-ms");
    }

    @Test
    void rejectsNegativeThreshold() {
        SupervisorProperties props = new SupervisorProperties();
        props.getStreaming().getThresholds().put(SensorType.ACC, -1.0);

        assertRejected(props, "linkband.supervisor.streaming.thresholds.acc");
    }

    @Test
    void rejectsRequiredSensorWithoutThreshold() {
        SupervisorProperties props = new SupervisorProperties();
        Map<SensorType, Double> thresholds = new EnumMap<>(SensorType.class);
        thresholds.put(SensorType.EEG, 200.0);
        props.getStreaming().setThresholds(thresholds);

        assertRejected(props, "linkband.supervisor.streaming.required-sensors");
    }

    @Test
    void rejectsVoteWindowLargerThanHistory() {
        SupervisorProperties props = new SupervisorProperties();
        props.getMonitor().setHistoryCapacity(3);

        assertRejected(props, "linkband.supervisor.monitor.vote-window");
    }

    @Test
    void rejectsInstabilityThresholdLargerThanVoteWindow() {
        SupervisorProperties props = new SupervisorProperties();
        props.getMonitor().setInstabilityThreshold(6);

        assertRejected(props, "linkband.supervisor.monitor.instability-threshold");
    }

    private static void assertRejected(SupervisorProperties props, String property) {
        SupervisorConfigurationValidator validator = new SupervisorConfigurationValidator(props);

        assertThatThrownBy(validator::validate)
                .isInstanceOf(SupervisorConfigurationException.class)
                .extracting("property")
                .isEqualTo(property);
    }
}
