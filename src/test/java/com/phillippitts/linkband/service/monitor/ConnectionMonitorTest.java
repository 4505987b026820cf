package com.phillippitts.linkband.service.monitor;

import com.phillippitts.linkband.testutil.ManualReactor;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class ConnectionMonitorTest {

    private ManualReactor time;
    private ConnectionMonitor monitor;

    @BeforeEach
    void setUp() {
        time = new ManualReactor();
        monitor = new ConnectionMonitor(time.clock(), ConnectionMonitor.Settings.defaults());
    }

    @Test
    void offlineBeforeAnythingIsRecorded() {
        assertThat(monitor.getOverallStatus()).isEqualTo(OverallStatus.OFFLINE);
        assertThat(monitor.currentStatus().overall()).isEqualTo(OverallStatus.OFFLINE);
        assertThat(monitor.getMetrics().totalChecks()).isZero();
        assertThat(monitor.getAlerts()).isEmpty();
    }

    @Test
    void recordedStatusCarriesDerivedOverall() {
        ConnectionStatus status = monitor.recordStatus(true, true, false);

        assertThat(status.overall()).isEqualTo(OverallStatus.READY);
        assertThat(status.lastCheck()).isEqualTo(time.now());
        assertThat(monitor.currentStatus()).isEqualTo(status);
    }

    @Test
    void reportedStatusIsMajorityVote() {
        healthy(3);
        ready(2);
        assertThat(monitor.getOverallStatus()).isEqualTo(OverallStatus.HEALTHY);

        ready(1);
        assertThat(monitor.getOverallStatus()).isEqualTo(OverallStatus.READY);
    }

    @Test
    void singleDroppedCheckDoesNotFlipReportedStatus() {
        healthy(4);

        monitor.recordStatus(false, false, false);

        assertThat(monitor.currentStatus().overall()).isEqualTo(OverallStatus.OFFLINE);
        assertThat(monitor.getOverallStatus()).isEqualTo(OverallStatus.HEALTHY);
    }

    @Test
    void partialLinkNeedsTwoRecordsToReportDegraded() {
        monitor.recordStatus(true, false, false);
        assertThat(monitor.getOverallStatus()).isEqualTo(OverallStatus.OFFLINE);

        monitor.recordStatus(true, false, false);
        assertThat(monitor.getOverallStatus()).isEqualTo(OverallStatus.DEGRADED);
    }

    @Test
    void metricsTrackChecksAndUptime() {
        monitor.recordStatus(true, true, true);
        time.advance(Duration.ofSeconds(1));
        monitor.recordStatus(true, true, true);
        time.advance(Duration.ofSeconds(1));
        monitor.recordStatus(false, false, false);
        time.advance(Duration.ofSeconds(1));
        monitor.recordStatus(true, true, false);

        ConnectionMetrics metrics = monitor.getMetrics();
        assertThat(metrics.uptimeMs()).isEqualTo(2_000);
        assertThat(metrics.totalChecks()).isEqualTo(4);
        assertThat(metrics.successfulChecks()).isEqualTo(3);
        assertThat(metrics.failedChecks()).isEqualTo(1);
        assertThat(metrics.lastSuccessfulCheck()).isEqualTo(time.now());
    }

    @Test
    void latencyIsExponentialMovingAverageSeededByFirstSample() {
        monitor.recordResponseTime(100);
        assertThat(monitor.getMetrics().averageLatencyMs()).isEqualTo(100.0);

        monitor.recordResponseTime(200);
        assertThat(monitor.getMetrics().averageLatencyMs()).isCloseTo(110.0, within(1e-9));
    }

    @Test
    void rejectsNegativeLatency() {
        assertThatThrownBy(() -> monitor.recordResponseTime(-1)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void recordErrorCountsErrors() {
        monitor.recordError();
        monitor.recordError();

        assertThat(monitor.getMetrics().errorCount()).isEqualTo(2);
    }

    @Test
    void goingOfflineRaisesCriticalAlert() {
        healthy(1);

        monitor.recordStatus(false, false, false);
        monitor.recordStatus(false, false, false);

        List<Alert> critical = alertsOf(AlertType.OFFLINE);
        assertThat(critical).hasSize(1);
        assertThat(critical.get(0).level()).isEqualTo(AlertLevel.CRITICAL);
    }

    @Test
    void firstRecordOfflineRaisesCriticalAlert() {
        monitor.recordStatus(false, false, false);

        assertThat(monitor.getAlerts().get(0).type()).isEqualTo(AlertType.OFFLINE);
        assertThat(monitor.getAlerts().get(0).id()).isEqualTo(1);
    }

    @Test
    void repeatedDegradedChecksRaiseInstabilityWarning() {
        monitor.recordStatus(true, false, false);
        monitor.recordStatus(true, true, false);
        monitor.recordStatus(true, false, false);
        monitor.recordStatus(true, true, false);
        assertThat(alertsOf(AlertType.UNSTABLE)).isEmpty();

        monitor.recordStatus(true, false, false);

        assertThat(alertsOf(AlertType.UNSTABLE)).hasSize(1)
                .first().extracting(Alert::level).isEqualTo(AlertLevel.WARNING);
    }

    @Test
    void exactlyOneHighErrorRateAlertPerCrossing() {
        healthy(100);

        offline(30);
        assertThat(monitor.getMetrics().errorRate()).isEqualTo(0.3);
        assertThat(alertsOf(AlertType.HIGH_ERROR_RATE)).isEmpty();

        offline(1);
        assertThat(monitor.getMetrics().errorRate()).isCloseTo(0.31, within(1e-9));
        assertThat(alertsOf(AlertType.HIGH_ERROR_RATE)).hasSize(1);

        offline(40);
        assertThat(alertsOf(AlertType.HIGH_ERROR_RATE)).hasSize(1);

        healthy(100);
        assertThat(monitor.getMetrics().errorRate()).isZero();

        offline(31);
        assertThat(alertsOf(AlertType.HIGH_ERROR_RATE)).hasSize(2);
    }

    @Test
    void alertCountIsMonotonicWhileListIsBounded() {
        long previous = 0;
        for (int i = 0; i < 120; i++) {
            monitor.recordStatus(false, false, false);
            monitor.recordStatus(true, true, false);
            assertThat(monitor.getAlertCount()).isGreaterThan(previous);
            previous = monitor.getAlertCount();
        }

        List<Alert> alerts = monitor.getAlerts();
        assertThat(alerts).hasSize(100);
        assertThat(alerts.get(alerts.size() - 1).id()).isEqualTo(monitor.getAlertCount());
        assertThat(alerts).extracting(Alert::id).isSorted();
    }

    @Test
    void statusListenersFireOnChangeOnlyAndCanUnsubscribe() {
        List<ConnectionStatus> changes = new ArrayList<>();
        Runnable unsubscribe = monitor.onStatusChange(changes::add);

        healthy(3);
        ready(1);
        assertThat(changes).extracting(ConnectionStatus::overall)
                .containsExactly(OverallStatus.HEALTHY, OverallStatus.READY);

        unsubscribe.run();
        healthy(1);
        assertThat(changes).hasSize(2);
    }

    @Test
    void alertListenersReceiveRaisedAlerts() {
        List<Alert> received = new ArrayList<>();
        monitor.onAlert(received::add);

        healthy(1);
        offline(1);

        assertThat(received).extracting(Alert::type).contains(AlertType.OFFLINE);
    }

    @Test
    void maintenancePrunesHistoryOlderThanMaxAge() {
        healthy(1);
        time.advance(Duration.ofHours(25));
        healthy(1);

        assertThat(monitor.performMaintenance()).isEqualTo(1);
        assertThat(monitor.getStatusHistory(0)).hasSize(1);
        assertThat(monitor.performMaintenance()).isZero();
    }

    @Test
    void historyQueryHonoursLimit() {
        healthy(2);
        ready(3);

        assertThat(monitor.getStatusHistory(2)).extracting(ConnectionStatus::overall)
                .containsExactly(OverallStatus.READY, OverallStatus.READY);
        assertThat(monitor.getStatusHistory(0)).hasSize(5);
        assertThat(monitor.getDebugInfo().historySize()).isEqualTo(5);
    }

    private List<Alert> alertsOf(AlertType type) {
        return monitor.getAlerts().stream().filter(a -> a.type() == type).toList();
    }

    private void healthy(int times) {
        for (int i = 0; i < times; i++) {
            monitor.recordStatus(true, true, true);
        }
    }

    private void ready(int times) {
        for (int i = 0; i < times; i++) {
            monitor.recordStatus(true, true, false);
        }
    }

    private void offline(int times) {
        for (int i = 0; i < times; i++) {
            monitor.recordStatus(false, false, false);
        }
    }
}
