package com.phillippitts.linkband.service.monitor;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Aggregates link observations into an overall status, metrics, history and alerts.
 *
 * <p>Each {@link #recordStatus} call derives the raw overall status from the table in
 * {@link OverallStatus}, appends it to a bounded history and updates metrics. The reported
 * status ({@link #getOverallStatus()}) is a vote over the most recent records, which smooths
 * a single dropped check.
 *
 * <p>Alerts:
 * <ul>
 *   <li>CRITICAL when a status change lands in OFFLINE</li>
 *   <li>WARNING when a status change lands in DEGRADED and the recent window holds at least
 *       {@code instabilityThreshold} DEGRADED records</li>
 *   <li>WARNING each time the error rate crosses above its threshold (edge-triggered)</li>
 * </ul>
 * Alerts are not deduplicated; the alert count only grows.
 *
 * <p>Mutators are confined to the supervisor reactor. Read accessors may be called from any
 * thread; they return immutable snapshots.
 */
public class ConnectionMonitor {

    private static final Logger LOG = LogManager.getLogger(ConnectionMonitor.class);

    private static final int ALERT_RETENTION = 100;

    /**
     * Monitor tuning.
     *
     * @param historyCapacity maximum retained records
     * @param historyMaxAge records older than this are pruned by maintenance
     * @param voteWindow records considered by the reported-status vote and instability alert
     * @param errorRateWindow records considered by the error rate
     * @param errorRateThreshold rate above which a HIGH_ERROR_RATE alert is raised
     * @param latencyWeight weight of a new sample in the latency moving average
     * @param instabilityThreshold DEGRADED records in the vote window that count as unstable
     */
    public record Settings(int historyCapacity,
                           Duration historyMaxAge,
                           int voteWindow,
                           int errorRateWindow,
                           double errorRateThreshold,
                           double latencyWeight,
                           int instabilityThreshold) {

        public static Settings defaults() {
            return new Settings(100, Duration.ofHours(24), 5, 100, 0.3, 0.1, 3);
        }
    }

    private final Clock clock;
    private final Settings settings;
    private final StatusHistory history;
    private final Deque<Alert> recentAlerts = new ArrayDeque<>();
    private final List<Consumer<ConnectionStatus>> statusListeners = new CopyOnWriteArrayList<>();
    private final List<Consumer<Alert>> alertListeners = new CopyOnWriteArrayList<>();

    private long uptimeMs;
    private long totalChecks;
    private long successfulChecks;
    private long failedChecks;
    private long errorCount;
    private double averageLatencyMs;
    private boolean latencySeeded;
    private double errorRate;
    private Instant lastSuccessfulCheck;
    private long nextAlertId = 1;

    private volatile ConnectionStatus currentStatus;
    private volatile OverallStatus reportedStatus = OverallStatus.OFFLINE;
    private volatile ConnectionMetrics metrics = ConnectionMetrics.EMPTY;
    private volatile List<ConnectionStatus> historyView = List.of();
    private volatile List<Alert> alertsView = List.of();
    private volatile long alertCount;

    public ConnectionMonitor(Clock clock, Settings settings) {
        this.clock = Objects.requireNonNull(clock, "clock");
        this.settings = Objects.requireNonNull(settings, "settings");
        this.history = new StatusHistory(settings.historyCapacity());
        this.currentStatus = ConnectionStatus.offline(clock.instant());
    }

    /**
     * Records one observation.
     *
     * @return the recorded status, with its derived overall
     */
    public ConnectionStatus recordStatus(boolean websocket, boolean api, boolean streaming) {
        Instant now = clock.instant();
        ConnectionStatus status = new ConnectionStatus(websocket, api, streaming, now);
        ConnectionStatus previous = history.latest();

        OverallStatus overall = status.overall();
        if (previous != null && overall != OverallStatus.OFFLINE) {
            uptimeMs += Math.max(0L, Duration.between(previous.lastCheck(), now).toMillis());
        }
        totalChecks++;
        if (overall == OverallStatus.OFFLINE) {
            failedChecks++;
        } else {
            successfulChecks++;
            lastSuccessfulCheck = now;
        }

        history.add(status, now);
        currentStatus = status;
        reportedStatus = vote();
        historyView = history.latest(0);

        boolean changed = previous == null || status.differsFrom(previous);
        if (changed) {
            LOG.info("Bridge status changed: websocket={}, api={}, streaming={}, overall={}",
                    websocket, api, streaming, overall);
            checkStatusAlerts(status);
        }
        updateErrorRate();
        publishMetrics();

        if (changed) {
            for (Consumer<ConnectionStatus> listener : statusListeners) {
                listener.accept(status);
            }
        }
        return status;
    }

    /** Folds one round-trip latency into the moving average. */
    public void recordResponseTime(long latencyMs) {
        if (latencyMs < 0) {
            throw new IllegalArgumentException("latencyMs must be >= 0, got: " + latencyMs);
        }
        if (!latencySeeded) {
            averageLatencyMs = latencyMs;
            latencySeeded = true;
        } else {
            double w = settings.latencyWeight();
            averageLatencyMs = averageLatencyMs * (1.0 - w) + latencyMs * w;
        }
        publishMetrics();
    }

    /** Counts an error and recomputes the error rate. */
    public void recordError() {
        errorCount++;
        updateErrorRate();
        publishMetrics();
    }

    /**
     * Prunes history entries older than the configured maximum age.
     *
     * @return number of entries removed
     */
    public int performMaintenance() {
        int removed = history.pruneOlderThan(clock.instant().minus(settings.historyMaxAge()));
        if (removed > 0) {
            LOG.debug("Pruned {} status history entries", removed);
            historyView = history.latest(0);
            reportedStatus = vote();
        }
        return removed;
    }

    /** Status voted over the recent window; OFFLINE before anything was recorded. */
    public OverallStatus getOverallStatus() {
        return reportedStatus;
    }

    /** Latest raw observation, or an OFFLINE placeholder before the first record. */
    public ConnectionStatus currentStatus() {
        return currentStatus;
    }

    public ConnectionMetrics getMetrics() {
        return metrics;
    }

    public MonitorDebugInfo getDebugInfo() {
        return new MonitorDebugInfo(currentStatus, reportedStatus, metrics, historyView.size(), alertCount);
    }

    /** Up to {@code limit} newest statuses, oldest first; all when {@code limit <= 0}. */
    public List<ConnectionStatus> getStatusHistory(int limit) {
        List<ConnectionStatus> view = historyView;
        if (limit <= 0 || limit >= view.size()) {
            return view;
        }
        return view.subList(view.size() - limit, view.size());
    }

    /** Recently raised alerts, oldest first. */
    public List<Alert> getAlerts() {
        return alertsView;
    }

    public long getAlertCount() {
        return alertCount;
    }

    /**
     * Subscribes to status changes (any of websocket, api, streaming or overall differs from
     * the previous record, or the first record).
     *
     * @return handle that unsubscribes when run
     */
    public Runnable onStatusChange(Consumer<ConnectionStatus> listener) {
        Objects.requireNonNull(listener, "listener");
        statusListeners.add(listener);
        return () -> statusListeners.remove(listener);
    }

    /**
     * Subscribes to raised alerts.
     *
     * @return handle that unsubscribes when run
     */
    public Runnable onAlert(Consumer<Alert> listener) {
        Objects.requireNonNull(listener, "listener");
        alertListeners.add(listener);
        return () -> alertListeners.remove(listener);
    }

    private OverallStatus vote() {
        if (history.isEmpty()) {
            return OverallStatus.OFFLINE;
        }
        int window = settings.voteWindow();
        int majority = window / 2 + 1;
        int partialQuorum = Math.min(2, window);
        if (history.countRecent(window, s -> s.overall() == OverallStatus.HEALTHY) >= majority) {
            return OverallStatus.HEALTHY;
        }
        if (history.countRecent(window, s -> s.websocket() && s.api()) >= majority) {
            return OverallStatus.READY;
        }
        if (history.countRecent(window, s -> s.websocket() || s.api()) >= partialQuorum) {
            return OverallStatus.DEGRADED;
        }
        return OverallStatus.OFFLINE;
    }

    private void checkStatusAlerts(ConnectionStatus status) {
        OverallStatus overall = status.overall();
        if (overall == OverallStatus.OFFLINE) {
            raise(AlertLevel.CRITICAL, AlertType.OFFLINE, "Bridge is offline");
        } else if (overall == OverallStatus.DEGRADED) {
            int degraded = history.countRecent(settings.voteWindow(), s -> s.overall() == OverallStatus.DEGRADED);
            if (degraded >= settings.instabilityThreshold()) {
                raise(AlertLevel.WARNING, AlertType.UNSTABLE,
                        "Connection unstable: " + degraded + " of last " + settings.voteWindow() + " checks degraded");
            }
        }
    }

    // Raises HIGH_ERROR_RATE only on the transition from at-or-below to above the threshold.
    private void updateErrorRate() {
        int window = Math.min(history.size(), settings.errorRateWindow());
        if (window == 0) {
            return;
        }
        double previous = errorRate;
        int offline = history.countRecent(window, s -> s.overall() == OverallStatus.OFFLINE);
        errorRate = (double) offline / window;
        double threshold = settings.errorRateThreshold();
        if (previous <= threshold && errorRate > threshold) {
            raise(AlertLevel.WARNING, AlertType.HIGH_ERROR_RATE,
                    String.format(Locale.ROOT, "High error rate: %.1f%% over last %d checks",
                            errorRate * 100.0, window));
        }
    }

    private void raise(AlertLevel level, AlertType type, String message) {
        Alert alert = new Alert(nextAlertId++, level, type, message, clock.instant());
        if (recentAlerts.size() == ALERT_RETENTION) {
            recentAlerts.pollFirst();
        }
        recentAlerts.addLast(alert);
        alertsView = List.copyOf(recentAlerts);
        alertCount = alert.id();
        LOG.warn("ALERT #{} [{}] {}: {}", alert.id(), level, type, message);
        for (Consumer<Alert> listener : alertListeners) {
            listener.accept(alert);
        }
    }

    private void publishMetrics() {
        metrics = new ConnectionMetrics(uptimeMs, totalChecks, successfulChecks, failedChecks, errorCount,
                averageLatencyMs, errorRate, lastSuccessfulCheck);
    }
}
