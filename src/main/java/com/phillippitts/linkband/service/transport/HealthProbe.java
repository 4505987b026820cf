package com.phillippitts.linkband.service.transport;

import com.phillippitts.linkband.exception.HealthTimeoutException;
import com.phillippitts.linkband.protocol.BridgeCommand;
import com.phillippitts.linkband.protocol.HealthCheckResponse;
import com.phillippitts.linkband.service.reactor.Reactor;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * Application-level liveness probe for the bridge link.
 *
 * <p>While armed, sends {@code health_check} every interval. Each request must be acknowledged
 * by a {@code health_check_response} within the timeout; acknowledgements are matched to
 * requests in FIFO order. Expired requests count as misses, and after {@code maxMissed}
 * consecutive misses the probe reports a {@link HealthTimeoutException}.
 *
 * <p>An expired request stays owed an acknowledgement. The next acknowledgement pays off the
 * oldest owed request before it can match a live one, and a late acknowledgement neither
 * resets the miss streak nor reports a latency. A peer that always answers after the timeout
 * is therefore declared dead.
 *
 * <p>Confined to the reactor thread.
 */
public final class HealthProbe {

    private static final Logger LOG = LogManager.getLogger(HealthProbe.class);

    /**
     * Probe timing.
     *
     * @param interval time between requests
     * @param timeout time after which an unacknowledged request is a miss
     * @param maxMissed consecutive misses that declare the link dead
     */
    public record Settings(Duration interval, Duration timeout, int maxMissed) {
        public Settings {
            Objects.requireNonNull(interval, "interval");
            Objects.requireNonNull(timeout, "timeout");
            if (interval.isZero() || interval.isNegative() || timeout.isZero() || timeout.isNegative()) {
                throw new IllegalArgumentException("interval and timeout must be positive");
            }
            if (maxMissed < 1) {
                throw new IllegalArgumentException("maxMissed must be >= 1, got: " + maxMissed);
            }
        }
    }

    /** Receives probe outcomes. */
    public interface Listener {

        /** A request was acknowledged. */
        void onAcknowledged(long latencyMs, HealthCheckResponse response);

        /** A request expired unacknowledged. */
        void onMissed(int consecutiveMisses);

        /** The miss budget is spent; the link should be treated as failed. */
        void onTimedOut(HealthTimeoutException exception);
    }

    private final Reactor reactor;
    private final Settings settings;
    private final Consumer<String> sender;
    private final Listener listener;

    private final Deque<Instant> outstanding = new ArrayDeque<>();
    private Reactor.ScheduledTask timer;
    private int consecutiveMisses;
    private int lateAcknowledgements;

    /**
     * @param sender sends one encoded command on the current connection
     */
    public HealthProbe(Reactor reactor, Settings settings, Consumer<String> sender, Listener listener) {
        this.reactor = Objects.requireNonNull(reactor, "reactor");
        this.settings = Objects.requireNonNull(settings, "settings");
        this.sender = Objects.requireNonNull(sender, "sender");
        this.listener = Objects.requireNonNull(listener, "listener");
    }

    /** Starts probing. No-op when already armed. */
    public void arm() {
        if (timer != null) {
            return;
        }
        outstanding.clear();
        consecutiveMisses = 0;
        lateAcknowledgements = 0;
        timer = reactor.scheduleAtFixedRate(this::tick, settings.interval());
        LOG.debug("Health probe armed (interval={}ms, timeout={}ms)",
                settings.interval().toMillis(), settings.timeout().toMillis());
    }

    /** Stops probing and forgets outstanding requests. Idempotent. */
    public void disarm() {
        if (timer != null) {
            timer.cancel();
            timer = null;
        }
        outstanding.clear();
        consecutiveMisses = 0;
        lateAcknowledgements = 0;
    }

    public boolean isArmed() {
        return timer != null;
    }

    int outstandingRequests() {
        return outstanding.size();
    }

    int lateAcknowledgementsOwed() {
        return lateAcknowledgements;
    }

    /** Matches a response to the oldest expired request, else the oldest outstanding one. */
    public void onResponse(HealthCheckResponse response) {
        if (timer == null) {
            return;
        }
        if (expireOutstanding()) {
            return;
        }
        if (lateAcknowledgements > 0) {
            lateAcknowledgements--;
            LOG.debug("Late health_check_response discarded ({} still owed)", lateAcknowledgements);
            return;
        }
        Instant sentAt = outstanding.pollFirst();
        if (sentAt == null) {
            LOG.debug("Unsolicited health_check_response ignored");
            return;
        }
        consecutiveMisses = 0;
        long latencyMs = Math.max(0L, Duration.between(sentAt, reactor.now()).toMillis());
        listener.onAcknowledged(latencyMs, response);
    }

    private void tick() {
        if (timer == null) {
            return;
        }
        if (expireOutstanding()) {
            return;
        }
        outstanding.addLast(reactor.now());
        sender.accept(BridgeCommand.HEALTH_CHECK.encode());
    }

    // Returns true when the miss budget was exhausted and the probe disarmed itself.
    private boolean expireOutstanding() {
        Instant now = reactor.now();
        while (!outstanding.isEmpty()
                && Duration.between(outstanding.peekFirst(), now).compareTo(settings.timeout()) >= 0) {
            outstanding.pollFirst();
            lateAcknowledgements++;
            consecutiveMisses++;
            LOG.warn("Health check not acknowledged within {}ms ({} consecutive)",
                    settings.timeout().toMillis(), consecutiveMisses);
            listener.onMissed(consecutiveMisses);
            if (consecutiveMisses >= settings.maxMissed()) {
                HealthTimeoutException timeout =
                        new HealthTimeoutException(consecutiveMisses, settings.timeout().toMillis());
                disarm();
                listener.onTimedOut(timeout);
                return true;
            }
        }
        return false;
    }
}
