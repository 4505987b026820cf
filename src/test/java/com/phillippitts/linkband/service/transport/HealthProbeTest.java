package com.phillippitts.linkband.service.transport;

import com.phillippitts.linkband.exception.HealthTimeoutException;
import com.phillippitts.linkband.protocol.HealthCheckResponse;
import com.phillippitts.linkband.testutil.ManualReactor;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class HealthProbeTest {

    private static final HealthCheckResponse OK = new HealthCheckResponse("ok", 1, false, true);

    private ManualReactor reactor;
    private List<String> sent;
    private RecordingListener listener;
    private HealthProbe probe;

    @BeforeEach
    void setUp() {
        reactor = new ManualReactor();
        sent = new ArrayList<>();
        listener = new RecordingListener();
        probe = new HealthProbe(reactor,
                new HealthProbe.Settings(Duration.ofSeconds(1), Duration.ofSeconds(2), 2),
                sent::add, listener);
    }

    @Test
    void sendsHealthCheckEveryInterval() {
        probe.arm();

        reactor.advance(Duration.ofMillis(999));
        assertThat(sent).isEmpty();

        reactor.advance(Duration.ofMillis(1));
        assertThat(sent).hasSize(1);
        assertThat(sent.get(0)).contains("\"health_check\"");

        acknowledge();
        reactor.advance(Duration.ofSeconds(1));
        acknowledge();
        reactor.advance(Duration.ofSeconds(1));
        assertThat(sent).hasSize(3);
        assertThat(listener.misses).isEmpty();
    }

    @Test
    void acknowledgementReportsRoundTripLatency() {
        probe.arm();
        reactor.advance(Duration.ofSeconds(1));
        reactor.advance(Duration.ofMillis(250));

        probe.onResponse(OK);

        assertThat(listener.latencies).containsExactly(250L);
        assertThat(listener.responses).containsExactly(OK);
        assertThat(probe.outstandingRequests()).isZero();
    }

    @Test
    void twoConsecutiveMissesTimeOutTheLink() {
        probe.arm();

        reactor.advance(Duration.ofSeconds(3));
        assertThat(listener.misses).containsExactly(1);
        assertThat(listener.timeouts).isEmpty();

        reactor.advance(Duration.ofSeconds(1));
        assertThat(listener.misses).containsExactly(1, 2);
        assertThat(listener.timeouts).hasSize(1);
        assertThat(listener.timeouts.get(0).getMissedAcknowledgements()).isEqualTo(2);
        assertThat(probe.isArmed()).isFalse();

        int sentAtTimeout = sent.size();
        reactor.advance(Duration.ofSeconds(5));
        assertThat(sent).hasSize(sentAtTimeout);
    }

    @Test
    void timelyAcknowledgementResetsMissCount() {
        probe.arm();
        reactor.advance(Duration.ofSeconds(3));
        assertThat(listener.misses).containsExactly(1);

        // The first answer pays off the expired request; the second acknowledges a live one.
        probe.onResponse(OK);
        probe.onResponse(OK);
        for (int i = 0; i < 3; i++) {
            reactor.advance(Duration.ofSeconds(1));
            acknowledge();
        }

        assertThat(listener.misses).containsExactly(1);
        assertThat(listener.latencies).containsExactly(1_000L, 1_000L, 1_000L, 1_000L);
        assertThat(listener.timeouts).isEmpty();
        assertThat(probe.isArmed()).isTrue();
    }

    @Test
    void peerThatAlwaysAnswersLateIsDeclaredDead() {
        probe.arm();

        // Every request is answered 2.5s after it was sent, past the 2s timeout.
        for (int second = 1; second <= 30 && probe.isArmed(); second++) {
            reactor.advance(Duration.ofMillis(500));
            if (second >= 4) {
                acknowledge();
            }
            reactor.advance(Duration.ofMillis(500));
        }

        assertThat(listener.latencies).isEmpty();
        assertThat(listener.misses).containsExactly(1, 2);
        assertThat(listener.timeouts).hasSize(1);
        assertThat(probe.isArmed()).isFalse();
    }

    @Test
    void lateAcknowledgementIsDiscardedWithoutLatency() {
        probe.arm();
        reactor.advance(Duration.ofSeconds(3));
        assertThat(probe.lateAcknowledgementsOwed()).isEqualTo(1);

        probe.onResponse(OK);

        assertThat(probe.lateAcknowledgementsOwed()).isZero();
        assertThat(probe.outstandingRequests()).isEqualTo(2);
        assertThat(listener.latencies).isEmpty();
    }

    @Test
    void answerArrivingAfterTimeoutButBeforeNextTickCountsAsLate() {
        probe = new HealthProbe(reactor,
                new HealthProbe.Settings(Duration.ofSeconds(1), Duration.ofMillis(1_500), 2),
                sent::add, listener);
        probe.arm();
        reactor.advance(Duration.ofMillis(2_700));

        probe.onResponse(OK);

        assertThat(listener.misses).containsExactly(1);
        assertThat(listener.latencies).isEmpty();
        assertThat(probe.outstandingRequests()).isEqualTo(1);
    }

    @Test
    void disarmStopsProbingAndForgetsOutstanding() {
        probe.arm();
        reactor.advance(Duration.ofSeconds(2));
        assertThat(probe.outstandingRequests()).isEqualTo(2);

        probe.disarm();
        reactor.advance(Duration.ofSeconds(10));

        assertThat(sent).hasSize(2);
        assertThat(probe.outstandingRequests()).isZero();
        assertThat(listener.timeouts).isEmpty();
    }

    @Test
    void unsolicitedResponseIsIgnored() {
        probe.arm();

        probe.onResponse(OK);

        assertThat(listener.latencies).isEmpty();
    }

    @Test
    void armIsIdempotent() {
        probe.arm();
        probe.arm();

        reactor.advance(Duration.ofSeconds(1));

        assertThat(sent).hasSize(1);
    }

    private void acknowledge() {
        probe.onResponse(OK);
    }

    private static final class RecordingListener implements HealthProbe.Listener {
        final List<Long> latencies = new ArrayList<>();
        final List<HealthCheckResponse> responses = new ArrayList<>();
        final List<Integer> misses = new ArrayList<>();
        final List<HealthTimeoutException> timeouts = new ArrayList<>();

        @Override
        public void onAcknowledged(long latencyMs, HealthCheckResponse response) {
            latencies.add(latencyMs);
            responses.add(response);
        }

        @Override
        public void onMissed(int consecutiveMisses) {
            misses.add(consecutiveMisses);
        }

        @Override
        public void onTimedOut(HealthTimeoutException exception) {
            timeouts.add(exception);
        }
    }
}
