package com.phillippitts.linkband.service.reactor;

import com.phillippitts.linkband.exception.LinkBandException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;

class ScheduledReactorTest {

    private ThreadPoolTaskScheduler scheduler;
    private ScheduledReactor reactor;

    @BeforeEach
    void setUp() {
        scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(1);
        scheduler.setThreadNamePrefix("reactor-test-");
        scheduler.initialize();
        reactor = new ScheduledReactor(scheduler, Clock.systemUTC());
    }

    @AfterEach
    void tearDown() {
        scheduler.shutdown();
    }

    @Test
    void runsTasksInSubmissionOrderOnOneThread() {
        List<Integer> order = new CopyOnWriteArrayList<>();
        Set<String> threads = ConcurrentHashMap.newKeySet();
        for (int i = 0; i < 50; i++) {
            int n = i;
            reactor.execute(() -> {
                order.add(n);
                threads.add(Thread.currentThread().getName());
            });
        }

        await().atMost(Duration.ofSeconds(5)).until(() -> order.size() == 50);
        assertThat(order).isSorted();
        assertThat(threads).hasSize(1);
    }

    @Test
    void failingTaskDoesNotStopPeriodicTask() {
        AtomicInteger runs = new AtomicInteger();
        Reactor.ScheduledTask task = reactor.scheduleAtFixedRate(() -> {
            if (runs.incrementAndGet() == 1) {
                throw new IllegalStateException("first run fails");
            }
        }, Duration.ofMillis(20));

        await().atMost(Duration.ofSeconds(5)).until(() -> runs.get() >= 3);
        task.cancel();
        assertThat(task.isCancelled()).isTrue();
    }

    @Test
    void executeAndWaitBlocksUntilDone() {
        AtomicBoolean ran = new AtomicBoolean();

        reactor.executeAndWait(() -> ran.set(true), Duration.ofSeconds(5));

        assertThat(ran).isTrue();
    }

    @Test
    void executeAndWaitRunsInlineOnReactorThread() {
        AtomicBoolean inner = new AtomicBoolean();

        reactor.executeAndWait(() -> reactor.executeAndWait(() -> inner.set(true), Duration.ofSeconds(1)),
                Duration.ofSeconds(5));

        assertThat(inner).isTrue();
    }

    @Test
    void executeAndWaitTimesOut() {
        CountDownLatch release = new CountDownLatch(1);
        reactor.execute(() -> {
            try {
                release.await();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        });

        try {
            assertThatThrownBy(() -> reactor.executeAndWait(() -> { }, Duration.ofMillis(50)))
                    .isInstanceOf(LinkBandException.class)
                    .hasMessageContaining("50ms");
        } finally {
            release.countDown();
        }
    }

    @Test
    void cancelledDelayedTaskNeverRuns() throws InterruptedException {
        AtomicBoolean ran = new AtomicBoolean();
        Reactor.ScheduledTask task = reactor.schedule(() -> ran.set(true), Duration.ofMillis(100));

        task.cancel();
        Thread.sleep(250);

        assertThat(ran).isFalse();
    }
}
