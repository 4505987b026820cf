package com.phillippitts.linkband.service.reactor;

import java.time.Duration;
import java.time.Instant;

/**
 * Serial task queue that owns all supervisor state.
 *
 * <p>Inbound socket callbacks, timer ticks and probe completions are all dispatched through one
 * reactor, so supervisor state has exactly one writer and needs no locks. Implementations must
 * run tasks one at a time, in submission order for tasks due at the same instant.
 */
public interface Reactor {

    /** Queues a task to run as soon as possible. */
    void execute(Runnable task);

    /**
     * Runs the task on the reactor and waits for it to finish. Runs inline when already on the
     * reactor thread.
     *
     * @param timeout maximum time to wait for the task
     */
    void executeAndWait(Runnable task, Duration timeout);

    /** Runs the task once after the delay. */
    ScheduledTask schedule(Runnable task, Duration delay);

    /** Runs the task repeatedly, first after {@code period}, then every {@code period}. */
    ScheduledTask scheduleAtFixedRate(Runnable task, Duration period);

    /** Current time as seen by tasks on this reactor. */
    Instant now();

    /** Handle to a scheduled task. */
    interface ScheduledTask {

        /** Cancels the task; a cancelled task never runs again. Idempotent. */
        void cancel();

        boolean isCancelled();
    }
}
