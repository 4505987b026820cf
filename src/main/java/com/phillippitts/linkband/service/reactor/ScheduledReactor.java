package com.phillippitts.linkband.service.reactor;

import com.phillippitts.linkband.exception.LinkBandException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.core.task.TaskDecorator;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * {@link Reactor} backed by a {@link ThreadPoolTaskScheduler} configured with exactly one thread
 * (see {@code ThreadPoolConfig#supervisorScheduler}).
 *
 * <p>Every task is wrapped so an exception is logged instead of silently cancelling a periodic
 * task or killing the reactor thread. The optional {@link TaskDecorator} is applied at
 * submission time, so a periodic task keeps the context captured when it was scheduled.
 */
public class ScheduledReactor implements Reactor {

    private static final Logger LOG = LogManager.getLogger(ScheduledReactor.class);

    private final ThreadPoolTaskScheduler scheduler;
    private final Clock clock;
    private final TaskDecorator decorator;
    private volatile Thread reactorThread;

    public ScheduledReactor(ThreadPoolTaskScheduler scheduler, Clock clock) {
        this(scheduler, clock, runnable -> runnable);
    }

    public ScheduledReactor(ThreadPoolTaskScheduler scheduler, Clock clock, TaskDecorator decorator) {
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.decorator = Objects.requireNonNull(decorator, "decorator");
    }

    @Override
    public void execute(Runnable task) {
        scheduler.execute(guarded(task));
    }

    @Override
    public void executeAndWait(Runnable task, Duration timeout) {
        if (Thread.currentThread() == reactorThread) {
            task.run();
            return;
        }
        Future<?> future = scheduler.submit(guarded(task));
        try {
            future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new LinkBandException("Interrupted while waiting for reactor task", e);
        } catch (ExecutionException | TimeoutException e) {
            throw new LinkBandException("Reactor task did not complete within " + timeout.toMillis() + "ms", e);
        }
    }

    @Override
    public ScheduledTask schedule(Runnable task, Duration delay) {
        ScheduledFuture<?> future = scheduler.schedule(guarded(task), clock.instant().plus(delay));
        return new FutureTask(future);
    }

    @Override
    public ScheduledTask scheduleAtFixedRate(Runnable task, Duration period) {
        ScheduledFuture<?> future = scheduler.scheduleAtFixedRate(guarded(task), clock.instant().plus(period), period);
        return new FutureTask(future);
    }

    @Override
    public Instant now() {
        return clock.instant();
    }

    private Runnable guarded(Runnable task) {
        return decorator.decorate(() -> {
            reactorThread = Thread.currentThread();
            try {
                task.run();
            } catch (RuntimeException e) {
                LOG.error("Supervisor task failed; reactor continues", e);
            }
        });
    }

    private record FutureTask(ScheduledFuture<?> future) implements ScheduledTask {
        @Override
        public void cancel() {
            future.cancel(false);
        }

        @Override
        public boolean isCancelled() {
            return future.isCancelled();
        }
    }
}
