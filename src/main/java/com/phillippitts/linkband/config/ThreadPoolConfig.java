package com.phillippitts.linkband.config;

import com.phillippitts.linkband.service.reactor.Reactor;
import com.phillippitts.linkband.service.reactor.ScheduledReactor;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskDecorator;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.time.Clock;
import java.util.Map;

/**
 * Thread pools used by the bridge supervisor.
 *
 * <p>The supervisor scheduler has exactly one thread: it is the reactor that owns all supervisor
 * state. Network callbacks arrive on the JDK HTTP client's threads and are handed back to the
 * reactor.
 */
@Configuration
public class ThreadPoolConfig {

    /** MDC key stamped on every log line written from the reactor thread. */
    public static final String MDC_COMPONENT = "component";

    static final String SUPERVISOR_COMPONENT = "bridge-supervisor";

    @Bean
    public Clock supervisorClock() {
        return Clock.systemUTC();
    }

    /**
     * Single-thread scheduler backing the supervisor {@link Reactor}.
     *
     * <p>Thread naming: {@code bridge-supervisor-1}.
     *
     * @return initialized scheduler with pool size 1
     */
    @Bean(name = "supervisorScheduler")
    public ThreadPoolTaskScheduler supervisorScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(1);
        scheduler.setThreadNamePrefix(SUPERVISOR_COMPONENT + "-");
        scheduler.setRemoveOnCancelPolicy(true);
        scheduler.setWaitForTasksToCompleteOnShutdown(false);
        scheduler.initialize();
        return scheduler;
    }

    /**
     * Supervisor reactor. Tasks carry the {@code component=bridge-supervisor} ThreadContext entry
     * on top of whatever the submitting thread had, e.g. the {@code requestId} of an HTTP command.
     */
    @Bean
    public Reactor supervisorReactor(ThreadPoolTaskScheduler supervisorScheduler, Clock supervisorClock) {
        return new ScheduledReactor(supervisorScheduler, supervisorClock,
                mdcDecorator(Map.of(MDC_COMPONENT, SUPERVISOR_COMPONENT)));
    }

    // Copies the submitter's ThreadContext (plus fixed entries) onto the worker and restores it after.
    static TaskDecorator mdcDecorator(Map<String, String> fixed) {
        return runnable -> {
            Map<String, String> contextMap = ThreadContext.getImmutableContext();
            return () -> {
                Map<String, String> previous = ThreadContext.getImmutableContext();
                try {
                    if (contextMap != null && !contextMap.isEmpty()) {
                        ThreadContext.putAll(contextMap);
                    }
                    ThreadContext.putAll(fixed);
                    runnable.run();
                } finally {
                    ThreadContext.clearAll();
                    if (previous != null && !previous.isEmpty()) {
                        ThreadContext.putAll(previous);
                    }
                }
            };
        };
    }
}
