package io.tempo4j.config;

import io.tempo4j.Scheduler;
import io.tempo4j.interaction.TaskSupervisor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.SmartLifecycle;

import java.util.Objects;

/**
 * Ties the {@link Scheduler} to the Spring container: jobs are restored once every other bean is up,
 * and dispatching stops (running handlers drained) before the container tears down the store.
 *
 * <p>When a {@link TaskSupervisor} is present its tasks are cancelled before the scheduler stops, so
 * a handler blocked on a question does not hold shutdown until its timeout.
 */
public class SchedulerLifecycle implements SmartLifecycle {
    private static final Logger log = LoggerFactory.getLogger(SchedulerLifecycle.class);

    private final Scheduler scheduler;
    private final TaskSupervisor supervisor;
    private volatile boolean running = false;

    public SchedulerLifecycle(Scheduler scheduler) {
        this(scheduler, null);
    }

    public SchedulerLifecycle(Scheduler scheduler, TaskSupervisor supervisor) {
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler must not be null");
        this.supervisor = supervisor;
    }

    @Override
    public void start() {
        try {
            scheduler.start();
        } catch (RuntimeException e) {
            log.error("Scheduler failed to start msg={}", e.getMessage(), e);
            throw e;
        }
        running = true;
    }

    @Override
    public void stop() {
        try {
            if (supervisor != null) {
                int cancelled = supervisor.cancelAll();
                if (cancelled > 0) {
                    log.info("Cancelled running tasks before shutdown count={}", cancelled);
                }
            }
        } finally {
            scheduler.stop();
            running = false;
        }
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    // Last to start, first to stop.
    @Override
    public int getPhase() {
        return Integer.MAX_VALUE;
    }
}
