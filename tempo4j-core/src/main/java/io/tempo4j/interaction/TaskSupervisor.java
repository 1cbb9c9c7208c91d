package io.tempo4j.interaction;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs long-lived background work per tenant and keeps a handle on it.
 *
 * <p>At most one task per tenant runs at a time. Cancelling a tenant's task interrupts it and also
 * cancels the tenant's pending question, so a thread blocked in {@link InteractionBridge#ask} is
 * released instead of waiting for a reply that will never matter.
 */
public class TaskSupervisor implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(TaskSupervisor.class);

    private final InteractionBridge bridge;
    private final Clock clock;
    private final Duration shutdownTimeout;
    private final Map<String, TaskHandle> running = new ConcurrentHashMap<>();
    private final ExecutorService executor;

    public TaskSupervisor(InteractionBridge bridge, Clock clock, Duration shutdownTimeout) {
        this.bridge = Objects.requireNonNull(bridge, "bridge must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.shutdownTimeout = Objects.requireNonNull(shutdownTimeout, "shutdownTimeout must not be null");
        AtomicInteger seq = new AtomicInteger();
        this.executor = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r);
            t.setName("tempo.task-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Start {@code task} for the tenant.
     *
     * @throws IllegalStateException if the tenant already has a running task
     */
    public TaskHandle start(String tenantId, String name, Runnable task) {
        Objects.requireNonNull(tenantId, "tenantId must not be null");
        Objects.requireNonNull(task, "task must not be null");

        TaskHandle handle = new TaskHandle(tenantId, name, clock.instant());
        TaskHandle existing = running.putIfAbsent(tenantId, handle);
        if (existing != null) {
            throw new IllegalStateException("Tenant " + tenantId + " already runs task '" + existing.name() + "'");
        }

        try {
            handle.attach(executor.submit(() -> run(handle, task)));
        } catch (RuntimeException e) {
            running.remove(tenantId, handle);
            throw e;
        }
        log.info("task started tenant={} name={}", tenantId, name);
        return handle;
    }

    private void run(TaskHandle handle, Runnable task) {
        try {
            task.run();
            handle.completion().complete(null);
            log.info("task finished tenant={} name={}", handle.tenantId(), handle.name());
        } catch (InteractionCancelledException e) {
            handle.completion().cancel(false);
            log.info("task cancelled while waiting for a reply tenant={} name={}", handle.tenantId(), handle.name());
        } catch (Throwable e) {
            handle.completion().completeExceptionally(e);
            if (!handle.completion().isCancelled()) {
                log.error("task failed tenant={} name={} msg={}", handle.tenantId(), handle.name(), e.getMessage(), e);
            }
        } finally {
            running.remove(handle.tenantId(), handle);
        }
    }

    /**
     * Cancel the tenant's running task and any question it is waiting on.
     *
     * @return {@code true} if a task was running
     */
    public boolean cancel(String tenantId) {
        TaskHandle handle = running.remove(tenantId);
        bridge.cancel(tenantId);
        if (handle == null) {
            return false;
        }
        handle.cancel();
        log.info("task cancel requested tenant={} name={}", tenantId, handle.name());
        return true;
    }

    public Optional<TaskHandle> find(String tenantId) {
        return Optional.ofNullable(running.get(tenantId));
    }

    /**
     * Cancel every running task.
     *
     * @return number of tasks cancelled
     */
    public int cancelAll() {
        List<String> tenants = new ArrayList<>(running.keySet());
        int cancelled = 0;
        for (String tenantId : tenants) {
            if (cancel(tenantId)) {
                cancelled++;
            }
        }
        return cancelled;
    }

    @Override
    public void close() {
        cancelAll();
        executor.shutdown();
        try {
            if (!executor.awaitTermination(shutdownTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            executor.shutdownNow();
        }
    }
}
