package io.tempo4j.interaction;

import java.time.Instant;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Future;

/**
 * Handle on a supervised background task.
 */
public final class TaskHandle {

    private final String tenantId;
    private final String name;
    private final Instant startedAt;
    private final CompletableFuture<Void> completion = new CompletableFuture<>();
    private volatile Future<?> future;

    TaskHandle(String tenantId, String name, Instant startedAt) {
        this.tenantId = tenantId;
        this.name = name;
        this.startedAt = startedAt;
    }

    public String tenantId() {
        return tenantId;
    }

    public String name() {
        return name;
    }

    public Instant startedAt() {
        return startedAt;
    }

    /**
     * Completes normally when the task finishes, exceptionally when it fails, and is cancelled when
     * the task is cancelled.
     */
    public CompletableFuture<Void> completion() {
        return completion;
    }

    public boolean isDone() {
        return completion.isDone();
    }

    void attach(Future<?> future) {
        this.future = future;
    }

    boolean cancel() {
        boolean cancelled = completion.cancel(false);
        Future<?> f = future;
        if (f != null) {
            f.cancel(true);
        }
        return cancelled;
    }
}
