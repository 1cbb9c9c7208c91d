package io.tempo4j.core;

/**
 * Lifecycle of a scheduled job. Only the scheduler engine moves a job between states.
 */
public enum JobState {
    /**
     * Armed and waiting for {@code nextFireAt}.
     */
    PENDING,
    /**
     * Handler running; the next occurrence is computed once it completes.
     */
    FIRING,
    /**
     * Dormant: no future occurrence. Still stored and queryable.
     */
    DISABLED
}
