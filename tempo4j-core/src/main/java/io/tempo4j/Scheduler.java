package io.tempo4j;

import io.tempo4j.core.JobRecord;
import io.tempo4j.core.JobRequest;
import io.tempo4j.core.PersistResult;

import java.util.List;
import java.util.Optional;

/**
 * Main scheduler API.
 *
 * <p>Supports two scheduling styles:
 * <ul>
 *   <li>One-time jobs at an absolute {@link java.time.Instant}</li>
 *   <li>Recurring jobs on a 6-field cron expression, optionally bounded by a validity window</li>
 * </ul>
 *
 * <p>The job id is the replace key: scheduling a job with an id that already exists replaces the old
 * schedule atomically, and the old one can no longer fire.
 */
public interface Scheduler {
    void start();

    void stop();

    <T> JobBuilder<T> create(String id, String handlerKind, T payload);

    JobBuilder<Void> create(String id, String handlerKind);

    /**
     * Validate, persist and arm a job request. Used by {@link JobBuilder#save()}.
     */
    PersistResult submit(JobRequest<?> request);

    /**
     * Disarm and delete a job. Idempotent.
     *
     * @return {@code true} if a job existed
     */
    boolean remove(String id);

    /**
     * Look up a job by id, including stored jobs while the scheduler is not running.
     */
    Optional<JobRecord> find(String id);

    List<JobRecord> jobs();

    List<JobRecord> jobsOwnedBy(String ownerId);
}
