package io.tempo4j.core;

import java.util.List;
import java.util.Optional;

/**
 * Durable key-value persistence of {@link JobRecord}s, keyed by job id.
 *
 * <p>The store never changes a record on its own; it persists and restores what the scheduler gives
 * it. Every operation either completes or throws {@link JobStoreException}; a failed write must leave
 * the previously stored record intact.
 */
public interface JobStore {

    /**
     * Insert or atomically replace the record with the same id.
     */
    PersistResult put(JobRecord record);

    Optional<JobRecord> get(String id);

    /**
     * @return {@code true} if a record was deleted, {@code false} if none existed
     */
    boolean remove(String id);

    /**
     * Load every record that can be rebuilt in this process. Records whose handler kind is not
     * registered in {@code handlers} are logged and skipped.
     */
    List<JobRecord> loadAll(JobHandlerRegistry handlers);
}
