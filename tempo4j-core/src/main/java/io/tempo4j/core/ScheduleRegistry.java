package io.tempo4j.core;

import java.util.List;
import java.util.Optional;

/**
 * Metadata CRUD for {@link RegistryEntry}s, keyed by job id and listable by owner.
 */
public interface ScheduleRegistry {

    PersistResult save(RegistryEntry entry);

    Optional<RegistryEntry> find(String jobId);

    List<RegistryEntry> listByOwner(String ownerId);

    boolean delete(String jobId);
}
