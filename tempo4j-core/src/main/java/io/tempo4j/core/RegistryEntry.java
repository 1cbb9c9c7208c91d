package io.tempo4j.core;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Human-facing metadata describing a scheduled job, used for listing and cancelling by owner.
 *
 * <p>Denormalized from the job for display. It never drives scheduling: when it disagrees with the
 * job store, the job store wins.
 */
public record RegistryEntry(
        String jobId,
        String ownerId,
        String chatId,
        String taskKind,
        String originalRequest,
        Map<String, Object> preferences,
        Instant createdAt
) {
    public RegistryEntry {
        Objects.requireNonNull(jobId, "jobId must not be null");
        Objects.requireNonNull(ownerId, "ownerId must not be null");
        Objects.requireNonNull(taskKind, "taskKind must not be null");
        Objects.requireNonNull(createdAt, "createdAt must not be null");
        originalRequest = originalRequest == null ? "" : originalRequest;
        preferences = (preferences == null || preferences.isEmpty())
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(preferences));
    }
}
