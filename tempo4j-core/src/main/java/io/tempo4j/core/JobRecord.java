package io.tempo4j.core;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Persisted form of a job.
 *
 * <p>The handler is referenced only by its symbolic {@code handlerKind}; the {@code payload} is plain
 * data (strings, numbers, booleans, nested maps and lists). A job is rebuilt from this record and the
 * {@link JobHandlerRegistry} of the running process, nothing else.
 */
public record JobRecord(
        // identity
        String id,
        String ownerId,
        String handlerKind,

        // scheduling
        ScheduleSpec spec,
        JobState state,
        Instant nextFireAt,
        Instant lastFiredAt,

        // payload
        Map<String, Object> payload,

        Instant createdAt
) {
    public JobRecord {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(ownerId, "ownerId must not be null");
        Objects.requireNonNull(handlerKind, "handlerKind must not be null");
        Objects.requireNonNull(spec, "spec must not be null");
        Objects.requireNonNull(state, "state must not be null");
        Objects.requireNonNull(createdAt, "createdAt must not be null");
        nextFireAt = toMillis(nextFireAt);
        lastFiredAt = toMillis(lastFiredAt);
        createdAt = toMillis(createdAt);
        payload = (payload == null || payload.isEmpty())
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(payload));
    }

    public JobRecord withSchedule(JobState state, Instant nextFireAt, Instant lastFiredAt) {
        return new JobRecord(id, ownerId, handlerKind, spec, state, nextFireAt, lastFiredAt, payload, createdAt);
    }

    // Stored dates carry milliseconds only.
    private static Instant toMillis(Instant instant) {
        return instant == null ? null : instant.truncatedTo(ChronoUnit.MILLIS);
    }
}
