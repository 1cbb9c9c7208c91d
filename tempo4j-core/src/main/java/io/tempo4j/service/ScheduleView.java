package io.tempo4j.service;

import io.tempo4j.core.JobState;
import io.tempo4j.core.RegistryEntry;
import io.tempo4j.core.ScheduleSpec;

import java.time.Instant;

/**
 * A registry entry joined with the live state of its job.
 */
public record ScheduleView(RegistryEntry entry, JobState state, Instant nextFireAt, ScheduleSpec spec) {

    public String jobId() {
        return entry.jobId();
    }

    public boolean isActive() {
        return state != JobState.DISABLED;
    }
}
