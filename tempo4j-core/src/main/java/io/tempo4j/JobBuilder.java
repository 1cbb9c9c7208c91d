package io.tempo4j;

import io.tempo4j.core.JobRequest;
import io.tempo4j.core.PersistResult;

import java.time.Instant;

/**
 * Fluent builder for configuring a job before persisting it.
 *
 * <p>Note:
 * <ul>
 *   <li>build(): returns an in-memory job request</li>
 *   <li>save(): build() + schedule (replaces any job with the same id)</li>
 * </ul>
 */
public interface JobBuilder<T> {

    /**
     * Set the tenant that owns the job. Required.
     */
    JobBuilder<T> owner(String ownerId);

    /**
     * Set the IANA time zone (e.g. "Europe/Brussels") used to evaluate the schedule.
     * When unset, the scheduler default applies.
     */
    JobBuilder<T> timezone(String timezone);

    /**
     * Run once at the given instant. An instant already in the past runs once, immediately.
     */
    JobBuilder<T> at(Instant time);

    /**
     * Repeat on a 6-field cron expression: {@code second minute hour day month weekday}.
     */
    JobBuilder<T> cron(String expression);

    /**
     * Earliest instant a cron schedule may fire.
     */
    JobBuilder<T> validFrom(Instant validFrom);

    /**
     * Instant from which a cron schedule stops firing.
     */
    JobBuilder<T> validUntil(Instant validUntil);

    /**
     * Build an immutable job request (not scheduled).
     */
    JobRequest<T> build();

    /**
     * Build + schedule + persist.
     */
    PersistResult save();

    PersistResult save(JobRequest<T> request);
}
