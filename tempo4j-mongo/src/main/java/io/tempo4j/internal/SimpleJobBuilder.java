package io.tempo4j.internal;

import io.tempo4j.JobBuilder;
import io.tempo4j.core.JobRequest;
import io.tempo4j.core.PersistResult;
import io.tempo4j.core.ScheduleSpec;
import io.tempo4j.utils.CronExpression;

import java.time.DateTimeException;
import java.time.Instant;
import java.time.ZoneId;
import java.util.Objects;
import java.util.function.Function;

/**
 * Default {@link JobBuilder} implementation used by {@link DefaultScheduler}.
 */
public class SimpleJobBuilder<T> implements JobBuilder<T> {

    private final String id;
    private final String handlerKind;
    private final T payload;
    private final Function<JobRequest<T>, PersistResult> persister;

    private String ownerId;
    private ZoneId zone;
    private Instant fireAt;
    private CronExpression cron;
    private Instant validFrom;
    private Instant validUntil;

    public SimpleJobBuilder(String id, String handlerKind, T payload,
                            Function<JobRequest<T>, PersistResult> persister, ZoneId defaultZone) {
        this.id = requireText(id, "job id");
        this.handlerKind = requireText(handlerKind, "handlerKind");
        this.payload = payload;
        this.persister = Objects.requireNonNull(persister, "persister must not be null");
        this.zone = Objects.requireNonNull(defaultZone, "defaultZone must not be null");
    }

    @Override
    public JobBuilder<T> owner(String ownerId) {
        this.ownerId = requireText(ownerId, "ownerId");
        return this;
    }

    @Override
    public JobBuilder<T> timezone(String timezone) {
        Objects.requireNonNull(timezone, "timezone must not be null");
        try {
            this.zone = ZoneId.of(timezone);
        } catch (DateTimeException e) {
            throw new IllegalArgumentException("Invalid timezone: " + timezone, e);
        }
        return this;
    }

    @Override
    public JobBuilder<T> at(Instant time) {
        this.fireAt = Objects.requireNonNull(time, "time must not be null");
        return this;
    }

    @Override
    public JobBuilder<T> cron(String expression) {
        this.cron = CronExpression.parse(expression);
        return this;
    }

    @Override
    public JobBuilder<T> validFrom(Instant validFrom) {
        this.validFrom = validFrom;
        return this;
    }

    @Override
    public JobBuilder<T> validUntil(Instant validUntil) {
        this.validUntil = validUntil;
        return this;
    }

    @Override
    public JobRequest<T> build() {
        if (ownerId == null) {
            throw new IllegalStateException("owner must be set for job " + id);
        }
        if ((fireAt == null) == (cron == null)) {
            throw new IllegalStateException("Exactly one of at() or cron() must be set for job " + id);
        }

        ScheduleSpec spec;
        if (cron != null) {
            spec = ScheduleSpec.cron(cron, zone).withWindow(validFrom, validUntil);
        } else {
            if (validFrom != null || validUntil != null) {
                throw new IllegalStateException("validFrom/validUntil apply to cron schedules only");
            }
            spec = ScheduleSpec.at(fireAt, zone);
        }
        return new JobRequest<>(id, ownerId, handlerKind, spec, payload);
    }

    @Override
    public PersistResult save() {
        return persister.apply(build());
    }

    @Override
    public PersistResult save(JobRequest<T> request) {
        return persister.apply(Objects.requireNonNull(request, "request must not be null"));
    }

    private static String requireText(String value, String name) {
        Objects.requireNonNull(value, name + " must not be null");
        if (value.isBlank()) {
            throw new IllegalArgumentException(name + " must not be blank");
        }
        return value;
    }
}
