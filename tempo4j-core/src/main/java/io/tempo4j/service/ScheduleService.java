package io.tempo4j.service;

import io.tempo4j.JobBuilder;
import io.tempo4j.Scheduler;
import io.tempo4j.core.CancelResult;
import io.tempo4j.core.JobRecord;
import io.tempo4j.core.JobRequest;
import io.tempo4j.core.RegistryEntry;
import io.tempo4j.core.ScheduleRegistry;
import io.tempo4j.utils.JobIds;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Create, list and cancel schedules on behalf of a tenant.
 *
 * <p>The scheduler is the source of truth. The registry only carries the metadata shown to the
 * tenant, and listing drops every entry whose job is gone or belongs to someone else.
 */
public class ScheduleService {
    private static final Logger log = LoggerFactory.getLogger(ScheduleService.class);

    private final Scheduler scheduler;
    private final ScheduleRegistry registry;
    private final Clock clock;

    public ScheduleService(Scheduler scheduler, ScheduleRegistry registry, Clock clock) {
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler must not be null");
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    /**
     * Schedule the job, then record it in the registry. If the registry write fails the job is
     * rolled back (the replaced job restored, or the new one removed) and the failure propagates.
     *
     * @throws IllegalArgumentException if the job id is taken by another owner, worded like a missing
     *                                  schedule so the other owner's job is not revealed
     */
    public ScheduleView create(ScheduleCreateRequest request) {
        Objects.requireNonNull(request, "request must not be null");
        requireText(request.ownerId(), "ownerId");
        requireText(request.taskKind(), "taskKind");
        if ((request.cron() == null) == (request.at() == null)) {
            throw new IllegalArgumentException("Exactly one of cron or at must be given");
        }

        String jobId = request.jobId() != null ? request.jobId() : deriveJobId(request);

        Optional<JobRecord> previous = scheduler.find(jobId);
        if (previous.isPresent() && !request.ownerId().equals(previous.get().ownerId())) {
            log.warn("create rejected, job id owned by another tenant jobId={} caller={}", jobId, request.ownerId());
            throw new IllegalArgumentException(CancelResult.notOwner(jobId).message());
        }

        JobBuilder<Object> builder = scheduler.create(jobId, request.taskKind(), request.payload())
                .owner(request.ownerId());
        if (request.timezone() != null) {
            builder.timezone(request.timezone());
        }
        if (request.cron() != null) {
            builder.cron(request.cron())
                    .validFrom(request.validFrom())
                    .validUntil(request.validUntil());
        } else {
            builder.at(request.at());
        }
        builder.save();

        RegistryEntry entry = new RegistryEntry(
                jobId,
                request.ownerId(),
                request.chatId(),
                request.taskKind(),
                request.originalRequest(),
                request.preferences(),
                clock.instant()
        );
        try {
            registry.save(entry);
        } catch (RuntimeException e) {
            log.error("registry write failed, rolling back job jobId={} replaced={} msg={}",
                    jobId, previous.isPresent(), e.getMessage(), e);
            try {
                rollback(jobId, previous.orElse(null));
            } catch (RuntimeException rollback) {
                e.addSuppressed(rollback);
            }
            throw e;
        }

        log.info("schedule created jobId={} owner={} kind={}", jobId, request.ownerId(), request.taskKind());
        JobRecord job = scheduler.find(jobId)
                .orElseThrow(() -> new IllegalStateException("Job vanished right after creation: " + jobId));
        return view(entry, job);
    }

    /**
     * The owner's schedules that still have a live job, in registry order.
     */
    public List<ScheduleView> list(String ownerId) {
        requireText(ownerId, "ownerId");
        List<ScheduleView> views = new ArrayList<>();
        for (RegistryEntry entry : registry.listByOwner(ownerId)) {
            Optional<JobRecord> job = scheduler.find(entry.jobId());
            if (job.isEmpty()) {
                log.debug("registry entry without job jobId={}", entry.jobId());
                continue;
            }
            if (!ownerId.equals(job.get().ownerId())) {
                log.warn("registry entry owner differs from job owner jobId={} entryOwner={} jobOwner={}",
                        entry.jobId(), ownerId, job.get().ownerId());
                continue;
            }
            views.add(view(entry, job.get()));
        }
        return List.copyOf(views);
    }

    /**
     * Cancel a job if the caller owns it. The job and its registry entry go together.
     */
    public CancelResult cancel(String jobId, String ownerId) {
        requireText(jobId, "jobId");
        requireText(ownerId, "ownerId");

        Optional<JobRecord> job = scheduler.find(jobId);
        if (job.isEmpty()) {
            registry.delete(jobId);
            log.info("cancel requested for unknown job jobId={} owner={}", jobId, ownerId);
            return CancelResult.notFound(jobId);
        }
        if (!ownerId.equals(job.get().ownerId())) {
            log.warn("cancel rejected, caller does not own job jobId={} caller={}", jobId, ownerId);
            return CancelResult.notOwner(jobId);
        }

        scheduler.remove(jobId);
        registry.delete(jobId);
        log.info("schedule cancelled jobId={} owner={}", jobId, ownerId);
        return CancelResult.cancelled(jobId);
    }

    /*
     * The registry still holds whatever entry it had before the failed write, so only the job changes.
     */
    private void rollback(String jobId, JobRecord previous) {
        if (previous == null) {
            scheduler.remove(jobId);
            return;
        }
        scheduler.submit(new JobRequest<>(
                previous.id(),
                previous.ownerId(),
                previous.handlerKind(),
                previous.spec(),
                previous.payload()
        ));
        log.info("previous job restored jobId={}", jobId);
    }

    private static String deriveJobId(ScheduleCreateRequest request) {
        String chatId = request.chatId() != null ? request.chatId() : request.ownerId();
        if (request.cron() != null) {
            return JobIds.forCron(request.taskKind(), chatId, request.cron());
        }
        return JobIds.forInstant(request.taskKind(), chatId, request.at());
    }

    private static ScheduleView view(RegistryEntry entry, JobRecord job) {
        return new ScheduleView(entry, job.state(), job.nextFireAt(), job.spec());
    }

    private static void requireText(String value, String name) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(name + " must not be blank");
        }
    }
}
