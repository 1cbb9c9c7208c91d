package io.tempo4j.internal;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.tempo4j.JobBuilder;
import io.tempo4j.JobContext;
import io.tempo4j.JobHandler;
import io.tempo4j.Scheduler;
import io.tempo4j.config.SchedulerProperties;
import io.tempo4j.core.JobHandlerRegistry;
import io.tempo4j.core.JobRecord;
import io.tempo4j.core.JobRequest;
import io.tempo4j.core.JobState;
import io.tempo4j.core.JobStore;
import io.tempo4j.core.JobStoreException;
import io.tempo4j.core.PersistResult;
import io.tempo4j.core.ScheduleSpec;
import io.tempo4j.utils.TriggerEvaluator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.temporal.ChronoUnit;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.DelayQueue;
import java.util.concurrent.Delayed;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Single-process scheduler backed by a {@link JobStore}.
 *
 * <p>Every known job lives in memory next to its timer; the store keeps the durable copy. A single
 * dispatcher thread waits on a {@link DelayQueue} and hands due jobs to a worker pool, so a slow
 * handler never delays other jobs' wake-ups.
 *
 * <p>Per-job state machine: {@code PENDING -> FIRING -> (PENDING | DISABLED | removed)}.
 *
 * <p>Typical usage:
 * <pre>{@code
 * scheduler.start();
 *
 * scheduler.create("reminder_42_0_0_9_*_*_*", "reminder", new ReminderData("Stand-up", "42"))
 *          .owner("42")
 *          .timezone("Europe/Brussels")
 *          .cron("0 0 9 * * 1-5")
 *          .save();
 *
 * scheduler.remove("reminder_42_0_0_9_*_*_*");
 * scheduler.stop();
 * }</pre>
 */
public class DefaultScheduler implements Scheduler {
    private static final Logger log = LoggerFactory.getLogger(DefaultScheduler.class);

    private static final Comparator<JobRecord> BY_NEXT_FIRE = Comparator
            .comparing(JobRecord::nextFireAt, Comparator.nullsLast(Comparator.naturalOrder()))
            .thenComparing(JobRecord::id);

    private final SchedulerProperties props;
    private final JobStore jobStore;
    private final JobHandlerRegistry handlers;
    private final TriggerEvaluator evaluator;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final ZoneId defaultZone;

    private final AtomicBoolean started = new AtomicBoolean(false);
    private final AtomicLong sequence = new AtomicLong();

    // Guards every transition of the jobs map and the timers.
    private final Object lock = new Object();
    private final Map<String, LiveJob> jobs = new ConcurrentHashMap<>();
    private final DelayQueue<DueJob> queue = new DelayQueue<>();

    private ExecutorService workerPool;
    private Thread dispatcherThread;

    private static final class LiveJob {
        private volatile JobRecord record;
        private DueJob due;

        private LiveJob(JobRecord record) {
            this.record = record;
        }
    }

    private final class DueJob implements Delayed {
        private final LiveJob job;
        private final Instant fireAt;
        private final long seq;

        private DueJob(LiveJob job, Instant fireAt, long seq) {
            this.job = job;
            this.fireAt = fireAt;
            this.seq = seq;
        }

        @Override
        public long getDelay(TimeUnit unit) {
            long ms = Duration.between(clock.instant(), fireAt).toMillis();
            return unit.convert(ms, TimeUnit.MILLISECONDS);
        }

        @Override
        public int compareTo(Delayed other) {
            if (other == this) return 0;
            if (other instanceof DueJob o) {
                int c = this.fireAt.compareTo(o.fireAt);
                return c != 0 ? c : Long.compare(this.seq, o.seq);
            }
            return Long.compare(getDelay(TimeUnit.MILLISECONDS), other.getDelay(TimeUnit.MILLISECONDS));
        }
    }

    public DefaultScheduler(SchedulerProperties props, JobStore jobStore, JobHandlerRegistry handlers,
                            TriggerEvaluator evaluator, ObjectMapper objectMapper, Clock clock) {
        this.props = Objects.requireNonNull(props, "props must not be null");
        this.jobStore = Objects.requireNonNull(jobStore, "jobStore must not be null");
        this.handlers = Objects.requireNonNull(handlers, "handlers must not be null");
        this.evaluator = Objects.requireNonNull(evaluator, "evaluator must not be null");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.defaultZone = ZoneId.of(Objects.requireNonNull(props.getDefaultTimezone(),
                "tempo.defaultTimezone must not be null"));
    }

    /**
     * Load persisted jobs, reschedule them from now and start dispatching. Idempotent.
     */
    @Override
    public void start() {
        if (!started.compareAndSet(false, true)) {
            return;
        }

        Duration shutdownTimeout = Objects.requireNonNull(props.getShutdownTimeout(),
                "tempo.shutdownTimeout must not be null");
        if (shutdownTimeout.isNegative()) {
            throw new IllegalArgumentException("tempo.shutdownTimeout must not be negative");
        }
        if (props.getMaxConcurrency() < 0) {
            throw new IllegalArgumentException("tempo.maxConcurrency must not be negative");
        }

        log.info("Scheduler starting with maxConcurrency={}, defaultTimezone={}, shutdownTimeout={}",
                props.getMaxConcurrency(), defaultZone, shutdownTimeout);

        if (workerPool == null) {
            workerPool = newWorkerPool(props.getMaxConcurrency());
        }

        try {
            List<JobRecord> records = jobStore.loadAll(handlers);
            synchronized (lock) {
                Instant now = now();
                for (JobRecord record : records) {
                    restore(record, now);
                }
            }
        } catch (RuntimeException e) {
            started.set(false);
            workerPool.shutdownNow();
            workerPool = null;
            throw e;
        }

        if (dispatcherThread == null) {
            dispatcherThread = new Thread(this::dispatchLoop);
            dispatcherThread.setName("tempo.dispatcher");
            dispatcherThread.setDaemon(true);
            dispatcherThread.start();
        }
        log.info("Scheduler started successfully. jobs={} armed={}", jobs.size(), queue.size());
    }

    /**
     * Stop dispatching and wait for running handlers. Idempotent.
     */
    @Override
    public void stop() {
        if (!started.compareAndSet(true, false)) {
            return;
        }

        log.info("Scheduler stopping...");

        if (dispatcherThread != null) {
            dispatcherThread.interrupt();
            dispatcherThread = null;
        }

        if (workerPool != null) {
            workerPool.shutdown();
            try {
                if (!workerPool.awaitTermination(props.getShutdownTimeout().toMillis(), TimeUnit.MILLISECONDS)) {
                    workerPool.shutdownNow();
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                workerPool.shutdownNow();
            } finally {
                workerPool = null;
            }
        }

        synchronized (lock) {
            queue.clear();
            jobs.clear();
        }
        log.info("Scheduler stopped successfully.");
    }

    @Override
    public <T> JobBuilder<T> create(String id, String handlerKind, T payload) {
        return new SimpleJobBuilder<>(id, handlerKind, payload, this::submit, defaultZone);
    }

    @Override
    public JobBuilder<Void> create(String id, String handlerKind) {
        return new SimpleJobBuilder<>(id, handlerKind, null, this::submit, defaultZone);
    }

    /**
     * Persist and arm a job, replacing any job with the same id. The store write happens first: if it
     * fails, the previous job keeps running untouched.
     */
    @Override
    public PersistResult submit(JobRequest<?> request) {
        Objects.requireNonNull(request, "request must not be null");
        Objects.requireNonNull(request.spec(), "spec must not be null");
        handlers.getRequired(request.handlerKind());
        Map<String, Object> payload = toPayload(request.payload());

        synchronized (lock) {
            Instant now = now();
            Instant next = initialFireTime(request.spec(), now);
            JobRecord record = new JobRecord(
                    request.id(),
                    request.ownerId(),
                    request.handlerKind(),
                    request.spec(),
                    next == null ? JobState.DISABLED : JobState.PENDING,
                    next,
                    null,
                    payload,
                    now
            );

            PersistResult result = jobStore.put(record);

            LiveJob live = new LiveJob(record);
            LiveJob previous = jobs.put(record.id(), live);
            if (previous != null) {
                disarm(previous);
            }
            if (next != null) {
                arm(live);
            } else {
                log.info("job never fires, stored disabled id={} kind={}", record.id(), record.handlerKind());
            }

            log.info("job scheduled id={} kind={} owner={} nextFireAt={} replaced={}",
                    record.id(), record.handlerKind(), record.ownerId(), next, previous != null || result.replaced());
            return result;
        }
    }

    /**
     * Delete from the store, then disarm. A store failure propagates and leaves the job armed.
     */
    @Override
    public boolean remove(String id) {
        Objects.requireNonNull(id, "id must not be null");
        synchronized (lock) {
            boolean stored = jobStore.remove(id);
            LiveJob live = jobs.remove(id);
            if (live != null) {
                disarm(live);
            }
            if (stored || live != null) {
                log.info("job removed id={}", id);
            }
            return stored || live != null;
        }
    }

    /**
     * Live record while running. Before {@link #start()} or after {@link #stop()} the live map may not
     * hold every stored job, so a miss falls back to the job store.
     */
    @Override
    public Optional<JobRecord> find(String id) {
        if (id == null) {
            return Optional.empty();
        }
        LiveJob live = jobs.get(id);
        if (live != null) {
            return Optional.of(live.record);
        }
        return started.get() ? Optional.empty() : jobStore.get(id);
    }

    @Override
    public List<JobRecord> jobs() {
        return jobs.values().stream()
                .map(l -> l.record)
                .sorted(BY_NEXT_FIRE)
                .toList();
    }

    @Override
    public List<JobRecord> jobsOwnedBy(String ownerId) {
        return jobs.values().stream()
                .map(l -> l.record)
                .filter(r -> r.ownerId().equals(ownerId))
                .sorted(BY_NEXT_FIRE)
                .toList();
    }

    int queuedCount() {
        return queue.size();
    }

    private void restore(JobRecord record, Instant now) {
        if (jobs.containsKey(record.id())) {
            return;
        }
        if (record.state() == JobState.DISABLED) {
            jobs.put(record.id(), new LiveJob(record));
            return;
        }

        Instant next = initialFireTime(record.spec(), now);
        if (record.spec() instanceof ScheduleSpec.Cron
                && record.nextFireAt() != null
                && record.nextFireAt().isBefore(now)) {
            log.info("skipping missed fires id={} missedSince={} next={}", record.id(), record.nextFireAt(), next);
        }

        JobRecord restored = record.withSchedule(
                next == null ? JobState.DISABLED : JobState.PENDING,
                next,
                record.lastFiredAt()
        );
        if (!restored.equals(record)) {
            persistQuietly(restored);
        }

        LiveJob live = new LiveJob(restored);
        jobs.put(restored.id(), live);
        if (next != null) {
            arm(live);
        }
    }

    private void dispatchLoop() {
        while (started.get()) {
            try {
                DueJob due = queue.take();
                dispatch(due);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            } catch (Exception e) {
                log.error("scheduler dispatcher failed msg={}", e.getMessage(), e);
            }
        }
    }

    private void dispatch(DueJob due) {
        LiveJob live = due.job;
        synchronized (lock) {
            JobRecord current = live.record;
            if (jobs.get(current.id()) != live || live.due != due || current.state() != JobState.PENDING) {
                log.debug("dropping stale timer id={} fireAt={}", current.id(), due.fireAt);
                return;
            }
            live.due = null;
            live.record = current.withSchedule(JobState.FIRING, current.nextFireAt(), current.lastFiredAt());
        }
        workerPool.submit(() -> fire(live, due.fireAt));
    }

    private void fire(LiveJob live, Instant fireTime) {
        JobRecord record = live.record;
        try {
            synchronized (lock) {
                if (jobs.get(record.id()) == live) {
                    persistQuietly(record);
                }
            }

            JobHandler<?> handler = handlers.getRequired(record.handlerKind());
            log.debug("job started id={} kind={} fireTime={}", record.id(), record.handlerKind(), fireTime);
            executeHandler(handler, new JobContext(record.id(), record.ownerId(), fireTime), record.payload());
            log.debug("job succeeded id={} kind={}", record.id(), record.handlerKind());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("job interrupted id={} kind={}", record.id(), record.handlerKind());
        } catch (Exception e) {
            log.error("job failed id={} kind={} msg={}", record.id(), record.handlerKind(), e.getMessage(), e);
        } finally {
            complete(live, fireTime);
        }
    }

    private void complete(LiveJob live, Instant fireTime) {
        synchronized (lock) {
            JobRecord record = live.record;
            if (jobs.get(record.id()) != live) {
                log.debug("job replaced or removed while firing id={}", record.id());
                return;
            }

            Instant now = now();
            Instant next = evaluator.nextFireAfter(record.spec(), fireTime).orElse(null);
            if (next != null && next.isBefore(now)) {
                Instant skipTo = evaluator.nextFireAfter(record.spec(), now).orElse(null);
                log.info("job overran, skipping missed fires id={} missed={} next={}", record.id(), next, skipTo);
                next = skipTo;
            }

            JobRecord updated = record.withSchedule(
                    next == null ? JobState.DISABLED : JobState.PENDING,
                    next,
                    fireTime
            );
            live.record = updated;
            persistQuietly(updated);
            if (next != null) {
                arm(live);
            } else {
                log.info("job has no further fire times, disabled id={}", record.id());
            }
        }
    }

    private Instant initialFireTime(ScheduleSpec spec, Instant now) {
        if (spec instanceof ScheduleSpec.FixedInstant fixed) {
            // A one-shot whose time has passed runs once, right away.
            return fixed.fireAt().isAfter(now) ? fixed.fireAt() : now;
        }
        return evaluator.nextFireAfter(spec, now).orElse(null);
    }

    private void arm(LiveJob live) {
        DueJob due = new DueJob(live, live.record.nextFireAt(), sequence.incrementAndGet());
        live.due = due;
        queue.offer(due);
    }

    private void disarm(LiveJob live) {
        if (live.due != null) {
            queue.remove(live.due);
            live.due = null;
        }
    }

    private void persistQuietly(JobRecord record) {
        try {
            jobStore.put(record);
        } catch (JobStoreException e) {
            log.error("job state write failed, keeping in-memory state id={} state={} msg={}",
                    record.id(), record.state(), e.getMessage(), e);
        }
    }

    private Map<String, Object> toPayload(Object payload) {
        if (payload == null) {
            return Map.of();
        }
        try {
            return objectMapper.convertValue(payload, new TypeReference<Map<String, Object>>() {
            });
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Job payload must serialize to a JSON object: " + e.getMessage(), e);
        }
    }

    @SuppressWarnings("unchecked")
    private <T> void executeHandler(JobHandler<?> handler, JobContext context, Map<String, Object> payload)
            throws Exception {
        var h = (JobHandler<T>) handler;
        Class<T> type = h.dataClass();
        T data = (type == null || type == Void.class) ? null : objectMapper.convertValue(payload, type);
        h.execute(context, data);
    }

    private Instant now() {
        return clock.instant().truncatedTo(ChronoUnit.MILLIS);
    }

    private static ExecutorService newWorkerPool(int maxConcurrency) {
        AtomicInteger seq = new AtomicInteger();
        ThreadFactory factory = r -> {
            Thread t = new Thread(r);
            t.setName("tempo.worker-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
        return maxConcurrency > 0
                ? Executors.newFixedThreadPool(maxConcurrency, factory)
                : Executors.newCachedThreadPool(factory);
    }
}
