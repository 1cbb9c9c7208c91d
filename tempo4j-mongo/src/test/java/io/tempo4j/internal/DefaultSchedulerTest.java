package io.tempo4j.internal;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.tempo4j.JobContext;
import io.tempo4j.JobHandler;
import io.tempo4j.config.SchedulerProperties;
import io.tempo4j.core.JobHandlerRegistry;
import io.tempo4j.core.JobRecord;
import io.tempo4j.core.JobState;
import io.tempo4j.core.JobStoreException;
import io.tempo4j.core.PersistResult;
import io.tempo4j.core.ScheduleSpec;
import io.tempo4j.core.UnknownJobHandlerException;
import io.tempo4j.utils.CronExpression;
import io.tempo4j.utils.InvalidCronExpressionException;
import io.tempo4j.utils.TriggerEvaluator;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DefaultSchedulerTest {

    private static final Instant T0 = Instant.parse("2025-01-01T10:00:00Z");

    private final MutableClock clock = new MutableClock(T0);
    private final InMemoryJobStore store = new InMemoryJobStore();
    private final PingHandler ping = new PingHandler();

    private DefaultScheduler scheduler;

    @BeforeEach
    void setUp() {
        scheduler = newScheduler();
    }

    @AfterEach
    void tearDown() {
        scheduler.stop();
    }

    @Test
    void futureOneShotShouldFireOnceThenBecomeDisabled() throws Exception {
        scheduler.start();
        Instant at = T0.plusMillis(300);
        scheduler.create("once", "ping", new Ping("hello")).owner("42").at(at).save();

        assertEquals(JobState.PENDING, scheduler.find("once").orElseThrow().state());
        clock.set(at);

        assertTrue(waitUntil(() -> store.get("once").map(JobRecord::state).orElse(null) == JobState.DISABLED));
        assertEquals(1, ping.fired.size());
        assertEquals(new Ping("hello"), ping.fired.get(0).data());
        assertEquals(at, ping.fired.get(0).context().fireTime());

        JobRecord stored = store.get("once").orElseThrow();
        assertEquals(JobState.DISABLED, stored.state());
        assertNull(stored.nextFireAt());
        assertEquals(at, stored.lastFiredAt());
    }

    @Test
    void jobsDueAtTheSameInstantShouldEachFireExactlyOnce() throws Exception {
        scheduler.start();
        Instant at = T0.plusMillis(300);
        int count = 20;
        for (int i = 0; i < count; i++) {
            scheduler.create("same-" + i, "ping", new Ping("n" + i)).owner("42").at(at).save();
        }
        assertEquals(count, scheduler.queuedCount());

        clock.set(at);

        assertTrue(waitUntil(() -> ping.fired.size() == count));
        assertTrue(waitUntil(() -> scheduler.jobs().stream().allMatch(r -> r.state() == JobState.DISABLED)));
        Thread.sleep(200);

        assertEquals(count, ping.fired.size());
        assertEquals(count, ping.fired.stream().map(f -> f.context().jobId()).distinct().count());
        assertEquals(0, scheduler.queuedCount());
    }

    @Test
    void pastOneShotShouldFireImmediatelyAndNeverAgain() throws Exception {
        scheduler.start();
        scheduler.create("late", "ping", new Ping("late")).owner("42").at(T0.minusSeconds(3600)).save();

        assertTrue(waitUntil(() -> stateOf("late") == JobState.DISABLED));
        clock.advance(Duration.ofDays(1));
        Thread.sleep(200);

        assertEquals(1, ping.fired.size());
        assertEquals(0, scheduler.queuedCount());
    }

    @Test
    void failedFiringShouldNotStopTheNextOccurrence() throws Exception {
        ping.failing = true;
        scheduler.start();
        scheduler.create("tick", "ping", new Ping("tick")).owner("42").cron("* * * * * *").save();

        clock.set(T0.plusSeconds(1));
        assertTrue(waitUntil(() -> T0.plusSeconds(2).equals(nextFireOf("tick"))));

        clock.set(T0.plusSeconds(2));
        assertTrue(waitUntil(() -> ping.fired.size() == 2));
        assertTrue(waitUntil(() -> T0.plusSeconds(3).equals(nextFireOf("tick"))));
        assertEquals(JobState.PENDING, stateOf("tick"));
    }

    @Test
    void overrunningHandlerShouldSkipMissedOccurrences() throws Exception {
        clock.set(Instant.parse("2025-01-01T10:00:59.900Z"));
        ping.onFire = () -> clock.set(Instant.parse("2025-01-01T10:05:30Z"));
        scheduler.start();
        scheduler.create("minutely", "ping", new Ping("m")).owner("42").cron("0 * * * * *").save();
        assertEquals(Instant.parse("2025-01-01T10:01:00Z"), nextFireOf("minutely"));

        clock.set(Instant.parse("2025-01-01T10:01:00Z"));

        assertTrue(waitUntil(() -> Instant.parse("2025-01-01T10:06:00Z").equals(nextFireOf("minutely"))));
        JobRecord record = scheduler.find("minutely").orElseThrow();
        assertEquals(Instant.parse("2025-01-01T10:01:00Z"), record.lastFiredAt());
        assertEquals(1, ping.fired.size());
    }

    @Test
    void recreatingAJobShouldLeaveOnlyTheNewTimer() {
        scheduler.start();
        PersistResult first = scheduler.create("daily", "ping", new Ping("a")).owner("42").cron("0 0 9 * * *").save();
        PersistResult second = scheduler.create("daily", "ping", new Ping("b")).owner("42").cron("0 0 18 * * *").save();

        assertTrue(first.created());
        assertTrue(second.replaced());
        assertEquals(1, scheduler.queuedCount());
        assertEquals(1, scheduler.jobs().size());
        assertEquals(Instant.parse("2025-01-01T18:00:00Z"), nextFireOf("daily"));

        JobRecord stored = store.get("daily").orElseThrow();
        assertEquals(CronExpression.parse("0 0 18 * * *"), ((ScheduleSpec.Cron) stored.spec()).expression());
        assertEquals(Map.of("note", "b"), stored.payload());
    }

    @Test
    void replacedJobFiringInFlightShouldNotRearmItself() throws Exception {
        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        ping.onFire = () -> {
            entered.countDown();
            try {
                release.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        };
        scheduler.start();
        scheduler.create("job", "ping", new Ping("old")).owner("42").cron("* * * * * *").save();
        clock.set(T0.plusSeconds(1));
        assertTrue(entered.await(2, TimeUnit.SECONDS));

        scheduler.create("job", "ping", new Ping("new")).owner("42").cron("0 0 12 * * *").save();
        release.countDown();

        Thread.sleep(300);
        assertEquals(1, scheduler.queuedCount());
        JobRecord live = scheduler.find("job").orElseThrow();
        assertEquals(Instant.parse("2025-01-01T12:00:00Z"), live.nextFireAt());
        assertEquals(JobState.PENDING, live.state());
        assertEquals(Map.of("note", "new"), store.get("job").orElseThrow().payload());
        assertEquals(1, ping.fired.size());
    }

    @Test
    void cronThatNeverMatchesShouldBeStoredDisabled() {
        scheduler.start();
        scheduler.create("never", "ping", new Ping("x")).owner("42").cron("0 0 0 30 2 *").save();

        JobRecord record = scheduler.find("never").orElseThrow();
        assertEquals(JobState.DISABLED, record.state());
        assertNull(record.nextFireAt());
        assertEquals(0, scheduler.queuedCount());
        assertTrue(store.get("never").isPresent());
    }

    @Test
    void invalidInputShouldBeRejectedBeforePersistence() {
        assertThrows(UnknownJobHandlerException.class,
                () -> scheduler.create("a", "nope", new Ping("x")).owner("42").cron("0 0 9 * * *").save());
        assertThrows(InvalidCronExpressionException.class,
                () -> scheduler.create("b", "ping", new Ping("x")).owner("42").cron("0 9 * * *"));
        assertThrows(IllegalArgumentException.class,
                () -> scheduler.create("c", "ping", "just text").owner("42").cron("0 0 9 * * *").save());

        assertEquals(0, store.size());
        assertTrue(scheduler.jobs().isEmpty());
    }

    @Test
    void removeShouldDeleteAndDisarmIdempotently() {
        scheduler.start();
        scheduler.create("gone", "ping", new Ping("x")).owner("42").cron("0 0 9 * * *").save();

        assertTrue(scheduler.remove("gone"));
        assertFalse(scheduler.remove("gone"));
        assertEquals(0, scheduler.queuedCount());
        assertTrue(store.get("gone").isEmpty());
        assertTrue(scheduler.find("gone").isEmpty());
    }

    @Test
    void storeFailureShouldLeaveTheCurrentJobArmed() {
        scheduler.start();
        scheduler.create("kept", "ping", new Ping("x")).owner("42").cron("0 0 9 * * *").save();
        store.failWrites.set(true);

        assertThrows(JobStoreException.class, () -> scheduler.remove("kept"));
        assertThrows(JobStoreException.class,
                () -> scheduler.create("kept", "ping", new Ping("y")).owner("42").cron("0 0 18 * * *").save());

        assertEquals(Instant.parse("2025-01-02T09:00:00Z"), nextFireOf("kept"));
        assertEquals(1, scheduler.queuedCount());
    }

    @Test
    void startShouldRescheduleFromNowWithoutReplayingMissedFires() throws Exception {
        JobRecord overdue = record("overdue", "ping", cron("0 0 9 * * *"), JobState.PENDING,
                Instant.parse("2024-12-30T09:00:00Z"));
        JobRecord dormant = record("dormant", "ping", cron("0 0 9 * * *"), JobState.DISABLED, null);
        JobRecord legacy = record("legacy", "retired_kind", cron("0 0 9 * * *"), JobState.PENDING,
                Instant.parse("2025-01-02T09:00:00Z"));
        store.put(overdue);
        store.put(dormant);
        store.put(legacy);

        scheduler.start();
        Thread.sleep(200);

        JobRecord restored = scheduler.find("overdue").orElseThrow();
        assertEquals(JobState.PENDING, restored.state());
        assertEquals(Instant.parse("2025-01-02T09:00:00Z"), restored.nextFireAt());
        assertEquals(restored, store.get("overdue").orElseThrow());
        assertEquals(JobState.DISABLED, scheduler.find("dormant").orElseThrow().state());
        assertTrue(scheduler.find("legacy").isEmpty());
        assertEquals(1, scheduler.queuedCount());
        assertTrue(ping.fired.isEmpty());
    }

    @Test
    void recordLeftFiringByACrashShouldRunAgainOnStart() throws Exception {
        store.put(record("crashed", "ping", ScheduleSpec.at(T0.minusSeconds(60), ZoneOffset.UTC),
                JobState.FIRING, T0.minusSeconds(60)));

        scheduler.start();

        assertTrue(waitUntil(() -> stateOf("crashed") == JobState.DISABLED));
        assertEquals(1, ping.fired.size());
    }

    @Test
    void restartShouldRestoreJobsFromTheStore() {
        scheduler.start();
        scheduler.create("daily", "ping", new Ping("a")).owner("42").timezone("Europe/Brussels")
                .cron("0 0 9 * * 1-5").save();
        JobRecord before = scheduler.find("daily").orElseThrow();

        scheduler.stop();
        assertTrue(scheduler.jobs().isEmpty());

        scheduler = newScheduler();
        scheduler.start();

        JobRecord after = scheduler.find("daily").orElseThrow();
        assertEquals(before, after);
        assertFalse(after.nextFireAt().isBefore(clock.instant()));
    }

    @Test
    void findShouldSeeStoredJobsWhileNotRunning() {
        store.put(record("stored", "ping", cron("0 0 9 * * *"), JobState.PENDING, T0.plusSeconds(3600)));

        assertEquals("stored", scheduler.find("stored").orElseThrow().id());

        scheduler.start();
        scheduler.stop();
        assertTrue(scheduler.find("stored").isPresent());
        assertTrue(scheduler.find("missing").isEmpty());
    }

    @Test
    void jobsOwnedByShouldFilterAndSortByNextFire() {
        scheduler.create("b", "ping", new Ping("x")).owner("42").cron("0 0 18 * * *").save();
        scheduler.create("a", "ping", new Ping("x")).owner("42").cron("0 0 12 * * *").save();
        scheduler.create("c", "ping", new Ping("x")).owner("7").cron("0 0 11 * * *").save();
        scheduler.create("d", "ping", new Ping("x")).owner("42").cron("0 0 0 30 2 *").save();

        List<String> ids = scheduler.jobsOwnedBy("42").stream().map(JobRecord::id).toList();

        assertEquals(List.of("a", "b", "d"), ids);
        assertEquals(4, scheduler.jobs().size());
    }

    private DefaultScheduler newScheduler() {
        SchedulerProperties props = new SchedulerProperties();
        props.setShutdownTimeout(Duration.ofSeconds(1));
        return new DefaultScheduler(
                props,
                store,
                new JobHandlerRegistry(List.of(ping)),
                new TriggerEvaluator(),
                new ObjectMapper(),
                clock
        );
    }

    private JobState stateOf(String id) {
        return scheduler.find(id).map(JobRecord::state).orElse(null);
    }

    private Instant nextFireOf(String id) {
        return scheduler.find(id).map(JobRecord::nextFireAt).orElse(null);
    }

    private static ScheduleSpec cron(String expression) {
        return ScheduleSpec.cron(CronExpression.parse(expression), ZoneOffset.UTC);
    }

    private static JobRecord record(String id, String kind, ScheduleSpec spec, JobState state, Instant nextFireAt) {
        return new JobRecord(id, "42", kind, spec, state, nextFireAt, null, Map.of("note", id),
                T0.minus(Duration.ofDays(10)));
    }

    private static boolean waitUntil(BooleanSupplier condition) throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (System.nanoTime() < deadline) {
            if (condition.getAsBoolean()) {
                return true;
            }
            Thread.sleep(20);
        }
        return false;
    }

    record Ping(String note) {
    }

    record Fired(JobContext context, Ping data) {
    }

    static class PingHandler implements JobHandler<Ping> {
        final List<Fired> fired = new CopyOnWriteArrayList<>();
        volatile boolean failing;
        volatile Runnable onFire = () -> { };

        @Override
        public String kind() {
            return "ping";
        }

        @Override
        public Class<Ping> dataClass() {
            return Ping.class;
        }

        @Override
        public void execute(JobContext context, Ping data) {
            fired.add(new Fired(context, data));
            onFire.run();
            if (failing) {
                throw new IllegalStateException("simulated handler failure");
            }
        }
    }
}
