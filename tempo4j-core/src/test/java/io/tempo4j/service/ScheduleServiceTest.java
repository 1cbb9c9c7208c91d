package io.tempo4j.service;

import io.tempo4j.JobBuilder;
import io.tempo4j.Scheduler;
import io.tempo4j.core.CancelResult;
import io.tempo4j.core.JobRecord;
import io.tempo4j.core.JobRequest;
import io.tempo4j.core.JobState;
import io.tempo4j.core.JobStoreException;
import io.tempo4j.core.PersistResult;
import io.tempo4j.core.RegistryEntry;
import io.tempo4j.core.ScheduleRegistry;
import io.tempo4j.core.ScheduleSpec;
import io.tempo4j.utils.CronExpression;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.RETURNS_SELF;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class ScheduleServiceTest {

    private static final Instant NOW = Instant.parse("2025-01-01T10:00:00Z");
    private static final String DAILY_ID = "reminder_42_0_0_9_*_*_*";

    private final Scheduler scheduler = mock(Scheduler.class);
    private final ScheduleRegistry registry = mock(ScheduleRegistry.class);
    private final ScheduleService service =
            new ScheduleService(scheduler, registry, Clock.fixed(NOW, ZoneOffset.UTC));

    @SuppressWarnings("unchecked")
    private final JobBuilder<Object> builder = mock(JobBuilder.class, RETURNS_SELF);

    @BeforeEach
    void setUp() {
        when(scheduler.create(anyString(), anyString(), any())).thenReturn(builder);
        when(builder.save()).thenReturn(PersistResult.createdResult());
    }

    @Test
    void createShouldScheduleThenRecordTheEntry() {
        when(scheduler.find(DAILY_ID)).thenReturn(Optional.of(job(DAILY_ID, "42")));
        ReminderPayload payload = new ReminderPayload("Stand-up", "42");

        ScheduleView view = service.create(ScheduleCreateRequest.builder()
                .ownerId("42")
                .chatId("42")
                .taskKind("reminder")
                .cron("0 0 9 * * *")
                .timezone("Europe/Brussels")
                .payload(payload)
                .originalRequest("remind me every day at 9")
                .preference("tone", "short")
                .build());

        verify(scheduler).create(DAILY_ID, "reminder", payload);
        verify(builder).owner("42");
        verify(builder).timezone("Europe/Brussels");
        verify(builder).cron("0 0 9 * * *");
        verify(builder).save();

        ArgumentCaptor<RegistryEntry> captor = ArgumentCaptor.forClass(RegistryEntry.class);
        verify(registry).save(captor.capture());
        RegistryEntry entry = captor.getValue();
        assertThat(entry.jobId()).isEqualTo(DAILY_ID);
        assertThat(entry.ownerId()).isEqualTo("42");
        assertThat(entry.originalRequest()).isEqualTo("remind me every day at 9");
        assertThat(entry.preferences()).isEqualTo(Map.of("tone", "short"));
        assertThat(entry.createdAt()).isEqualTo(NOW);

        assertThat(view.jobId()).isEqualTo(DAILY_ID);
        assertThat(view.state()).isEqualTo(JobState.PENDING);
        assertThat(view.nextFireAt()).isEqualTo(Instant.parse("2025-01-02T09:00:00Z"));
    }

    @Test
    void oneShotWithoutIdShouldUseTheInstantId() {
        Instant at = Instant.parse("2025-01-01T12:00:00Z");
        String expectedId = "reminder_42_at_" + at.getEpochSecond();
        when(scheduler.find(expectedId)).thenReturn(Optional.of(job(expectedId, "42")));

        service.create(ScheduleCreateRequest.builder()
                .ownerId("42")
                .chatId("42")
                .taskKind("reminder")
                .at(at)
                .build());

        verify(scheduler).create(eq(expectedId), eq("reminder"), any());
        verify(builder).at(at);
    }

    @Test
    void registryFailureShouldRemoveTheJobAgain() {
        JobStoreException failure = new JobStoreException("registry down", new RuntimeException());
        when(registry.save(any())).thenThrow(failure);

        assertThatThrownBy(() -> service.create(dailyRequest()))
                .isSameAs(failure);
        verify(scheduler).remove(DAILY_ID);
    }

    @Test
    void registryFailureOnReplaceShouldRestoreThePreviousJob() {
        JobRecord previous = job(DAILY_ID, "42");
        when(scheduler.find(DAILY_ID)).thenReturn(Optional.of(previous));
        JobStoreException failure = new JobStoreException("registry down", new RuntimeException());
        when(registry.save(any())).thenThrow(failure);

        assertThatThrownBy(() -> service.create(dailyRequest()))
                .isSameAs(failure);

        ArgumentCaptor<JobRequest<?>> captor = ArgumentCaptor.forClass(JobRequest.class);
        verify(scheduler).submit(captor.capture());
        JobRequest<?> restored = captor.getValue();
        assertThat(restored.id()).isEqualTo(DAILY_ID);
        assertThat(restored.ownerId()).isEqualTo("42");
        assertThat(restored.spec()).isEqualTo(previous.spec());
        assertThat(restored.payload()).isEqualTo(previous.payload());
        verify(scheduler, never()).remove(DAILY_ID);
        verify(registry, never()).delete(DAILY_ID);
    }

    @Test
    void createWithAnotherOwnersJobIdShouldBeRejected() {
        when(scheduler.find("job1")).thenReturn(Optional.of(job("job1", "alice")));

        ScheduleCreateRequest takeover = ScheduleCreateRequest.builder()
                .jobId("job1")
                .ownerId("mallory")
                .taskKind("reminder")
                .cron("0 0 9 * * *")
                .build();

        assertThatThrownBy(() -> service.create(takeover))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("No schedule found with ID: job1");
        verify(scheduler, never()).create(anyString(), anyString(), any());
        verify(builder, never()).save();
        verifyNoInteractions(registry);
    }

    @Test
    void createWithOwnJobIdShouldReplaceIt() {
        when(scheduler.find("job1")).thenReturn(Optional.of(job("job1", "alice")));

        service.create(ScheduleCreateRequest.builder()
                .jobId("job1")
                .ownerId("alice")
                .taskKind("reminder")
                .cron("0 0 9 * * *")
                .build());

        verify(scheduler).create(eq("job1"), eq("reminder"), any());
        verify(builder).save();
        verify(registry).save(any());
    }

    @Test
    void createShouldRequireExactlyOneSchedule() {
        ScheduleCreateRequest both = ScheduleCreateRequest.builder()
                .ownerId("42")
                .taskKind("reminder")
                .cron("0 0 9 * * *")
                .at(NOW)
                .build();

        assertThatThrownBy(() -> service.create(both)).isInstanceOf(IllegalArgumentException.class);
        verifyNoInteractions(registry);
        verify(scheduler, never()).create(anyString(), anyString(), any());
    }

    @Test
    void listShouldDropEntriesWithoutALiveJobOfTheSameOwner() {
        RegistryEntry live = entry("live", "42");
        RegistryEntry orphan = entry("orphan", "42");
        RegistryEntry stolen = entry("stolen", "42");
        when(registry.listByOwner("42")).thenReturn(List.of(live, orphan, stolen));
        when(scheduler.find("live")).thenReturn(Optional.of(job("live", "42")));
        when(scheduler.find("orphan")).thenReturn(Optional.empty());
        when(scheduler.find("stolen")).thenReturn(Optional.of(job("stolen", "99")));

        List<ScheduleView> views = service.list("42");

        assertThat(views).extracting(ScheduleView::jobId).containsExactly("live");
    }

    @Test
    void cancelByOwnerShouldRemoveJobAndEntry() {
        when(scheduler.find(DAILY_ID)).thenReturn(Optional.of(job(DAILY_ID, "42")));

        CancelResult result = service.cancel(DAILY_ID, "42");

        assertThat(result.outcome()).isEqualTo(CancelResult.Outcome.CANCELLED);
        assertThat(result.message()).isEqualTo("Schedule cancelled (ID: " + DAILY_ID + ")");
        verify(scheduler).remove(DAILY_ID);
        verify(registry).delete(DAILY_ID);
    }

    @Test
    void cancelByAnotherTenantShouldLookLikeNotFound() {
        when(scheduler.find(DAILY_ID)).thenReturn(Optional.of(job(DAILY_ID, "42")));
        when(scheduler.find("missing")).thenReturn(Optional.empty());

        CancelResult notOwner = service.cancel(DAILY_ID, "99");
        CancelResult notFound = service.cancel("missing", "99");

        assertThat(notOwner.outcome()).isEqualTo(CancelResult.Outcome.NOT_OWNER);
        assertThat(notFound.outcome()).isEqualTo(CancelResult.Outcome.NOT_FOUND);
        assertThat(notOwner.hasEffect()).isFalse();
        assertThat(notOwner.message()).isEqualTo("No schedule found with ID: " + DAILY_ID);
        assertThat(notFound.message()).isEqualTo("No schedule found with ID: missing");
        verify(scheduler, never()).remove(DAILY_ID);
        verify(registry, never()).delete(DAILY_ID);
    }

    private static ScheduleCreateRequest dailyRequest() {
        return ScheduleCreateRequest.builder()
                .ownerId("42")
                .chatId("42")
                .taskKind("reminder")
                .cron("0 0 9 * * *")
                .build();
    }

    private static JobRecord job(String id, String ownerId) {
        return new JobRecord(
                id,
                ownerId,
                "reminder",
                ScheduleSpec.cron(CronExpression.parse("0 0 9 * * *"), ZoneOffset.UTC),
                JobState.PENDING,
                Instant.parse("2025-01-02T09:00:00Z"),
                null,
                Map.of("message", "Stand-up"),
                NOW
        );
    }

    private static RegistryEntry entry(String jobId, String ownerId) {
        return new RegistryEntry(jobId, ownerId, ownerId, "reminder", "", Map.of(), NOW);
    }

    record ReminderPayload(String message, String chatId) {
    }
}
