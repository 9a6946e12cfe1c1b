package io.crontab4j.internal.file;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.crontab4j.CronEventListener;
import io.crontab4j.MessageSender;
import io.crontab4j.SkillTask;
import io.crontab4j.config.CronProperties;
import io.crontab4j.core.CronEvent;
import io.crontab4j.core.CronEventAction;
import io.crontab4j.core.CronJob;
import io.crontab4j.core.CronJobCreate;
import io.crontab4j.core.CronJobNotFoundException;
import io.crontab4j.core.CronJobPatch;
import io.crontab4j.core.CronPayload;
import io.crontab4j.core.CronPayloadPatch;
import io.crontab4j.core.CronSchedule;
import io.crontab4j.core.CronStatus;
import io.crontab4j.core.RunLogEntry;
import io.crontab4j.core.RunMode;
import io.crontab4j.core.RunResult;
import io.crontab4j.core.RunStatus;
import io.crontab4j.core.Schedules;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.BooleanSupplier;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class FileCronServiceTest {

    private static final Instant T0 = Instant.parse("2026-01-01T00:00:00Z");

    @TempDir
    Path dir;

    @Mock
    MessageSender sender;

    private final MutableClock clock = new MutableClock(T0);
    private final Map<String, SkillTask> skills = new ConcurrentHashMap<>();
    private final List<CronEvent> events = new CopyOnWriteArrayList<>();
    private final CronProperties props = new CronProperties();

    private FileJobStore jobStore;
    private FileCronService service;

    @BeforeEach
    void setUp() {
        props.setStorePath(dir.toString());
        jobStore = new FileJobStore(dir, new ObjectMapper());
        service = newService(clock, events::add);
    }

    @AfterEach
    void tearDown() {
        service.close();
    }

    @Test
    void addShouldPersistJobAndEmitAdded() {
        CronJob job = service.add(everyMinute("  water  "));

        assertThat(job.getName()).isEqualTo("water");
        assertThat(job.getState().getNextRunAt()).isEqualTo(T0.plusSeconds(60));
        assertThat(new FileJobStore(dir, new ObjectMapper()).load(true).getJobs())
                .extracting(CronJob::getId).containsExactly(job.getId());
        assertThat(events).containsExactly(CronEvent.added(job.getId(), T0.plusSeconds(60)));
    }

    @Test
    void addShouldRejectInvalidScheduleWithoutStoringIt() {
        assertThatThrownBy(() -> service.add(CronJobCreate.builder()
                .schedule(new CronSchedule.Cron("99 * * * *", null))
                .message(1L, "hi", "bot")
                .build()))
                .isInstanceOf(IllegalArgumentException.class);

        assertThat(service.list(true)).isEmpty();
        assertThat(events).isEmpty();
    }

    @Test
    void listShouldSortByNextRunWithUnscheduledJobsFirst() {
        CronJob hourly = service.add(CronJobCreate.builder()
                .name("hourly")
                .schedule(Schedules.every(Duration.ofHours(1)))
                .message(1L, "hourly", "bot")
                .build());
        CronJob minutely = service.add(everyMinute("minutely"));
        CronJob paused = service.add(CronJobCreate.builder()
                .name("paused")
                .enabled(false)
                .schedule(Schedules.every(Duration.ofMinutes(5)))
                .message(1L, "paused", "bot")
                .build());

        assertThat(service.list()).extracting(CronJob::getId).containsExactly(minutely.getId(), hourly.getId());
        assertThat(service.list(true)).extracting(CronJob::getId)
                .containsExactly(paused.getId(), minutely.getId(), hourly.getId());
    }

    @Test
    void returnedJobsShouldBeDetachedCopies() {
        CronJob job = service.add(everyMinute("water"));

        job.setName("mutated");
        service.list().get(0).setName("mutated again");

        assertThat(service.get(job.getId()).getName()).isEqualTo("water");
    }

    @Test
    void updateShouldMergePayloadAndRecomputeOnlyWhenTimingChanges() {
        CronJob job = service.add(everyMinute("water"));
        clock.advance(Duration.ofSeconds(10));

        CronJob renamed = service.update(job.getId(), CronJobPatch.builder()
                .name(" drink ")
                .payload(new CronPayloadPatch.Message("drink water", null, null))
                .build());

        assertThat(renamed.getName()).isEqualTo("drink");
        assertThat(renamed.getPayload()).isEqualTo(new CronPayload.Message("drink water", 42L, "bot"));
        assertThat(renamed.getState().getNextRunAt()).isEqualTo(T0.plusSeconds(60));
        assertThat(renamed.getUpdatedAt()).isEqualTo(T0.plusSeconds(10));

        CronJob rescheduled = service.update(job.getId(), CronJobPatch.builder()
                .schedule(Schedules.cron("0 9 * * *", "UTC"))
                .build());
        assertThat(rescheduled.getState().getNextRunAt()).isEqualTo(Instant.parse("2026-01-01T09:00:00Z"));

        CronJob disabled = service.update(job.getId(), CronJobPatch.builder().enabled(false).build());
        assertThat(disabled.getState().getNextRunAt()).isNull();
        assertThat(events).extracting(CronEvent::action)
                .containsExactly(CronEventAction.ADDED, CronEventAction.UPDATED, CronEventAction.UPDATED, CronEventAction.UPDATED);
    }

    @Test
    void updateShouldRejectUnknownIdsAndIncompletePayloads() {
        CronJob job = service.add(everyMinute("water"));

        assertThatThrownBy(() -> service.update("missing", CronJobPatch.builder().name("x").build()))
                .isInstanceOf(CronJobNotFoundException.class)
                .hasMessageContaining("missing");
        assertThatThrownBy(() -> service.update(job.getId(), CronJobPatch.builder()
                .payload(new CronPayloadPatch.SkillJob("reflection", null))
                .build()))
                .isInstanceOf(IllegalArgumentException.class);

        assertThat(service.get(job.getId()).getPayload()).isInstanceOf(CronPayload.Message.class);
    }

    @Test
    void removeShouldReportWhetherAJobWasRemoved() {
        CronJob job = service.add(everyMinute("water"));

        assertThat(service.remove(job.getId()).removed()).isTrue();
        assertThat(service.remove(job.getId()).removed()).isFalse();
        assertThat(service.list(true)).isEmpty();
        assertThat(events).extracting(CronEvent::action).containsExactly(CronEventAction.ADDED, CronEventAction.REMOVED);
    }

    @Test
    void runDueShouldOnlyExecuteWhenDue() throws Exception {
        CronJob job = service.add(everyMinute("water"));

        assertThat(service.run(job.getId(), RunMode.DUE)).isEqualTo(RunResult.notRun(RunResult.NOT_DUE));
        verify(sender, never()).send(anyLong(), anyString(), anyString());

        clock.advance(Duration.ofSeconds(60));
        assertThat(service.run(job.getId(), RunMode.DUE)).isEqualTo(RunResult.ranResult());
        verify(sender).send(42L, "water", "bot");
    }

    @Test
    void runForceShouldExecuteAndRecordRunLog() throws Exception {
        CronJob job = service.add(everyMinute("water"));
        clock.advance(Duration.ofSeconds(5));

        RunResult result = service.run(job.getId(), RunMode.FORCE);

        assertThat(result.ran()).isTrue();
        verify(sender).send(42L, "water", "bot");
        CronJob after = service.get(job.getId());
        assertThat(after.getState().getLastStatus()).isEqualTo(RunStatus.OK);
        assertThat(after.getState().getRunningAt()).isNull();
        assertThat(after.getState().getNextRunAt()).isEqualTo(T0.plusSeconds(60));

        List<RunLogEntry> runs = service.runs(job.getId(), 10);
        assertThat(runs).hasSize(1);
        assertThat(runs.get(0).status()).isEqualTo(RunStatus.OK);
        assertThat(runs.get(0).output()).isEqualTo("Message sent");
        assertThat(runs.get(0).runAtMs()).isEqualTo(T0.plusSeconds(5).toEpochMilli());
        assertThat(events).extracting(CronEvent::action)
                .containsExactly(CronEventAction.ADDED, CronEventAction.STARTED, CronEventAction.FINISHED);
    }

    @Test
    void runOnUnknownJobShouldThrow() {
        assertThatThrownBy(() -> service.run("missing", RunMode.FORCE))
                .isInstanceOf(CronJobNotFoundException.class);
    }

    @Test
    void concurrentForcedRunsShouldExecuteExactlyOnce() throws Exception {
        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        AtomicInteger invocations = new AtomicInteger();
        skills.put("reflection/daily", () -> {
            invocations.incrementAndGet();
            entered.countDown();
            release.await(5, TimeUnit.SECONDS);
            return "reflected";
        });
        CronJob job = service.add(skillJob("reflection", "daily"));

        ExecutorService pool = Executors.newSingleThreadExecutor();
        try {
            Future<RunResult> first = pool.submit(() -> service.run(job.getId(), RunMode.FORCE));
            assertThat(entered.await(5, TimeUnit.SECONDS)).isTrue();

            RunResult second = service.run(job.getId(), RunMode.FORCE);
            release.countDown();

            assertThat(first.get(5, TimeUnit.SECONDS)).isEqualTo(RunResult.ranResult());
            assertThat(second).isEqualTo(RunResult.notRun(RunResult.ALREADY_RUNNING));
            assertThat(invocations.get()).isEqualTo(1);
        } finally {
            release.countDown();
            pool.shutdownNow();
        }
    }

    @Test
    void runShouldNotOverlapATickReservation() {
        CronJob job = service.add(everyMinute("water"));
        jobStore.current().getJobs().get(0).getState().setRunningAt(T0);

        assertThat(service.run(job.getId(), RunMode.FORCE)).isEqualTo(RunResult.notRun(RunResult.ALREADY_RUNNING));
    }

    @Test
    void tickShouldDeleteSuccessfulOneShot() throws Exception {
        CronJob job = service.add(CronJobCreate.builder()
                .name("once")
                .schedule(Schedules.at(T0.plusSeconds(60)))
                .message(42L, "once", "bot")
                .build());
        clock.advance(Duration.ofMinutes(2));

        service.onTimer();

        verify(sender).send(42L, "once", "bot");
        assertThat(service.list(true)).isEmpty();
        assertThat(service.runs(job.getId(), 10)).extracting(RunLogEntry::status).containsExactly(RunStatus.OK);
        assertThat(events).extracting(CronEvent::action).containsExactly(
                CronEventAction.ADDED, CronEventAction.STARTED, CronEventAction.FINISHED, CronEventAction.REMOVED);
    }

    @Test
    void failedOneShotShouldStayDisabled() throws Exception {
        doThrow(new IllegalStateException("telegram down")).when(sender).send(anyLong(), anyString(), anyString());
        CronJob job = service.add(CronJobCreate.builder()
                .name("once")
                .schedule(Schedules.at(T0.plusSeconds(60)))
                .message(42L, "once", "bot")
                .build());
        clock.advance(Duration.ofMinutes(2));

        service.onTimer();

        assertThat(service.list()).isEmpty();
        CronJob kept = service.get(job.getId());
        assertThat(kept.isEnabled()).isFalse();
        assertThat(kept.getState().getNextRunAt()).isNull();
        assertThat(kept.getState().getLastStatus()).isEqualTo(RunStatus.ERROR);
        assertThat(kept.getState().getLastError()).isEqualTo("telegram down");
        assertThat(kept.getState().getConsecutiveErrors()).isEqualTo(1);
    }

    @Test
    void repeatedFailuresShouldBackOff() throws Exception {
        doThrow(new IllegalStateException("telegram down")).when(sender).send(anyLong(), anyString(), anyString());
        CronJob job = service.add(CronJobCreate.builder()
                .name("fast")
                .schedule(Schedules.every(Duration.ofSeconds(10)))
                .message(42L, "fast", "bot")
                .build());

        clock.advance(Duration.ofSeconds(10));
        service.onTimer();
        assertThat(service.get(job.getId()).getState().getNextRunAt()).isEqualTo(T0.plusSeconds(40));

        clock.set(T0.plusSeconds(40));
        service.onTimer();
        CronJob after = service.get(job.getId());
        assertThat(after.getState().getConsecutiveErrors()).isEqualTo(2);
        assertThat(after.getState().getNextRunAt()).isEqualTo(T0.plusSeconds(100));
        verify(sender, times(2)).send(42L, "fast", "bot");
    }

    @Test
    void missingSkillHandlerShouldSkipWithoutCountingAnError() {
        CronJob job = service.add(skillJob("reflection", "weekly"));
        clock.advance(Duration.ofHours(1).plusMillis(1));

        service.onTimer();

        CronJob after = service.get(job.getId());
        assertThat(after.getState().getLastStatus()).isEqualTo(RunStatus.SKIPPED);
        assertThat(after.getState().getLastError()).isEqualTo("Skill handler not found: reflection/weekly");
        assertThat(after.getState().getConsecutiveErrors()).isZero();
        assertThat(after.getState().getNextRunAt()).isEqualTo(T0.plus(Duration.ofHours(2)));
    }

    @Test
    void skillOutputShouldBeRecorded() {
        skills.put("reflection/daily", () -> "3 notes");
        CronJob job = service.add(skillJob("reflection", "daily"));

        service.run(job.getId(), RunMode.FORCE);

        assertThat(service.runs(job.getId(), 10)).extracting(RunLogEntry::output).containsExactly("3 notes");
    }

    @Test
    void slowJobShouldTimeOutAsError() {
        service.close();
        props.setJobTimeout(Duration.ofMillis(200));
        service = newService(clock, events::add);
        CountDownLatch release = new CountDownLatch(1);
        skills.put("reflection/daily", () -> {
            release.await(10, TimeUnit.SECONDS);
            return "late";
        });
        try {
            CronJob job = service.add(skillJob("reflection", "daily"));
            clock.advance(Duration.ofHours(1));

            service.onTimer();

            CronJob after = service.get(job.getId());
            assertThat(after.getState().getLastStatus()).isEqualTo(RunStatus.ERROR);
            assertThat(after.getState().getLastError()).isEqualTo("cron: job execution timed out");
            assertThat(after.getState().getRunningAt()).isNull();
        } finally {
            release.countDown();
        }
    }

    @Test
    void sweepShouldClearStuckMarkerAndMakeJobEligibleAgain() throws Exception {
        CronJob job = service.add(everyMinute("water"));
        clock.advance(Duration.ofHours(3));
        jobStore.current().getJobs().get(0).getState().setRunningAt(T0);
        jobStore.current().getJobs().get(0).getState().setNextRunAt(T0.plus(Duration.ofHours(4)));
        jobStore.save();

        service.onTimer();
        assertThat(service.get(job.getId()).getState().getRunningAt()).isNull();
        verify(sender, never()).send(anyLong(), anyString(), anyString());

        clock.advance(Duration.ofHours(1));
        service.onTimer();
        verify(sender).send(42L, "water", "bot");
    }

    @Test
    void jobRemovedWhileRunningShouldNotBeResurrected() {
        AtomicReference<String> id = new AtomicReference<>();
        skills.put("reflection/daily", () -> {
            service.remove(id.get());
            return "done";
        });
        CronJob job = service.add(skillJob("reflection", "daily"));
        id.set(job.getId());
        clock.advance(Duration.ofHours(1));

        service.onTimer();

        assertThat(service.list(true)).isEmpty();
        assertThat(service.runs(job.getId(), 10)).isEmpty();
        assertThat(events).extracting(CronEvent::action)
                .containsExactly(CronEventAction.ADDED, CronEventAction.STARTED, CronEventAction.REMOVED);
    }

    @Test
    void failingListenerShouldNotAffectScheduling() {
        service.close();
        service = newService(clock, event -> {
            throw new IllegalStateException("dashboard offline");
        });

        CronJob job = service.add(everyMinute("water"));

        assertThat(service.get(job.getId()).getState().getNextRunAt()).isEqualTo(T0.plusSeconds(60));
    }

    @Test
    void startShouldClearLeftoverMarkersAndReportStatus() {
        CronJob job = service.add(everyMinute("water"));
        jobStore.current().getJobs().get(0).getState().setRunningAt(T0);
        jobStore.save();

        service.start();
        service.start();

        assertThat(service.isStarted()).isTrue();
        assertThat(service.get(job.getId()).getState().getRunningAt()).isNull();
        CronStatus status = service.status();
        assertThat(status.enabled()).isTrue();
        assertThat(status.storePath()).isEqualTo(dir.toString());
        assertThat(status.jobCount()).isEqualTo(1);
        assertThat(status.nextWakeAt()).isEqualTo(T0.plusSeconds(60));

        service.stop();
        assertThat(service.isStarted()).isFalse();
    }

    @Test
    void disabledServiceShouldNotStart() {
        service.close();
        props.setEnabled(false);
        service = newService(clock, events::add);
        service.add(everyMinute("water"));

        service.start();

        assertThat(service.isStarted()).isFalse();
        assertThat(service.status().enabled()).isFalse();
        assertThat(service.status().nextWakeAt()).isNull();
    }

    @Test
    void runLogsCanBeDeletedAndCleared() {
        CronJob job = service.add(everyMinute("water"));
        service.run(job.getId(), RunMode.FORCE);
        clock.advance(Duration.ofSeconds(1));
        service.run(job.getId(), RunMode.FORCE);
        List<RunLogEntry> runs = service.runs(job.getId(), 10);
        assertThat(runs).hasSize(2);

        assertThat(service.deleteRuns(job.getId(), List.of(runs.get(0).ts()))).isEqualTo(1);
        assertThat(service.runs(job.getId(), 10)).hasSize(1);

        service.clearRuns(job.getId());
        assertThat(service.runs(job.getId(), 10)).isEmpty();
    }

    @Test
    void startedServiceShouldFireDueJobsOnItsOwn() throws Exception {
        service.close();
        service = newService(Clock.systemUTC(), events::add);
        CronJob job = service.add(CronJobCreate.builder()
                .name("soon")
                .schedule(Schedules.at(Instant.now().plusMillis(300)))
                .message(42L, "soon", "bot")
                .build());

        service.start();

        verify(sender, timeout(5_000)).send(42L, "soon", "bot");
        assertThat(waitUntil(5, TimeUnit.SECONDS, () -> service.list(true).isEmpty())).isTrue();
        assertThat(service.runs(job.getId(), 10)).hasSize(1);
    }

    private FileCronService newService(Clock clock, CronEventListener listener) {
        return new FileCronService(props, jobStore, new FileRunLog(new ObjectMapper(), 2_000_000, 2_000),
                sender, (skillId, jobId) -> skills.get(skillId + "/" + jobId), listener, clock);
    }

    private static CronJobCreate everyMinute(String text) {
        return CronJobCreate.builder()
                .name(text)
                .schedule(Schedules.every(Duration.ofMinutes(1)))
                .message(42L, text.trim(), "bot")
                .build();
    }

    private static CronJobCreate skillJob(String skillId, String jobId) {
        return CronJobCreate.builder()
                .name(skillId + ": " + jobId)
                .schedule(Schedules.every(Duration.ofHours(1)))
                .skillJob(skillId, jobId)
                .build();
    }

    private static boolean waitUntil(long timeout, TimeUnit unit, BooleanSupplier condition) throws InterruptedException {
        long deadline = System.nanoTime() + unit.toNanos(timeout);
        while (System.nanoTime() < deadline) {
            if (condition.getAsBoolean()) {
                return true;
            }
            Thread.sleep(100);
        }
        return false;
    }
}
