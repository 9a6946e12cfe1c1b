package io.crontab4j.internal.file;

import io.crontab4j.CronEventListener;
import io.crontab4j.config.CronProperties;
import io.crontab4j.core.CronEvent;
import io.crontab4j.core.CronJob;
import io.crontab4j.core.CronStoreFile;
import io.crontab4j.core.RunLogEntry;
import io.crontab4j.internal.CriticalSection;
import io.crontab4j.internal.ExecutionResult;
import io.crontab4j.internal.JobExecutor;
import io.crontab4j.internal.Jobs;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.BooleanSupplier;
import java.util.function.Supplier;

/**
 * Wake-up timer and tick loop.
 *
 * <p>A tick selects and reserves due jobs under the lock, runs them one by one outside the lock,
 * then settles the results under the lock again. At most one wake-up is pending at any time and
 * it is only touched from the lock thread.
 */
class CronTimer implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(CronTimer.class);

    private final CronProperties props;
    private final FileJobStore jobStore;
    private final FileRunLog runLog;
    private final CriticalSection lock;
    private final JobExecutor executor;
    private final CronEventListener listener;
    private final Supplier<Instant> clock;
    private final BooleanSupplier active;

    private final ScheduledExecutorService scheduler;
    private final AtomicBoolean ticking = new AtomicBoolean(false);
    private ScheduledFuture<?> pending;

    CronTimer(CronProperties props, FileJobStore jobStore, FileRunLog runLog, CriticalSection lock,
              JobExecutor executor, CronEventListener listener, Supplier<Instant> clock, BooleanSupplier active) {
        this.props = props;
        this.jobStore = jobStore;
        this.runLog = runLog;
        this.lock = lock;
        this.executor = executor;
        this.listener = listener;
        this.clock = clock;
        this.active = active;
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r);
            t.setName("crontab.timer");
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * (Re)arm the single wake-up for the earliest due job. Must run on the lock thread.
     */
    void armLocked() {
        cancelLocked();
        if (!active.getAsBoolean() || !props.isEnabled()) {
            return;
        }
        Instant nextAt = Jobs.nextWakeAt(jobStore.current());
        if (nextAt == null) {
            return;
        }
        long delay = Math.max(0, Duration.between(clock.get(), nextAt).toMillis());
        long maxDelay = props.getMaxTimerDelay().toMillis();
        long clamped = Math.min(delay, maxDelay);
        pending = scheduler.schedule(this::fire, clamped, TimeUnit.MILLISECONDS);
        log.debug("cron timer armed nextAt={} delayMs={} clamped={}", nextAt, clamped, delay > maxDelay);
    }

    void cancelLocked() {
        if (pending != null) {
            pending.cancel(false);
            pending = null;
        }
    }

    private void fire() {
        try {
            onTimer();
        } catch (RuntimeException e) {
            log.error("cron timer tick failed msg={}", e.getMessage(), e);
        }
    }

    /**
     * One scheduling pass. Overlapping calls return immediately.
     */
    void onTimer() {
        if (!ticking.compareAndSet(false, true)) {
            return;
        }
        try {
            List<CronJob> due = lock.call(this::reserveDueJobs);

            List<ExecutionResult> results = new ArrayList<>(due.size());
            for (CronJob job : due) {
                results.add(execute(job));
            }

            if (!results.isEmpty()) {
                lock.run(() -> {
                    CronStoreFile store = jobStore.load(true);
                    for (ExecutionResult result : results) {
                        settle(store, result);
                    }
                    Jobs.recomputeNextRuns(store, clock.get(), props.getStuckRunThreshold());
                    jobStore.save();
                });
            }
        } finally {
            ticking.set(false);
            rearm();
        }
    }

    private List<CronJob> reserveDueJobs() {
        CronStoreFile store = jobStore.load(true);
        Instant now = clock.get();
        List<CronJob> due = new ArrayList<>();
        for (CronJob job : store.getJobs()) {
            if (Jobs.isDue(job, now, false)) {
                due.add(job);
            }
        }
        if (due.isEmpty()) {
            if (Jobs.recomputeNextRuns(store, now, props.getStuckRunThreshold())) {
                jobStore.save();
            }
            return List.of();
        }
        List<CronJob> reserved = new ArrayList<>(due.size());
        for (CronJob job : due) {
            job.getState().setRunningAt(now);
            job.getState().setLastError(null);
            reserved.add(job.copy());
        }
        jobStore.save();
        log.debug("cron tick reserved jobs count={}", reserved.size());
        return reserved;
    }

    private void rearm() {
        try {
            lock.run(this::armLocked);
        } catch (RuntimeException e) {
            log.error("cron timer re-arm failed msg={}", e.getMessage(), e);
        }
    }

    /**
     * Execute one job payload, emitting {@code started}. Safe to call with or without the lock.
     */
    ExecutionResult execute(CronJob job) {
        Instant startedAt = clock.get();
        log.debug("cron job started id={} name={} at={}", job.getId(), job.getName(), startedAt);
        emit(CronEvent.started(job.getId(), startedAt));
        ExecutionResult result = executor.execute(job, startedAt);
        log.debug("cron job finished id={} status={} durationMs={}", job.getId(), result.status(), result.durationMs());
        return result;
    }

    /**
     * Apply a result to the stored job, emit {@code finished}, append the run log and remove a
     * consumed one-shot. Must run on the lock thread; does not persist.
     */
    void settle(CronStoreFile store, ExecutionResult result) {
        CronJob job = null;
        for (CronJob candidate : store.getJobs()) {
            if (candidate.getId().equals(result.jobId())) {
                job = candidate;
                break;
            }
        }
        if (job == null) {
            log.debug("cron job removed while running id={}", result.jobId());
            return;
        }

        boolean shouldDelete = Jobs.applyJobResult(job, result, props.getErrorBackoff());
        Instant nextRunAt = job.getState().getNextRunAt();
        emit(CronEvent.finished(job.getId(), result.startedAt(), result.durationMs(), result.status(),
                result.error(), nextRunAt));

        try {
            runLog.append(FileRunLog.pathFor(jobStore.storeDir(), job.getId()), RunLogEntry.finished(
                    result.endedAt().toEpochMilli(),
                    job.getId(),
                    result.status(),
                    result.error(),
                    result.output(),
                    result.startedAt().toEpochMilli(),
                    result.durationMs(),
                    nextRunAt != null ? nextRunAt.toEpochMilli() : null));
        } catch (RuntimeException e) {
            log.warn("cron run log append failed id={} msg={}", job.getId(), e.getMessage());
        }

        if (shouldDelete) {
            String id = job.getId();
            store.getJobs().removeIf(j -> j.getId().equals(id));
            log.info("cron one-shot job consumed id={} name={}", id, job.getName());
            emit(CronEvent.removed(id));
        }
    }

    void emit(CronEvent event) {
        try {
            listener.onEvent(event);
        } catch (RuntimeException e) {
            log.warn("cron event listener failed id={} action={} msg={}", event.jobId(), event.action(), e.getMessage());
        }
    }

    @Override
    public void close() {
        scheduler.shutdownNow();
    }
}
