package io.crontab4j.internal.file;

import io.crontab4j.CronEventListener;
import io.crontab4j.CronService;
import io.crontab4j.MessageSender;
import io.crontab4j.SkillHandlerResolver;
import io.crontab4j.config.CronProperties;
import io.crontab4j.core.CronEvent;
import io.crontab4j.core.CronJob;
import io.crontab4j.core.CronJobCreate;
import io.crontab4j.core.CronJobPatch;
import io.crontab4j.core.CronStatus;
import io.crontab4j.core.CronStoreFile;
import io.crontab4j.core.RemoveResult;
import io.crontab4j.core.RunLogEntry;
import io.crontab4j.core.RunMode;
import io.crontab4j.core.RunResult;
import io.crontab4j.internal.CriticalSection;
import io.crontab4j.internal.ExecutionResult;
import io.crontab4j.internal.JobExecutor;
import io.crontab4j.internal.Jobs;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Collectors;

/**
 * File-backed {@link CronService}.
 *
 * <p>Every store access is funnelled through one {@link CriticalSection}. Job payloads run on a
 * worker pool; during a tick they run outside the lock.
 *
 * <p>Typical usage:
 * <pre>{@code
 * service.start();
 *
 * service.add(CronJobCreate.builder()
 *         .name("standup reminder")
 *         .schedule(Schedules.cron("0 9 * * 1-5", "Europe/Madrid"))
 *         .message(chatId, "Standup in 5 minutes", "main-bot")
 *         .build());
 *
 * service.run(jobId, RunMode.FORCE);
 * service.stop();
 * }</pre>
 */
public class FileCronService implements CronService, AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(FileCronService.class);

    private final CronProperties props;
    private final FileJobStore jobStore;
    private final FileRunLog runLog;
    private final Clock clock;

    private final CriticalSection lock = new CriticalSection("crontab.lock");
    private final JobExecutor executor;
    private final CronTimer timer;

    private final AtomicBoolean started = new AtomicBoolean(false);
    private final Set<String> manualRuns = ConcurrentHashMap.newKeySet();

    public FileCronService(CronProperties props,
                           FileJobStore jobStore,
                           FileRunLog runLog,
                           MessageSender messageSender,
                           SkillHandlerResolver skillResolver,
                           CronEventListener listener,
                           Clock clock) {
        this.props = Objects.requireNonNull(props, "props must not be null");
        props.validate();
        this.jobStore = Objects.requireNonNull(jobStore, "jobStore must not be null");
        this.runLog = Objects.requireNonNull(runLog, "runLog must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.executor = new JobExecutor(messageSender, skillResolver, props.getJobTimeout(), this::nowInstant);
        this.timer = new CronTimer(props, jobStore, runLog, lock, executor,
                Objects.requireNonNull(listener, "listener must not be null"),
                this::nowInstant, started::get);
    }

    /**
     * Load the store, clear leftover running markers and arm the timer. Idempotent.
     */
    @Override
    public void start() {
        if (!props.isEnabled()) {
            log.info("cron disabled; scheduler not started storePath={}", jobStore.storeDir());
            return;
        }
        if (!started.compareAndSet(false, true)) {
            return;
        }
        try {
            lock.run(() -> {
                CronStoreFile store = jobStore.load(true);
                for (CronJob job : store.getJobs()) {
                    if (job.getState().getRunningAt() != null) {
                        log.warn("cron clearing stale running marker on startup id={} runningAt={}",
                                job.getId(), job.getState().getRunningAt());
                        job.getState().setRunningAt(null);
                    }
                }
                Jobs.recomputeNextRuns(store, nowInstant(), props.getStuckRunThreshold());
                jobStore.save();
                timer.armLocked();
                log.info("cron started storePath={} jobs={} nextWakeAt={}",
                        jobStore.storeDir(), store.getJobs().size(), Jobs.nextWakeAt(store));
            });
        } catch (RuntimeException e) {
            started.set(false);
            throw e;
        }
    }

    /**
     * Stop the timer. API calls keep working. Idempotent.
     */
    @Override
    public void stop() {
        if (!started.compareAndSet(true, false)) {
            return;
        }
        lock.run(timer::cancelLocked);
        log.info("cron stopped");
    }

    @Override
    public List<CronJob> list(boolean includeDisabled) {
        return lock.call(() -> {
            CronStoreFile store = loadAndRecompute();
            return store.getJobs().stream()
                    .filter(j -> includeDisabled || j.isEnabled())
                    .sorted(Comparator.comparingLong(FileCronService::sortKey))
                    .map(CronJob::copy)
                    .collect(Collectors.toList());
        });
    }

    // absent next run sorts as epoch 0, ahead of scheduled jobs
    private static long sortKey(CronJob job) {
        Instant next = job.getState().getNextRunAt();
        return next == null ? 0L : next.toEpochMilli();
    }

    @Override
    public CronJob get(String id) {
        return lock.call(() -> Jobs.findOrThrow(jobStore.current(), id).copy());
    }

    @Override
    public CronJob add(CronJobCreate create) {
        return lock.call(() -> {
            CronStoreFile store = jobStore.current();
            Instant now = nowInstant();
            CronJob job = Jobs.createJob(create, now, UUID.randomUUID().toString());
            store.getJobs().add(job);
            Jobs.recomputeNextRuns(store, now, props.getStuckRunThreshold());
            jobStore.save();
            timer.armLocked();
            log.info("cron job added id={} name={} nextRunAt={}", job.getId(), job.getName(), job.getState().getNextRunAt());
            timer.emit(CronEvent.added(job.getId(), job.getState().getNextRunAt()));
            return job.copy();
        });
    }

    @Override
    public CronJob update(String id, CronJobPatch patch) {
        return lock.call(() -> {
            CronStoreFile store = jobStore.current();
            CronJob job = Jobs.findOrThrow(store, id);
            Instant now = nowInstant();
            Jobs.applyPatch(job, patch, now);
            if (patch.touchesTiming()) {
                if (job.isEnabled()) {
                    job.getState().setNextRunAt(Jobs.computeJobNextRunAt(job, now));
                } else {
                    job.getState().setNextRunAt(null);
                    job.getState().setRunningAt(null);
                }
            }
            jobStore.save();
            timer.armLocked();
            log.info("cron job updated id={} enabled={} nextRunAt={}", id, job.isEnabled(), job.getState().getNextRunAt());
            timer.emit(CronEvent.updated(id, job.getState().getNextRunAt()));
            return job.copy();
        });
    }

    @Override
    public RemoveResult remove(String id) {
        return lock.call(() -> {
            CronStoreFile store = jobStore.current();
            boolean removed = store.getJobs().removeIf(j -> j.getId().equals(id));
            jobStore.save();
            timer.armLocked();
            if (!removed) {
                return RemoveResult.notFound();
            }
            log.info("cron job removed id={}", id);
            timer.emit(CronEvent.removed(id));
            return RemoveResult.removedResult();
        });
    }

    /**
     * Execute a job right away, holding the lock for the whole run. A second manual run of the same
     * job while one is in flight returns {@code already-running} without waiting.
     */
    @Override
    public RunResult run(String id, RunMode mode) {
        Objects.requireNonNull(mode, "mode must not be null");
        if (!manualRuns.add(id)) {
            return RunResult.notRun(RunResult.ALREADY_RUNNING);
        }
        try {
            return lock.call(() -> {
                CronStoreFile store = jobStore.current();
                CronJob job = Jobs.findOrThrow(store, id);
                Instant now = nowInstant();
                if (job.getState().getRunningAt() != null) {
                    return RunResult.notRun(RunResult.ALREADY_RUNNING);
                }
                if (!Jobs.isDue(job, now, mode == RunMode.FORCE)) {
                    return RunResult.notRun(RunResult.NOT_DUE);
                }

                job.getState().setRunningAt(now);
                job.getState().setLastError(null);
                jobStore.save();

                log.info("cron manual run id={} mode={}", id, mode);
                ExecutionResult result = timer.execute(job.copy());
                timer.settle(store, result);

                Jobs.recomputeNextRuns(store, nowInstant(), props.getStuckRunThreshold());
                jobStore.save();
                timer.armLocked();
                return RunResult.ranResult();
            });
        } finally {
            manualRuns.remove(id);
        }
    }

    @Override
    public CronStatus status() {
        return lock.call(() -> {
            CronStoreFile store = loadAndRecompute();
            return new CronStatus(
                    props.isEnabled(),
                    jobStore.storeDir().toString(),
                    store.getJobs().size(),
                    props.isEnabled() ? Jobs.nextWakeAt(store) : null);
        });
    }

    @Override
    public List<RunLogEntry> runs(String jobId, int limit) {
        return runLog.read(FileRunLog.pathFor(jobStore.storeDir(), jobId), limit, jobId);
    }

    @Override
    public void clearRuns(String jobId) {
        runLog.clear(FileRunLog.pathFor(jobStore.storeDir(), jobId));
    }

    @Override
    public int deleteRuns(String jobId, Collection<Long> timestamps) {
        return runLog.deleteEntries(FileRunLog.pathFor(jobStore.storeDir(), jobId), timestamps);
    }

    /**
     * Stop the timer and release all threads. The service cannot be used afterwards.
     */
    @Override
    public void close() {
        stop();
        timer.close();
        executor.close();
        lock.close();
    }

    /**
     * Run one scheduling pass now.
     */
    void onTimer() {
        timer.onTimer();
    }

    boolean isStarted() {
        return started.get();
    }

    private CronStoreFile loadAndRecompute() {
        CronStoreFile store = jobStore.current();
        if (Jobs.recomputeNextRuns(store, nowInstant(), props.getStuckRunThreshold())) {
            jobStore.save();
        }
        return store;
    }

    /**
     * Utility: current scheduler time source (useful for tests).
     */
    protected Instant nowInstant() {
        return clock.instant();
    }
}
