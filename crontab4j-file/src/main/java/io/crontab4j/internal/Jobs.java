package io.crontab4j.internal;

import io.crontab4j.core.CronJob;
import io.crontab4j.core.CronJobCreate;
import io.crontab4j.core.CronJobNotFoundException;
import io.crontab4j.core.CronJobPatch;
import io.crontab4j.core.CronPayload;
import io.crontab4j.core.CronSchedule;
import io.crontab4j.core.CronStoreFile;
import io.crontab4j.core.JobState;
import io.crontab4j.core.RunStatus;
import io.crontab4j.utils.ScheduleEvaluator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Job-level scheduling rules shared by the timer and the service.
 *
 * <p>All methods mutate the jobs they are given and must be called inside the critical section.
 */
public final class Jobs {
    private static final Logger log = LoggerFactory.getLogger(Jobs.class);

    static final String UNNAMED_JOB = "Unnamed job";

    private Jobs() {
    }

    /**
     * Next run time of a job, taking its state into account. A one-shot job that has not yet run
     * successfully keeps its original instant even when it lies in the past.
     */
    public static Instant computeJobNextRunAt(CronJob job, Instant now) {
        if (!job.isEnabled()) {
            return null;
        }
        CronSchedule schedule = job.getSchedule();
        if (schedule instanceof CronSchedule.Every every) {
            Instant anchor = every.anchor() != null ? every.anchor() : job.getCreatedAt();
            return ScheduleEvaluator.nextRunAt(every.withAnchor(anchor), now);
        }
        if (schedule instanceof CronSchedule.At at) {
            JobState state = job.getState();
            if (state.getLastStatus() == RunStatus.OK && state.getLastRunAt() != null) {
                return null;
            }
            return at.at();
        }
        return ScheduleEvaluator.nextRunAt(schedule, now);
    }

    /**
     * Self-healing sweep. Clears state of disabled jobs, drops stuck running markers and fills in
     * next run times that are missing or already due. Times pushed out by backoff are kept.
     *
     * @return whether any job changed
     */
    public static boolean recomputeNextRuns(CronStoreFile store, Instant now, Duration stuckThreshold) {
        boolean changed = false;
        for (CronJob job : store.getJobs()) {
            if (job.getState() == null) {
                job.setState(new JobState());
                changed = true;
            }
            JobState state = job.getState();
            if (!job.isEnabled()) {
                if (state.getNextRunAt() != null) {
                    state.setNextRunAt(null);
                    changed = true;
                }
                if (state.getRunningAt() != null) {
                    state.setRunningAt(null);
                    changed = true;
                }
                continue;
            }
            Instant runningAt = state.getRunningAt();
            if (runningAt != null && Duration.between(runningAt, now).compareTo(stuckThreshold) > 0) {
                log.warn("cron clearing stuck running marker id={} runningAt={}", job.getId(), runningAt);
                state.setRunningAt(null);
                changed = true;
            }
            Instant next = state.getNextRunAt();
            if (next == null || !now.isBefore(next)) {
                Instant recomputed = computeJobNextRunAt(job, now);
                if (!Objects.equals(next, recomputed)) {
                    state.setNextRunAt(recomputed);
                    changed = true;
                }
            }
        }
        return changed;
    }

    /**
     * Earliest next run time over enabled jobs, or {@code null} when nothing is scheduled.
     */
    public static Instant nextWakeAt(CronStoreFile store) {
        Instant min = null;
        for (CronJob job : store.getJobs()) {
            Instant next = job.getState().getNextRunAt();
            if (job.isEnabled() && next != null && (min == null || next.isBefore(min))) {
                min = next;
            }
        }
        return min;
    }

    /**
     * A reserved job is never due. A forced check ignores {@code enabled} and {@code nextRunAt}.
     */
    public static boolean isDue(CronJob job, Instant now, boolean forced) {
        if (job.getState().getRunningAt() != null) {
            return false;
        }
        if (forced) {
            return true;
        }
        Instant next = job.getState().getNextRunAt();
        return job.isEnabled() && next != null && !now.isBefore(next);
    }

    public static CronJob findOrThrow(CronStoreFile store, String id) {
        for (CronJob job : store.getJobs()) {
            if (job.getId().equals(id)) {
                return job;
            }
        }
        throw new CronJobNotFoundException(id);
    }

    /**
     * Build a new job from validated input.
     *
     * @throws IllegalArgumentException if the schedule or payload is malformed
     */
    public static CronJob createJob(CronJobCreate create, Instant now, String id) {
        Objects.requireNonNull(create, "create must not be null");
        ScheduleEvaluator.validate(create.schedule());
        CronPayload.validate(create.payload());

        CronSchedule schedule = create.schedule();
        if (schedule instanceof CronSchedule.Every every && every.anchor() == null) {
            schedule = every.withAnchor(now);
        }

        CronJob job = new CronJob();
        job.setId(id);
        job.setName(trimToNull(create.name()) != null ? create.name().trim() : UNNAMED_JOB);
        job.setDescription(trimToNull(create.description()));
        job.setEnabled(create.enabled() == null || create.enabled());
        if (create.deleteAfterRun() != null) {
            job.setDeleteAfterRun(create.deleteAfterRun());
        } else if (schedule instanceof CronSchedule.At) {
            job.setDeleteAfterRun(Boolean.TRUE);
        }
        job.setCreatedAt(now);
        job.setUpdatedAt(now);
        job.setSchedule(schedule);
        job.setPayload(create.payload());
        job.setState(new JobState());
        job.getState().setNextRunAt(computeJobNextRunAt(job, now));
        return job;
    }

    /**
     * Apply a partial update. Timing is not recomputed here.
     *
     * @throws IllegalArgumentException if the new schedule or payload is malformed
     */
    public static void applyPatch(CronJob job, CronJobPatch patch, Instant now) {
        Objects.requireNonNull(patch, "patch must not be null");

        // validate before touching the job so a rejected patch leaves it unchanged
        if (patch.schedule() != null) {
            ScheduleEvaluator.validate(patch.schedule());
        }
        CronPayload payload = job.getPayload();
        if (patch.payload() != null) {
            payload = patch.payload().mergeInto(job.getPayload());
            CronPayload.validate(payload);
        }

        if (patch.name() != null) {
            String name = patch.name().trim();
            if (!name.isEmpty()) {
                job.setName(name);
            }
        }
        if (patch.hasDescription()) {
            job.setDescription(trimToNull(patch.description()));
        }
        if (patch.enabled() != null) {
            job.setEnabled(patch.enabled());
        }
        if (patch.deleteAfterRun() != null) {
            job.setDeleteAfterRun(patch.deleteAfterRun());
        }
        if (patch.schedule() != null) {
            job.setSchedule(patch.schedule());
        }
        job.setPayload(payload);

        if (job.getSchedule() instanceof CronSchedule.Every every && every.anchor() == null) {
            job.setSchedule(every.withAnchor(job.getCreatedAt() != null ? job.getCreatedAt() : now));
        }
        job.setUpdatedAt(now);
    }

    /**
     * Backoff for the n-th consecutive error. The last table entry repeats.
     */
    public static Duration errorBackoff(List<Duration> table, int consecutiveErrors) {
        int idx = Math.min(consecutiveErrors - 1, table.size() - 1);
        return table.get(Math.max(0, idx));
    }

    /**
     * Fold an execution result into the job's state and derive its next run time.
     *
     * @return {@code true} when the job is a consumed one-shot and must be removed from the store
     */
    public static boolean applyJobResult(CronJob job, ExecutionResult result, List<Duration> backoffTable) {
        JobState state = job.getState();
        state.setRunningAt(null);
        state.setLastRunAt(result.startedAt());
        state.setLastStatus(result.status());
        state.setLastDurationMs(result.durationMs());
        state.setLastError(result.error());
        job.setUpdatedAt(result.endedAt());

        if (result.status() == RunStatus.ERROR) {
            state.setConsecutiveErrors(state.getConsecutiveErrors() + 1);
        } else {
            state.setConsecutiveErrors(0);
        }

        boolean oneShot = job.getSchedule() instanceof CronSchedule.At;
        boolean shouldDelete = oneShot && result.status() == RunStatus.OK && job.deletesAfterRun();
        if (shouldDelete) {
            return true;
        }

        if (oneShot) {
            job.setEnabled(false);
            state.setNextRunAt(null);
            if (result.status() == RunStatus.ERROR) {
                log.warn("cron disabling one-shot job after error id={} name={} consecutiveErrors={} error={}",
                        job.getId(), job.getName(), state.getConsecutiveErrors(), result.error());
            }
        } else if (result.status() == RunStatus.ERROR && job.isEnabled()) {
            Duration backoff = errorBackoff(backoffTable, state.getConsecutiveErrors());
            Instant backoffNext = result.endedAt().plus(backoff);
            Instant normalNext = computeJobNextRunAt(job, result.endedAt());
            state.setNextRunAt(normalNext != null && normalNext.isAfter(backoffNext) ? normalNext : backoffNext);
            log.info("cron applying error backoff id={} consecutiveErrors={} backoff={} nextRunAt={}",
                    job.getId(), state.getConsecutiveErrors(), backoff, state.getNextRunAt());
        } else if (job.isEnabled()) {
            state.setNextRunAt(computeJobNextRunAt(job, result.endedAt()));
        } else {
            state.setNextRunAt(null);
        }
        return false;
    }

    private static String trimToNull(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }
}
