package io.crontab4j;

import io.crontab4j.core.CronJob;
import io.crontab4j.core.CronJobCreate;
import io.crontab4j.core.CronJobPatch;
import io.crontab4j.core.CronStatus;
import io.crontab4j.core.RemoveResult;
import io.crontab4j.core.RunLogEntry;
import io.crontab4j.core.RunMode;
import io.crontab4j.core.RunResult;

import java.util.Collection;
import java.util.List;

/**
 * Main scheduler API.
 *
 * <p>Supports three schedule kinds:
 * <ul>
 *   <li>One-shot jobs at an absolute {@link java.time.Instant}</li>
 *   <li>Fixed-interval jobs on a grid anchored at creation time</li>
 *   <li>Cron expressions evaluated in a timezone</li>
 * </ul>
 *
 * <p>Jobs returned from this API are detached copies. Mutating them has no effect on the store.
 */
public interface CronService {
    int DEFAULT_RUNS_LIMIT = 200;

    void start();

    void stop();

    List<CronJob> list(boolean includeDisabled);

    default List<CronJob> list() {
        return list(false);
    }

    /**
     * @throws io.crontab4j.core.CronJobNotFoundException if no job has this id
     */
    CronJob get(String id);

    /**
     * Validate, create and persist a job.
     *
     * @throws IllegalArgumentException if the schedule or payload is malformed
     */
    CronJob add(CronJobCreate create);

    /**
     * Apply a partial update. Next run time is re-derived only when the patch touches
     * {@code schedule} or {@code enabled}.
     *
     * @throws io.crontab4j.core.CronJobNotFoundException if no job has this id
     */
    CronJob update(String id, CronJobPatch patch);

    RemoveResult remove(String id);

    /**
     * Run a job now. {@link RunMode#DUE} only runs a job whose next run time has arrived;
     * {@link RunMode#FORCE} ignores the next run time but never overlaps an in-flight run.
     *
     * @throws io.crontab4j.core.CronJobNotFoundException if no job has this id
     */
    RunResult run(String id, RunMode mode);

    CronStatus status();

    /**
     * Most recent finished runs of a job, oldest first.
     *
     * @param limit clamped to [1, 5000]
     */
    List<RunLogEntry> runs(String jobId, int limit);

    default List<RunLogEntry> runs(String jobId) {
        return runs(jobId, DEFAULT_RUNS_LIMIT);
    }

    void clearRuns(String jobId);

    int deleteRuns(String jobId, Collection<Long> timestamps);
}
