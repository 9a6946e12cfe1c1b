package io.crontab4j.core;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;

/**
 * Lifecycle notification for dashboards and logs. Fields that do not apply to the action are null.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record CronEvent(
        String jobId,
        CronEventAction action,
        Instant runAt,
        Long durationMs,
        RunStatus status,
        String error,
        Instant nextRunAt
) {
    public static CronEvent added(String jobId, Instant nextRunAt) {
        return new CronEvent(jobId, CronEventAction.ADDED, null, null, null, null, nextRunAt);
    }

    public static CronEvent updated(String jobId, Instant nextRunAt) {
        return new CronEvent(jobId, CronEventAction.UPDATED, null, null, null, null, nextRunAt);
    }

    public static CronEvent removed(String jobId) {
        return new CronEvent(jobId, CronEventAction.REMOVED, null, null, null, null, null);
    }

    public static CronEvent started(String jobId, Instant runAt) {
        return new CronEvent(jobId, CronEventAction.STARTED, runAt, null, null, null, null);
    }

    public static CronEvent finished(String jobId, Instant runAt, Long durationMs, RunStatus status,
                                     String error, Instant nextRunAt) {
        return new CronEvent(jobId, CronEventAction.FINISHED, runAt, durationMs, status, error, nextRunAt);
    }
}
