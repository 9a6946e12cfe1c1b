package io.crontab4j.core;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * One line of a job's run log. Times are epoch milliseconds.
 *
 * ts          : when the run finished; also the key used for deleting entries
 * runAtMs     : when the run started
 * nextRunAtMs : next run time computed after this run
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record RunLogEntry(
        long ts,
        String jobId,
        String action,
        RunStatus status,
        String error,
        String output,
        Long runAtMs,
        Long durationMs,
        Long nextRunAtMs
) {
    public static final String FINISHED = "finished";

    public static RunLogEntry finished(long ts, String jobId, RunStatus status, String error, String output,
                                       Long runAtMs, Long durationMs, Long nextRunAtMs) {
        return new RunLogEntry(ts, jobId, FINISHED, status, error, output, runAtMs, durationMs, nextRunAtMs);
    }
}
