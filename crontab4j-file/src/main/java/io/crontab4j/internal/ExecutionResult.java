package io.crontab4j.internal;

import io.crontab4j.core.RunStatus;

import java.time.Instant;

/**
 * Outcome of one payload execution.
 */
public record ExecutionResult(String jobId, RunStatus status, String error, String output,
                              Instant startedAt, Instant endedAt) {

    public long durationMs() {
        return Math.max(0, endedAt.toEpochMilli() - startedAt.toEpochMilli());
    }
}
