package io.crontab4j.core;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;
import java.util.Objects;

/**
 * Scheduler-owned runtime state of a job.
 *
 * <p>{@code runningAt} doubles as the crash-recovery marker: it is set when a run is reserved and
 * cleared when the result is applied. A marker that outlives the stuck threshold is treated as an
 * abandoned reservation.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class JobState {

    private Instant nextRunAt;
    private Instant runningAt;
    private Instant lastRunAt;
    private RunStatus lastStatus;
    private String lastError;
    private Long lastDurationMs;
    private int consecutiveErrors;

    public JobState() {
    }

    public JobState copy() {
        JobState c = new JobState();
        c.nextRunAt = nextRunAt;
        c.runningAt = runningAt;
        c.lastRunAt = lastRunAt;
        c.lastStatus = lastStatus;
        c.lastError = lastError;
        c.lastDurationMs = lastDurationMs;
        c.consecutiveErrors = consecutiveErrors;
        return c;
    }

    public Instant getNextRunAt() {
        return nextRunAt;
    }

    public void setNextRunAt(Instant nextRunAt) {
        this.nextRunAt = nextRunAt;
    }

    public Instant getRunningAt() {
        return runningAt;
    }

    public void setRunningAt(Instant runningAt) {
        this.runningAt = runningAt;
    }

    public Instant getLastRunAt() {
        return lastRunAt;
    }

    public void setLastRunAt(Instant lastRunAt) {
        this.lastRunAt = lastRunAt;
    }

    public RunStatus getLastStatus() {
        return lastStatus;
    }

    public void setLastStatus(RunStatus lastStatus) {
        this.lastStatus = lastStatus;
    }

    public String getLastError() {
        return lastError;
    }

    public void setLastError(String lastError) {
        this.lastError = lastError;
    }

    public Long getLastDurationMs() {
        return lastDurationMs;
    }

    public void setLastDurationMs(Long lastDurationMs) {
        this.lastDurationMs = lastDurationMs;
    }

    public int getConsecutiveErrors() {
        return consecutiveErrors;
    }

    public void setConsecutiveErrors(int consecutiveErrors) {
        this.consecutiveErrors = Math.max(0, consecutiveErrors);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof JobState that)) return false;
        return consecutiveErrors == that.consecutiveErrors
                && Objects.equals(nextRunAt, that.nextRunAt)
                && Objects.equals(runningAt, that.runningAt)
                && Objects.equals(lastRunAt, that.lastRunAt)
                && lastStatus == that.lastStatus
                && Objects.equals(lastError, that.lastError)
                && Objects.equals(lastDurationMs, that.lastDurationMs);
    }

    @Override
    public int hashCode() {
        return Objects.hash(nextRunAt, runningAt, lastRunAt, lastStatus, lastError, lastDurationMs, consecutiveErrors);
    }

    @Override
    public String toString() {
        return "JobState{nextRunAt=" + nextRunAt
                + ", runningAt=" + runningAt
                + ", lastStatus=" + lastStatus
                + ", consecutiveErrors=" + consecutiveErrors + '}';
    }
}
