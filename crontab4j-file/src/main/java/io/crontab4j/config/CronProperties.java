package io.crontab4j.config;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Runtime configuration for the cron service.
 */
@ConfigurationProperties(prefix = "crontab")
public class CronProperties {
    private boolean enabled = true;
    private String storePath = "data/cron"; // directory holding jobs.json and runs/
    private Duration maxTimerDelay = Duration.ofSeconds(60);
    private Duration jobTimeout = Duration.ofMinutes(10);
    private Duration stuckRunThreshold = Duration.ofHours(2);
    private List<Duration> errorBackoff = new ArrayList<>(List.of(
            Duration.ofSeconds(30),
            Duration.ofMinutes(1),
            Duration.ofMinutes(5),
            Duration.ofMinutes(15),
            Duration.ofMinutes(60)));
    private long runLogMaxBytes = 2_000_000L;
    private int runLogKeepLines = 2_000;

    /**
     * Fail fast on values the scheduler cannot work with.
     */
    public void validate() {
        requirePositive(maxTimerDelay, "crontab.maxTimerDelay");
        requirePositive(jobTimeout, "crontab.jobTimeout");
        requirePositive(stuckRunThreshold, "crontab.stuckRunThreshold");
        if (storePath == null || storePath.isBlank()) {
            throw new IllegalArgumentException("crontab.storePath must not be blank");
        }
        if (errorBackoff == null || errorBackoff.isEmpty()) {
            throw new IllegalArgumentException("crontab.errorBackoff must not be empty");
        }
        Duration previous = Duration.ZERO;
        for (Duration step : errorBackoff) {
            requirePositive(step, "crontab.errorBackoff");
            if (step.compareTo(previous) < 0) {
                throw new IllegalArgumentException("crontab.errorBackoff must be non-decreasing");
            }
            previous = step;
        }
        if (runLogMaxBytes <= 0) {
            throw new IllegalArgumentException("crontab.runLogMaxBytes must be positive");
        }
        if (runLogKeepLines <= 0) {
            throw new IllegalArgumentException("crontab.runLogKeepLines must be positive");
        }
    }

    private static void requirePositive(Duration value, String name) {
        Objects.requireNonNull(value, name + " must not be null");
        if (value.isZero() || value.isNegative()) {
            throw new IllegalArgumentException(name + " must be a positive duration");
        }
    }

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public String getStorePath() {
        return storePath;
    }

    public void setStorePath(String storePath) {
        this.storePath = storePath;
    }

    public Duration getMaxTimerDelay() {
        return maxTimerDelay;
    }

    public void setMaxTimerDelay(Duration maxTimerDelay) {
        this.maxTimerDelay = maxTimerDelay;
    }

    public Duration getJobTimeout() {
        return jobTimeout;
    }

    public void setJobTimeout(Duration jobTimeout) {
        this.jobTimeout = jobTimeout;
    }

    public Duration getStuckRunThreshold() {
        return stuckRunThreshold;
    }

    public void setStuckRunThreshold(Duration stuckRunThreshold) {
        this.stuckRunThreshold = stuckRunThreshold;
    }

    public List<Duration> getErrorBackoff() {
        return errorBackoff;
    }

    public void setErrorBackoff(List<Duration> errorBackoff) {
        this.errorBackoff = errorBackoff;
    }

    public long getRunLogMaxBytes() {
        return runLogMaxBytes;
    }

    public void setRunLogMaxBytes(long runLogMaxBytes) {
        this.runLogMaxBytes = runLogMaxBytes;
    }

    public int getRunLogKeepLines() {
        return runLogKeepLines;
    }

    public void setRunLogKeepLines(int runLogKeepLines) {
        this.runLogKeepLines = runLogKeepLines;
    }
}
