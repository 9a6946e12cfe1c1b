package io.crontab4j.core;

import java.time.Instant;

/**
 * Snapshot of the scheduler. {@code nextWakeAt} is null when disabled or when no enabled job
 * has a next run time.
 */
public record CronStatus(
        boolean enabled,
        String storePath,
        int jobCount,
        Instant nextWakeAt
) {
}
