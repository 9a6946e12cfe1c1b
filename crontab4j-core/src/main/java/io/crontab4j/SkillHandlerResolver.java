package io.crontab4j;

/**
 * Resolves the task behind a {@link io.crontab4j.core.CronPayload.SkillJob} payload.
 */
@FunctionalInterface
public interface SkillHandlerResolver {

    /**
     * @return the task to run, or {@code null} when no handler is registered. A missing handler
     * marks the run as skipped rather than failed.
     */
    SkillTask resolve(String skillId, String jobId);

    static SkillHandlerResolver none() {
        return (skillId, jobId) -> null;
    }
}
