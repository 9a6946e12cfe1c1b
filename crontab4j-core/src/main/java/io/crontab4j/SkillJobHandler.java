package io.crontab4j;

/**
 * A skill-provided job that is registered with the scheduler on startup.
 */
public interface SkillJobHandler {
    String skillId();

    String jobId();

    /**
     * Schedule text: cron expression, human interval ("30 minutes") or ISO-8601 instant.
     */
    String schedule();

    /**
     * IANA time zone id for cron schedules; null means system default.
     */
    default String timezone() {
        return null;
    }

    String execute() throws Exception;
}
