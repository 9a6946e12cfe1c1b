package io.crontab4j.core;

import java.util.Objects;

/**
 * Input for creating a job.
 *
 * <p>Defaults applied on creation:
 * <ul>
 *   <li>blank name: "Unnamed job"</li>
 *   <li>enabled: true</li>
 *   <li>deleteAfterRun: true for {@link CronSchedule.At}, unset otherwise</li>
 *   <li>{@link CronSchedule.Every} without anchor: anchored at creation time</li>
 * </ul>
 */
public record CronJobCreate(
        String name,
        String description,
        Boolean enabled,
        Boolean deleteAfterRun,
        CronSchedule schedule,
        CronPayload payload
) {

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String name;
        private String description;
        private Boolean enabled;
        private Boolean deleteAfterRun;
        private CronSchedule schedule;
        private CronPayload payload;

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder enabled(boolean enabled) {
            this.enabled = enabled;
            return this;
        }

        public Builder deleteAfterRun(boolean deleteAfterRun) {
            this.deleteAfterRun = deleteAfterRun;
            return this;
        }

        public Builder schedule(CronSchedule schedule) {
            this.schedule = schedule;
            return this;
        }

        public Builder payload(CronPayload payload) {
            this.payload = payload;
            return this;
        }

        public Builder message(long chatId, String text, String botId) {
            return payload(new CronPayload.Message(text, chatId, botId));
        }

        public Builder skillJob(String skillId, String jobId) {
            return payload(new CronPayload.SkillJob(skillId, jobId));
        }

        public CronJobCreate build() {
            Objects.requireNonNull(schedule, "schedule must not be null");
            Objects.requireNonNull(payload, "payload must not be null");
            return new CronJobCreate(name, description, enabled, deleteAfterRun, schedule, payload);
        }
    }
}
