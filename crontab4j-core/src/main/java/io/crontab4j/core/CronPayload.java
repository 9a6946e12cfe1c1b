package io.crontab4j.core;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * What a job does when it fires. Resolved against external collaborators at execution time.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "kind")
@JsonSubTypes({
        @JsonSubTypes.Type(value = CronPayload.Message.class, name = "message"),
        @JsonSubTypes.Type(value = CronPayload.SkillJob.class, name = "skillJob")
})
public sealed interface CronPayload permits CronPayload.Message, CronPayload.SkillJob {

    record Message(String text, long chatId, String botId) implements CronPayload {
    }

    record SkillJob(String skillId, String jobId) implements CronPayload {
    }

    /**
     * Rejects payloads missing a required field.
     *
     * @throws IllegalArgumentException naming the first missing field
     */
    static void validate(CronPayload payload) {
        if (payload == null) {
            throw new IllegalArgumentException("cron: payload is required");
        }
        if (payload instanceof Message m) {
            if (isBlank(m.text())) {
                throw new IllegalArgumentException("cron: message payload requires text");
            }
            if (isBlank(m.botId())) {
                throw new IllegalArgumentException("cron: message payload requires botId");
            }
        } else if (payload instanceof SkillJob s) {
            if (isBlank(s.skillId())) {
                throw new IllegalArgumentException("cron: skillJob payload requires skillId");
            }
            if (isBlank(s.jobId())) {
                throw new IllegalArgumentException("cron: skillJob payload requires jobId");
            }
        }
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
