package io.crontab4j.core;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * Partial payload. A patch of the same kind as the existing payload merges field by field;
 * a patch of another kind replaces the payload and must then carry every required field.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "kind")
@JsonSubTypes({
        @JsonSubTypes.Type(value = CronPayloadPatch.Message.class, name = "message"),
        @JsonSubTypes.Type(value = CronPayloadPatch.SkillJob.class, name = "skillJob")
})
public sealed interface CronPayloadPatch permits CronPayloadPatch.Message, CronPayloadPatch.SkillJob {

    record Message(String text, Long chatId, String botId) implements CronPayloadPatch {
    }

    record SkillJob(String skillId, String jobId) implements CronPayloadPatch {
    }

    /**
     * Merge this patch into {@code existing}.
     *
     * @throws IllegalArgumentException when the kind changes and a required field is missing
     */
    default CronPayload mergeInto(CronPayload existing) {
        if (this instanceof Message m) {
            if (existing instanceof CronPayload.Message e) {
                return new CronPayload.Message(
                        m.text() != null ? m.text() : e.text(),
                        m.chatId() != null ? m.chatId() : e.chatId(),
                        m.botId() != null ? m.botId() : e.botId()
                );
            }
            if (m.text() == null || m.text().isEmpty()) {
                throw new IllegalArgumentException("cron: message payload requires text");
            }
            if (m.chatId() == null) {
                throw new IllegalArgumentException("cron: message payload requires chatId");
            }
            if (m.botId() == null || m.botId().isEmpty()) {
                throw new IllegalArgumentException("cron: message payload requires botId");
            }
            return new CronPayload.Message(m.text(), m.chatId(), m.botId());
        }

        SkillJob s = (SkillJob) this;
        if (existing instanceof CronPayload.SkillJob e) {
            return new CronPayload.SkillJob(
                    s.skillId() != null ? s.skillId() : e.skillId(),
                    s.jobId() != null ? s.jobId() : e.jobId()
            );
        }
        if (s.skillId() == null || s.skillId().isEmpty()) {
            throw new IllegalArgumentException("cron: skillJob payload requires skillId");
        }
        if (s.jobId() == null || s.jobId().isEmpty()) {
            throw new IllegalArgumentException("cron: skillJob payload requires jobId");
        }
        return new CronPayload.SkillJob(s.skillId(), s.jobId());
    }
}
