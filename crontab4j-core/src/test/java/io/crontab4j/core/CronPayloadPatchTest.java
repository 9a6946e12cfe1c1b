package io.crontab4j.core;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CronPayloadPatchTest {

    private static final CronPayload.Message MESSAGE = new CronPayload.Message("drink water", 42L, "bot-a");

    @Test
    void sameKindPatchShouldMergeFieldByField() {
        CronPayload merged = new CronPayloadPatch.Message("stretch", null, null).mergeInto(MESSAGE);

        assertThat(merged).isEqualTo(new CronPayload.Message("stretch", 42L, "bot-a"));
    }

    @Test
    void kindChangeShouldReplacePayloadWholesale() {
        CronPayload replaced = new CronPayloadPatch.SkillJob("reflection", "daily").mergeInto(MESSAGE);

        assertThat(replaced).isEqualTo(new CronPayload.SkillJob("reflection", "daily"));
    }

    @Test
    void kindChangeWithMissingFieldsShouldFail() {
        assertThatThrownBy(() -> new CronPayloadPatch.SkillJob("reflection", null).mergeInto(MESSAGE))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("jobId");

        CronPayload skill = new CronPayload.SkillJob("reflection", "daily");
        assertThatThrownBy(() -> new CronPayloadPatch.Message("hi", null, "bot-a").mergeInto(skill))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("chatId");
    }

    @Test
    void validateShouldRequireMessageFields() {
        assertThatThrownBy(() -> CronPayload.validate(new CronPayload.Message(" ", 1L, "bot")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("text");
        assertThatThrownBy(() -> CronPayload.validate(null))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
