package io.crontab4j.core;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import java.time.Instant;

/**
 * When a job fires. Persisted with a {@code kind} discriminator.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "kind")
@JsonSubTypes({
        @JsonSubTypes.Type(value = CronSchedule.At.class, name = "at"),
        @JsonSubTypes.Type(value = CronSchedule.Every.class, name = "every"),
        @JsonSubTypes.Type(value = CronSchedule.Cron.class, name = "cron")
})
@JsonInclude(JsonInclude.Include.NON_NULL)
public sealed interface CronSchedule permits CronSchedule.At, CronSchedule.Every, CronSchedule.Cron {

    /**
     * Fires once at an absolute instant.
     */
    record At(Instant at) implements CronSchedule {
    }

    /**
     * Fires on a fixed grid of {@code everyMs} milliseconds starting at {@code anchor}.
     * The anchor is resolved once, at creation time, and never recomputed.
     */
    record Every(long everyMs, Instant anchor) implements CronSchedule {
        public Every withAnchor(Instant anchor) {
            return new Every(everyMs, anchor);
        }
    }

    /**
     * Cron expression (5-field, or 6-field with leading seconds).
     * {@code tz} is an IANA zone id; null means system default.
     */
    record Cron(String expr, String tz) implements CronSchedule {
    }
}
