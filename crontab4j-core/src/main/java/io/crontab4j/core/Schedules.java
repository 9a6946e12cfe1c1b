package io.crontab4j.core;

import io.crontab4j.utils.Durations;
import io.crontab4j.utils.ScheduleEvaluator;

import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Objects;

/**
 * Factories for {@link CronSchedule} values, including parsing of schedule text.
 */
public final class Schedules {

    private Schedules() {
    }

    public static CronSchedule at(Instant time) {
        Objects.requireNonNull(time, "time must not be null");
        return new CronSchedule.At(time);
    }

    /**
     * @param isoTime ISO-8601 instant, e.g. "2026-01-20T09:30:00Z"
     */
    public static CronSchedule at(String isoTime) {
        Objects.requireNonNull(isoTime, "isoTime must not be null");
        try {
            return new CronSchedule.At(Instant.parse(isoTime.trim()));
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("Invalid ISO-8601 timestamp: " + isoTime, e);
        }
    }

    /**
     * Unanchored interval; the anchor is resolved when the job is created.
     */
    public static CronSchedule every(Duration interval) {
        Objects.requireNonNull(interval, "interval must not be null");
        if (interval.isZero() || interval.isNegative()) {
            throw new IllegalArgumentException("interval must be positive: " + interval);
        }
        return new CronSchedule.Every(interval.toMillis(), null);
    }

    /**
     * @param interval human interval text, e.g. "5 minutes", "2h", "90"
     */
    public static CronSchedule every(String interval) {
        return every(Durations.parse(interval));
    }

    public static CronSchedule cron(String expr, String timezone) {
        CronSchedule schedule = new CronSchedule.Cron(expr, timezone);
        ScheduleEvaluator.validate(schedule);
        return schedule;
    }

    public static CronSchedule cron(String expr) {
        return cron(expr, null);
    }

    /**
     * Detects the schedule kind from text: an ISO-8601 instant is one-shot, a 5/6-field cron
     * expression is cron, anything else must be a human interval.
     *
     * @throws IllegalArgumentException if the text matches none of the supported forms
     */
    public static CronSchedule parse(String text, String timezone) {
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("schedule must not be blank");
        }
        String s = text.trim();

        Instant instant = tryParseInstant(s);
        if (instant != null) {
            return new CronSchedule.At(instant);
        }

        if (ScheduleEvaluator.looksLikeCron(s)) {
            return cron(s, timezone);
        }

        return every(s);
    }

    private static Instant tryParseInstant(String s) {
        if (s.isEmpty() || !Character.isDigit(s.charAt(0)) || s.indexOf('T') < 0) {
            return null;
        }
        try {
            return Instant.parse(s);
        } catch (DateTimeParseException e) {
            return null;
        }
    }
}
