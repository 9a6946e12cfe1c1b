package io.crontab4j.utils;

import io.crontab4j.core.CronSchedule;
import org.quartz.CronExpression;

import java.text.ParseException;
import java.time.DateTimeException;
import java.time.Instant;
import java.time.ZoneId;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Date;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.TimeZone;
import java.util.TreeSet;

/**
 * Computes the next fire time of a {@link CronSchedule}.
 * <p>
 * Pure functions: no state, no I/O. Cron expressions are evaluated by Quartz {@link CronExpression}
 * after translating standard 5-field syntax into Quartz syntax (see {@link #normalizeCron(String)}).
 * Precision is one second. An interval grid point that cannot be represented in epoch milliseconds
 * means the schedule never fires.
 */
public final class ScheduleEvaluator {

    private static final String[] QUARTZ_DAY_NUMBERS = {"1", "2", "3", "4", "5", "6", "7"};

    // Leaves headroom for an anchor plus one interval in epoch millis.
    private static final long MAX_EVERY_MS = Long.MAX_VALUE / 2;

    private ScheduleEvaluator() {
    }

    /**
     * Next fire time strictly derived from the schedule and {@code now}.
     *
     * @return the next fire time, or {@code null} when the schedule will not fire again
     * (past one-shot, unrepresentable interval, blank or unparseable cron expression)
     */
    public static Instant nextRunAt(CronSchedule schedule, Instant now) {
        Objects.requireNonNull(schedule, "schedule must not be null");
        Objects.requireNonNull(now, "now must not be null");

        if (schedule instanceof CronSchedule.At at) {
            if (at.at() == null) {
                return null;
            }
            return at.at().isAfter(now) ? at.at() : null;
        }

        if (schedule instanceof CronSchedule.Every every) {
            return nextOnGrid(every, now);
        }

        CronSchedule.Cron cron = (CronSchedule.Cron) schedule;
        return nextCronRun(cron.expr(), cron.tz(), now);
    }

    /*
     * The first fire is always one full interval after the anchor; a "now" exactly on a grid
     * point yields that point (due immediately).
     */
    private static Instant nextOnGrid(CronSchedule.Every every, Instant now) {
        long everyMs = Math.max(1L, every.everyMs());
        long nowMs = now.toEpochMilli();
        long anchorMs = every.anchor() != null ? Math.max(0L, every.anchor().toEpochMilli()) : nowMs;

        if (nowMs < anchorMs) {
            return Instant.ofEpochMilli(anchorMs);
        }

        long elapsed = nowMs - anchorMs;
        long steps = Math.max(1L, elapsed / everyMs + (elapsed % everyMs == 0 ? 0 : 1));
        try {
            return Instant.ofEpochMilli(Math.addExact(anchorMs, Math.multiplyExact(steps, everyMs)));
        } catch (ArithmeticException e) {
            return null;
        }
    }

    private static Instant nextCronRun(String expr, String tz, Instant now) {
        if (expr == null || expr.isBlank()) {
            return null;
        }

        List<String> quartz;
        try {
            quartz = normalizeCron(expr);
        } catch (RuntimeException e) {
            return null;
        }

        TimeZone zone = TimeZone.getTimeZone(resolveZone(tz));
        Instant nowSecond = now.truncatedTo(ChronoUnit.SECONDS);
        Instant earliest = null;
        for (String q : quartz) {
            CronExpression exp;
            try {
                exp = new CronExpression(q);
            } catch (ParseException | RuntimeException e) {
                return null;
            }
            exp.setTimeZone(zone);
            Date next = exp.getNextValidTimeAfter(Date.from(nowSecond));
            if (next == null || next.toInstant().isBefore(nowSecond)) {
                continue;
            }
            if (earliest == null || next.toInstant().isBefore(earliest)) {
                earliest = next.toInstant();
            }
        }
        return earliest;
    }

    /**
     * Creation-time validation. Unlike {@link #nextRunAt}, malformed input is an error here.
     *
     * @throws IllegalArgumentException describing the first problem found
     */
    public static void validate(CronSchedule schedule) {
        if (schedule == null) {
            throw new IllegalArgumentException("cron: schedule is required");
        }

        if (schedule instanceof CronSchedule.At at) {
            if (at.at() == null) {
                throw new IllegalArgumentException("cron: at schedule requires a timestamp");
            }
            return;
        }

        if (schedule instanceof CronSchedule.Every every) {
            if (every.everyMs() <= 0) {
                throw new IllegalArgumentException("cron: every schedule requires a positive everyMs: " + every.everyMs());
            }
            if (every.everyMs() > MAX_EVERY_MS) {
                throw new IllegalArgumentException("cron: every schedule interval too large: " + every.everyMs());
            }
            return;
        }

        CronSchedule.Cron cron = (CronSchedule.Cron) schedule;
        if (cron.expr() == null || cron.expr().isBlank()) {
            throw new IllegalArgumentException("cron: cron schedule requires an expression");
        }
        if (cron.tz() != null && !cron.tz().isBlank()) {
            try {
                ZoneId.of(cron.tz().trim());
            } catch (DateTimeException e) {
                throw new IllegalArgumentException("cron: invalid timezone: " + cron.tz(), e);
            }
        }
        for (String quartz : normalizeCron(cron.expr())) {
            if (!CronExpression.isValidExpression(quartz)) {
                throw new IllegalArgumentException("Invalid cron expression: " + cron.expr());
            }
        }
    }

    /**
     * Returns true if the string parses as a 5- or 6-field cron expression.
     */
    public static boolean looksLikeCron(String expr) {
        try {
            return normalizeCron(expr).stream().allMatch(CronExpression::isValidExpression);
        } catch (RuntimeException ignored) {
            return false;
        }
    }

    /**
     * Translate standard cron into Quartz syntax:
     * <ul>
     *   <li>5 fields: a "0" seconds field is prepended; 6 fields: the first field is seconds</li>
     *   <li>numeric day-of-week (0-7, Sunday = 0 or 7) becomes Quartz numbering (1-7, Sunday = 1)</li>
     *   <li>the unrestricted one of day-of-month / day-of-week becomes "?"</li>
     * </ul>
     * When both day fields are restricted, standard cron fires on a day matching either of them.
     * Quartz cannot say that in one expression, so two are returned: one per day field. The schedule
     * fires at the earlier of their next times.
     *
     * @return one Quartz expression, or two when both day fields are restricted
     * @throws IllegalArgumentException on a wrong field count or an out-of-range day-of-week
     */
    public static List<String> normalizeCron(String expr) {
        if (expr == null) {
            throw new IllegalArgumentException("cron expression must not be null");
        }
        String s = expr.trim();
        if (s.isEmpty()) {
            throw new IllegalArgumentException("cron expression must not be empty");
        }

        String[] parts = s.split("\\s+");
        if (parts.length == 5) {
            return toQuartzCron("0", parts[0], parts[1], parts[2], parts[3], parts[4]);
        }
        if (parts.length == 6) {
            return toQuartzCron(parts[0], parts[1], parts[2], parts[3], parts[4], parts[5]);
        }
        throw new IllegalArgumentException("cron expression must have 5 or 6 fields: " + expr);
    }

    private static List<String> toQuartzCron(String sec, String min, String hour, String dayOfMonth, String month, String dayOfWeek) {
        String dom = dayOfMonth;
        String dow = toQuartzDayOfWeek(dayOfWeek);

        boolean domOpen = "*".equals(dom) || "?".equals(dom);
        boolean dowOpen = "*".equals(dow) || "?".equals(dow);

        List<String> out = new ArrayList<>(2);
        if (domOpen && dowOpen) {
            out.add(String.join(" ", sec, min, hour, "*", month, "?"));
        } else if (domOpen) {
            out.add(String.join(" ", sec, min, hour, "?", month, dow));
        } else if (dowOpen) {
            out.add(String.join(" ", sec, min, hour, dom, month, "?"));
        } else {
            out.add(String.join(" ", sec, min, hour, dom, month, "?"));
            out.add(String.join(" ", sec, min, hour, "?", month, dow));
        }
        return List.copyOf(out);
    }

    private static String toQuartzDayOfWeek(String field) {
        if ("*".equals(field) || "?".equals(field)) {
            return field;
        }

        String[] items = field.split(",", -1);
        StringBuilder out = new StringBuilder(field.length() + 4);
        for (int i = 0; i < items.length; i++) {
            if (i > 0) {
                out.append(',');
            }
            String item = items[i];
            int slash = item.indexOf('/');
            String base = slash >= 0 ? item.substring(0, slash) : item;
            String step = slash >= 0 ? item.substring(slash) : "";

            int dash = base.indexOf('-');
            if (dash > 0 && "7".equals(base.substring(dash + 1)) && base.substring(0, dash).matches("\\d+")) {
                out.append(expandToSunday(Integer.parseInt(base.substring(0, dash)), step));
                continue;
            }
            if (dash > 0) {
                out.append(toQuartzDay(base.substring(0, dash)))
                        .append('-')
                        .append(toQuartzDay(base.substring(dash + 1)));
            } else {
                out.append(toQuartzDay(base));
            }
            out.append(step);
        }
        return out.toString();
    }

    /*
     * A range ending in 7 runs up to the second Sunday. Folding 7 to Quartz's 1 would turn "0-7"
     * into "1-1", so such ranges are enumerated as a day list instead.
     */
    private static String expandToSunday(int start, String step) {
        if (start > 7) {
            throw new IllegalArgumentException("cron: day-of-week out of range: " + start);
        }
        int stride = 1;
        if (!step.isEmpty()) {
            try {
                stride = Integer.parseInt(step.substring(1));
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("cron: invalid day-of-week step: " + step, e);
            }
            if (stride <= 0) {
                throw new IllegalArgumentException("cron: invalid day-of-week step: " + step);
            }
        }
        TreeSet<Integer> days = new TreeSet<>();
        for (int n = start; n <= 7; n += stride) {
            days.add(n % 7 + 1);
        }
        StringBuilder out = new StringBuilder();
        for (Integer day : days) {
            if (out.length() > 0) {
                out.append(',');
            }
            out.append(day);
        }
        return out.toString();
    }

    private static String toQuartzDay(String token) {
        if (!token.matches("\\d+")) {
            return token.toUpperCase(Locale.ROOT);
        }
        int n = Integer.parseInt(token);
        if (n > 7) {
            throw new IllegalArgumentException("cron: day-of-week out of range: " + token);
        }
        return QUARTZ_DAY_NUMBERS[n % 7];
    }

    /**
     * Zone for evaluating cron schedules. Blank or unknown ids fall back to the system default.
     */
    public static ZoneId resolveZone(String tz) {
        if (tz == null || tz.isBlank()) {
            return ZoneId.systemDefault();
        }
        try {
            return ZoneId.of(tz.trim());
        } catch (DateTimeException e) {
            return ZoneId.systemDefault();
        }
    }
}
