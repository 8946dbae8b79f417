package io.mailagenda.utils;

import io.mailagenda.TimeParser;
import io.mailagenda.core.UnparseableTimeException;
import org.quartz.CronExpression;

import java.text.ParseException;
import java.time.DateTimeException;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;
import java.util.Date;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.TimeZone;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses time expressions into absolute instants.
 * <p>
 * Supported formats:
 * <ul>
 *   <li>{@code now}</li>
 *   <li>ISO instants and offset date-times: "2026-01-20T09:30:00Z", "2026-01-20T09:30:00+09:00"</li>
 *   <li>Local date-times in the configured zone: "2026-01-20 09:30", "2026-01-20T09:30:15"</li>
 *   <li>Relative offsets: "in 2 hours", "in 1 day 3 hours", "in 90m"</li>
 *   <li>Named anchors: "tomorrow", "tomorrow 9am", "today 5:30pm", "tomorrow at 14:00"</li>
 *   <li>Next time of day: "at 10:00"</li>
 *   <li>Cron expressions (5 or 6 fields, optionally prefixed with "cron:"): next fire time</li>
 * </ul>
 * <p>
 * Named anchors, local date-times and cron are resolved in the zone given at construction, never
 * the JVM default. "tomorrow" without a time means 09:00.
 */
public final class DefaultTimeParser implements TimeParser {

    private static final LocalTime DEFAULT_ANCHOR_TIME = LocalTime.of(9, 0);

    private static final Pattern ANCHOR = Pattern.compile(
            "^(today|tomorrow)(?:\\s+(?:at\\s+)?(\\d{1,2})(?::(\\d{2}))?\\s*(am|pm)?)?$");

    private static final Pattern OFFSET_TERM = Pattern.compile(
            "(\\d+)\\s*(weeks?|w|days?|d|hours?|hrs?|h|minutes?|mins?|m|seconds?|secs?|s)\\b");

    private static final List<DateTimeFormatter> LOCAL_FORMATS = List.of(
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm"),
            DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm"),
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss"),
            DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss")
    );

    private final ZoneId zone;

    public DefaultTimeParser(ZoneId zone) {
        this.zone = Objects.requireNonNull(zone, "zone must not be null");
    }

    public DefaultTimeParser(String timezone) {
        this(resolveZone(timezone));
    }

    public ZoneId zone() {
        return zone;
    }

    @Override
    public Instant parse(String expression, Instant referenceNow) {
        Objects.requireNonNull(referenceNow, "referenceNow must not be null");
        if (expression == null || expression.isBlank()) {
            throw new UnparseableTimeException(String.valueOf(expression), "Time expression must not be empty");
        }

        String s = expression.trim();
        String lower = s.toLowerCase(Locale.ROOT);

        if (lower.equals("now")) {
            return referenceNow;
        }

        if (lower.startsWith("in ")) {
            try {
                return referenceNow.plus(relativeOffset(lower.substring(3)));
            } catch (ArithmeticException | DateTimeException e) {
                throw new UnparseableTimeException(expression, "Relative offset out of range");
            } catch (IllegalArgumentException e) {
                throw new UnparseableTimeException(expression, "Invalid relative offset (" + e.getMessage() + ")");
            }
        }

        if (lower.startsWith("cron:")) {
            return nextCronTime(s.substring(5).trim(), referenceNow, expression);
        }

        if (lower.startsWith("at ")) {
            LocalTime time = parseClock(lower.substring(3).trim(), expression);
            ZonedDateTime base = ZonedDateTime.ofInstant(referenceNow, zone);
            ZonedDateTime candidate = base.with(time);
            if (!candidate.isAfter(base)) {
                candidate = candidate.plusDays(1);
            }
            return candidate.toInstant();
        }

        Matcher anchor = ANCHOR.matcher(lower);
        if (anchor.matches()) {
            return resolveAnchor(anchor, referenceNow, expression);
        }

        Instant absolute = tryAbsolute(s);
        if (absolute != null) {
            return absolute;
        }

        if (looksLikeCron(s)) {
            return nextFire(toQuartzCron(s), referenceNow, expression);
        }

        throw new UnparseableTimeException(expression, "Unrecognized time expression");
    }

    private Instant resolveAnchor(Matcher m, Instant referenceNow, String expression) {
        boolean tomorrow = m.group(1).equals("tomorrow");
        LocalTime time;
        if (m.group(2) == null) {
            if (!tomorrow) {
                throw new UnparseableTimeException(expression, "'today' requires a time of day");
            }
            time = DEFAULT_ANCHOR_TIME;
        } else {
            time = toLocalTime(m.group(2), m.group(3), m.group(4), expression);
        }

        ZonedDateTime base = ZonedDateTime.ofInstant(referenceNow, zone);
        if (tomorrow) {
            base = base.plusDays(1);
        }
        return base.toLocalDate().atTime(time).atZone(zone).toInstant();
    }

    private static LocalTime toLocalTime(String hourText, String minuteText, String ampm, String expression) {
        int hour = Integer.parseInt(hourText);
        int minute = minuteText == null ? 0 : Integer.parseInt(minuteText);
        if (minute > 59) {
            throw new UnparseableTimeException(expression, "Minute out of range");
        }
        if (ampm != null) {
            if (hour < 1 || hour > 12) {
                throw new UnparseableTimeException(expression, "Hour out of range for a 12-hour clock");
            }
            if (ampm.equals("pm") && hour < 12) {
                hour += 12;
            } else if (ampm.equals("am") && hour == 12) {
                hour = 0;
            }
        } else if (hour > 23) {
            throw new UnparseableTimeException(expression, "Hour out of range");
        }
        return LocalTime.of(hour, minute);
    }

    private static LocalTime parseClock(String text, String expression) {
        Matcher m = Pattern.compile("^(\\d{1,2})(?::(\\d{2}))?\\s*(am|pm)?$").matcher(text);
        if (!m.matches() || (m.group(2) == null && m.group(3) == null)) {
            throw new UnparseableTimeException(expression, "Expected HH:mm or a 12-hour time like 9am");
        }
        return toLocalTime(m.group(1), m.group(2), m.group(3), expression);
    }

    private Instant tryAbsolute(String s) {
        try {
            return Instant.parse(s);
        } catch (DateTimeParseException ignored) {
            // not an instant, try the next form
        }
        try {
            return OffsetDateTime.parse(s).toInstant();
        } catch (DateTimeParseException ignored) {
            // not an offset date-time
        }
        for (DateTimeFormatter f : LOCAL_FORMATS) {
            try {
                return LocalDateTime.parse(s, f).atZone(zone).toInstant();
            } catch (DateTimeParseException ignored) {
                // try the next pattern
            }
        }
        return null;
    }

    /* ================= helper ================= */

    private static ZoneId resolveZone(String timezone) {
        if (timezone == null || timezone.isBlank()) {
            throw new IllegalArgumentException("timezone must not be blank");
        }
        try {
            return ZoneId.of(timezone);
        } catch (DateTimeException e) {
            throw new IllegalArgumentException("Unknown timezone: " + timezone, e);
        }
    }

    private Instant nextCronTime(String cronSpec, Instant referenceNow, String expression) {
        String quartz = toQuartzCron(cronSpec);
        if (quartz == null || !CronExpression.isValidExpression(quartz)) {
            throw new UnparseableTimeException(expression, "Invalid cron expression");
        }
        return nextFire(quartz, referenceNow, expression);
    }

    private Instant nextFire(String quartz, Instant referenceNow, String expression) {
        CronExpression cron;
        try {
            cron = new CronExpression(quartz);
        } catch (ParseException e) {
            throw new UnparseableTimeException(expression, "Invalid cron expression (" + e.getMessage() + ")");
        }
        cron.setTimeZone(TimeZone.getTimeZone(zone));

        Date next = cron.getNextValidTimeAfter(Date.from(referenceNow));
        if (next == null) {
            throw new UnparseableTimeException(expression, "Cron expression has no future fire time");
        }
        return next.toInstant();
    }

    private static boolean looksLikeCron(String spec) {
        String quartz = toQuartzCron(spec);
        return quartz != null && CronExpression.isValidExpression(quartz);
    }

    // 5 fields get a leading "0" seconds field; Quartz needs '?' in one of the two day fields.
    private static String toQuartzCron(String spec) {
        String[] f = spec.trim().split("\\s+");
        if (f.length == 5) {
            f = new String[]{"0", f[0], f[1], f[2], f[3], f[4]};
        } else if (f.length != 6) {
            return null;
        }
        if (!"?".equals(f[3]) && !"?".equals(f[5])) {
            if ("*".equals(f[3])) {
                f[3] = "?";
            } else if ("*".equals(f[5])) {
                f[5] = "?";
            }
        }
        return String.join(" ", f);
    }

    /**
     * "2 hours", "1 day 3 hours", "90m", "1d 12h". Each unit at most once.
     */
    private static Duration relativeOffset(String text) {
        String s = text.trim();
        Matcher m = OFFSET_TERM.matcher(s);
        EnumSet<ChronoUnit> seen = EnumSet.noneOf(ChronoUnit.class);
        long seconds = 0;
        int pos = 0;

        while (m.find()) {
            if (m.start() != pos) {
                throw new IllegalArgumentException("Unexpected text '" + s.substring(pos, m.start()).trim() + "'");
            }
            pos = skipSpaces(s, m.end());

            ChronoUnit unit = unitOf(m.group(2));
            if (!seen.add(unit)) {
                throw new IllegalArgumentException("Duplicate unit: " + m.group(2));
            }
            long amount;
            try {
                amount = Long.parseLong(m.group(1));
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Amount out of range: " + m.group(1));
            }
            // overflow means an offset beyond any representable instant
            seconds = Math.addExact(seconds, Math.multiplyExact(amount, unit.getDuration().getSeconds()));
        }

        if (seen.isEmpty() || pos != s.length()) {
            throw new IllegalArgumentException("Expected amounts like '3 hours' or '90m'");
        }
        return Duration.ofSeconds(seconds);
    }

    private static ChronoUnit unitOf(String token) {
        return switch (token.charAt(0)) {
            case 'w' -> ChronoUnit.WEEKS;
            case 'd' -> ChronoUnit.DAYS;
            case 'h' -> ChronoUnit.HOURS;
            case 'm' -> ChronoUnit.MINUTES;
            default -> ChronoUnit.SECONDS;
        };
    }

    private static int skipSpaces(String s, int from) {
        int i = from;
        while (i < s.length() && s.charAt(i) == ' ') {
            i++;
        }
        return i;
    }
}
