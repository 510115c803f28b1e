package io.github.dailies.runtime.recurrence;

import org.springframework.scheduling.support.CronExpression;

import java.time.DateTimeException;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Decides whether a recurring task has crossed its next reset boundary.
 *
 * <p>Expressions use the classic five-field cron grammar
 * ({@code minute hour day-of-month month day-of-week}) or one of the
 * {@code @daily}-style macros. Parsed expressions are cached by their raw text.
 * Evaluation happens in the frequency's own timezone, or in the default zone
 * when the frequency has none.
 */
public class RecurrenceEvaluator {

    private static final Set<String> MACROS = Set.of(
            "@yearly", "@annually", "@monthly", "@weekly", "@daily", "@midnight", "@hourly");

    private final ZoneId defaultZone;
    private final Map<String, Schedule> parsed = new ConcurrentHashMap<>();

    public RecurrenceEvaluator(ZoneId defaultZone) {
        this.defaultZone = defaultZone;
    }

    public ZoneId getDefaultZone() {
        return defaultZone;
    }

    /**
     * True iff the first boundary strictly after {@code lastModified} is at or before {@code now}.
     *
     * @throws InvalidRecurrenceException when the expression or timezone is malformed
     */
    public boolean shouldReset(String expression, String timezone, Instant lastModified, Instant now) {
        return nextBoundaryAfter(expression, timezone, lastModified)
                .map(boundary -> !boundary.isAfter(now))
                .orElse(false);
    }

    /**
     * First boundary strictly after {@code after}; empty when the expression never fires again
     * (e.g. {@code 0 0 30 2 *}).
     */
    public Optional<Instant> nextBoundaryAfter(String expression, String timezone, Instant after) {
        Schedule schedule = parse(expression);
        ZoneId zone = resolveZone(expression, timezone);
        ZonedDateTime next = schedule.next(after.atZone(zone));
        return Optional.ofNullable(next).map(ZonedDateTime::toInstant);
    }

    /** Compact "time until" label used by the frequency timers view: {@code 2d}, {@code 6h}, {@code 12m}. */
    public static String formatRemaining(Duration remaining) {
        if (remaining.isNegative()) return "0m";
        long days = remaining.toDays();
        if (days > 0) return days + "d";
        long hours = remaining.toHours();
        if (hours > 0) return hours + "h";
        return remaining.toMinutes() + "m";
    }

    public boolean isValid(String expression) {
        try {
            parse(expression);
            return true;
        } catch (InvalidRecurrenceException e) {
            return false;
        }
    }

    /** Drops a cached expression, called when a frequency's period is edited. */
    public void evict(String expression) {
        if (expression != null) {
            parsed.remove(expression.trim());
        }
    }

    Schedule parse(String expression) {
        if (expression == null || expression.isBlank()) {
            throw new InvalidRecurrenceException(String.valueOf(expression), "expression is empty");
        }
        String key = expression.trim();
        Schedule cached = parsed.get(key);
        if (cached != null) return cached;

        Schedule schedule = compile(key);
        parsed.put(key, schedule);
        return schedule;
    }

    private static Schedule compile(String expression) {
        if (expression.startsWith("@")) {
            String macro = expression.toLowerCase(Locale.ROOT);
            if (!MACROS.contains(macro)) {
                throw new InvalidRecurrenceException(expression, "unknown macro");
            }
            return new Schedule(toCron(expression, macro), null);
        }

        String[] fields = expression.split("\\s+");
        if (fields.length != 5) {
            throw new InvalidRecurrenceException(expression,
                    "expected 5 fields (minute hour day-of-month month day-of-week) but found " + fields.length);
        }
        String minute = fields[0], hour = fields[1], dayOfMonth = fields[2], month = fields[3], dayOfWeek = fields[4];
        // Spring's grammar carries a leading seconds field
        if (isRestricted(dayOfMonth) && isRestricted(dayOfWeek)) {
            // classic cron fires when either day field matches; Spring requires both
            return new Schedule(
                    toCron(expression, String.join(" ", "0", minute, hour, dayOfMonth, month, "?")),
                    toCron(expression, String.join(" ", "0", minute, hour, "?", month, dayOfWeek)));
        }
        return new Schedule(toCron(expression, "0 " + String.join(" ", fields)), null);
    }

    /** A day field starting with {@code *} or {@code ?} (including steps like {@code *}{@code /2}) matches any day. */
    private static boolean isRestricted(String dayField) {
        return !dayField.startsWith("*") && !dayField.startsWith("?");
    }

    private static CronExpression toCron(String expression, String springExpression) {
        try {
            return CronExpression.parse(springExpression);
        } catch (IllegalArgumentException e) {
            throw new InvalidRecurrenceException(expression, e.getMessage(), e);
        }
    }

    private ZoneId resolveZone(String expression, String timezone) {
        if (timezone == null || timezone.isBlank()) return defaultZone;
        try {
            return ZoneId.of(timezone.trim());
        } catch (DateTimeException e) {
            throw new InvalidRecurrenceException(expression, "unknown timezone " + timezone, e);
        }
    }

    /** One parsed expression; a second cron holds the day-of-week half when both day fields are restricted. */
    static final class Schedule {
        private final CronExpression primary;
        private final CronExpression alternative;

        Schedule(CronExpression primary, CronExpression alternative) {
            this.primary = primary;
            this.alternative = alternative;
        }

        ZonedDateTime next(ZonedDateTime after) {
            ZonedDateTime first = primary.next(after);
            if (alternative == null) return first;
            ZonedDateTime second = alternative.next(after);
            if (first == null) return second;
            if (second == null) return first;
            return second.isBefore(first) ? second : first;
        }
    }
}
