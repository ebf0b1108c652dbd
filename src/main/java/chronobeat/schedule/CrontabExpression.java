package chronobeat.schedule;

import com.cronutils.model.CronType;
import com.cronutils.model.definition.CronDefinitionBuilder;
import com.cronutils.model.time.ExecutionTime;
import com.cronutils.parser.CronParser;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.YearMonth;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;
import java.util.Locale;
import java.util.Objects;

/**
 * Five-field crontab expression (minute, hour, day of month, month, day of week).
 *
 * Parsing and the minute/hour/month search are done by cron-utils with the Unix
 * definition. The day rule is applied here: day of month and day of week are
 * OR'd when both are restricted; if either starts with {@code *} both must
 * match, which leaves the other one as the only constraint. cron-utils treats
 * a stepped wildcard such as {@code *}{@code /2} as a restriction and ORs it, so
 * it cannot decide the day on its own.
 *
 * All calendar arithmetic is on local date-times; callers convert to and from
 * the schedule's zone.
 */
public final class CrontabExpression {

    private static final CronParser PARSER =
            new CronParser(CronDefinitionBuilder.instanceDefinitionFor(CronType.UNIX));

    /** Upper bound on the forward search; covers every leap-day/weekday combination. */
    private static final int SEARCH_YEARS = 28;

    /** A leap year starting on a Monday; 2024-01-07 is a Sunday. */
    private static final int REFERENCE_YEAR = 2024;

    private final String minute;
    private final String hour;
    private final String dayOfMonth;
    private final String monthOfYear;
    private final String dayOfWeek;

    // minute, hour and month; both day fields left open
    private final ExecutionTime timeOfYear;
    private final boolean[] daysOfMonth = new boolean[32];
    private final boolean[] daysOfWeek = new boolean[7]; // Sunday=0
    private final boolean[] months = new boolean[13];
    private final boolean eitherDay;

    private CrontabExpression(String minute, String hour, String dayOfMonth, String monthOfYear, String dayOfWeek) {
        this.minute = minute;
        this.hour = hour;
        this.dayOfMonth = dayOfMonth;
        this.monthOfYear = monthOfYear;
        this.dayOfWeek = dayOfWeek;

        this.timeOfYear = compile(minute + " " + hour + " * " + monthOfYear + " *");
        this.eitherDay = !dayOfMonth.startsWith("*") && !dayOfWeek.startsWith("*");

        ExecutionTime domOnly = compile("0 0 " + dayOfMonth + " * *");
        for (int d = 1; d <= 31; d++) {
            daysOfMonth[d] = domOnly.isMatch(midnight(LocalDate.of(REFERENCE_YEAR, 1, d)));
        }
        ExecutionTime dowOnly = compile("0 0 * * " + dayOfWeek);
        for (int d = 0; d < 7; d++) {
            daysOfWeek[d] = dowOnly.isMatch(midnight(LocalDate.of(REFERENCE_YEAR, 1, 7 + d)));
        }
        ExecutionTime monthOnly = compile("0 0 1 " + monthOfYear + " *");
        for (int m = 1; m <= 12; m++) {
            months[m] = monthOnly.isMatch(midnight(LocalDate.of(REFERENCE_YEAR, m, 1)));
        }
    }

    /**
     * Parse the five fields.
     *
     * @throws IllegalArgumentException if any field is malformed; the message
     *                                  starts with the field name
     */
    public static CrontabExpression parse(String minute, String hour, String dayOfMonth, String monthOfYear,
            String dayOfWeek) {
        String m = checkField("minute", minute, 0, 59, "%s * * * *");
        String h = checkField("hour", hour, 0, 23, "* %s * * *");
        String dom = checkField("day_of_month", dayOfMonth, 1, 31, "* * %s * *");
        String mon = checkField("month_of_year", monthOfYear, 1, 12, "* * * %s *");
        String dow = checkField("day_of_week", dayOfWeek, 0, 7, "* * * * %s");
        return new CrontabExpression(m, h, dom, mon, dow);
    }

    /**
     * Parse a classic single-line expression {@code "m h dom mon dow"}.
     */
    public static CrontabExpression parse(String expression) {
        Objects.requireNonNull(expression, "expression");
        String[] parts = expression.trim().split("\\s+");
        if (parts.length != 5) {
            throw new IllegalArgumentException("crontab must have 5 fields: " + expression);
        }
        return parse(parts[0], parts[1], parts[2], parts[3], parts[4]);
    }

    /**
     * Whether the minute containing {@code time} matches every field.
     */
    public boolean matches(LocalDateTime time) {
        LocalDateTime minuteStart = time.truncatedTo(ChronoUnit.MINUTES);
        return dayMatches(minuteStart.toLocalDate())
                && timeOfYear.isMatch(minuteStart.atZone(ZoneOffset.UTC));
    }

    /**
     * First matching minute at or after {@code from} (seconds are dropped).
     * cron-utils proposes the next minute/hour/month match; days rejected by the
     * day rule are skipped whole.
     *
     * @throws IllegalStateException if nothing ever matches
     */
    public LocalDateTime nextMatch(LocalDateTime from) {
        if (!canMatch()) {
            throw neverMatches(from);
        }
        LocalDateTime cursor = from.truncatedTo(ChronoUnit.MINUTES);
        int lastYear = cursor.getYear() + SEARCH_YEARS;

        while (cursor.getYear() <= lastYear) {
            // strictly after one second earlier, so the cursor minute itself counts
            LocalDateTime candidate = timeOfYear.nextExecution(cursor.atZone(ZoneOffset.UTC).minusSeconds(1))
                    .map(ZonedDateTime::toLocalDateTime)
                    .orElseThrow(() -> neverMatches(from));
            if (dayMatches(candidate.toLocalDate())) {
                return candidate;
            }
            cursor = candidate.toLocalDate().plusDays(1).atStartOfDay();
        }
        throw neverMatches(from);
    }

    /**
     * False when the allowed days of month never occur in the allowed months,
     * e.g. {@code 31 2}. Every weekday falls on every date within the search
     * window, so the day of week alone never makes an expression unsatisfiable.
     */
    private boolean canMatch() {
        if (eitherDay) {
            return true;
        }
        for (int m = 1; m <= 12; m++) {
            if (!months[m]) {
                continue;
            }
            int length = YearMonth.of(REFERENCE_YEAR, m).lengthOfMonth();
            for (int d = 1; d <= length; d++) {
                if (daysOfMonth[d]) {
                    return true;
                }
            }
        }
        return false;
    }

    private boolean dayMatches(LocalDate date) {
        boolean domMatch = daysOfMonth[date.getDayOfMonth()];
        boolean dowMatch = daysOfWeek[date.getDayOfWeek().getValue() % 7];
        return eitherDay ? domMatch || dowMatch : domMatch && dowMatch;
    }

    private IllegalStateException neverMatches(LocalDateTime from) {
        return new IllegalStateException("crontab '" + this + "' never matches after " + from);
    }

    /**
     * Validate one field on its own so errors name it, then hand it to
     * cron-utils in the upper case its name tables use.
     */
    private static String checkField(String name, String token, int min, int max, String layout) {
        if (token == null || token.isBlank()) {
            throw new IllegalArgumentException(name + " must not be empty");
        }
        String text = token.trim();
        for (String part : text.split(",", -1)) {
            checkPart(name, text, part, min, max);
        }
        try {
            PARSER.parse(String.format(layout, text.toUpperCase(Locale.ROOT)));
        } catch (RuntimeException e) {
            throw new IllegalArgumentException(name + ": invalid value '" + text + "' (" + e.getMessage() + ")", e);
        }
        return text;
    }

    private static void checkPart(String name, String field, String part, int min, int max) {
        if (part.isEmpty()) {
            throw new IllegalArgumentException(name + ": empty list element in '" + field + "'");
        }
        String range = part;
        int slash = part.indexOf('/');
        if (slash >= 0) {
            String stepText = part.substring(slash + 1);
            int step;
            try {
                step = Integer.parseInt(stepText);
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException(name + ": invalid step in '" + part + "'");
            }
            if (step < 1 || step > max - min) {
                throw new IllegalArgumentException(
                        String.format("%s: step in '%s' must be between 1 and %d", name, part, max - min));
            }
            range = part.substring(0, slash);
        }
        int dash = range.indexOf('-');
        if (dash > 0) {
            Integer start = number(range.substring(0, dash));
            Integer end = number(range.substring(dash + 1));
            if (start != null && end != null && start > end) {
                throw new IllegalArgumentException(name + ": range '" + range + "' runs backwards");
            }
        }
    }

    private static Integer number(String text) {
        try {
            return Integer.valueOf(text);
        } catch (NumberFormatException e) {
            return null; // a name such as "mon"; cron-utils checks it
        }
    }

    private static ExecutionTime compile(String expression) {
        return ExecutionTime.forCron(PARSER.parse(expression.toUpperCase(Locale.ROOT)));
    }

    private static ZonedDateTime midnight(LocalDate date) {
        return date.atStartOfDay(ZoneOffset.UTC);
    }

    @Override
    public String toString() {
        return minute + " " + hour + " " + dayOfMonth + " " + monthOfYear + " " + dayOfWeek;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof CrontabExpression other))
            return false;
        return toString().equals(other.toString());
    }

    @Override
    public int hashCode() {
        return toString().hashCode();
    }
}
