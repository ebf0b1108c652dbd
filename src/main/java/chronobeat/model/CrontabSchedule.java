package chronobeat.model;

import chronobeat.schedule.CronSchedule;
import chronobeat.schedule.CrontabExpression;

import java.time.ZoneId;

/**
 * Crontab pattern shared by any number of periodic tasks.
 */
public record CrontabSchedule(
        long id,
        String minute,
        String hour,
        String dayOfWeek,
        String dayOfMonth,
        String monthOfYear,
        String timezone) {

    public static final String DEFAULT_TIMEZONE = "UTC";

    public CrontabSchedule {
        minute = orWildcard(minute);
        hour = orWildcard(hour);
        dayOfWeek = orWildcard(dayOfWeek);
        dayOfMonth = orWildcard(dayOfMonth);
        monthOfYear = orWildcard(monthOfYear);
        timezone = timezone == null || timezone.isBlank() ? DEFAULT_TIMEZONE : timezone.trim();
    }

    /**
     * Resolve into an evaluable schedule.
     *
     * @throws IllegalArgumentException if a field or the timezone is invalid
     */
    public CronSchedule toSchedule() {
        CrontabExpression expression = CrontabExpression.parse(minute, hour, dayOfMonth, monthOfYear, dayOfWeek);
        ZoneId zone;
        try {
            zone = ZoneId.of(timezone);
        } catch (Exception e) {
            throw new IllegalArgumentException("unknown timezone: " + timezone);
        }
        return new CronSchedule(expression, zone);
    }

    public String expression() {
        return minute + " " + hour + " " + dayOfMonth + " " + monthOfYear + " " + dayOfWeek;
    }

    public String display() {
        return expression() + " (m/h/dM/MY/d) " + timezone;
    }

    private static String orWildcard(String field) {
        return field == null || field.isBlank() ? "*" : field.trim();
    }
}
