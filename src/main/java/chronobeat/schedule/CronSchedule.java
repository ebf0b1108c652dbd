package chronobeat.schedule;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;
import java.util.Objects;

/**
 * Crontab schedule evaluated in its own timezone.
 *
 * A matching minute fires at most once: if the last run falls inside the
 * current matching minute the schedule waits for the next match. A match
 * missed since the last run (beat down, dispatch outage across the minute)
 * fires once on the next check; older misses are not replayed.
 */
public record CronSchedule(CrontabExpression expression, ZoneId zone) implements Schedule {

    public CronSchedule {
        Objects.requireNonNull(expression, "expression");
        Objects.requireNonNull(zone, "zone");
    }

    @Override
    public DueCheck check(Instant lastRunAt, Instant now) {
        ZonedDateTime minuteStart = now.atZone(zone).truncatedTo(ChronoUnit.MINUTES);
        boolean firedThisMinute = lastRunAt != null && !lastRunAt.isBefore(minuteStart.toInstant());

        if (!firedThisMinute) {
            if (expression.matches(minuteStart.toLocalDateTime())) {
                return DueCheck.dueNow(minuteStart.toInstant());
            }
            if (lastRunAt != null) {
                Instant missed = nextAfter(lastRunAt);
                if (!missed.isAfter(now)) {
                    return DueCheck.dueNow(missed);
                }
            }
        }
        return DueCheck.notDueUntil(nextAfter(now));
    }

    /**
     * First matching minute strictly after the minute containing {@code instant}.
     */
    public Instant nextAfter(Instant instant) {
        LocalDateTime from = instant.atZone(zone)
                .toLocalDateTime()
                .truncatedTo(ChronoUnit.MINUTES)
                .plusMinutes(1);
        return expression.nextMatch(from).atZone(zone).toInstant();
    }

    @Override
    public String describe() {
        return expression + " (m/h/dM/MY/d) " + zone.getId();
    }
}
