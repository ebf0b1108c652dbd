package chronobeat.schedule;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Fixed-interval schedule: due once {@code every} has elapsed since the last run.
 */
public record EverySchedule(Duration every, String display) implements Schedule {

    public EverySchedule {
        Objects.requireNonNull(every, "every");
        if (every.isZero() || every.isNegative()) {
            throw new IllegalArgumentException("interval must be positive: " + every);
        }
        if (display == null) {
            display = "every " + every.toSeconds() + " seconds";
        }
    }

    public EverySchedule(Duration every) {
        this(every, null);
    }

    @Override
    public DueCheck check(Instant lastRunAt, Instant now) {
        if (lastRunAt == null) {
            return DueCheck.dueNow(now);
        }
        Instant next = lastRunAt.plus(every);
        return new DueCheck(!now.isBefore(next), next);
    }

    @Override
    public String describe() {
        return display;
    }
}
