package chronobeat.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.time.Duration;
import java.util.Locale;

/**
 * Unit of an interval schedule.
 */
public enum IntervalPeriod {
    SECONDS(Duration.ofSeconds(1), "second"),
    MINUTES(Duration.ofMinutes(1), "minute"),
    HOURS(Duration.ofHours(1), "hour"),
    DAYS(Duration.ofDays(1), "day");

    private final Duration unit;
    private final String singular;

    IntervalPeriod(Duration unit, String singular) {
        this.unit = unit;
        this.singular = singular;
    }

    public Duration toDuration(long every) {
        return unit.multipliedBy(every);
    }

    public String singular() {
        return singular;
    }

    @JsonValue
    public String jsonName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static IntervalPeriod parse(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("period is required");
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("unknown period: " + value);
        }
    }
}
