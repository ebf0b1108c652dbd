package chronobeat.model;

import chronobeat.schedule.EverySchedule;

/**
 * Fixed interval shared by any number of periodic tasks.
 */
public record IntervalSchedule(long id, int every, IntervalPeriod period) {

    public EverySchedule toSchedule() {
        return new EverySchedule(period.toDuration(every), display());
    }

    /** e.g. {@code every 5 minutes}, {@code every hour} */
    public String display() {
        if (every == 1) {
            return "every " + period.singular();
        }
        return "every " + every + " " + period.jsonName();
    }
}
