package chronobeat.schedule;

import java.time.Instant;

/**
 * Recurrence rule of a periodic task. Resolved once when the schedule cache is
 * loaded so the loop never branches on nullable bindings.
 */
public sealed interface Schedule permits EverySchedule, CronSchedule {

    /**
     * Decide whether the schedule is due at {@code now}.
     *
     * @param lastRunAt last dispatch instant, or null if never run
     * @param now       evaluation instant
     */
    DueCheck check(Instant lastRunAt, Instant now);

    /** Human readable form, e.g. {@code every 5 minutes}. */
    String describe();
}
