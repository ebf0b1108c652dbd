package chronobeat.schedule;

import java.time.Instant;

/**
 * Result of evaluating a schedule at a point in time.
 *
 * @param due     whether the schedule should fire now
 * @param nextDue earliest instant at which it is (or becomes) due; never null
 */
public record DueCheck(boolean due, Instant nextDue) {

    public static DueCheck dueNow(Instant at) {
        return new DueCheck(true, at);
    }

    public static DueCheck notDueUntil(Instant next) {
        return new DueCheck(false, next);
    }
}
