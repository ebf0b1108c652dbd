package chronobeat.beat;

import chronobeat.model.PeriodicTask;
import chronobeat.schedule.DueCheck;
import chronobeat.schedule.Schedule;

import java.time.Instant;
import java.util.Objects;

/**
 * Immutable snapshot of one enabled periodic task as seen by the beat loop:
 * its definition, its resolved schedule and its run bookkeeping.
 */
public final class ScheduleEntry {

    private final PeriodicTask task;
    private final Schedule schedule;
    private final Instant lastRunAt;
    private final int totalRunCount;

    ScheduleEntry(PeriodicTask task, Schedule schedule, Instant lastRunAt, int totalRunCount) {
        this.task = Objects.requireNonNull(task, "task");
        this.schedule = Objects.requireNonNull(schedule, "schedule");
        this.lastRunAt = lastRunAt;
        this.totalRunCount = totalRunCount;
    }

    static ScheduleEntry of(PeriodicTask task, Schedule schedule) {
        return new ScheduleEntry(task, schedule, task.lastRunAt(), task.totalRunCount());
    }

    public String name() {
        return task.name();
    }

    public PeriodicTask task() {
        return task;
    }

    public Schedule schedule() {
        return schedule;
    }

    public Instant lastRunAt() {
        return lastRunAt;
    }

    public int totalRunCount() {
        return totalRunCount;
    }

    /**
     * Identity of the definition this entry was built from. Changes whenever an
     * admin edits the task or the schedule it is bound to.
     */
    public String definitionKey() {
        return task.name() + "@" + task.updatedAt() + "#" + schedule.describe();
    }

    /**
     * Due check honouring the start time: before it the entry is never due.
     */
    public DueCheck evaluate(Instant now) {
        Instant start = task.startTime();
        if (start != null && now.isBefore(start)) {
            DueCheck atStart = schedule.check(lastRunAt, start);
            Instant next = atStart.due() || atStart.nextDue().isBefore(start) ? start : atStart.nextDue();
            return DueCheck.notDueUntil(next);
        }
        return schedule.check(lastRunAt, now);
    }

    public boolean isExpired(Instant now) {
        return task.expiresAt() != null && !task.expiresAt().isAfter(now);
    }

    ScheduleEntry withRun(Instant at) {
        return new ScheduleEntry(task, schedule, at, totalRunCount + 1);
    }

    ScheduleEntry withBookkeeping(Instant lastRunAt, int totalRunCount) {
        return new ScheduleEntry(task, schedule, lastRunAt, totalRunCount);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof ScheduleEntry other))
            return false;
        return totalRunCount == other.totalRunCount
                && definitionKey().equals(other.definitionKey())
                && schedule.equals(other.schedule)
                && Objects.equals(lastRunAt, other.lastRunAt);
    }

    @Override
    public int hashCode() {
        return Objects.hash(definitionKey(), lastRunAt, totalRunCount);
    }

    @Override
    public String toString() {
        return "ScheduleEntry{name='" + name() + "', schedule=" + schedule.describe()
                + ", lastRunAt=" + lastRunAt + ", totalRunCount=" + totalRunCount + "}";
    }
}
